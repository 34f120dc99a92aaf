package org.janelia.coreprep.channels;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects one source image per output channel from a file listing.
 *
 * Files are grouped by base marker and ordered by round. Within a group explicitly included entries win
 * and are published under their round qualified names; otherwise excluded entries are dropped and
 * the DAPI group keeps only round 1 while any other marker keeps its highest round.
 */
public class ChannelCatalog {

    private static final Logger LOG = LoggerFactory.getLogger(ChannelCatalog.class);

    private static final String PREFERRED_DAPI = "001_" + ChannelDescriptor.DAPI;

    private final ChannelSelectionCriteria criteria;
    private final ChannelFileNameParser parser;

    public ChannelCatalog(ChannelSelectionCriteria criteria) {
        this.criteria = criteria;
        this.parser = new ChannelFileNameParser(criteria.getProcessingPass());
    }

    /**
     * @return output channel name to the selected descriptor, in case insensitive name order
     */
    public Map<String, ChannelDescriptor> discover(Collection<String> listing) {
        Map<String, ChannelDescriptor> discovered = new LinkedHashMap<>();
        for (String filePath : listing) {
            Optional<ChannelDescriptor> descriptor = parser.parse(filePath);
            descriptor.ifPresent(d -> {
                ChannelDescriptor previous = discovered.put(d.getLogicalName(), d);
                if (previous != null) {
                    LOG.warn("Channel {} found in both {} and {} - using {}",
                            d.getLogicalName(), previous.getSourcePath(), d.getSourcePath(), d.getSourcePath());
                }
            });
        }
        if (discovered.isEmpty()) {
            throw new ChannelDiscoveryException("No valid ." + criteria.getProcessingPass() + " OME-TIFF channel files found");
        }
        LOG.info("Discovered channels before filtering: {}", discovered.keySet());

        Map<String, List<ChannelDescriptor>> groups = discovered.values().stream()
                .collect(Collectors.groupingBy(ChannelDescriptor::getBaseMarker, LinkedHashMap::new, Collectors.toList()));

        Map<String, ChannelDescriptor> selected = new LinkedHashMap<>();
        groups.forEach((baseMarker, group) -> selectFromGroup(baseMarker, group, selected));

        if (!criteria.getUseChannels().isEmpty()) {
            selected.keySet().retainAll(criteria.getUseChannels());
            LOG.info("Restricting to use channels {} -> {}", criteria.getUseChannels(), selected.keySet());
        }

        if (selected.isEmpty()) {
            throw new ChannelDiscoveryException("No channel left after selection from " + discovered.keySet()
                    + " with " + criteria);
        }
        Map<String, ChannelDescriptor> result = new TreeMap<>(String.CASE_INSENSITIVE_ORDER.thenComparing(Comparator.naturalOrder()));
        result.putAll(selected);
        LOG.info("Final selected channels:");
        result.forEach((channel, descriptor) -> LOG.info("  Channel: {} <- {}", channel, descriptor.getSourcePath()));

        Set<String> used = result.values().stream().map(ChannelDescriptor::getLogicalName).collect(Collectors.toSet());
        List<ChannelDescriptor> unused = discovered.values().stream()
                .filter(d -> !used.contains(d.getLogicalName()))
                .sorted(Comparator.comparing(ChannelDescriptor::getLogicalName))
                .collect(Collectors.toList());
        if (!unused.isEmpty()) {
            LOG.info("OME-TIFF files not used in final channel selection:");
            unused.forEach(d -> LOG.info("  Unused: Channel {} <- {}", d.getLogicalName(), d.getSourcePath()));
        }
        return new LinkedHashMap<>(result);
    }

    private void selectFromGroup(String baseMarker, List<ChannelDescriptor> group, Map<String, ChannelDescriptor> selected) {
        List<ChannelDescriptor> byRound = new ArrayList<>(group);
        byRound.sort(Comparator.comparingInt(ChannelDescriptor::getRoundNumber));

        List<ChannelDescriptor> included = byRound.stream()
                .filter(d -> criteria.getIncludeChannels().contains(d.getLogicalName()))
                .collect(Collectors.toList());
        if (!included.isEmpty()) {
            included.forEach(d -> selected.put(d.getLogicalName(), d));
            return;
        }
        List<ChannelDescriptor> candidates = byRound.stream()
                .filter(d -> !criteria.getExcludeChannels().contains(d.getLogicalName()))
                .collect(Collectors.toList());
        if (candidates.isEmpty()) {
            return;
        }
        if (ChannelDescriptor.DAPI.equalsIgnoreCase(baseMarker)) {
            candidates.stream()
                    .filter(d -> PREFERRED_DAPI.equals(d.getLogicalName()))
                    .findFirst()
                    .ifPresent(d -> selected.put(ChannelDescriptor.DAPI, d));
        } else {
            selected.put(baseMarker, candidates.get(candidates.size() - 1));
        }
    }

    /**
     * @return output channel name to source path
     */
    public static Map<String, String> toPathMap(Map<String, ChannelDescriptor> channels) {
        Map<String, String> paths = new LinkedHashMap<>();
        channels.forEach((channel, descriptor) -> paths.put(channel, descriptor.getSourcePath()));
        return paths;
    }

}
