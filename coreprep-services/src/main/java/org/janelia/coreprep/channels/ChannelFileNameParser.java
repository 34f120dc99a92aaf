package org.janelia.coreprep.channels;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Splitter;
import org.apache.commons.lang3.StringUtils;

/**
 * Parses channel image names of the form
 * <code>&lt;slide&gt;_&lt;round&gt;.0.&lt;pass&gt;_R000_&lt;dye&gt;_&lt;marker&gt;-&lt;fluor&gt;[_...].ome.tif[f]</code>.
 */
public class ChannelFileNameParser {

    private static final Splitter PATH_SPLITTER = Splitter.on('/');
    private static final Pattern OME_TIFF_SUFFIX = Pattern.compile("\\.ome\\.tif+$", Pattern.CASE_INSENSITIVE);

    private final Pattern channelPattern;

    public ChannelFileNameParser(int processingPass) {
        this.channelPattern = Pattern.compile("[^_]+_(\\d+)\\.0\\." + processingPass + "_R000_([^_]+)_(.*)\\.ome\\.tif+");
    }

    /**
     * @return the descriptor or empty if the name is not a channel image of the processing pass
     * @throws ChannelDiscoveryException if the name matches but no marker can be derived from it
     */
    public Optional<ChannelDescriptor> parse(String filePath) {
        String fileName = baseName(filePath);
        Matcher matcher = channelPattern.matcher(fileName);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        int roundNumber = Integer.parseInt(matcher.group(1));
        String dye = matcher.group(2);
        String marker;
        if (StringUtils.containsIgnoreCase(dye, ChannelDescriptor.DAPI)) {
            marker = ChannelDescriptor.DAPI;
        } else {
            List<String> parts = Splitter.on('_').splitToList(OME_TIFF_SUFFIX.matcher(fileName).replaceFirst(""));
            if (parts.size() < 5 || StringUtils.isBlank(parts.get(4))) {
                throw new ChannelDiscoveryException("Cannot extract marker from file name '" + fileName +
                        "'. Expected at least 5 underscore separated parts");
            }
            String markerPart = parts.get(4);
            int suffixIndex = markerPart.lastIndexOf('-');
            marker = suffixIndex > 0 ? markerPart.substring(0, suffixIndex) : markerPart;
        }
        return Optional.of(new ChannelDescriptor(filePath, roundNumber, marker));
    }

    private String baseName(String filePath) {
        String normalizedPath = StringUtils.replaceChars(filePath, '\\', '/');
        List<String> components = PATH_SPLITTER.splitToList(StringUtils.removeEnd(normalizedPath, "/"));
        return components.get(components.size() - 1);
    }
}
