package org.janelia.coreprep.assembly;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableSet;
import org.janelia.coreprep.exceptions.CoreAssemblyException;
import org.janelia.coreprep.exceptions.MissingDataException;
import org.janelia.coreprep.fragments.FragmentStore;
import org.janelia.coreprep.imaging.ImagePlaneIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Combines the fragments of a core into a single multiscale, multichannel artifact.
 */
public class CoreAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(CoreAssembler.class);

    private final FragmentStore fragmentStore;
    private final OutputStore outputStore;
    private final PyramidBuilder pyramidBuilder;
    private final Set<String> allowedChannels;
    private final boolean cleanupEnabled;

    /**
     * @param allowedChannels channels to assemble; fragments of any other channel are ignored. Empty allows all.
     */
    public CoreAssembler(FragmentStore fragmentStore,
                         OutputStore outputStore,
                         PyramidBuilder pyramidBuilder,
                         Collection<String> allowedChannels,
                         boolean cleanupEnabled) {
        this.fragmentStore = fragmentStore;
        this.outputStore = outputStore;
        this.pyramidBuilder = pyramidBuilder;
        this.allowedChannels = allowedChannels == null ? ImmutableSet.of() : ImmutableSet.copyOf(allowedChannels);
        this.cleanupEnabled = cleanupEnabled;
    }

    public Path assemble(String coreId) {
        return assemble(coreId, allowedChannels);
    }

    /**
     * Assembles the core from the fragments of the given channels only, so fragments left over from an earlier run
     * for channels the core does not need are never picked up.
     *
     * @param coreChannels channels the core requires. Empty allows all.
     */
    public Path assemble(String coreId, Set<String> coreChannels) {
        Path coreDir = fragmentStore.getCoreDir(coreId);
        if (!Files.isDirectory(coreDir)) {
            throw new MissingDataException("No fragment folder found for core " + coreId + " in " + fragmentStore.getTempDir());
        }
        List<Path> fragments = new ArrayList<>();
        for (Path fragment : fragmentStore.listFragments(coreId)) {
            String channel = FragmentStore.getChannelName(fragment);
            if (!coreChannels.isEmpty() && !coreChannels.contains(channel)) {
                LOG.debug("Skip fragment {} of core {}", fragment, coreId);
                continue;
            }
            fragments.add(fragment);
        }
        if (fragments.isEmpty()) {
            throw new MissingDataException("No fragments found for core " + coreId + " in " + coreDir);
        }
        List<MultiscaleChannel> channels = new ArrayList<>();
        Path artifactPath;
        try {
            for (Path fragment : fragments) {
                channels.add(new MultiscaleChannel(FragmentStore.getChannelName(fragment), pyramidBuilder.build(ImagePlaneIO.readTiff(fragment))));
            }
            CoreArtifact artifact = new CoreArtifact(coreId, pyramidBuilder.getDownscale(), channels);
            artifactPath = outputStore.write(coreId, artifact);
            LOG.info("Core '{}' assembled with channels {} into {}", coreId, artifact.getChannelNames(), artifactPath);
        } catch (IOException | RuntimeException e) {
            LOG.error("Error assembling core {}", coreId, e);
            throw new CoreAssemblyException(coreId, e);
        }
        if (cleanupEnabled) {
            cleanupFragments(fragments);
        }
        return artifactPath;
    }

    private void cleanupFragments(List<Path> fragments) {
        for (Path fragment : fragments) {
            try {
                Files.deleteIfExists(fragment);
                LOG.debug("Deleted fragment {}", fragment);
            } catch (IOException e) {
                LOG.warn("Failed to delete fragment {}: {}", fragment, e.toString());
            }
        }
    }
}
