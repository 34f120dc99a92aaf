package org.janelia.coreprep.channels;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.janelia.coreprep.utils.FileUtils;

public class LocalChannelListing implements ChannelListing {

    private static final String OME_TIFF_GLOB = "*.ome.tif*";

    private final Path imageDir;

    public LocalChannelListing(Path imageDir) {
        this.imageDir = imageDir;
    }

    @Override
    public List<String> listFiles() {
        if (!Files.isDirectory(imageDir)) {
            throw new ChannelDiscoveryException("Image directory " + imageDir + " not found");
        }
        try (Stream<Path> imageFiles = FileUtils.lookupFiles(imageDir, 1, OME_TIFF_GLOB)) {
            return imageFiles.map(Path::toString).sorted().collect(Collectors.toList());
        }
    }
}
