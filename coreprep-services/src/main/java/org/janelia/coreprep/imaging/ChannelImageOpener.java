package org.janelia.coreprep.imaging;

import java.nio.file.Path;

@FunctionalInterface
public interface ChannelImageOpener {
    ChannelImage open(Path imagePath);
}
