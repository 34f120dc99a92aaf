package org.janelia.coreprep.imaging;

import java.io.Closeable;

/**
 * Lazily readable full resolution channel image. Only the requested regions are read into memory.
 */
public interface ChannelImage extends Closeable {

    int getHeight();

    int getWidth();

    PixelType getPixelType();

    /**
     * Reads the region starting at (rowStart, colStart). The region must lie within the image bounds.
     */
    ImagePlane readRegion(int rowStart, int colStart, int height, int width);

    @Override
    void close();
}
