package org.janelia.coreprep.imaging;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

import javax.imageio.ImageIO;

public class ImagePlaneIO {

    private static final String TIFF_FORMAT = "TIFF";

    public static void writeTiff(ImagePlane plane, Path tiffPath) throws IOException {
        if (plane.isEmpty()) {
            throw new IllegalArgumentException("Cannot write empty image " + plane + " to " + tiffPath);
        }
        BufferedImage image = new BufferedImage(plane.getWidth(), plane.getHeight(), plane.getPixelType().getBufferedImageType());
        image.getRaster().setSamples(0, 0, plane.getWidth(), plane.getHeight(), 0, plane.getPixels());
        if (!ImageIO.write(image, TIFF_FORMAT, tiffPath.toFile())) {
            throw new IOException("No " + TIFF_FORMAT + " writer available for " + tiffPath);
        }
    }

    public static ImagePlane readTiff(Path tiffPath) {
        try (ChannelImage image = TiffChannelImage.open(tiffPath)) {
            return image.readRegion(0, 0, image.getHeight(), image.getWidth());
        }
    }
}
