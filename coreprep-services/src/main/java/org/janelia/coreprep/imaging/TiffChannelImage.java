package org.janelia.coreprep.imaging;

import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Iterator;

import javax.imageio.ImageIO;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.stream.ImageInputStream;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * TIFF backed channel image. The first image of the file and its first band are used.
 */
public class TiffChannelImage implements ChannelImage {

    private static final Logger LOG = LoggerFactory.getLogger(TiffChannelImage.class);

    public static TiffChannelImage open(Path imagePath) {
        ImageInputStream imageStream = null;
        try {
            imageStream = ImageIO.createImageInputStream(imagePath.toFile());
            if (imageStream == null) {
                throw new IOException("Cannot open " + imagePath);
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(imageStream);
            if (!readers.hasNext()) {
                throw new IOException("No image reader found for " + imagePath);
            }
            ImageReader reader = readers.next();
            reader.setInput(imageStream, true, true);
            return new TiffChannelImage(imagePath, imageStream, reader);
        } catch (IOException e) {
            closeQuietly(imagePath, imageStream);
            throw new UncheckedIOException("Error opening channel image " + imagePath, e);
        }
    }

    private final Path imagePath;
    private final ImageInputStream imageStream;
    private final ImageReader reader;
    private final int height;
    private final int width;
    private final PixelType pixelType;

    private TiffChannelImage(Path imagePath, ImageInputStream imageStream, ImageReader reader) throws IOException {
        this.imagePath = imagePath;
        this.imageStream = imageStream;
        this.reader = reader;
        this.height = reader.getHeight(0);
        this.width = reader.getWidth(0);
        Iterator<ImageTypeSpecifier> imageTypes = reader.getImageTypes(0);
        if (!imageTypes.hasNext()) {
            throw new IOException("Cannot determine the pixel type of " + imagePath);
        }
        this.pixelType = PixelType.fromDataBufferType(imageTypes.next().getSampleModel().getDataType());
    }

    @Override
    public int getHeight() {
        return height;
    }

    @Override
    public int getWidth() {
        return width;
    }

    @Override
    public PixelType getPixelType() {
        return pixelType;
    }

    @Override
    public ImagePlane readRegion(int rowStart, int colStart, int regionHeight, int regionWidth) {
        Preconditions.checkArgument(rowStart >= 0 && colStart >= 0 && rowStart + regionHeight <= height && colStart + regionWidth <= width,
                "Region (%s, %s, %sx%s) is outside of %s", rowStart, colStart, regionHeight, regionWidth, imagePath);
        if (regionHeight == 0 || regionWidth == 0) {
            return ImagePlane.empty(pixelType);
        }
        ImageReadParam readParam = reader.getDefaultReadParam();
        readParam.setSourceRegion(new Rectangle(colStart, rowStart, regionWidth, regionHeight));
        try {
            BufferedImage regionImage = reader.read(0, readParam);
            Raster raster = regionImage.getRaster();
            int[] pixels = raster.getSamples(raster.getMinX(), raster.getMinY(), regionWidth, regionHeight, 0, (int[]) null);
            return new ImagePlane(regionHeight, regionWidth, pixelType, pixels);
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading region from " + imagePath, e);
        }
    }

    @Override
    public void close() {
        reader.dispose();
        closeQuietly(imagePath, imageStream);
    }

    private static void closeQuietly(Path imagePath, ImageInputStream imageStream) {
        if (imageStream == null) {
            return;
        }
        try {
            imageStream.close();
        } catch (IOException e) {
            LOG.warn("Error closing image stream for {}", imagePath, e);
        }
    }

    @Override
    public String toString() {
        return imagePath + "(" + height + "x" + width + ", " + pixelType + ")";
    }
}
