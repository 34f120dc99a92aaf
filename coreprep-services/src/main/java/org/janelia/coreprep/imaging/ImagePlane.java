package org.janelia.coreprep.imaging;

import java.util.Arrays;

import com.google.common.base.Preconditions;

/**
 * A single channel 2D image held in memory, stored in row major order.
 */
public class ImagePlane {

    private final int height;
    private final int width;
    private final PixelType pixelType;
    private final int[] pixels;

    public static ImagePlane empty(PixelType pixelType) {
        return new ImagePlane(0, 0, pixelType, new int[0]);
    }

    public ImagePlane(int height, int width, PixelType pixelType) {
        this(height, width, pixelType, new int[Math.multiplyExact(height, width)]);
    }

    public ImagePlane(int height, int width, PixelType pixelType, int[] pixels) {
        Preconditions.checkArgument(height >= 0 && width >= 0, "Invalid plane size %sx%s", height, width);
        Preconditions.checkArgument(pixels.length == height * width,
                "Pixel buffer size %s does not match %sx%s", pixels.length, height, width);
        this.height = height;
        this.width = width;
        this.pixelType = Preconditions.checkNotNull(pixelType);
        this.pixels = pixels;
    }

    public int getHeight() {
        return height;
    }

    public int getWidth() {
        return width;
    }

    public PixelType getPixelType() {
        return pixelType;
    }

    public boolean isEmpty() {
        return height == 0 || width == 0;
    }

    public int get(int row, int col) {
        return pixels[index(row, col)];
    }

    public void set(int row, int col, int value) {
        pixels[index(row, col)] = value;
    }

    public void fill(int value) {
        Arrays.fill(pixels, value);
    }

    int[] getPixels() {
        return pixels;
    }

    private int index(int row, int col) {
        Preconditions.checkElementIndex(row, height, "row");
        Preconditions.checkElementIndex(col, width, "col");
        return row * width + col;
    }

    @Override
    public String toString() {
        return "ImagePlane{" + height + "x" + width + ", " + pixelType + "}";
    }
}
