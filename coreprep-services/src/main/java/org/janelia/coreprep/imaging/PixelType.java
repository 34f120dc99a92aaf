package org.janelia.coreprep.imaging;

import java.awt.image.BufferedImage;
import java.awt.image.DataBuffer;

/**
 * Supported single band pixel types.
 */
public enum PixelType {
    UINT8(BufferedImage.TYPE_BYTE_GRAY, DataBuffer.TYPE_BYTE, 255),
    UINT16(BufferedImage.TYPE_USHORT_GRAY, DataBuffer.TYPE_USHORT, 65535);

    private final int bufferedImageType;
    private final int dataBufferType;
    private final int maxValue;

    PixelType(int bufferedImageType, int dataBufferType, int maxValue) {
        this.bufferedImageType = bufferedImageType;
        this.dataBufferType = dataBufferType;
        this.maxValue = maxValue;
    }

    public static PixelType fromDataBufferType(int dataBufferType) {
        for (PixelType pixelType : values()) {
            if (pixelType.dataBufferType == dataBufferType) {
                return pixelType;
            }
        }
        throw new IllegalArgumentException("Unsupported pixel data type: " + dataBufferType);
    }

    public int getBufferedImageType() {
        return bufferedImageType;
    }

    public int getMaxValue() {
        return maxValue;
    }

    /**
     * Rounds the value to the nearest representable intensity.
     */
    public int clamp(double value) {
        long rounded = Math.round(value);
        if (rounded < 0) {
            return 0;
        } else if (rounded > maxValue) {
            return maxValue;
        } else {
            return (int) rounded;
        }
    }
}
