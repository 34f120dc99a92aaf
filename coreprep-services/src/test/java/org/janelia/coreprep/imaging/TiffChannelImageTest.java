package org.janelia.coreprep.imaging;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.assertThrows;

public class TiffChannelImageTest {

    private static final short TYPE_SHORT = 3;
    private static final short TYPE_LONG8 = 16;

    @Rule
    public TemporaryFolder testFolder = new TemporaryFolder();

    @Test
    public void readRegionFromClassicTiff() throws IOException {
        ImagePlane plane = new ImagePlane(20, 30, PixelType.UINT16);
        for (int r = 0; r < 20; r++) {
            for (int c = 0; c < 30; c++) {
                plane.set(r, c, 100 * r + c);
            }
        }
        Path tiffPath = testFolder.getRoot().toPath().resolve("S1_1.0.4_R000_DAPI_DAPI_FINAL.ome.tif");
        ImagePlaneIO.writeTiff(plane, tiffPath);

        try (TiffChannelImage channelImage = TiffChannelImage.open(tiffPath)) {
            assertThat(channelImage.getHeight(), equalTo(20));
            assertThat(channelImage.getWidth(), equalTo(30));
            assertThat(channelImage.getPixelType(), equalTo(PixelType.UINT16));
            ImagePlane region = channelImage.readRegion(5, 10, 4, 3);
            assertThat(region.getHeight(), equalTo(4));
            assertThat(region.getWidth(), equalTo(3));
            assertThat(region.get(0, 0), equalTo(510));
            assertThat(region.get(3, 2), equalTo(812));
        }
    }

    @Test
    public void readRegionFromBigTiff() throws IOException {
        int height = 6;
        int width = 8;
        Path bigTiffPath = testFolder.getRoot().toPath().resolve("S1_4.0.4_R000_Cy3_CD3-AF555_FINAL.ome.tif");
        writeBigTiff(bigTiffPath, height, width);

        try (TiffChannelImage channelImage = TiffChannelImage.open(bigTiffPath)) {
            assertThat(channelImage.getHeight(), equalTo(height));
            assertThat(channelImage.getWidth(), equalTo(width));
            assertThat(channelImage.getPixelType(), equalTo(PixelType.UINT16));
            ImagePlane region = channelImage.readRegion(2, 3, 3, 4);
            assertThat(region.get(0, 0), equalTo(1000 * 2 + 3));
            assertThat(region.get(2, 3), equalTo(1000 * 4 + 6));
        }
    }

    @Test
    public void emptyRegionIsNotRead() throws IOException {
        Path tiffPath = testFolder.getRoot().toPath().resolve("small.tif");
        ImagePlaneIO.writeTiff(new ImagePlane(4, 4, PixelType.UINT8), tiffPath);
        try (TiffChannelImage channelImage = TiffChannelImage.open(tiffPath)) {
            assertThat(channelImage.readRegion(4, 0, 0, 4).isEmpty(), equalTo(true));
            assertThrows(IllegalArgumentException.class, () -> channelImage.readRegion(2, 2, 3, 3));
        }
    }

    @Test
    public void notAnImage() throws IOException {
        Path textPath = testFolder.newFile("notes.ome.tif").toPath();
        Files.write(textPath, "not a tiff".getBytes());
        assertThrows(UncheckedIOException.class, () -> TiffChannelImage.open(textPath));
    }

    /**
     * Writes a single strip, uncompressed, 16 bit grayscale BigTIFF where pixel (r, c) = 1000 * r + c.
     */
    private static void writeBigTiff(Path path, int height, int width) throws IOException {
        int entryCount = 9;
        long ifdOffset = 16;
        long dataOffset = ifdOffset + 8 + entryCount * 20L + 8;
        int dataLength = height * width * 2;
        ByteBuffer buffer = ByteBuffer.allocate((int) dataOffset + dataLength).order(ByteOrder.LITTLE_ENDIAN);
        // header: byte order, version 43, offset size 8, reserved, first IFD offset
        buffer.put((byte) 'I').put((byte) 'I').putShort((short) 43).putShort((short) 8).putShort((short) 0).putLong(ifdOffset);
        buffer.putLong(entryCount);
        putEntry(buffer, 256, TYPE_SHORT, width);
        putEntry(buffer, 257, TYPE_SHORT, height);
        putEntry(buffer, 258, TYPE_SHORT, 16);
        putEntry(buffer, 259, TYPE_SHORT, 1);
        putEntry(buffer, 262, TYPE_SHORT, 1);
        putEntry(buffer, 273, TYPE_LONG8, dataOffset);
        putEntry(buffer, 277, TYPE_SHORT, 1);
        putEntry(buffer, 278, TYPE_SHORT, height);
        putEntry(buffer, 279, TYPE_LONG8, dataLength);
        buffer.putLong(0);
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                buffer.putShort((short) (1000 * r + c));
            }
        }
        Files.write(path, buffer.array());
    }

    private static void putEntry(ByteBuffer buffer, int tag, short type, long value) {
        buffer.putShort((short) tag).putShort(type).putLong(1);
        if (type == TYPE_SHORT) {
            buffer.putShort((short) value).putShort((short) 0).putInt(0);
        } else {
            buffer.putLong(value);
        }
    }
}
