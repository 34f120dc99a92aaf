package org.janelia.coreprep.cores;

import java.util.Objects;

/**
 * Half open pixel box [rowStart, rowStop) x [colStart, colStop).
 */
public class BoundingBox {

    private final int rowStart;
    private final int rowStop;
    private final int colStart;
    private final int colStop;

    public BoundingBox(int rowStart, int rowStop, int colStart, int colStop) {
        this.rowStart = rowStart;
        this.rowStop = rowStop;
        this.colStart = colStart;
        this.colStop = colStop;
    }

    public int getRowStart() {
        return rowStart;
    }

    public int getRowStop() {
        return rowStop;
    }

    public int getColStart() {
        return colStart;
    }

    public int getColStop() {
        return colStop;
    }

    public int getHeight() {
        return Math.max(0, rowStop - rowStart);
    }

    public int getWidth() {
        return Math.max(0, colStop - colStart);
    }

    public boolean isEmpty() {
        return getHeight() == 0 || getWidth() == 0;
    }

    /**
     * Grows the box by margin on every side and clips it to an image of the given size.
     * The clipped box never has a negative extent.
     */
    public BoundingBox expandAndClip(int margin, int imageHeight, int imageWidth) {
        int clippedRowStart = Math.min(imageHeight, Math.max(0, rowStart - margin));
        int clippedRowStop = Math.max(clippedRowStart, Math.min(imageHeight, rowStop + margin));
        int clippedColStart = Math.min(imageWidth, Math.max(0, colStart - margin));
        int clippedColStop = Math.max(clippedColStart, Math.min(imageWidth, colStop + margin));
        return new BoundingBox(clippedRowStart, clippedRowStop, clippedColStart, clippedColStop);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BoundingBox that = (BoundingBox) o;
        return rowStart == that.rowStart && rowStop == that.rowStop && colStart == that.colStart && colStop == that.colStop;
    }

    @Override
    public int hashCode() {
        return Objects.hash(rowStart, rowStop, colStart, colStop);
    }

    @Override
    public String toString() {
        return "[" + rowStart + ":" + rowStop + ", " + colStart + ":" + colStop + "]";
    }
}
