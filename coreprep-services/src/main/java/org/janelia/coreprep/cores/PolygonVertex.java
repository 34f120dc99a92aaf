package org.janelia.coreprep.cores;

import java.util.Objects;

/**
 * Polygon vertex in (y, x) image coordinates.
 */
public class PolygonVertex {

    private final double y;
    private final double x;

    public PolygonVertex(double y, double x) {
        this.y = y;
        this.x = x;
    }

    public double getY() {
        return y;
    }

    public double getX() {
        return x;
    }

    public PolygonVertex shift(double dy, double dx) {
        return new PolygonVertex(y + dy, x + dx);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PolygonVertex that = (PolygonVertex) o;
        return Double.compare(that.y, y) == 0 && Double.compare(that.x, x) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(y, x);
    }

    @Override
    public String toString() {
        return "(" + y + ", " + x + ")";
    }
}
