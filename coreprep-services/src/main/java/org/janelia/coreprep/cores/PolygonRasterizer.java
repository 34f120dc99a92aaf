package org.janelia.coreprep.cores;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;

/**
 * Rasterizes a polygon given in local pixel coordinates into a keep mask.
 * Pixel (r, c) is kept if the point (r, c) is strictly inside the polygon by the even-odd rule
 * or lies on one of its edges or vertices.
 */
public class PolygonRasterizer {

    private static final double EPS = 1e-9;

    /**
     * @return row major mask of size height x width
     */
    public boolean[] rasterize(List<PolygonVertex> vertices, int height, int width) {
        Preconditions.checkArgument(vertices.size() >= 3, "A polygon requires at least 3 vertices");
        boolean[] mask = new boolean[height * width];
        for (int row = 0; row < height; row++) {
            fillInterior(vertices, row, width, mask);
        }
        markBoundary(vertices, height, width, mask);
        return mask;
    }

    private void fillInterior(List<PolygonVertex> vertices, int row, int width, boolean[] mask) {
        List<Double> crossings = new ArrayList<>();
        int n = vertices.size();
        for (int i = 0; i < n; i++) {
            PolygonVertex v1 = vertices.get(i);
            PolygonVertex v2 = vertices.get((i + 1) % n);
            // half open in y so a vertex shared by two edges is counted once
            if ((v1.getY() <= row && v2.getY() > row) || (v2.getY() <= row && v1.getY() > row)) {
                crossings.add(v1.getX() + (row - v1.getY()) * (v2.getX() - v1.getX()) / (v2.getY() - v1.getY()));
            }
        }
        Collections.sort(crossings);
        for (int i = 0; i + 1 < crossings.size(); i += 2) {
            int firstCol = Math.max(0, (int) Math.floor(crossings.get(i)) + 1);
            int lastCol = Math.min(width - 1, (int) Math.ceil(crossings.get(i + 1)) - 1);
            for (int col = firstCol; col <= lastCol; col++) {
                mask[row * width + col] = true;
            }
        }
    }

    private void markBoundary(List<PolygonVertex> vertices, int height, int width, boolean[] mask) {
        int n = vertices.size();
        for (int i = 0; i < n; i++) {
            PolygonVertex v1 = vertices.get(i);
            PolygonVertex v2 = vertices.get((i + 1) % n);
            int firstRow = Math.max(0, (int) Math.ceil(Math.min(v1.getY(), v2.getY()) - EPS));
            int lastRow = Math.min(height - 1, (int) Math.floor(Math.max(v1.getY(), v2.getY()) + EPS));
            for (int row = firstRow; row <= lastRow; row++) {
                if (Math.abs(v2.getY() - v1.getY()) < EPS) {
                    if (Math.abs(row - v1.getY()) >= EPS) {
                        continue;
                    }
                    int firstCol = Math.max(0, (int) Math.ceil(Math.min(v1.getX(), v2.getX()) - EPS));
                    int lastCol = Math.min(width - 1, (int) Math.floor(Math.max(v1.getX(), v2.getX()) + EPS));
                    for (int col = firstCol; col <= lastCol; col++) {
                        mask[row * width + col] = true;
                    }
                } else {
                    double x = v1.getX() + (row - v1.getY()) * (v2.getX() - v1.getX()) / (v2.getY() - v1.getY());
                    long col = Math.round(x);
                    if (Math.abs(x - col) < EPS && col >= 0 && col < width) {
                        mask[row * width + (int) col] = true;
                    }
                }
            }
        }
    }
}
