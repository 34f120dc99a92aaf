package org.janelia.coreprep.assembly;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;
import org.janelia.coreprep.imaging.ImagePlane;

/**
 * Builds a multiscale pyramid by block averaging. Level 0 is the full resolution image and every
 * following level is smaller by the downscale factor (rounded up). No level is generated past the
 * point where a dimension has reached 1.
 */
public class PyramidBuilder {

    private final int maxLevels;
    private final int downscale;

    public PyramidBuilder(int maxLevels, int downscale) {
        Preconditions.checkArgument(maxLevels >= 1, "Max pyramid levels must be at least 1: %s", maxLevels);
        Preconditions.checkArgument(downscale >= 2, "Downscale factor must be at least 2: %s", downscale);
        this.maxLevels = maxLevels;
        this.downscale = downscale;
    }

    public int getDownscale() {
        return downscale;
    }

    public List<ImagePlane> build(ImagePlane fullResolution) {
        List<ImagePlane> levels = new ArrayList<>();
        levels.add(fullResolution);
        ImagePlane current = fullResolution;
        while (levels.size() < maxLevels && current.getHeight() > 1 && current.getWidth() > 1) {
            current = downsample(current, downscale);
            levels.add(current);
        }
        return levels;
    }

    static ImagePlane downsample(ImagePlane plane, int factor) {
        int height = (plane.getHeight() + factor - 1) / factor;
        int width = (plane.getWidth() + factor - 1) / factor;
        ImagePlane downsampled = new ImagePlane(height, width, plane.getPixelType());
        for (int row = 0; row < height; row++) {
            int rowStop = Math.min(plane.getHeight(), (row + 1) * factor);
            for (int col = 0; col < width; col++) {
                int colStop = Math.min(plane.getWidth(), (col + 1) * factor);
                long sum = 0;
                int count = 0;
                for (int r = row * factor; r < rowStop; r++) {
                    for (int c = col * factor; c < colStop; c++) {
                        sum += plane.get(r, c);
                        count++;
                    }
                }
                downsampled.set(row, col, plane.getPixelType().clamp((double) sum / count));
            }
        }
        return downsampled;
    }
}
