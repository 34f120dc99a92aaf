package org.janelia.coreprep.cores;

import java.util.List;
import java.util.stream.Collectors;

import com.google.common.base.Preconditions;
import org.janelia.coreprep.imaging.ChannelImage;
import org.janelia.coreprep.imaging.ImagePlane;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cuts a core out of a channel image. The core bounding box is grown by the margin and clipped to the image;
 * for polygon cores every pixel outside the polygon is replaced with the mask value.
 */
public class RegionExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(RegionExtractor.class);

    private final int margin;
    private final double maskValue;
    private final PolygonRasterizer rasterizer;

    public RegionExtractor(int margin, double maskValue) {
        this(margin, maskValue, new PolygonRasterizer());
    }

    RegionExtractor(int margin, double maskValue, PolygonRasterizer rasterizer) {
        Preconditions.checkArgument(margin >= 0, "Margin must not be negative: %s", margin);
        this.margin = margin;
        this.maskValue = maskValue;
        this.rasterizer = rasterizer;
    }

    public ImagePlane extract(ChannelImage image, CoreSpec core) {
        BoundingBox region = core.getBbox().expandAndClip(margin, image.getHeight(), image.getWidth());
        LOG.debug("Extract {} region {} from {}", core.getCoreId(), region, image);
        ImagePlane plane = image.readRegion(region.getRowStart(), region.getColStart(), region.getHeight(), region.getWidth());
        switch (core.getGeometryKind()) {
            case RECTANGLE:
                return plane;
            case POLYGON:
                return applyPolygonMask(plane, region, core.getPolygonVertices());
            default:
                throw new IllegalArgumentException("Unknown geometry kind: " + core.getGeometryKind());
        }
    }

    private ImagePlane applyPolygonMask(ImagePlane plane, BoundingBox region, List<PolygonVertex> vertices) {
        if (plane.isEmpty()) {
            return plane;
        }
        List<PolygonVertex> localVertices = vertices.stream()
                .map(v -> v.shift(-region.getRowStart(), -region.getColStart()))
                .collect(Collectors.toList());
        boolean[] keep = rasterizer.rasterize(localVertices, plane.getHeight(), plane.getWidth());
        ImagePlane masked = new ImagePlane(plane.getHeight(), plane.getWidth(), plane.getPixelType());
        masked.fill(plane.getPixelType().clamp(maskValue));
        for (int row = 0; row < plane.getHeight(); row++) {
            for (int col = 0; col < plane.getWidth(); col++) {
                if (keep[row * plane.getWidth() + col]) {
                    masked.set(row, col, plane.get(row, col));
                }
            }
        }
        return masked;
    }
}
