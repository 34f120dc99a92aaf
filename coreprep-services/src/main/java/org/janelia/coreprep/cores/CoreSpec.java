package org.janelia.coreprep.cores;

import java.util.Collection;
import java.util.List;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Definition of a core. An empty set of required channels means the core needs every selected channel.
 */
public class CoreSpec {

    private final String coreId;
    private final BoundingBox bbox;
    private final GeometryKind geometryKind;
    private final List<PolygonVertex> polygonVertices;
    private final Set<String> requiredChannels;

    public CoreSpec(String coreId, BoundingBox bbox, GeometryKind geometryKind,
                    Collection<PolygonVertex> polygonVertices, Collection<String> requiredChannels) {
        Preconditions.checkArgument(StringUtils.isNotBlank(coreId), "Core id is required");
        Preconditions.checkArgument(geometryKind != GeometryKind.POLYGON || (polygonVertices != null && polygonVertices.size() >= 3),
                "Polygon core %s requires at least 3 vertices", coreId);
        this.coreId = coreId;
        this.bbox = Preconditions.checkNotNull(bbox);
        this.geometryKind = Preconditions.checkNotNull(geometryKind);
        this.polygonVertices = polygonVertices == null ? ImmutableList.of() : ImmutableList.copyOf(polygonVertices);
        this.requiredChannels = requiredChannels == null ? ImmutableSet.of() : ImmutableSet.copyOf(requiredChannels);
    }

    public static CoreSpec rectangle(String coreId, BoundingBox bbox) {
        return new CoreSpec(coreId, bbox, GeometryKind.RECTANGLE, null, null);
    }

    public static CoreSpec polygon(String coreId, BoundingBox bbox, List<PolygonVertex> vertices) {
        return new CoreSpec(coreId, bbox, GeometryKind.POLYGON, vertices, null);
    }

    public String getCoreId() {
        return coreId;
    }

    public BoundingBox getBbox() {
        return bbox;
    }

    public GeometryKind getGeometryKind() {
        return geometryKind;
    }

    public List<PolygonVertex> getPolygonVertices() {
        return polygonVertices;
    }

    public Set<String> getRequiredChannels() {
        return requiredChannels;
    }

    public boolean hasExplicitChannels() {
        return !requiredChannels.isEmpty();
    }

    public CoreSpec withRequiredChannels(Collection<String> channels) {
        return new CoreSpec(coreId, bbox, geometryKind, polygonVertices, channels);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("coreId", coreId)
                .append("bbox", bbox)
                .append("geometryKind", geometryKind)
                .append("requiredChannels", requiredChannels)
                .toString();
    }
}
