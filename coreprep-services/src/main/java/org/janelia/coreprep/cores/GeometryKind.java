package org.janelia.coreprep.cores;

import org.apache.commons.lang3.StringUtils;

public enum GeometryKind {
    RECTANGLE("rectangle"),
    POLYGON("polygon");

    private final String typeName;

    GeometryKind(String typeName) {
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }

    public static GeometryKind fromTypeName(String typeName) {
        for (GeometryKind kind : values()) {
            if (kind.typeName.equalsIgnoreCase(StringUtils.trim(typeName))) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown geometry kind: " + typeName);
    }
}
