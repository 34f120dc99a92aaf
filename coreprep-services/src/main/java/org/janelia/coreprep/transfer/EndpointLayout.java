package org.janelia.coreprep.transfer;

/**
 * How the destination endpoint exposes the host file system.
 */
public enum EndpointLayout {
    /** host paths are used unchanged */
    POSIX("posix"),
    /** every drive is a top level folder, e.g. C:\data -> /C/data */
    MULTI_DRIVE("multi_drive"),
    /** the drive root is the endpoint root, e.g. R:\data -> /data */
    SINGLE_DRIVE("single_drive"),
    /** only a folder is shared and it is the endpoint root */
    SUBFOLDER_ROOT("subfolder_root");

    private final String layoutName;

    EndpointLayout(String layoutName) {
        this.layoutName = layoutName;
    }

    public String getLayoutName() {
        return layoutName;
    }

    public static EndpointLayout fromLayoutName(String layoutName) {
        for (EndpointLayout layout : values()) {
            if (layout.layoutName.equalsIgnoreCase(layoutName) || layout.name().equalsIgnoreCase(layoutName)) {
                return layout;
            }
        }
        throw new IllegalArgumentException("Unsupported endpoint layout: " + layoutName);
    }
}
