package org.janelia.coreprep.assembly;

import java.util.List;

import com.google.common.collect.ImmutableList;
import org.janelia.coreprep.imaging.ImagePlane;

/**
 * A named channel of a core artifact with its pyramid levels, full resolution first.
 */
public class MultiscaleChannel {

    private final String name;
    private final List<ImagePlane> levels;

    public MultiscaleChannel(String name, List<ImagePlane> levels) {
        this.name = name;
        this.levels = ImmutableList.copyOf(levels);
    }

    public String getName() {
        return name;
    }

    public List<ImagePlane> getLevels() {
        return levels;
    }
}
