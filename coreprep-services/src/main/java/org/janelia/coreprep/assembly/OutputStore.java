package org.janelia.coreprep.assembly;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Persists assembled cores.
 */
public interface OutputStore {

    boolean exists(String coreId);

    /**
     * Writes the artifact replacing any previous artifact of the same core.
     *
     * @return location of the written artifact
     */
    Path write(String coreId, CoreArtifact artifact) throws IOException;
}
