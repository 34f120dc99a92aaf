package org.janelia.coreprep.transfer;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Set;

/**
 * Channel images that are already on the local file system. They are never deleted.
 */
public class LocalAvailability implements FileAvailability {

    @Override
    public boolean fetchOrWait(String channel, Path localPath) {
        return Files.exists(localPath);
    }

    @Override
    public void cleanup(String channel, Path localPath, boolean force) {
        // source images are not owned by the run
    }

    @Override
    public Set<String> getFailedChannels() {
        return Collections.emptySet();
    }
}
