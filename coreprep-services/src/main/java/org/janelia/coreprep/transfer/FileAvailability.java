package org.janelia.coreprep.transfer;

import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

/**
 * Makes channel images available on the local file system.
 */
public interface FileAvailability {

    /**
     * Non blocking check.
     *
     * @return true if the channel image is ready to be read from the local path
     */
    boolean fetchOrWait(String channel, Path localPath);

    /**
     * Releases a channel image once it is no longer needed. Errors are logged, never thrown.
     */
    default void cleanup(String channel, Path localPath) {
        cleanup(channel, localPath, false);
    }

    void cleanup(String channel, Path localPath, boolean force);

    /**
     * @return channels that will never become available
     */
    Set<String> getFailedChannels();

    default Optional<String> getFailureReason(String channel) {
        return Optional.empty();
    }
}
