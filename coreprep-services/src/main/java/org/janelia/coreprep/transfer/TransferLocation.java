package org.janelia.coreprep.transfer;

import java.nio.file.Path;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Where a channel image comes from and where it lands.
 * The transfer path is the destination as seen by the destination endpoint and
 * the local path is the same file as seen by this host.
 */
public class TransferLocation {

    private final String remotePath;
    private final String transferPath;
    private final Path localPath;

    public TransferLocation(String remotePath, String transferPath, Path localPath) {
        this.remotePath = remotePath;
        this.transferPath = transferPath;
        this.localPath = localPath;
    }

    public String getRemotePath() {
        return remotePath;
    }

    public String getTransferPath() {
        return transferPath;
    }

    public Path getLocalPath() {
        return localPath;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("remotePath", remotePath)
                .append("transferPath", transferPath)
                .append("localPath", localPath)
                .toString();
    }
}
