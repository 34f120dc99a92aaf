package org.janelia.coreprep.transfer;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * A single file transfer between two endpoints, verified by checksum.
 */
public class TransferRequest {

    public static final String DEFAULT_LABEL = "Core Image Transfer";
    public static final String CHECKSUM_SYNC_LEVEL = "checksum";

    private final String sourceEndpoint;
    private final String destinationEndpoint;
    private final String sourcePath;
    private final String destinationPath;
    private final String label;
    private final String syncLevel;
    private final boolean verifyChecksum;

    public static TransferRequest checksumVerified(TransferEndpoints endpoints, String sourcePath, String destinationPath) {
        return new TransferRequest(endpoints.getSourceEndpoint(), endpoints.getDestinationEndpoint(),
                sourcePath, destinationPath, DEFAULT_LABEL, CHECKSUM_SYNC_LEVEL, true);
    }

    public TransferRequest(String sourceEndpoint, String destinationEndpoint, String sourcePath, String destinationPath,
                           String label, String syncLevel, boolean verifyChecksum) {
        this.sourceEndpoint = sourceEndpoint;
        this.destinationEndpoint = destinationEndpoint;
        this.sourcePath = sourcePath;
        this.destinationPath = destinationPath;
        this.label = label;
        this.syncLevel = syncLevel;
        this.verifyChecksum = verifyChecksum;
    }

    public String getSourceEndpoint() {
        return sourceEndpoint;
    }

    public String getDestinationEndpoint() {
        return destinationEndpoint;
    }

    public String getSourcePath() {
        return sourcePath;
    }

    public String getDestinationPath() {
        return destinationPath;
    }

    public String getLabel() {
        return label;
    }

    public String getSyncLevel() {
        return syncLevel;
    }

    public boolean isVerifyChecksum() {
        return verifyChecksum;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("sourceEndpoint", sourceEndpoint)
                .append("sourcePath", sourcePath)
                .append("destinationEndpoint", destinationEndpoint)
                .append("destinationPath", destinationPath)
                .toString();
    }
}
