package org.janelia.coreprep.transfer;

public enum TransferStatus {
    PENDING,
    SUCCEEDED,
    FAILED;

    /**
     * Maps a transfer service task status. Anything that is neither SUCCEEDED nor FAILED is still in progress.
     */
    public static TransferStatus fromServiceStatus(String serviceStatus) {
        if ("SUCCEEDED".equalsIgnoreCase(serviceStatus)) {
            return SUCCEEDED;
        } else if ("FAILED".equalsIgnoreCase(serviceStatus)) {
            return FAILED;
        } else {
            return PENDING;
        }
    }

    public boolean isTerminal() {
        return this != PENDING;
    }
}
