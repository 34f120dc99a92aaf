package org.janelia.coreprep.orchestration;

public enum ChannelState {
    DISCOVERED,
    PENDING_TRANSFER,
    LOCAL_READY,
    CUT,
    CLEANED,
    FAILED;

    /**
     * @return true if the channel needs no further processing
     */
    public boolean isSettled() {
        return this == CUT || this == CLEANED || this == FAILED;
    }
}
