package org.janelia.coreprep.orchestration;

public enum CoreState {
    WAITING,
    READY,
    ASSEMBLED,
    FAILED;

    public boolean isDone() {
        return this == ASSEMBLED || this == FAILED;
    }
}
