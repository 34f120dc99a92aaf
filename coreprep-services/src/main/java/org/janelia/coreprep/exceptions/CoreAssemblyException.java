package org.janelia.coreprep.exceptions;

public class CoreAssemblyException extends ComputationException {

    private final String coreId;

    public CoreAssemblyException(String coreId, Throwable cause) {
        super("Error assembling core " + coreId + ": " + cause.getMessage(), cause);
        this.coreId = coreId;
    }

    public String getCoreId() {
        return coreId;
    }
}
