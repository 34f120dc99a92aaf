package org.janelia.coreprep.exceptions;

public class MissingDataException extends ComputationException {

    public MissingDataException(String msg) {
        super(msg);
    }
    public MissingDataException(String msg, Throwable e) {
        super(msg, e);
    }

}
