package org.janelia.coreprep.exceptions;

/**
 * Exception thrown if something goes wrong while preparing a core.
 */
public class ComputationException extends RuntimeException {

    public ComputationException(String message) {
        super(message);
    }

    public ComputationException(String message, Throwable cause) {
        super(message, cause);
    }

}
