package org.janelia.coreprep.transfer;

/**
 * Transfer error that may succeed if retried, e.g. a connection failure or an unavailable service.
 */
public class TransientTransferException extends TransferException {

    public TransientTransferException(String message, Throwable cause) {
        super(message, cause);
    }

    public TransientTransferException(String message, int statusCode, Throwable cause) {
        super(message, statusCode, cause);
    }
}
