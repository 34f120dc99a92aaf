package org.janelia.coreprep.transfer;

public class TransferException extends RuntimeException {

    private final int statusCode;

    public TransferException(String message) {
        this(message, -1, null);
    }

    public TransferException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public TransferException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * @return the HTTP status of the failed request or -1 if the request did not get a response
     */
    public int getStatusCode() {
        return statusCode;
    }
}
