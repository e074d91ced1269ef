package com.vendoretl.error;

/**
 * Raised by the vendor API client. Carries the HTTP status when the failure came from a
 * response rather than from the transport.
 */
public class FetchException extends PipelineException {

    private final int statusCode;

    public FetchException(ErrorKind kind, String message) {
        this(kind, message, -1, null);
    }

    public FetchException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, -1, cause);
    }

    public FetchException(ErrorKind kind, String message, int statusCode, Throwable cause) {
        super(kind, message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP status of the failed response, or -1 for transport failures. */
    public int getStatusCode() {
        return statusCode;
    }
}
