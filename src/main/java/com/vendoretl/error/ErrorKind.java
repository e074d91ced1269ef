package com.vendoretl.error;

/**
 * Failure categories recorded on a city job.
 */
public enum ErrorKind {
    FETCH_RATE_LIMITED(true),
    FETCH_TRANSIENT(true),
    FETCH_PERMANENT(false),

    TRANSFORM_MISSING_REQUIRED_FIELD(false),
    TRANSFORM_MALFORMED_VALUE(false),
    TRANSFORM_SYSTEMIC(false),

    WRITE_ENCODING(false),
    WRITE_IO(false),

    UPLOAD_TRANSIENT(true),
    UPLOAD_PERMANENT(false),
    UPLOAD_UNACKNOWLEDGED(true),

    CANCELLED(false),
    INTERNAL(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
