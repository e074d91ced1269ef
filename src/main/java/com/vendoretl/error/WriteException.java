package com.vendoretl.error;

/**
 * Raised while writing the columnar file.
 */
public class WriteException extends PipelineException {

    public WriteException(ErrorKind kind, String message) {
        super(kind, message);
    }

    public WriteException(ErrorKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }
}
