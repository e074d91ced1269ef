package com.vendoretl.error;

/**
 * Raised while uploading to object storage.
 */
public class UploadException extends PipelineException {

    public UploadException(ErrorKind kind, String message) {
        super(kind, message);
    }

    public UploadException(ErrorKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }
}
