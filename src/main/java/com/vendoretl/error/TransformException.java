package com.vendoretl.error;

public class TransformException extends PipelineException {

    public TransformException(ErrorKind kind, String message) {
        super(kind, message);
    }
}
