package com.vendoretl.error;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Base for every failure a city job can end with. Unchecked so it can travel through
 * {@link java.util.concurrent.CompletableFuture} stages untouched.
 */
public class PipelineException extends RuntimeException {

    private final ErrorKind kind;

    public PipelineException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PipelineException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    public static PipelineException cancelled(String message) {
        return new PipelineException(ErrorKind.CANCELLED, message);
    }

    /**
     * Strips the {@link CompletionException} / {@link ExecutionException} wrappers the async
     * stages add and maps whatever is left onto a {@link PipelineException}.
     */
    public static PipelineException from(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof PipelineException) {
            return (PipelineException) cause;
        }
        if (cause instanceof CancellationException) {
            return new PipelineException(ErrorKind.CANCELLED, "Run cancelled", cause);
        }
        return new PipelineException(ErrorKind.INTERNAL, String.valueOf(cause.getMessage()), cause);
    }

    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
