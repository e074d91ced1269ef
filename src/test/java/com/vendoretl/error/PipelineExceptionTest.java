package com.vendoretl.error;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelineExceptionTest {

    @Test
    void testFromUnwrapsAsyncWrappers() {
        FetchException original = new FetchException(ErrorKind.FETCH_RATE_LIMITED, "429", 429, null);

        PipelineException unwrapped = PipelineException.from(
                new CompletionException(new ExecutionException(original)));

        assertSame(original, unwrapped);
        assertTrue(unwrapped.isRetryable());
    }

    @Test
    void testFromMapsForeignExceptions() {
        assertEquals(ErrorKind.CANCELLED, PipelineException.from(new CompletionException(new CancellationException())).getKind());

        PipelineException internal = PipelineException.from(new NullPointerException("oops"));
        assertEquals(ErrorKind.INTERNAL, internal.getKind());
        assertFalse(internal.isRetryable());
    }

    @Test
    void testRetryableKinds() {
        assertTrue(ErrorKind.FETCH_RATE_LIMITED.isRetryable());
        assertTrue(ErrorKind.FETCH_TRANSIENT.isRetryable());
        assertTrue(ErrorKind.UPLOAD_TRANSIENT.isRetryable());
        assertTrue(ErrorKind.UPLOAD_UNACKNOWLEDGED.isRetryable());
        assertFalse(ErrorKind.FETCH_PERMANENT.isRetryable());
        assertFalse(ErrorKind.TRANSFORM_SYSTEMIC.isRetryable());
        assertFalse(ErrorKind.WRITE_IO.isRetryable());
        assertFalse(ErrorKind.UPLOAD_PERMANENT.isRetryable());
        assertFalse(ErrorKind.CANCELLED.isRetryable());
    }
}
