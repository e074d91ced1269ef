package com.vendoretl;

import com.vendoretl.error.PipelineException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.IntConsumer;
import java.util.function.Supplier;

/**
 * Runs an asynchronous operation under a {@link BackoffPolicy}. Retryable {@link PipelineException}s
 * are retried after a non-blocking delay; anything else, or the last retryable failure once the
 * budget is spent, completes the returned future exceptionally.
 */
@Slf4j
@RequiredArgsConstructor
public class RetryingExecutor {

    private final BackoffPolicy policy;
    private final Executor executor;
    private final CancellationToken cancellation;

    public BackoffPolicy getPolicy() {
        return policy;
    }

    /**
     * @param description     what is being attempted, for logs
     * @param operation       starts one attempt; called again for every retry
     * @param attemptListener told the 1-based number of every attempt before it starts
     */
    public <T> CompletableFuture<T> execute(String description,
                                            Supplier<CompletableFuture<T>> operation,
                                            IntConsumer attemptListener) {
        CompletableFuture<T> result = new CompletableFuture<>();
        attempt(description, operation, attemptListener, 0, result);
        return result;
    }

    private <T> void attempt(String description,
                             Supplier<CompletableFuture<T>> operation,
                             IntConsumer attemptListener,
                             int retry,
                             CompletableFuture<T> result) {
        if (cancellation.isCancelled()) {
            result.completeExceptionally(PipelineException.cancelled("Cancelled before " + description));
            return;
        }
        attemptListener.accept(retry + 1);

        CompletableFuture<T> current;
        try {
            current = operation.get();
        } catch (RuntimeException e) {
            current = CompletableFuture.failedFuture(e);
        }

        current.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
                return;
            }
            PipelineException failure = PipelineException.from(error);
            if (!failure.isRetryable()) {
                result.completeExceptionally(failure);
                return;
            }
            if (retry + 1 >= policy.maxAttempts()) {
                log.warn("{} failed after {} attempt(s): {}", description, retry + 1, failure.getMessage());
                result.completeExceptionally(failure);
                return;
            }

            Duration delay = policy.delayFor(retry);
            log.warn("{} failed with {} - retrying in {} ms (attempt {}/{})",
                    description, failure.getKind(), delay.toMillis(), retry + 1, policy.maxAttempts());

            sleep(delay).whenComplete((ignored, interrupted) -> {
                if (interrupted != null) {
                    result.completeExceptionally(PipelineException.cancelled("Cancelled while backing off: " + description));
                } else {
                    attempt(description, operation, attemptListener, retry + 1, result);
                }
            });
        });
    }

    private CompletableFuture<Void> sleep(Duration delay) {
        CompletableFuture<Void> timer = new CompletableFuture<>();
        CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS, executor)
                .execute(() -> timer.complete(null));
        return cancellation.register(timer);
    }
}
