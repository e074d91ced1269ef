package com.vendoretl;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff shared by the fetch and upload stages.
 *
 * <p>Retry {@code n} (0-based) waits {@code min(baseDelay * 2^n, maxDelay)} scaled by a jitter
 * factor in {@code [0.5, 1.5)}, and never more than {@code maxDelay}. {@code maxRetries} is the
 * total number of attempts an operation gets, the first one included.
 */
@Value
@Builder
public class BackoffPolicy {
    static final double JITTER_MIN = 0.5;
    static final double JITTER_MAX = 1.5;

    Duration baseDelay;
    Duration maxDelay;
    int maxRetries;

    @Builder.Default
    DoubleSupplier jitter = () -> ThreadLocalRandom.current().nextDouble(JITTER_MIN, JITTER_MAX);

    public static BackoffPolicy from(EnvironmentConfig config) {
        return BackoffPolicy.builder()
                .baseDelay(config.getRetryBaseDelay())
                .maxDelay(config.getRetryMaxDelay())
                .maxRetries(config.getMaxRetries())
                .build();
    }

    /** Delay before retry {@code retry}, without jitter. */
    public Duration baseDelayFor(int retry) {
        long cap = maxDelay.toMillis();
        long delay = baseDelay.toMillis();
        for (int i = 0; i < retry && delay < cap; i++) {
            delay = delay * 2;
        }
        return Duration.ofMillis(Math.min(delay, cap));
    }

    /** Jittered delay before retry {@code retry}. */
    public Duration delayFor(int retry) {
        long base = baseDelayFor(retry).toMillis();
        long jittered = Math.round(base * jitter.getAsDouble());
        return Duration.ofMillis(Math.min(jittered, maxDelay.toMillis()));
    }

    /** Total attempts a single operation gets, the first one included. */
    public int maxAttempts() {
        return maxRetries;
    }
}
