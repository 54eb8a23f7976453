package com.llmbridge.common.retry;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Bounded retry with exponential backoff.
 *
 * <p>Backoff before retry {@code k} (0-indexed) is {@code min(minBackoff * 2^k, maxBackoff)},
 * scaled by {@code (1 + jitter)} with {@code jitter} drawn from [0, 0.1) when jitter is enabled.
 */
@Value
@Builder(toBuilder = true)
public class RetryPolicy {

    /** Retries after the first attempt. Zero means a single attempt. */
    @Builder.Default
    int maxAttempts = 3;

    @Builder.Default
    Duration minBackoff = Duration.ofMillis(1000);

    @Builder.Default
    Duration maxBackoff = Duration.ofMillis(10000);

    @Builder.Default
    boolean jitter = true;

    /** Decides whether an error may be retried. Null treats every error as retriable. */
    Predicate<Throwable> retryPredicate;

    /** Observes each failed attempt that is about to be retried. */
    Consumer<FailedAttempt> onFailedAttempt;

    public static RetryPolicy defaults() {
        return RetryPolicy.builder().build();
    }

    public static RetryPolicy noRetry() {
        return RetryPolicy.builder().maxAttempts(0).build();
    }

    public int getTotalAttempts() {
        return maxAttempts + 1;
    }

    /**
     * Backoff before retry {@code retryIndex} without jitter.
     */
    public Duration baseBackoff(int retryIndex) {
        long minMs = minBackoff.toMillis();
        long maxMs = maxBackoff.toMillis();
        double exponential = minMs * Math.pow(2, retryIndex);
        return Duration.ofMillis((long) Math.min(exponential, maxMs));
    }

    /**
     * Backoff before retry {@code retryIndex} scaled by {@code (1 + jitterFactor)}.
     * The factor is ignored when jitter is disabled.
     */
    public Duration backoff(int retryIndex, double jitterFactor) {
        Duration base = baseBackoff(retryIndex);
        if (!jitter) {
            return base;
        }
        return Duration.ofNanos((long) (base.toNanos() * (1 + jitterFactor)));
    }

    public void validate() {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0, was " + maxAttempts);
        }
        if (minBackoff == null || maxBackoff == null || minBackoff.isNegative() || maxBackoff.isNegative()) {
            throw new IllegalArgumentException("Backoff bounds must be non-negative durations");
        }
    }
}
