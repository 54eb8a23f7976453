package com.llmbridge.common.retry;

import com.llmbridge.common.exception.NonRetriableException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

/**
 * Runs an operation under a {@link RetryPolicy}.
 *
 * <p>Backoff only parks the calling thread. Instances hold no per-call state and can be
 * shared across threads.
 */
@Slf4j
public class RetryExecutor {

    private static final double MAX_JITTER = 0.1;

    private final BackoffSleeper sleeper;
    private final DoubleSupplier jitterSource;

    public RetryExecutor() {
        this(BackoffSleeper.THREAD_SLEEP, () -> ThreadLocalRandom.current().nextDouble(MAX_JITTER));
    }

    public RetryExecutor(BackoffSleeper sleeper, DoubleSupplier jitterSource) {
        this.sleeper = sleeper;
        this.jitterSource = jitterSource;
    }

    /**
     * Executes {@code operation} up to {@code policy.getMaxAttempts() + 1} times.
     * When every attempt fails, or a failure is not retriable, the last error is rethrown as-is.
     */
    public <T> T runWithRetry(Supplier<T> operation, RetryPolicy policy) {
        policy.validate();
        int maxAttempts = policy.getMaxAttempts();

        for (int attempt = 0; ; attempt++) {
            try {
                return operation.get();
            } catch (RuntimeException e) {
                if (attempt >= maxAttempts) {
                    if (maxAttempts > 0) {
                        log.debug("[RETRY] Attempts exhausted | attempts={} | error={}", attempt + 1, e.getMessage());
                    }
                    throw e;
                }
                if (e instanceof NonRetriableException) {
                    log.debug("[RETRY] Non-retriable failure, giving up | attempt={} | error={}", attempt + 1, e.getMessage());
                    throw e;
                }
                if (policy.getRetryPredicate() != null && !policy.getRetryPredicate().test(e)) {
                    log.debug("[RETRY] Retry predicate rejected failure | attempt={} | error={}", attempt + 1, e.getMessage());
                    throw e;
                }

                int retriesLeft = maxAttempts - attempt - 1;
                if (policy.getOnFailedAttempt() != null) {
                    policy.getOnFailedAttempt().accept(new FailedAttempt(e, attempt + 1, retriesLeft));
                }

                Duration delay = policy.backoff(attempt, policy.isJitter() ? jitterSource.getAsDouble() : 0);
                log.debug("[RETRY] Retrying in {}ms | attempt={} | retriesLeft={} | error={}",
                    delay.toMillis(), attempt + 1, retriesLeft, e.getMessage());

                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("[RETRY] Interrupted during backoff, giving up | attempt={}", attempt + 1);
                    e.addSuppressed(ie);
                    throw e;
                }
            }
        }
    }
}
