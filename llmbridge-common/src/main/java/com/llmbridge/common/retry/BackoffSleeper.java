package com.llmbridge.common.retry;

import java.time.Duration;

/**
 * Suspends the calling thread between retry attempts.
 */
@FunctionalInterface
public interface BackoffSleeper {

    BackoffSleeper THREAD_SLEEP = delay -> Thread.sleep(delay.toMillis(), delay.toNanosPart() % 1_000_000);

    void sleep(Duration delay) throws InterruptedException;
}
