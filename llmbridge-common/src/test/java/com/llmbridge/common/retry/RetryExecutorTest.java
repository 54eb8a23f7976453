package com.llmbridge.common.retry;

import com.llmbridge.common.exception.NonRetriableException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryExecutorTest {

    private final List<Duration> delays = new ArrayList<>();
    private final RetryExecutor executor = new RetryExecutor(delays::add, () -> 0.05);

    private static RetryPolicy fastPolicy(int maxAttempts) {
        return RetryPolicy.builder()
            .maxAttempts(maxAttempts)
            .minBackoff(Duration.ofMillis(10))
            .maxBackoff(Duration.ofMillis(100))
            .jitter(false)
            .build();
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2, 5})
    void permanentFailureIsInvokedMaxAttemptsPlusOneTimes(int maxAttempts) {
        AtomicInteger calls = new AtomicInteger();
        IllegalStateException failure = new IllegalStateException("boom");

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
            () -> executor.runWithRetry(() -> {
                calls.incrementAndGet();
                throw failure;
            }, fastPolicy(maxAttempts)));

        assertEquals(maxAttempts + 1, calls.get());
        assertSame(failure, thrown);
        assertEquals(maxAttempts, delays.size());
    }

    @Test
    void succeedsAfterTransientFailures() {
        AtomicInteger calls = new AtomicInteger();

        String result = executor.runWithRetry(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("503");
            }
            return "ok";
        }, fastPolicy(2));

        assertEquals("ok", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(Duration.ofMillis(10), Duration.ofMillis(20)), delays);
    }

    @Test
    void predicateRejectionStopsImmediately() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = fastPolicy(5).toBuilder()
            .retryPredicate(e -> !(e instanceof IllegalArgumentException))
            .build();

        assertThrows(IllegalArgumentException.class, () -> executor.runWithRetry(() -> {
            calls.incrementAndGet();
            throw new IllegalArgumentException("bad input");
        }, policy));

        assertEquals(1, calls.get());
        assertTrue(delays.isEmpty());
    }

    @Test
    void nonRetriableExceptionIsNeverRetriedEvenWithoutPredicate() {
        AtomicInteger calls = new AtomicInteger();

        NonRetriableException thrown = assertThrows(NonRetriableException.class,
            () -> executor.runWithRetry(() -> {
                calls.incrementAndGet();
                throw new NonRetriableException("404", new IllegalStateException("not found"));
            }, fastPolicy(3)));

        assertEquals(1, calls.get());
        assertTrue(delays.isEmpty());
        assertInstanceOf(IllegalStateException.class, thrown.getCause());
    }

    @Test
    void failureCallbackSeesAttemptNumbersAndRemainingRetries() {
        List<FailedAttempt> attempts = new ArrayList<>();
        RetryPolicy policy = fastPolicy(3).toBuilder().onFailedAttempt(attempts::add).build();

        assertThrows(IllegalStateException.class, () -> executor.runWithRetry(() -> {
            throw new IllegalStateException("down");
        }, policy));

        assertEquals(3, attempts.size());
        for (int i = 0; i < attempts.size(); i++) {
            assertEquals(i + 1, attempts.get(i).getAttemptNumber());
            assertEquals(2 - i, attempts.get(i).getRetriesLeft());
            assertEquals("down", attempts.get(i).getMessage());
        }
    }

    @Test
    void jitterScalesEachDelay() {
        RetryPolicy policy = fastPolicy(2).toBuilder().jitter(true).build();
        AtomicInteger calls = new AtomicInteger();

        executor.runWithRetry(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("flaky");
            }
            return calls.get();
        }, policy);

        assertEquals(List.of(Duration.ofNanos(10_500_000), Duration.ofNanos(21_000_000)), delays);
    }

    @Test
    void interruptedBackoffRethrowsLastError() {
        RetryExecutor interrupting = new RetryExecutor(delay -> {
            throw new InterruptedException("stop");
        }, () -> 0);
        IllegalStateException failure = new IllegalStateException("down");

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
            () -> interrupting.runWithRetry(() -> {
                throw failure;
            }, fastPolicy(3)));

        assertSame(failure, thrown);
        assertTrue(Thread.interrupted());
    }
}
