package com.llmbridge.common.retry;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private final RetryPolicy policy = RetryPolicy.builder()
        .minBackoff(Duration.ofMillis(100))
        .maxBackoff(Duration.ofMillis(1000))
        .jitter(false)
        .build();

    @ParameterizedTest
    @CsvSource({
        "0, 100",
        "1, 200",
        "2, 400",
        "3, 800",
        "4, 1000",
        "10, 1000",
        "80, 1000",
    })
    void baseBackoffDoublesUntilCapped(int retryIndex, long expectedMs) {
        assertEquals(Duration.ofMillis(expectedMs), policy.backoff(retryIndex, 0.05));
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, 0.01, 0.05, 0.0999999})
    void jitterStaysWithinTenPercentAboveBase(double jitter) {
        RetryPolicy jittered = policy.toBuilder().jitter(true).build();
        for (int k = 0; k < 6; k++) {
            long base = jittered.baseBackoff(k).toNanos();
            long actual = jittered.backoff(k, jitter).toNanos();
            assertTrue(actual >= base, "backoff below base for k=" + k);
            assertTrue(actual < base * 1.1, "backoff reached base * 1.1 for k=" + k);
        }
    }

    @Test
    void defaultsMatchDocumentedValues() {
        RetryPolicy defaults = RetryPolicy.defaults();
        assertEquals(3, defaults.getMaxAttempts());
        assertEquals(Duration.ofSeconds(1), defaults.getMinBackoff());
        assertEquals(Duration.ofSeconds(10), defaults.getMaxBackoff());
        assertTrue(defaults.isJitter());
        assertNull(defaults.getRetryPredicate());
        assertEquals(4, defaults.getTotalAttempts());
    }

    @Test
    void negativeAttemptsAreRejected() {
        RetryPolicy invalid = RetryPolicy.builder().maxAttempts(-1).build();
        assertThrows(IllegalArgumentException.class, invalid::validate);
    }
}
