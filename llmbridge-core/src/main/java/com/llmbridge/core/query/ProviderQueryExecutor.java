package com.llmbridge.core.query;

import com.llmbridge.common.retry.FailedAttempt;
import com.llmbridge.common.retry.RetryExecutor;
import com.llmbridge.common.retry.RetryPolicy;
import com.llmbridge.llm.model.LlmResponse;
import com.llmbridge.llm.model.QueryOptions;
import com.llmbridge.llm.provider.ProviderAdapter;
import com.llmbridge.llm.provider.ProviderErrorClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Runs one provider query under the retry policy and stamps latency and timestamp on the result.
 *
 * <p>The configured policy is narrowed so that failures the provider classified as
 * non-retriable end the call immediately. Any predicate or callback already on the policy
 * still applies.
 */
@Component
@Slf4j
public class ProviderQueryExecutor {

    private final RetryExecutor retryExecutor;
    private final RetryPolicy retryPolicy;

    public ProviderQueryExecutor(RetryExecutor retryExecutor, RetryPolicy retryPolicy) {
        this.retryExecutor = retryExecutor;
        this.retryPolicy = retryPolicy;
    }

    public LlmResponse execute(ProviderAdapter adapter, String prompt, QueryOptions options) {
        if (!adapter.isAvailable()) {
            throw new IllegalStateException(adapter.getName() + " provider is not configured");
        }
        if (options != null) {
            // malformed input is never retried
            options.validate();
        }

        RetryPolicy policy = policyFor(adapter);
        long startNanos = System.nanoTime();

        LlmResponse response = retryExecutor.runWithRetry(() -> adapter.query(prompt, options), policy);

        Duration latency = Duration.ofNanos(System.nanoTime() - startNanos);
        log.debug("{} Query finished | latencyMs={}", adapter.getProvider().getLogTag(), latency.toMillis());
        return response.withTiming(latency, Instant.now());
    }

    RetryPolicy policyFor(ProviderAdapter adapter) {
        Predicate<Throwable> retriable = ProviderErrorClassifier::isRetriableError;
        Predicate<Throwable> configured = retryPolicy.getRetryPredicate();

        Consumer<FailedAttempt> logAttempt = attempt ->
            log.warn("{} Attempt failed, retrying | attempt={} | retriesLeft={} | kind={} | error={}",
                adapter.getProvider().getLogTag(), attempt.getAttemptNumber(), attempt.getRetriesLeft(),
                attempt.getKind(), attempt.getMessage());
        Consumer<FailedAttempt> configuredCallback = retryPolicy.getOnFailedAttempt();

        return retryPolicy.toBuilder()
            .retryPredicate(configured != null ? retriable.and(configured) : retriable)
            .onFailedAttempt(configuredCallback != null ? logAttempt.andThen(configuredCallback) : logAttempt)
            .build();
    }
}
