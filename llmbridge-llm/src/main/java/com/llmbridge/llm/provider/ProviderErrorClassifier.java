package com.llmbridge.llm.provider;

import com.llmbridge.common.exception.NonRetriableException;
import com.llmbridge.llm.provider.ProviderAdapter.ProviderException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Decides whether a provider failure is worth retrying.
 *
 * <p>Unclassified failures (no HTTP status, no recognized network code) are treated as
 * retriable. Callers that compose their own retry predicate over raw provider errors should
 * use {@link #isRetriableError(Throwable)} to stay consistent with the adapters.
 */
public final class ProviderErrorClassifier {

    private ProviderErrorClassifier() {
    }

    public static boolean isRetriableError(Integer statusCode, NetworkErrorCode networkErrorCode) {
        if (statusCode != null) {
            if (statusCode >= 500) return true;
            if (statusCode == 429) return true;
            if (statusCode == 408) return true;
            if (statusCode >= 400) return false;
        }
        if (networkErrorCode != null) {
            return true;
        }
        // Unclassified failures fail open
        return true;
    }

    public static boolean isRetriableError(Throwable error) {
        if (error instanceof NonRetriableException) {
            return false;
        }
        if (error instanceof ProviderException) {
            return ((ProviderException) error).isRetryable();
        }
        return isRetriableError(statusOf(error), NetworkErrorCode.fromThrowable(error));
    }

    /**
     * Returns the failure unchanged when it is retriable, otherwise wraps it in a
     * {@link NonRetriableException} that keeps it as the cause.
     */
    public static RuntimeException classify(ProviderException failure) {
        if (failure.isRetryable()) {
            return failure;
        }
        return new NonRetriableException(failure.getMessage(), failure);
    }

    static Integer statusOf(Throwable error) {
        if (error instanceof WebClientResponseException) {
            return ((WebClientResponseException) error).getStatusCode().value();
        }
        return null;
    }
}
