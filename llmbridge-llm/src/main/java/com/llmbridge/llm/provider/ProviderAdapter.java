package com.llmbridge.llm.provider;

import com.llmbridge.common.exception.ErrorKind;
import com.llmbridge.common.exception.LlmBridgeException;
import com.llmbridge.llm.model.LlmResponse;
import com.llmbridge.llm.model.QueryOptions;
import com.llmbridge.llm.stream.ChunkStream;
import lombok.Getter;

public interface ProviderAdapter {

    LlmProvider getProvider();

    default String getName() {
        return getProvider().getDisplayName();
    }

    /**
     * True when an API key was configured. Never touches the network.
     */
    boolean isAvailable();

    /**
     * Single-shot completion. The returned response carries no latency or timestamp;
     * the caller that timed the call stamps them.
     *
     * @throws ProviderException for retriable failures
     * @throws com.llmbridge.common.exception.NonRetriableException for failures that retrying cannot fix
     */
    LlmResponse query(String prompt, QueryOptions options);

    /**
     * Opens a streamed completion. No request is sent until the first fragment is pulled.
     * The returned stream is single-use and must be closed by the consumer.
     */
    ChunkStream stream(String prompt, QueryOptions options);

    @Getter
    class ProviderException extends LlmBridgeException {
        private final LlmProvider provider;
        private final Integer statusCode;
        private final NetworkErrorCode networkErrorCode;

        public ProviderException(String message, LlmProvider provider, Integer statusCode,
                                 NetworkErrorCode networkErrorCode, Throwable cause) {
            super(kindFor(statusCode, networkErrorCode), message, cause);
            this.provider = provider;
            this.statusCode = statusCode;
            this.networkErrorCode = networkErrorCode;
        }

        public ProviderException(String message, LlmProvider provider, Integer statusCode) {
            this(message, provider, statusCode, null, null);
        }

        public boolean isRetryable() { return isRetriable(); }
        public boolean isRateLimited() { return statusCode != null && statusCode == 429; }
        public boolean isAuthError() { return statusCode != null && (statusCode == 401 || statusCode == 403); }

        private static ErrorKind kindFor(Integer statusCode, NetworkErrorCode networkErrorCode) {
            if (!ProviderErrorClassifier.isRetriableError(statusCode, networkErrorCode)) {
                return ErrorKind.NON_RETRIABLE;
            }
            if (statusCode == null && networkErrorCode != null) {
                return ErrorKind.UPSTREAM_TRANSPORT;
            }
            return ErrorKind.RETRIABLE;
        }
    }
}
