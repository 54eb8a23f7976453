package com.llmbridge.common.exception;

/**
 * Raised when a provider rejected the request for a reason that retrying cannot fix.
 * The original failure is always available through {@link #getCause()}.
 * {@link com.llmbridge.common.retry.RetryExecutor} never retries this exception.
 */
public class NonRetriableException extends LlmBridgeException {

    public NonRetriableException(String message, Throwable cause) {
        super(ErrorKind.NON_RETRIABLE, message, cause);
    }
}
