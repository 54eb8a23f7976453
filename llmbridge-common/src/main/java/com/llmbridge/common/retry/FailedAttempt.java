package com.llmbridge.common.retry;

import com.llmbridge.common.exception.ErrorKind;
import com.llmbridge.common.exception.LlmBridgeException;
import lombok.Value;

/**
 * A failed attempt handed to {@link RetryPolicy#getOnFailedAttempt()} before the next retry.
 */
@Value
public class FailedAttempt {

    Throwable error;

    /** 1-indexed number of the attempt that just failed. */
    int attemptNumber;

    int retriesLeft;

    public ErrorKind getKind() {
        return LlmBridgeException.kindOf(error);
    }

    public String getMessage() {
        return error.getMessage();
    }
}
