package com.llmbridge.core.query.model;

import com.llmbridge.common.exception.ErrorKind;
import com.llmbridge.common.exception.LlmBridgeException;
import com.llmbridge.llm.model.LlmResponse;
import com.llmbridge.llm.provider.LlmProvider;
import com.llmbridge.llm.provider.ProviderAdapter.ProviderException;
import lombok.Builder;
import lombok.Value;

/**
 * Result of one provider in a fan-out: either a response or the failure that ended the call.
 */
@Value
@Builder
public class ProviderOutcome {
    LlmProvider provider;
    boolean success;
    LlmResponse response;
    ErrorKind errorKind;
    String errorMessage;
    Integer statusCode;

    public static ProviderOutcome success(LlmProvider provider, LlmResponse response) {
        return ProviderOutcome.builder()
            .provider(provider)
            .success(true)
            .response(response)
            .build();
    }

    public static ProviderOutcome failure(LlmProvider provider, Throwable error) {
        return ProviderOutcome.builder()
            .provider(provider)
            .success(false)
            .errorKind(LlmBridgeException.kindOf(error))
            .errorMessage(error.getMessage())
            .statusCode(statusOf(error))
            .build();
    }

    private static Integer statusOf(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof ProviderException) {
                return ((ProviderException) current).getStatusCode();
            }
            current = current.getCause();
        }
        return null;
    }
}
