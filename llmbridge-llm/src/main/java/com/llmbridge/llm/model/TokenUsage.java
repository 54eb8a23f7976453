package com.llmbridge.llm.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TokenUsage {
    int promptTokens;
    int completionTokens;
    int totalTokens;

    /**
     * The total is always derived from its parts.
     */
    public static TokenUsage of(int promptTokens, int completionTokens) {
        if (promptTokens < 0 || completionTokens < 0) {
            throw new IllegalArgumentException(
                "Token counts must be non-negative: prompt=" + promptTokens + ", completion=" + completionTokens);
        }
        return new TokenUsage(promptTokens, completionTokens, promptTokens + completionTokens);
    }
}
