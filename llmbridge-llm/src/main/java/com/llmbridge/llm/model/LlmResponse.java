package com.llmbridge.llm.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Normalized completion. Adapters leave {@code latency} and {@code timestamp} unset;
 * the layer that timed the call fills them in with {@link #withTiming(Duration, Instant)}.
 */
@Value
@Builder(toBuilder = true)
public class LlmResponse {
    String provider;
    String model;
    @Builder.Default
    String content = "";
    TokenUsage usage;
    Duration latency;
    Instant timestamp;

    public LlmResponse withTiming(Duration latency, Instant timestamp) {
        if (latency.isNegative()) {
            throw new IllegalArgumentException("Latency must be non-negative: " + latency);
        }
        return toBuilder().latency(latency).timestamp(timestamp).build();
    }

    public boolean hasUsage() {
        return usage != null;
    }
}
