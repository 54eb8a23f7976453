package com.llmbridge.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.llmbridge.common.exception.ErrorKind;
import com.llmbridge.core.query.model.ProviderOutcome;
import com.llmbridge.llm.model.LlmResponse;
import com.llmbridge.llm.model.TokenUsage;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

@Data
@Builder
public class QueryResponse {
    private List<ProviderResult> results;
    private int succeeded;
    private int failed;

    public static QueryResponse fromOutcomes(List<ProviderOutcome> outcomes) {
        List<ProviderResult> results = outcomes.stream()
            .map(ProviderResult::fromOutcome)
            .collect(Collectors.toList());
        int succeeded = (int) results.stream().filter(ProviderResult::isSuccess).count();
        return QueryResponse.builder()
            .results(results)
            .succeeded(succeeded)
            .failed(results.size() - succeeded)
            .build();
    }

    public static QueryResponse fromResponse(LlmResponse response) {
        return QueryResponse.builder()
            .results(List.of(ProviderResult.fromResponse(response)))
            .succeeded(1)
            .failed(0)
            .build();
    }

    @Data
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ProviderResult {
        private String provider;
        private boolean success;
        private String model;
        private String content;
        private TokenUsage usage;
        private Long latencyMs;
        private Instant timestamp;
        private ErrorKind errorKind;
        private String error;
        private Integer statusCode;

        static ProviderResult fromOutcome(ProviderOutcome outcome) {
            if (outcome.isSuccess()) {
                return fromResponse(outcome.getResponse());
            }
            return ProviderResult.builder()
                .provider(outcome.getProvider().getDisplayName())
                .success(false)
                .errorKind(outcome.getErrorKind())
                .error(outcome.getErrorMessage())
                .statusCode(outcome.getStatusCode())
                .build();
        }

        static ProviderResult fromResponse(LlmResponse response) {
            return ProviderResult.builder()
                .provider(response.getProvider())
                .success(true)
                .model(response.getModel())
                .content(response.getContent())
                .usage(response.getUsage())
                .latencyMs(response.getLatency() != null ? response.getLatency().toMillis() : null)
                .timestamp(response.getTimestamp())
                .build();
        }
    }
}
