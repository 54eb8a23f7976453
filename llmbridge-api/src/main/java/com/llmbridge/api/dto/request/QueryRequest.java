package com.llmbridge.api.dto.request;

import com.llmbridge.llm.model.ChatMessage;
import com.llmbridge.llm.model.QueryOptions;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class QueryRequest {

    @NotBlank(message = "Prompt is required")
    private String prompt;

    private String provider; // null = every configured provider (not allowed for streaming)

    private String systemPrompt;

    @Valid
    private List<ChatMessage> context = new ArrayList<>();

    private String model;

    @DecimalMin(value = "0.0", message = "Temperature must be between 0 and 2")
    @DecimalMax(value = "2.0", message = "Temperature must be between 0 and 2")
    private Double temperature;

    @Positive(message = "maxTokens must be positive")
    private Integer maxTokens;

    public QueryOptions toQueryOptions() {
        return QueryOptions.builder()
            .systemPrompt(systemPrompt)
            .context(context != null ? context : List.of())
            .model(model)
            .temperature(temperature)
            .maxTokens(maxTokens)
            .build();
    }
}
