package com.llmbridge.core.query.model;

import com.llmbridge.llm.provider.LlmProvider;
import lombok.Value;

@Value
public class ProviderStatus {
    LlmProvider provider;
    String name;
    String slug;
    boolean available;
}
