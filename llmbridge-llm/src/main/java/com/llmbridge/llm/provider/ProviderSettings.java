package com.llmbridge.llm.provider;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable adapter configuration. Only the API key is required for the adapter to be available.
 */
@Value
@Builder(toBuilder = true)
public class ProviderSettings {

    String apiKey;

    /** Falls back to {@link LlmProvider#getDefaultModel()}. */
    String defaultModel;

    @Builder.Default
    double defaultTemperature = 0.7;

    @Builder.Default
    int defaultMaxTokens = 4096;

    @Builder.Default
    TransportMode transport = TransportMode.direct();

    /** Overrides the provider's public endpoint in direct mode. */
    String apiBaseUrl;

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isEmpty();
    }

    public String resolveDefaultModel(LlmProvider provider) {
        return defaultModel != null && !defaultModel.isBlank() ? defaultModel : provider.getDefaultModel();
    }

    public String resolveBaseUrl(LlmProvider provider) {
        String direct = apiBaseUrl != null && !apiBaseUrl.isBlank() ? apiBaseUrl : provider.getBaseUrl();
        return transport.resolveBaseUrl(provider, direct);
    }

    @Override
    public String toString() {
        return "ProviderSettings(apiKey=" + (hasApiKey() ? "***" : "<none>") +
            ", defaultModel=" + defaultModel +
            ", defaultTemperature=" + defaultTemperature +
            ", defaultMaxTokens=" + defaultMaxTokens +
            ", transport=" + transport +
            ", apiBaseUrl=" + apiBaseUrl + ")";
    }
}
