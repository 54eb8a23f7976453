package com.llmbridge.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmbridge.llm.provider.LlmProvider;
import com.llmbridge.llm.provider.ProviderAdapter;
import com.llmbridge.llm.provider.ProviderSettings;
import com.llmbridge.llm.provider.TransportMode;
import com.llmbridge.llm.provider.clients.OpenAiCompatibleProviderAdapter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * One adapter per supported provider. A provider without an API key is still registered
 * and reports itself unavailable.
 */
@Configuration
@Slf4j
public class ProviderConfig {

    /** When set, every adapter sends its traffic through the relay at this URL. */
    @Value("${llm.transport.proxy-url:${LLM_PROXY_URL:}}")
    private String proxyUrl;

    @Value("${llm.defaults.temperature:0.7}")
    private double defaultTemperature;

    @Value("${llm.defaults.max-tokens:4096}")
    private int defaultMaxTokens;

    private final WebClient.Builder webClientBuilder;
    private final ObjectMapper objectMapper;

    public ProviderConfig(WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        this.webClientBuilder = webClientBuilder;
        this.objectMapper = objectMapper;
    }

    @Bean
    public ProviderAdapter openAiAdapter(
            @Value("${llm.openai.api-key:${OPENAI_API_KEY:}}") String apiKey,
            @Value("${llm.openai.model:}") String model,
            @Value("${llm.openai.base-url:}") String baseUrl) {
        return adapter(LlmProvider.OPENAI, apiKey, model, baseUrl);
    }

    @Bean
    public ProviderAdapter groqAdapter(
            @Value("${llm.groq.api-key:${GROQ_API_KEY:}}") String apiKey,
            @Value("${llm.groq.model:}") String model,
            @Value("${llm.groq.base-url:}") String baseUrl) {
        return adapter(LlmProvider.GROQ, apiKey, model, baseUrl);
    }

    @Bean
    public ProviderAdapter cerebrasAdapter(
            @Value("${llm.cerebras.api-key:${CEREBRAS_API_KEY:}}") String apiKey,
            @Value("${llm.cerebras.model:}") String model,
            @Value("${llm.cerebras.base-url:}") String baseUrl) {
        return adapter(LlmProvider.CEREBRAS, apiKey, model, baseUrl);
    }

    @Bean
    public ProviderAdapter sambaNovaAdapter(
            @Value("${llm.sambanova.api-key:${SAMBANOVA_API_KEY:}}") String apiKey,
            @Value("${llm.sambanova.model:}") String model,
            @Value("${llm.sambanova.base-url:}") String baseUrl) {
        return adapter(LlmProvider.SAMBANOVA, apiKey, model, baseUrl);
    }

    private ProviderAdapter adapter(LlmProvider provider, String apiKey, String model, String baseUrl) {
        TransportMode transport = proxyUrl == null || proxyUrl.isBlank()
            ? TransportMode.direct()
            : TransportMode.proxied(proxyUrl);

        ProviderSettings settings = ProviderSettings.builder()
            .apiKey(apiKey)
            .defaultModel(model == null || model.isBlank() ? null : model)
            .defaultTemperature(defaultTemperature)
            .defaultMaxTokens(defaultMaxTokens)
            .transport(transport)
            .apiBaseUrl(baseUrl == null || baseUrl.isBlank() ? null : baseUrl)
            .build();

        log.info("{} Provider registered | available={} | transport={}",
            provider.getLogTag(), settings.hasApiKey(), transport);
        return new OpenAiCompatibleProviderAdapter(provider, settings, webClientBuilder, objectMapper);
    }
}
