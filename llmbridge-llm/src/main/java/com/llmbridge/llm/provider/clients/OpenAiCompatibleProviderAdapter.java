package com.llmbridge.llm.provider.clients;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmbridge.common.exception.LlmBridgeException;
import com.llmbridge.common.exception.NonRetriableException;
import com.llmbridge.llm.model.ChatMessage;
import com.llmbridge.llm.model.LlmResponse;
import com.llmbridge.llm.model.QueryOptions;
import com.llmbridge.llm.model.TokenUsage;
import com.llmbridge.llm.provider.LlmProvider;
import com.llmbridge.llm.provider.NetworkErrorCode;
import com.llmbridge.llm.provider.ProviderAdapter;
import com.llmbridge.llm.provider.ProviderErrorClassifier;
import com.llmbridge.llm.provider.ProviderSettings;
import com.llmbridge.llm.stream.ChunkStream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adapter for providers exposing the OpenAI chat-completions API.
 *
 * <p>Direct and proxied transport differ only in the base URL; the relay forwards the same
 * request and relays the same response bytes. Instances share nothing mutable beyond their
 * configuration and are safe for concurrent use.
 */
@Slf4j
public class OpenAiCompatibleProviderAdapter implements ProviderAdapter {

    static final String CHAT_COMPLETIONS_PATH = "/chat/completions";
    private static final String DONE_SIGNAL = "[DONE]";
    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
        new ParameterizedTypeReference<>() {};

    private final LlmProvider provider;
    private final ProviderSettings settings;
    private final ObjectMapper objectMapper;
    private final WebClient webClient;
    private final String baseUrl;

    public OpenAiCompatibleProviderAdapter(LlmProvider provider, ProviderSettings settings,
                                           WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        this.provider = provider;
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.baseUrl = settings.resolveBaseUrl(provider);
        this.webClient = webClientBuilder.clone()
            .baseUrl(baseUrl)
            .build();
    }

    @Override
    public LlmProvider getProvider() {
        return provider;
    }

    @Override
    public boolean isAvailable() {
        return settings.hasApiKey();
    }

    @Override
    public LlmResponse query(String prompt, QueryOptions options) {
        ensureAvailable();
        QueryOptions effective = options != null ? options : QueryOptions.empty();
        String model = resolveModel(effective);
        Map<String, Object> requestBody = buildRequestBody(prompt, effective, model, false);
        long startTime = System.currentTimeMillis();

        log.info("{} Starting query | model={} | promptLength={} | contextTurns={} | transport={}",
            provider.getLogTag(), model, prompt.length(), effective.getContext().size(), settings.getTransport());

        try {
            log.debug("{} Sending request | model={} | url={}{}", provider.getLogTag(), model, baseUrl, CHAT_COMPLETIONS_PATH);

            String body = webClient.post()
                .uri(CHAT_COMPLETIONS_PATH)
                .header(HttpHeaders.AUTHORIZATION, bearerToken())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(requestBody)
                .retrieve()
                .bodyToMono(String.class)
                .block();

            LlmResponse response = parseCompletion(body, model);
            long duration = System.currentTimeMillis() - startTime;
            log.info("{} Query succeeded | model={} | durationMs={} | contentLength={} | totalTokens={}",
                provider.getLogTag(), response.getModel(), duration, response.getContent().length(),
                response.hasUsage() ? response.getUsage().getTotalTokens() : "n/a");
            return response;

        } catch (LlmBridgeException e) {
            throw e;
        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            ProviderException failure = toProviderException(e);
            log.warn("{} Query failed | model={} | statusCode={} | networkError={} | retryable={} | durationMs={} | error={}",
                provider.getLogTag(), model, failure.getStatusCode(), failure.getNetworkErrorCode(),
                failure.isRetryable(), duration, failure.getMessage());
            throw ProviderErrorClassifier.classify(failure);
        }
    }

    @Override
    public ChunkStream stream(String prompt, QueryOptions options) {
        ensureAvailable();
        QueryOptions effective = options != null ? options : QueryOptions.empty();
        String model = resolveModel(effective);
        Map<String, Object> requestBody = buildRequestBody(prompt, effective, model, true);

        Flux<String> chunks = Flux.defer(() -> {
                log.info("{} Opening stream | model={} | promptLength={} | transport={}",
                    provider.getLogTag(), model, prompt.length(), settings.getTransport());
                return webClient.post()
                    .uri(CHAT_COMPLETIONS_PATH)
                    .header(HttpHeaders.AUTHORIZATION, bearerToken())
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.TEXT_EVENT_STREAM)
                    .bodyValue(requestBody)
                    .retrieve()
                    .bodyToFlux(SSE_TYPE);
            })
            .mapNotNull(ServerSentEvent::data)
            .takeWhile(data -> !DONE_SIGNAL.equals(data.trim()))
            .map(this::extractDelta)
            .filter(content -> !content.isEmpty())
            .onErrorMap(e -> !(e instanceof LlmBridgeException), e -> {
                ProviderException failure = toProviderException(e);
                log.warn("{} Stream failed | model={} | statusCode={} | networkError={} | error={}",
                    provider.getLogTag(), model, failure.getStatusCode(), failure.getNetworkErrorCode(), failure.getMessage());
                return ProviderErrorClassifier.classify(failure);
            })
            .doOnComplete(() -> log.info("{} Stream completed | model={}", provider.getLogTag(), model))
            .doOnCancel(() -> log.debug("{} Stream cancelled by consumer | model={}", provider.getLogTag(), model));

        return ChunkStream.of(chunks);
    }

    Map<String, Object> buildRequestBody(String prompt, QueryOptions options, String model, boolean stream) {
        List<Map<String, String>> messages = new ArrayList<>();
        for (ChatMessage message : options.buildMessages(prompt)) {
            messages.add(Map.of(
                "role", message.getRole().getValue(),
                "content", message.getContent() != null ? message.getContent() : ""
            ));
        }

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("model", model);
        request.put("messages", messages);
        request.put("temperature", options.getTemperature() != null
            ? options.getTemperature() : settings.getDefaultTemperature());
        request.put("max_tokens", options.getMaxTokens() != null
            ? options.getMaxTokens() : settings.getDefaultMaxTokens());
        request.put("stream", stream);
        return request;
    }

    private LlmResponse parseCompletion(String body, String requestedModel) {
        if (body == null || body.isBlank()) {
            throw new NonRetriableException(provider.getDisplayName() + " returned an empty response",
                new ProviderException("Empty response body", provider, null));
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode message = root.path("choices").path(0).path("message");
            JsonNode content = message.path("content");

            TokenUsage usage = null;
            JsonNode usageNode = root.path("usage");
            if (usageNode.isObject()) {
                usage = TokenUsage.of(
                    usageNode.path("prompt_tokens").asInt(0),
                    usageNode.path("completion_tokens").asInt(0));
                int reportedTotal = usageNode.path("total_tokens").asInt(usage.getTotalTokens());
                if (reportedTotal != usage.getTotalTokens()) {
                    log.debug("{} Reported total tokens differ from prompt + completion | reported={} | computed={}",
                        provider.getLogTag(), reportedTotal, usage.getTotalTokens());
                }
            }

            return LlmResponse.builder()
                .provider(provider.getDisplayName())
                .model(root.path("model").asText(requestedModel))
                .content(content.isTextual() ? content.asText() : "")
                .usage(usage)
                .build();
        } catch (Exception e) {
            throw new NonRetriableException("Failed to parse " + provider.getDisplayName() + " response",
                new ProviderException("Unparseable response: " + e.getMessage(), provider, null, null, e));
        }
    }

    private String extractDelta(String data) {
        try {
            JsonNode content = objectMapper.readTree(data).path("choices").path(0).path("delta").path("content");
            return content.isTextual() ? content.asText() : "";
        } catch (Exception e) {
            throw new NonRetriableException("Failed to parse " + provider.getDisplayName() + " stream chunk",
                new ProviderException("Unparseable stream chunk: " + e.getMessage(), provider, null, null, e));
        }
    }

    private ProviderException toProviderException(Throwable raw) {
        Throwable error = Exceptions.unwrap(raw);
        if (error instanceof WebClientResponseException) {
            WebClientResponseException e = (WebClientResponseException) error;
            int status = e.getStatusCode().value();
            String message = String.format("%s API error: %d %s", provider.getDisplayName(), status, e.getStatusText());
            try {
                JsonNode body = objectMapper.readTree(e.getResponseBodyAsString());
                if (body.has("error") && body.get("error").has("message")) {
                    message = body.get("error").get("message").asText();
                }
            } catch (Exception parseFailure) {
                log.debug("{} Error body is not JSON | statusCode={}", provider.getLogTag(), status);
            }
            return new ProviderException(message, provider, status, null, e);
        }

        NetworkErrorCode networkErrorCode = NetworkErrorCode.fromThrowable(error);
        String message = provider.getDisplayName() + " request failed: " + error.getMessage();
        return new ProviderException(message, provider, null, networkErrorCode, error);
    }

    private void ensureAvailable() {
        if (!isAvailable()) {
            throw new IllegalStateException(provider.getDisplayName() + " provider is not configured");
        }
    }

    private String resolveModel(QueryOptions options) {
        return options.getModel() != null && !options.getModel().isBlank()
            ? options.getModel() : settings.resolveDefaultModel(provider);
    }

    private String bearerToken() {
        return "Bearer " + settings.getApiKey();
    }
}
