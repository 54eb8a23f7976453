package com.llmbridge.proxy.config;

import com.llmbridge.llm.provider.LlmProvider;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Relay settings, supplied by whoever bootstraps the relay.
 */
@Value
@Builder(toBuilder = true)
public class ProxyConfig {

    public static final String DEFAULT_USER_AGENT = "LLM-Provider-Proxy/1.0";

    @Builder.Default
    String host = "0.0.0.0";

    /** Zero binds an ephemeral port. */
    @Builder.Default
    int port = 3000;

    @Builder.Default
    boolean corsEnabled = true;

    @Builder.Default
    List<String> allowedOrigins = List.of("*");

    /** Provider slug to upstream API base URL, e.g. {@code openai -> https://api.openai.com/v1}. */
    @Builder.Default
    Map<String, String> upstreams = defaultUpstreams();

    @Builder.Default
    String userAgent = DEFAULT_USER_AGENT;

    /** How long {@code stop()} waits for in-flight requests. */
    @Builder.Default
    Duration shutdownTimeout = Duration.ofSeconds(30);

    public static Map<String, String> defaultUpstreams() {
        Map<String, String> upstreams = new LinkedHashMap<>();
        for (LlmProvider provider : LlmProvider.values()) {
            upstreams.put(provider.getSlug(), provider.getBaseUrl());
        }
        return upstreams;
    }

    public String upstreamFor(String slug) {
        if (slug == null) {
            return null;
        }
        String baseUrl = upstreams.get(slug.toLowerCase());
        if (baseUrl == null) {
            return null;
        }
        return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }
}
