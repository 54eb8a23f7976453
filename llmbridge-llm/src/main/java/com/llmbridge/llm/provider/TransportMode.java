package com.llmbridge.llm.provider;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Where an adapter sends its HTTP calls: straight to the provider, or through a relay
 * exposing {@code /proxy/<slug>/...}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransportMode {

    public enum Type {
        DIRECT,
        PROXIED
    }

    Type type;
    String proxyBaseUrl;

    public static TransportMode direct() {
        return new TransportMode(Type.DIRECT, null);
    }

    public static TransportMode proxied(String proxyBaseUrl) {
        if (proxyBaseUrl == null || proxyBaseUrl.isBlank()) {
            throw new IllegalArgumentException("A proxy base URL is required for proxied transport");
        }
        return new TransportMode(Type.PROXIED, stripTrailingSlash(proxyBaseUrl));
    }

    public boolean isProxied() {
        return type == Type.PROXIED;
    }

    /**
     * Base URL that chat-completion paths are appended to.
     *
     * @param directBaseUrl provider endpoint used in direct mode
     */
    public String resolveBaseUrl(LlmProvider provider, String directBaseUrl) {
        if (isProxied()) {
            return proxyBaseUrl + "/proxy/" + provider.getSlug();
        }
        return stripTrailingSlash(directBaseUrl);
    }

    @Override
    public String toString() {
        return isProxied() ? "proxied(" + proxyBaseUrl + ")" : "direct";
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
