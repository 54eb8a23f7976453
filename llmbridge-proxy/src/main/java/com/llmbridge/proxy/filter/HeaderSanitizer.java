package com.llmbridge.proxy.filter;

import org.springframework.http.HttpHeaders;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Produces a loggable copy of request headers with credentials replaced by a placeholder.
 */
public final class HeaderSanitizer {

    public static final String REDACTED = "[REDACTED]";

    private HeaderSanitizer() {
    }

    public static Map<String, String> sanitize(HttpHeaders headers) {
        Map<String, String> sanitized = new LinkedHashMap<>();
        headers.forEach((name, values) -> {
            String key = name.toLowerCase();
            if (isCredential(key)) {
                sanitized.put(key, redact(key, values.isEmpty() ? "" : values.get(0)));
            } else {
                sanitized.put(key, String.join(", ", values));
            }
        });
        return sanitized;
    }

    static boolean isCredential(String lowerCaseName) {
        return lowerCaseName.equals("authorization")
            || lowerCaseName.equals("proxy-authorization")
            || lowerCaseName.contains("api-key");
    }

    private static String redact(String name, String value) {
        if (name.endsWith("authorization") && value.regionMatches(true, 0, "Bearer ", 0, 7)) {
            return "Bearer " + REDACTED;
        }
        return REDACTED;
    }
}
