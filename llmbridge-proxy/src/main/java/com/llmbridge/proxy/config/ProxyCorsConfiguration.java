package com.llmbridge.proxy.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsWebFilter;
import org.springframework.web.cors.reactive.UrlBasedCorsConfigurationSource;

import java.util.Arrays;
import java.util.List;

/**
 * CORS policy applied uniformly to every relay route. Requests from origins outside the
 * allowed set are rejected with 403.
 */
@Slf4j
public final class ProxyCorsConfiguration {

    static final List<String> ALLOWED_METHODS = Arrays.asList("GET", "POST", "PUT", "DELETE", "OPTIONS");
    static final List<String> ALLOWED_HEADERS = Arrays.asList("Content-Type", "Authorization", "X-API-Key");

    private ProxyCorsConfiguration() {
    }

    public static CorsWebFilter corsWebFilter(ProxyConfig config) {
        CorsConfiguration configuration = new CorsConfiguration();

        // origin patterns accept "*" together with credentials, plain origins do not
        configuration.setAllowedOriginPatterns(config.getAllowedOrigins());
        configuration.setAllowedMethods(ALLOWED_METHODS);
        configuration.setAllowedHeaders(ALLOWED_HEADERS);
        configuration.setAllowCredentials(true);

        log.info("[PROXY] CORS configuration | allowedOrigins={} | methods={} | headers={} | credentials=true",
            config.getAllowedOrigins(), ALLOWED_METHODS, ALLOWED_HEADERS);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", configuration);
        return new CorsWebFilter(source);
    }
}
