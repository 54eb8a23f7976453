package com.llmbridge.api.config;

import com.llmbridge.proxy.config.ProxyConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

@Configuration
public class ProxyRelayConfig {

    @Value("${llm.proxy.port:${PROXY_PORT:3000}}")
    private int port;

    @Value("${llm.proxy.host:0.0.0.0}")
    private String host;

    @Value("${llm.proxy.cors-enabled:true}")
    private boolean corsEnabled;

    /** Comma-separated. */
    @Value("${llm.proxy.allowed-origins:${ALLOWED_ORIGINS:*}}")
    private String allowedOrigins;

    @Bean
    public ProxyConfig proxyConfig() {
        return ProxyConfig.builder()
            .host(host)
            .port(port)
            .corsEnabled(corsEnabled)
            .allowedOrigins(parseOrigins(allowedOrigins))
            .build();
    }

    static List<String> parseOrigins(String value) {
        List<String> origins = Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(origin -> !origin.isEmpty())
            .collect(Collectors.toList());
        return origins.isEmpty() ? List.of("*") : origins;
    }
}
