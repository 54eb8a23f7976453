package com.llmbridge.api.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmbridge.proxy.ProxyServer;
import com.llmbridge.proxy.config.ProxyConfig;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Runs the forwarding relay alongside the application.
 *
 * Configuration:
 * - llm.proxy.enabled (ENABLE_PROXY): start the relay (default: false)
 * - llm.proxy.port (PROXY_PORT): listening port (default: 3000)
 * - llm.proxy.allowed-origins (ALLOWED_ORIGINS): comma-separated CORS origins (default: *)
 */
@Service
@ConditionalOnProperty(name = "llm.proxy.enabled", havingValue = "true")
@Slf4j
public class ProxyRelayService {

    private final ProxyServer proxyServer;

    public ProxyRelayService(ProxyConfig proxyConfig, WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        this.proxyServer = new ProxyServer(proxyConfig, webClientBuilder, objectMapper);
    }

    @PostConstruct
    public void start() {
        proxyServer.start();
        log.info("[PROXY] Relay enabled | port={}", proxyServer.getPort());
    }

    @PreDestroy
    public void stop() {
        log.info("[PROXY] Shutting down relay");
        proxyServer.stop();
    }

    public ProxyServer getProxyServer() {
        return proxyServer;
    }
}
