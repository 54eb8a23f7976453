package com.llmbridge.proxy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmbridge.proxy.config.ProxyConfig;
import com.llmbridge.proxy.config.ProxyCorsConfiguration;
import com.llmbridge.proxy.exception.ProxyExceptionHandler;
import com.llmbridge.proxy.filter.RequestLoggingFilter;
import com.llmbridge.proxy.handler.HealthHandler;
import com.llmbridge.proxy.handler.ProxyHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.server.reactive.HttpHandler;
import org.springframework.http.server.reactive.ReactorHttpHandlerAdapter;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.server.RequestPredicates;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerResponse;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.adapter.WebHttpHandlerBuilder;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;

import java.util.ArrayList;
import java.util.List;

/**
 * Embedded HTTP relay that lets provider traffic leave through a single local port.
 *
 * <p>Routes: {@code GET /health} and {@code /proxy/{provider}/**} for any method.
 * {@link #start()} and {@link #stop()} may be called from any thread.
 */
@Slf4j
public class ProxyServer {

    private final ProxyConfig config;
    private final HttpHandler httpHandler;
    private DisposableServer server;

    public ProxyServer(ProxyConfig config, WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        this.config = config;
        this.httpHandler = buildHttpHandler(config, webClientBuilder, objectMapper);
    }

    static RouterFunction<ServerResponse> routes(HealthHandler healthHandler, ProxyHandler proxyHandler,
                                                 ProxyExceptionHandler exceptionHandler) {
        return RouterFunctions.route()
            .GET("/health", healthHandler::health)
            .route(RequestPredicates.path(ProxyHandler.PROXY_PREFIX + "**"), proxyHandler::proxy)
            .onError(Throwable.class, exceptionHandler::handleRouteError)
            .build();
    }

    private static HttpHandler buildHttpHandler(ProxyConfig config, WebClient.Builder webClientBuilder,
                                                ObjectMapper objectMapper) {
        ProxyExceptionHandler exceptionHandler = new ProxyExceptionHandler(objectMapper);
        RouterFunction<ServerResponse> routes = routes(
            new HealthHandler(),
            new ProxyHandler(config, webClientBuilder, objectMapper),
            exceptionHandler);

        // logging runs first so requests rejected by CORS are still recorded
        List<WebFilter> filters = new ArrayList<>();
        filters.add(new RequestLoggingFilter());
        if (config.isCorsEnabled()) {
            filters.add(ProxyCorsConfiguration.corsWebFilter(config));
        }

        return WebHttpHandlerBuilder.webHandler(RouterFunctions.toWebHandler(routes))
            .filters(list -> list.addAll(filters))
            .exceptionHandler(exceptionHandler)
            .build();
    }

    public synchronized void start() {
        if (server != null) {
            log.warn("[PROXY] Proxy server already running | port={}", server.port());
            return;
        }
        try {
            server = HttpServer.create()
                .host(config.getHost())
                .port(config.getPort())
                .handle(new ReactorHttpHandlerAdapter(httpHandler))
                .bindNow();
        } catch (RuntimeException e) {
            log.error("[PROXY] Failed to start proxy server | host={} | port={} | error={}",
                config.getHost(), config.getPort(), e.getMessage());
            throw new IllegalStateException("Failed to bind proxy server on port " + config.getPort(), e);
        }
        log.info("[PROXY] Proxy server started | host={} | port={} | upstreams={}",
            config.getHost(), server.port(), config.getUpstreams().keySet());
    }

    public synchronized void stop() {
        if (server == null) {
            return;
        }
        log.info("[PROXY] Stopping proxy server | port={}", server.port());
        server.disposeNow(config.getShutdownTimeout());
        server = null;
        log.info("[PROXY] Proxy server stopped");
    }

    public synchronized boolean isRunning() {
        return server != null;
    }

    /**
     * Bound port, or -1 when the server is not running.
     */
    public synchronized int getPort() {
        return server != null ? server.port() : -1;
    }

    public synchronized String getBaseUrl() {
        return server != null ? "http://127.0.0.1:" + server.port() : null;
    }
}
