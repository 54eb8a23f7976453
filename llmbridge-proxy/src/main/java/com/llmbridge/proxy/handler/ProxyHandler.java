package com.llmbridge.proxy.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmbridge.common.exception.LlmBridgeException;
import com.llmbridge.proxy.config.ProxyConfig;
import com.llmbridge.proxy.exception.ProxyAuthException;
import com.llmbridge.proxy.exception.UnknownProviderException;
import com.llmbridge.proxy.exception.UpstreamTransportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.reactive.function.BodyInserter;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.Set;

/**
 * Forwards {@code /proxy/{provider}/{rest}} to the provider's upstream API.
 *
 * <p>The caller's bearer credential is passed through untouched. Event-stream responses are
 * relayed chunk by chunk, flushing after each one; every other response is parsed as JSON and
 * re-emitted with the upstream status.
 */
@Slf4j
public class ProxyHandler {

    public static final String PROXY_PREFIX = "/proxy/";
    private static final String BEARER_PREFIX = "Bearer ";

    private static final Set<String> HOP_BY_HOP_HEADERS = Set.of(
        "content-length", "transfer-encoding", "connection", "keep-alive");

    private final ProxyConfig config;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public ProxyHandler(ProxyConfig config, WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        this.config = config;
        this.webClient = webClientBuilder.clone().build();
        this.objectMapper = objectMapper;
    }

    public Mono<ServerResponse> proxy(ServerRequest request) {
        ProxyTarget target;
        try {
            target = resolveTarget(request);
        } catch (LlmBridgeException e) {
            return Mono.error(e);
        }

        String authorization = request.headers().firstHeader(HttpHeaders.AUTHORIZATION);
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            return Mono.error(new ProxyAuthException("Missing or invalid Authorization header"));
        }

        HttpMethod method = request.method();
        long startTime = System.currentTimeMillis();
        log.debug("[PROXY] Forwarding | provider={} | method={} | target={}", target.slug(), method, target.url());

        WebClient.RequestBodySpec forward = webClient.method(method)
            .uri(URI.create(target.url()))
            .headers(headers -> {
                headers.set(HttpHeaders.AUTHORIZATION, authorization);
                headers.setContentType(MediaType.APPLICATION_JSON);
                headers.set(HttpHeaders.USER_AGENT, config.getUserAgent());
            });

        WebClient.RequestHeadersSpec<?> outbound = hasBody(method)
            ? forward.body(BodyInserters.fromDataBuffers(request.bodyToFlux(DataBuffer.class)))
            : forward;

        return outbound.retrieve()
            .onStatus(status -> true, response -> Mono.empty())
            .toEntityFlux(DataBuffer.class)
            .onErrorMap(e -> !(e instanceof LlmBridgeException),
                e -> new UpstreamTransportException("Upstream request to " + target.slug() + " failed", e))
            .flatMap(entity -> relay(target, entity, startTime));
    }

    private Mono<ServerResponse> relay(ProxyTarget target, ResponseEntity<Flux<DataBuffer>> entity, long startTime) {
        HttpHeaders upstreamHeaders = entity.getHeaders();
        Flux<DataBuffer> body = entity.getBody() != null ? entity.getBody() : Flux.empty();
        boolean streaming = isEventStream(upstreamHeaders);

        log.info("[PROXY] Upstream responded | provider={} | target={} | status={} | streaming={} | durationMs={}",
            target.slug(), target.url(), entity.getStatusCode().value(), streaming, System.currentTimeMillis() - startTime);

        ServerResponse.BodyBuilder builder = ServerResponse.status(entity.getStatusCode())
            .headers(headers -> copyHeaders(upstreamHeaders, headers));

        if (streaming) {
            Flux<DataBuffer> chunks = body
                .doOnComplete(() -> log.debug("[PROXY] Stream relayed | provider={}", target.slug()))
                .onErrorResume(e -> {
                    log.error("[PROXY] Upstream stream broke | provider={} | error={}", target.slug(), e.getMessage());
                    return Flux.empty();
                });
            BodyInserter<Flux<DataBuffer>, ServerHttpResponse> inserter =
                (outputMessage, context) -> outputMessage.writeAndFlushWith(chunks.map(Flux::just));

            return builder
                .headers(headers -> {
                    headers.setContentType(MediaType.TEXT_EVENT_STREAM);
                    headers.setCacheControl("no-cache");
                    headers.set(HttpHeaders.CONNECTION, "keep-alive");
                })
                .body(inserter);
        }

        return DataBufferUtils.join(body)
            .map(this::readBytes)
            .defaultIfEmpty(new byte[0])
            .flatMap(bytes -> {
                if (bytes.length == 0) {
                    return builder.build();
                }
                JsonNode json;
                try {
                    json = objectMapper.readTree(bytes);
                } catch (IOException e) {
                    return Mono.error(new UpstreamTransportException(
                        "Upstream " + target.slug() + " returned a body that is not JSON", e));
                }
                return builder.contentType(MediaType.APPLICATION_JSON).bodyValue(json);
            });
    }

    ProxyTarget resolveTarget(ServerRequest request) {
        URI uri = request.uri();
        String rawPath = uri.getRawPath();
        String remainder = rawPath.startsWith(PROXY_PREFIX) ? rawPath.substring(PROXY_PREFIX.length()) : "";

        int slash = remainder.indexOf('/');
        String slug = slash >= 0 ? remainder.substring(0, slash) : remainder;
        String rest = slash >= 0 ? remainder.substring(slash) : "";

        String baseUrl = config.upstreamFor(slug);
        if (baseUrl == null) {
            throw new UnknownProviderException(slug);
        }

        StringBuilder url = new StringBuilder(baseUrl).append(rest);
        if (uri.getRawQuery() != null) {
            url.append('?').append(uri.getRawQuery());
        }
        return new ProxyTarget(slug.toLowerCase(), url.toString());
    }

    private static void copyHeaders(HttpHeaders from, HttpHeaders to) {
        from.forEach((name, values) -> {
            String lower = name.toLowerCase();
            if (lower.startsWith("access-control-") || HOP_BY_HOP_HEADERS.contains(lower)) {
                return;
            }
            to.put(name, new ArrayList<>(values));
        });
    }

    private static boolean isEventStream(HttpHeaders headers) {
        String contentType = headers.getFirst(HttpHeaders.CONTENT_TYPE);
        return contentType != null && contentType.toLowerCase().contains(MediaType.TEXT_EVENT_STREAM_VALUE);
    }

    private static boolean hasBody(HttpMethod method) {
        return !HttpMethod.GET.equals(method) && !HttpMethod.HEAD.equals(method);
    }

    private byte[] readBytes(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }

    record ProxyTarget(String slug, String url) {
    }
}
