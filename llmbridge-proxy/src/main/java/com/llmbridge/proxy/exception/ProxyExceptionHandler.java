package com.llmbridge.proxy.exception;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmbridge.proxy.dto.ErrorResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebExceptionHandler;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * Turns every relay failure into the {@code {error, message}} JSON envelope.
 * Route-level failures come through {@link #handleRouteError(Throwable, ServerRequest)}; anything that
 * escapes the routes (filters included) through {@link #handle(ServerWebExchange, Throwable)}.
 */
@Slf4j
@RequiredArgsConstructor
public class ProxyExceptionHandler implements WebExceptionHandler {

    private final ObjectMapper objectMapper;

    public Mono<ServerResponse> handleRouteError(Throwable error, ServerRequest request) {
        HttpStatusCode status = statusFor(error);
        return ServerResponse.status(status)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(toErrorResponse(error, status, request.path()));
    }

    @Override
    public Mono<Void> handle(ServerWebExchange exchange, Throwable error) {
        ServerHttpResponse response = exchange.getResponse();
        if (response.isCommitted()) {
            log.error("[PROXY] Failure after response was committed | path={} | error={}",
                exchange.getRequest().getPath().value(), error.getMessage());
            return Mono.error(error);
        }

        HttpStatusCode status = statusFor(error);
        ErrorResponse body = toErrorResponse(error, status, exchange.getRequest().getPath().value());
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            bytes = ("{\"error\":\"" + body.getError() + "\"}").getBytes(StandardCharsets.UTF_8);
        }

        response.setStatusCode(status);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        DataBuffer buffer = response.bufferFactory().wrap(bytes);
        return response.writeWith(Mono.just(buffer));
    }

    private HttpStatusCode statusFor(Throwable error) {
        if (error instanceof ProxyAuthException) {
            return HttpStatus.UNAUTHORIZED;
        }
        if (error instanceof UnknownProviderException) {
            return HttpStatus.NOT_FOUND;
        }
        if (error instanceof ResponseStatusException) {
            return ((ResponseStatusException) error).getStatusCode();
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private ErrorResponse toErrorResponse(Throwable error, HttpStatusCode status, String path) {
        if (error instanceof ProxyAuthException) {
            log.warn("[PROXY] Rejected request without bearer credentials | path={}", path);
            return ErrorResponse.builder()
                .error("Missing or invalid Authorization header")
                .path(path)
                .build();
        }
        if (error instanceof UnknownProviderException) {
            log.warn("[PROXY] Unknown provider | path={} | error={}", path, error.getMessage());
            return ErrorResponse.builder()
                .error("Unknown provider")
                .message(error.getMessage())
                .path(path)
                .build();
        }
        if (error instanceof UpstreamTransportException) {
            log.error("[PROXY] Proxy request failed | path={} | error={}", path, error.getMessage(), error.getCause());
            return ErrorResponse.builder()
                .error("Proxy request failed")
                .message(error.getCause() != null ? error.getCause().getMessage() : error.getMessage())
                .path(path)
                .build();
        }

        if (error instanceof ResponseStatusException && status.is4xxClientError()) {
            log.debug("[PROXY] Request rejected | path={} | status={}", path, status.value());
            return ErrorResponse.builder()
                .error(((ResponseStatusException) error).getReason() != null
                    ? ((ResponseStatusException) error).getReason() : "Request rejected")
                .path(path)
                .build();
        }

        log.error("[PROXY] Proxy server error | path={} | status={}", path, status.value(), error);
        return ErrorResponse.builder()
            .error("Internal proxy server error")
            .message(error.getMessage())
            .path(path)
            .build();
    }
}
