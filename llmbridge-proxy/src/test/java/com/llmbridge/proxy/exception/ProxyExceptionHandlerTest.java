package com.llmbridge.proxy.exception;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.reactive.function.server.MockServerRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.net.ConnectException;
import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

class ProxyExceptionHandlerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ProxyExceptionHandler handler = new ProxyExceptionHandler(objectMapper);

    private static MockServerRequest request() {
        return MockServerRequest.builder()
            .uri(URI.create("http://localhost:3000/proxy/openai/chat/completions"))
            .build();
    }

    @Test
    void authFailureIsUnauthorized() {
        StepVerifier.create(handler.handleRouteError(new ProxyAuthException("missing"), request()))
            .assertNext(response -> {
                assertEquals(401, response.statusCode().value());
                assertEquals(MediaType.APPLICATION_JSON, response.headers().getContentType());
            })
            .verifyComplete();
    }

    @Test
    void unknownProviderIsNotFound() {
        StepVerifier.create(handler.handleRouteError(new UnknownProviderException("nosuch"), request()))
            .assertNext(response -> assertEquals(404, response.statusCode().value()))
            .verifyComplete();
    }

    @Test
    void transportFailureIsServerError() {
        UpstreamTransportException failure = new UpstreamTransportException("Upstream request to openai failed",
            new ConnectException("Connection refused"));

        StepVerifier.create(handler.handleRouteError(failure, request()))
            .assertNext(response -> assertEquals(500, response.statusCode().value()))
            .verifyComplete();
    }

    @Test
    void uncaughtFailureIsWrittenAsJsonEnvelope() throws Exception {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/health"));

        StepVerifier.create(handler.handle(exchange, new IllegalStateException("boom")))
            .verifyComplete();

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, exchange.getResponse().getStatusCode());
        JsonNode body = objectMapper.readTree(exchange.getResponse().getBodyAsString().block());
        assertEquals("Internal proxy server error", body.get("error").asText());
        assertEquals("boom", body.get("message").asText());
        assertEquals("/health", body.get("path").asText());
    }

    @Test
    void frameworkStatusIsKept() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/nowhere"));

        StepVerifier.create(handler.handle(exchange, new ResponseStatusException(HttpStatus.NOT_FOUND)))
            .verifyComplete();

        assertEquals(HttpStatus.NOT_FOUND, exchange.getResponse().getStatusCode());
    }
}
