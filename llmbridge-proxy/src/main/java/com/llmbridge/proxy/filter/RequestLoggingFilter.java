package com.llmbridge.proxy.filter;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpMethod;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpRequestDecorator;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Logs every inbound relay request. Headers go through {@link HeaderSanitizer} first.
 * Request bodies are never logged, only their size, at DEBUG once they have been read.
 */
@Slf4j
public class RequestLoggingFilter implements WebFilter {

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        log.info("[PROXY] Proxy request: {} {} | headers={}",
            request.getMethod(), request.getPath().value(), HeaderSanitizer.sanitize(request.getHeaders()));

        if (!log.isDebugEnabled() || HttpMethod.GET.equals(request.getMethod())) {
            return chain.filter(exchange);
        }
        return chain.filter(exchange.mutate().request(new BodySizeLoggingRequest(request)).build());
    }

    private static class BodySizeLoggingRequest extends ServerHttpRequestDecorator {

        BodySizeLoggingRequest(ServerHttpRequest delegate) {
            super(delegate);
        }

        @Override
        public Flux<DataBuffer> getBody() {
            AtomicLong bytes = new AtomicLong();
            return super.getBody()
                .doOnNext(buffer -> bytes.addAndGet(buffer.readableByteCount()))
                .doOnComplete(() -> log.debug("[PROXY] Request body read | method={} | path={} | bytes={}",
                    getMethod(), getPath().value(), bytes.get()));
        }
    }
}
