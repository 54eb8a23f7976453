package com.llmbridge.llm.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * WebClient configuration shared by provider adapters and the relay.
 *
 * Key configurations:
 * - 16MB codec buffer for large completion payloads
 * - Connect and response timeouts; there is no per-call timeout beyond these
 */
@Configuration
public class WebClientConfig {

    private static final int MAX_IN_MEMORY_SIZE = 16 * 1024 * 1024;
    private static final int CONNECT_TIMEOUT_MILLIS = 10_000;
    private static final Duration RESPONSE_TIMEOUT = Duration.ofSeconds(60);

    @Bean
    public WebClient.Builder webClientBuilder() {
        return createBuilder();
    }

    /**
     * Builder with the shared defaults, for callers outside a Spring context.
     * Callers that customize it should {@link WebClient.Builder#clone() clone} it first.
     */
    public static WebClient.Builder createBuilder() {
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(configurer -> configurer
                        .defaultCodecs()
                        .maxInMemorySize(MAX_IN_MEMORY_SIZE))
                .build();

        // responseTimeout bounds the gap between reads, so long streams stay open while data flows
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(RESPONSE_TIMEOUT)
                .option(io.netty.channel.ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS);

        return WebClient.builder()
                .exchangeStrategies(strategies)
                .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
