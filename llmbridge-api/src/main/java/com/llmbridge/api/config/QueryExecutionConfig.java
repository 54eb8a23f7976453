package com.llmbridge.api.config;

import com.llmbridge.common.retry.RetryExecutor;
import com.llmbridge.common.retry.RetryPolicy;
import com.llmbridge.core.query.QueryOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@Slf4j
public class QueryExecutionConfig {

    public static final String STREAM_EXECUTOR = "streamRelayExecutor";

    @Value("${llm.retry.max-attempts:3}")
    private int maxAttempts;

    @Value("${llm.retry.min-backoff-ms:1000}")
    private long minBackoffMs;

    @Value("${llm.retry.max-backoff-ms:10000}")
    private long maxBackoffMs;

    @Value("${llm.retry.jitter:true}")
    private boolean jitter;

    @Value("${llm.fan-out.pool-size:8}")
    private int fanOutPoolSize;

    @Bean
    public RetryPolicy retryPolicy() {
        RetryPolicy policy = RetryPolicy.builder()
            .maxAttempts(maxAttempts)
            .minBackoff(Duration.ofMillis(minBackoffMs))
            .maxBackoff(Duration.ofMillis(maxBackoffMs))
            .jitter(jitter)
            .build();
        policy.validate();
        log.info("[RETRY] Retry policy | maxAttempts={} | minBackoffMs={} | maxBackoffMs={} | jitter={}",
            maxAttempts, minBackoffMs, maxBackoffMs, jitter);
        return policy;
    }

    @Bean
    public RetryExecutor retryExecutor() {
        return new RetryExecutor();
    }

    @Bean(name = QueryOrchestrator.FAN_OUT_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService providerFanOutExecutor() {
        return Executors.newFixedThreadPool(fanOutPoolSize);
    }

    // one thread per open stream; each stream blocks its thread while it waits for fragments
    @Bean(name = STREAM_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService streamRelayExecutor() {
        return Executors.newCachedThreadPool();
    }
}
