package com.llmbridge.core.query;

import com.llmbridge.core.query.model.ProviderOutcome;
import com.llmbridge.core.query.model.ProviderStatus;
import com.llmbridge.llm.model.LlmResponse;
import com.llmbridge.llm.model.QueryOptions;
import com.llmbridge.llm.provider.LlmProvider;
import com.llmbridge.llm.provider.ProviderAdapter;
import com.llmbridge.llm.stream.ChunkStream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Entry point for querying providers: fan-out to every configured provider, a single
 * provider, or a streamed completion from one provider.
 */
@Service
@Slf4j
public class QueryOrchestrator {

    public static final String FAN_OUT_EXECUTOR = "providerFanOutExecutor";

    private final Map<LlmProvider, ProviderAdapter> adapters = new EnumMap<>(LlmProvider.class);
    private final ProviderQueryExecutor queryExecutor;
    private final Executor fanOutExecutor;

    public QueryOrchestrator(List<ProviderAdapter> adapters,
                             ProviderQueryExecutor queryExecutor,
                             @Qualifier(FAN_OUT_EXECUTOR) Executor fanOutExecutor) {
        for (ProviderAdapter adapter : adapters) {
            ProviderAdapter previous = this.adapters.put(adapter.getProvider(), adapter);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate adapter for provider " + adapter.getProvider());
            }
        }
        this.queryExecutor = queryExecutor;
        this.fanOutExecutor = fanOutExecutor;
    }

    /**
     * Queries every available provider concurrently. One outcome per available provider,
     * in provider declaration order; a failing provider never fails the others.
     */
    public List<ProviderOutcome> queryAll(String prompt, QueryOptions options) {
        long startTime = System.currentTimeMillis();
        List<ProviderAdapter> available = adapters.values().stream()
            .filter(ProviderAdapter::isAvailable)
            .collect(Collectors.toList());

        log.info("[ORCH] Fan-out query started | providers={} | promptLength={}",
            available.stream().map(ProviderAdapter::getName).collect(Collectors.toList()), prompt.length());

        if (available.isEmpty()) {
            log.warn("[ORCH] No providers configured, nothing to query");
            return List.of();
        }

        List<CompletableFuture<ProviderOutcome>> futures = available.stream()
            .map(adapter -> CompletableFuture
                .supplyAsync(() -> queryExecutor.execute(adapter, prompt, options), fanOutExecutor)
                .handle((response, error) -> {
                    if (error == null) {
                        return ProviderOutcome.success(adapter.getProvider(), response);
                    }
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                    log.error("[ORCH] Provider failed | provider={} | error={}", adapter.getName(), cause.getMessage());
                    return ProviderOutcome.failure(adapter.getProvider(), cause);
                }))
            .collect(Collectors.toList());

        List<ProviderOutcome> outcomes = new ArrayList<>(futures.size());
        for (CompletableFuture<ProviderOutcome> future : futures) {
            outcomes.add(future.join());
        }

        long succeeded = outcomes.stream().filter(ProviderOutcome::isSuccess).count();
        log.info("[ORCH] Fan-out query completed | succeeded={} | failed={} | durationMs={}",
            succeeded, outcomes.size() - succeeded, System.currentTimeMillis() - startTime);
        return outcomes;
    }

    public LlmResponse query(LlmProvider provider, String prompt, QueryOptions options) {
        ProviderAdapter adapter = adapterFor(provider);
        log.info("[ORCH] Single-provider query | provider={}", adapter.getName());
        return queryExecutor.execute(adapter, prompt, options);
    }

    /**
     * Streams from one provider. Streams are never retried: a failure surfaces on the stream.
     */
    public ChunkStream stream(LlmProvider provider, String prompt, QueryOptions options) {
        ProviderAdapter adapter = adapterFor(provider);
        log.info("[ORCH] Stream requested | provider={}", adapter.getName());
        return adapter.stream(prompt, options);
    }

    public List<ProviderStatus> listProviders() {
        return adapters.values().stream()
            .map(adapter -> new ProviderStatus(adapter.getProvider(), adapter.getName(),
                adapter.getProvider().getSlug(), adapter.isAvailable()))
            .collect(Collectors.toList());
    }

    private ProviderAdapter adapterFor(LlmProvider provider) {
        ProviderAdapter adapter = adapters.get(provider);
        if (adapter == null) {
            throw new IllegalArgumentException("No adapter registered for provider " + provider);
        }
        return adapter;
    }
}
