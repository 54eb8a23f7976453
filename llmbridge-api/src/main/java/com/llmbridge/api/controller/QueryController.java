package com.llmbridge.api.controller;

import com.llmbridge.api.config.QueryExecutionConfig;
import com.llmbridge.api.dto.request.QueryRequest;
import com.llmbridge.api.dto.response.ProviderResponse;
import com.llmbridge.api.dto.response.QueryResponse;
import com.llmbridge.core.query.QueryOrchestrator;
import com.llmbridge.core.query.model.ProviderOutcome;
import com.llmbridge.llm.model.LlmResponse;
import com.llmbridge.llm.provider.LlmProvider;
import com.llmbridge.llm.stream.ChunkStream;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1")
@Slf4j
public class QueryController {

    private final QueryOrchestrator queryOrchestrator;
    private final ExecutorService streamExecutor;

    @Value("${llm.stream.timeout-ms:300000}")
    private long streamTimeoutMs;

    public QueryController(QueryOrchestrator queryOrchestrator,
                           @Qualifier(QueryExecutionConfig.STREAM_EXECUTOR) ExecutorService streamExecutor) {
        this.queryOrchestrator = queryOrchestrator;
        this.streamExecutor = streamExecutor;
    }

    /**
     * Queries one provider when {@code provider} is set, otherwise every configured provider.
     */
    @PostMapping("/query")
    public ResponseEntity<QueryResponse> query(@Valid @RequestBody QueryRequest request) {
        log.info("Query request - provider: {}, promptLength: {}",
            request.getProvider() != null ? request.getProvider() : "all", request.getPrompt().length());

        if (request.getProvider() != null && !request.getProvider().isBlank()) {
            LlmProvider provider = LlmProvider.fromString(request.getProvider());
            LlmResponse response = queryOrchestrator.query(provider, request.getPrompt(), request.toQueryOptions());
            return ResponseEntity.ok(QueryResponse.fromResponse(response));
        }

        List<ProviderOutcome> outcomes = queryOrchestrator.queryAll(request.getPrompt(), request.toQueryOptions());
        if (outcomes.isEmpty()) {
            throw new IllegalStateException("No LLM providers are configured");
        }
        return ResponseEntity.ok(QueryResponse.fromOutcomes(outcomes));
    }

    /**
     * Streams fragments as server-sent events: one {@code chunk} event per fragment, then
     * {@code done}, or {@code error} if the upstream fails mid-stream.
     */
    @PostMapping(value = "/query/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@Valid @RequestBody QueryRequest request) {
        if (request.getProvider() == null || request.getProvider().isBlank()) {
            throw new IllegalArgumentException("Streaming requires a provider");
        }
        LlmProvider provider = LlmProvider.fromString(request.getProvider());
        ChunkStream chunks = queryOrchestrator.stream(provider, request.getPrompt(), request.toQueryOptions());

        SseEmitter emitter = new SseEmitter(streamTimeoutMs);
        emitter.onCompletion(chunks::close);
        emitter.onTimeout(chunks::close);
        emitter.onError(error -> chunks.close());

        streamExecutor.execute(() -> relayChunks(provider, chunks, emitter));
        return emitter;
    }

    @GetMapping("/providers")
    public ResponseEntity<List<ProviderResponse>> providers() {
        List<ProviderResponse> providers = queryOrchestrator.listProviders().stream()
            .map(ProviderResponse::from)
            .collect(Collectors.toList());
        return ResponseEntity.ok(providers);
    }

    private void relayChunks(LlmProvider provider, ChunkStream chunks, SseEmitter emitter) {
        int count = 0;
        try (chunks) {
            while (chunks.hasNext()) {
                emitter.send(SseEmitter.event().name("chunk").data(chunks.next()));
                count++;
            }
            emitter.send(SseEmitter.event().name("done").data("[DONE]"));
            emitter.complete();
            log.info("Stream completed - provider: {}, chunks: {}", provider.getDisplayName(), count);
        } catch (IOException e) {
            // client went away; closing the stream cancels the upstream request
            log.debug("Stream client disconnected - provider: {}, chunks: {}", provider.getDisplayName(), count);
            emitter.completeWithError(e);
        } catch (RuntimeException e) {
            log.error("Stream failed - provider: {}, chunks: {}, error: {}", provider.getDisplayName(), count, e.getMessage());
            try {
                emitter.send(SseEmitter.event().name("error")
                    .data(Map.of("error", "Stream failed", "message", String.valueOf(e.getMessage())),
                        MediaType.APPLICATION_JSON));
                emitter.complete();
            } catch (IOException sendFailure) {
                emitter.completeWithError(e);
            }
        }
    }
}
