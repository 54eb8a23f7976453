package com.llmbridge.core.query;

import com.llmbridge.common.exception.ErrorKind;
import com.llmbridge.common.exception.NonRetriableException;
import com.llmbridge.common.retry.RetryExecutor;
import com.llmbridge.common.retry.RetryPolicy;
import com.llmbridge.core.query.model.ProviderOutcome;
import com.llmbridge.core.query.model.ProviderStatus;
import com.llmbridge.llm.model.LlmResponse;
import com.llmbridge.llm.model.QueryOptions;
import com.llmbridge.llm.provider.LlmProvider;
import com.llmbridge.llm.provider.ProviderAdapter.ProviderException;
import com.llmbridge.llm.stream.ChunkStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class QueryOrchestratorTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private final ProviderQueryExecutor queryExecutor = new ProviderQueryExecutor(
        new RetryExecutor(delay -> { }, () -> 0), RetryPolicy.noRetry());

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    private QueryOrchestrator orchestrator(ScriptedProviderAdapter... adapters) {
        return new QueryOrchestrator(List.of(adapters), queryExecutor, executor);
    }

    @Test
    void queryAllReturnsOneOutcomePerAvailableProvider() {
        ScriptedProviderAdapter openAi = new ScriptedProviderAdapter(LlmProvider.OPENAI, true)
            .thenAnswer("from openai");
        ScriptedProviderAdapter groq = new ScriptedProviderAdapter(LlmProvider.GROQ, true)
            .thenFail(new NonRetriableException("Invalid API Key",
                new ProviderException("Invalid API Key", LlmProvider.GROQ, 401)));
        ScriptedProviderAdapter cerebras = new ScriptedProviderAdapter(LlmProvider.CEREBRAS, false);

        List<ProviderOutcome> outcomes = orchestrator(groq, cerebras, openAi).queryAll("hi", QueryOptions.empty());

        assertEquals(2, outcomes.size());

        ProviderOutcome first = outcomes.get(0);
        assertEquals(LlmProvider.OPENAI, first.getProvider());
        assertTrue(first.isSuccess());
        assertEquals("from openai", first.getResponse().getContent());
        assertNotNull(first.getResponse().getLatency());

        ProviderOutcome second = outcomes.get(1);
        assertEquals(LlmProvider.GROQ, second.getProvider());
        assertFalse(second.isSuccess());
        assertEquals(ErrorKind.NON_RETRIABLE, second.getErrorKind());
        assertEquals(401, second.getStatusCode());
        assertEquals("Invalid API Key", second.getErrorMessage());

        assertEquals(0, cerebras.queryCalls());
    }

    @Test
    void queryAllRunsProvidersConcurrently() {
        CountDownLatch bothStarted = new CountDownLatch(2);
        ScriptedProviderAdapter openAi = new ScriptedProviderAdapter(LlmProvider.OPENAI, true)
            .thenRun(() -> awaitPeer(bothStarted, LlmProvider.OPENAI));
        ScriptedProviderAdapter groq = new ScriptedProviderAdapter(LlmProvider.GROQ, true)
            .thenRun(() -> awaitPeer(bothStarted, LlmProvider.GROQ));

        List<ProviderOutcome> outcomes = orchestrator(openAi, groq).queryAll("hi", QueryOptions.empty());

        assertTrue(outcomes.stream().allMatch(ProviderOutcome::isSuccess));
    }

    private static LlmResponse awaitPeer(CountDownLatch latch, LlmProvider provider) {
        latch.countDown();
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("providers were queried one after another");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
        return LlmResponse.builder().provider(provider.getDisplayName()).model("m").content("ok").build();
    }

    @Test
    void queryAllWithNothingConfiguredIsEmpty() {
        ScriptedProviderAdapter openAi = new ScriptedProviderAdapter(LlmProvider.OPENAI, false);

        assertTrue(orchestrator(openAi).queryAll("hi", QueryOptions.empty()).isEmpty());
    }

    @Test
    void singleProviderQueryIsTimed() {
        ScriptedProviderAdapter sambaNova = new ScriptedProviderAdapter(LlmProvider.SAMBANOVA, true)
            .thenAnswer("single");

        LlmResponse response = orchestrator(sambaNova).query(LlmProvider.SAMBANOVA, "hi", QueryOptions.empty());

        assertEquals("single", response.getContent());
        assertNotNull(response.getTimestamp());
    }

    @Test
    void unregisteredProviderIsRejected() {
        QueryOrchestrator orchestrator = orchestrator(new ScriptedProviderAdapter(LlmProvider.OPENAI, true));

        assertThrows(IllegalArgumentException.class,
            () -> orchestrator.query(LlmProvider.GROQ, "hi", QueryOptions.empty()));
        assertThrows(IllegalArgumentException.class,
            () -> orchestrator.stream(LlmProvider.GROQ, "hi", QueryOptions.empty()));
    }

    @Test
    void streamDelegatesToAdapter() {
        ScriptedProviderAdapter openAi = new ScriptedProviderAdapter(LlmProvider.OPENAI, true)
            .streaming(List.of("a", "b", "c"));

        try (ChunkStream stream = orchestrator(openAi).stream(LlmProvider.OPENAI, "hi", QueryOptions.empty())) {
            assertEquals("abc", stream.readRemaining());
        }
    }

    @Test
    void listProvidersReportsAvailability() {
        List<ProviderStatus> statuses = orchestrator(
            new ScriptedProviderAdapter(LlmProvider.GROQ, false),
            new ScriptedProviderAdapter(LlmProvider.OPENAI, true)).listProviders();

        assertEquals(2, statuses.size());
        assertEquals("OpenAI", statuses.get(0).getName());
        assertTrue(statuses.get(0).isAvailable());
        assertEquals("groq", statuses.get(1).getSlug());
        assertFalse(statuses.get(1).isAvailable());
    }

    @Test
    void duplicateAdaptersAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> orchestrator(
            new ScriptedProviderAdapter(LlmProvider.OPENAI, true),
            new ScriptedProviderAdapter(LlmProvider.OPENAI, false)));
    }
}
