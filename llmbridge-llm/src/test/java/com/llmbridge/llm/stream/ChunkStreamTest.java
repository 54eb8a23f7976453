package com.llmbridge.llm.stream;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ChunkStreamTest {

    @Test
    void subscribesOnlyWhenFirstPulled() {
        AtomicInteger subscriptions = new AtomicInteger();
        Flux<String> source = Flux.just("a", "b").doOnSubscribe(s -> subscriptions.incrementAndGet());

        ChunkStream stream = ChunkStream.of(source);
        assertEquals(0, subscriptions.get());

        assertEquals("ab", stream.readRemaining());
        assertEquals(1, subscriptions.get());
        assertTrue(stream.isClosed());
    }

    @Test
    void closingEarlyCancelsTheSource() {
        AtomicBoolean cancelled = new AtomicBoolean();
        Flux<String> source = Flux.just("one", "two", "three").concatWith(Flux.never())
            .doOnCancel(() -> cancelled.set(true));

        try (ChunkStream stream = ChunkStream.of(source)) {
            assertEquals("one", stream.next());
        }

        assertTrue(cancelled.get());
    }

    @Test
    void errorsPropagateAndReleaseTheStream() {
        ChunkStream stream = ChunkStream.of(Flux.just("partial").concatWith(Flux.error(new IllegalStateException("reset"))));

        List<String> seen = new ArrayList<>();
        IllegalStateException thrown = assertThrows(IllegalStateException.class,
            () -> stream.forEachRemaining(seen::add));

        assertEquals("reset", thrown.getMessage());
        assertEquals(List.of("partial"), seen);
        assertTrue(stream.isClosed());
    }

    @Test
    void bufferedFragmentsAreDeliveredInOrderBeforeTheFailure() {
        ChunkStream stream = ChunkStream.of(Flux.just("Hel", "lo", " wor")
            .concatWith(Flux.error(new IllegalStateException("connection reset"))));

        assertEquals("Hel", stream.next());
        assertEquals("lo", stream.next());
        assertEquals(" wor", stream.next());
        assertThrows(IllegalStateException.class, stream::hasNext);
        assertTrue(stream.isClosed());
    }

    @Test
    void closeFromAnotherThreadStopsTheConsumer() throws InterruptedException {
        AtomicBoolean cancelled = new AtomicBoolean();
        ChunkStream stream = ChunkStream.of(Flux.just("first").concatWith(Flux.never())
            .doOnCancel(() -> cancelled.set(true)));

        assertEquals("first", stream.next());

        Thread closer = new Thread(stream::close);
        closer.start();
        closer.join(5000);

        assertTrue(stream.isClosed());
        assertTrue(cancelled.get());
        assertFalse(stream.hasNext());
    }

    @Test
    void exhaustedStreamIsNotRestartable() {
        ChunkStream stream = ChunkStream.of(Flux.just("only"));

        assertEquals("only", stream.next());
        assertFalse(stream.hasNext());
        assertFalse(stream.hasNext());
        assertThrows(NoSuchElementException.class, stream::next);
    }
}
