package com.llmbridge.llm.stream;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Signal;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.stream.Stream;

/**
 * Pull-based sequence of content fragments backed by a streaming HTTP body.
 *
 * <p>Nothing is requested from the source until the first {@link #hasNext()} call. Fragments
 * received before a failure are handed out first; the failure is thrown once they are drained.
 * The underlying subscription is released by {@link #close()}, on completion and on failure;
 * try-with-resources covers early exits. Single consumer, single use. {@link #close()} may be
 * called from another thread.
 */
@Slf4j
public class ChunkStream implements Iterator<String>, AutoCloseable {

    private final Flux<Signal<String>> signals;
    private Stream<Signal<String>> blockingStream;
    private Iterator<Signal<String>> iterator;
    private String pending;
    private volatile boolean closed;

    private ChunkStream(Flux<String> source) {
        // terminal signals travel in-band so buffered fragments are not overtaken by an error
        this.signals = source.materialize();
    }

    public static ChunkStream of(Flux<String> source) {
        return new ChunkStream(source);
    }

    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        Iterator<Signal<String>> signalIterator = openIterator();
        if (signalIterator == null) {
            return false;
        }
        try {
            if (signalIterator.hasNext()) {
                Signal<String> signal = signalIterator.next();
                if (signal.isOnNext()) {
                    pending = signal.get();
                    return true;
                }
                if (signal.isOnError()) {
                    throw Exceptions.propagate(signal.getThrowable());
                }
            }
        } catch (RuntimeException e) {
            close();
            throw e;
        }
        close();
        return false;
    }

    @Override
    public String next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Stream is exhausted or closed");
        }
        String fragment = pending;
        pending = null;
        return fragment;
    }

    /**
     * Drains every remaining fragment into one string and closes the stream.
     */
    public String readRemaining() {
        StringBuilder content = new StringBuilder();
        try {
            while (hasNext()) {
                content.append(next());
            }
        } finally {
            close();
        }
        return content.toString();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        pending = null;
        if (blockingStream != null) {
            // cancels the upstream subscription, which releases the HTTP body
            blockingStream.close();
            log.debug("[STREAM] Chunk stream closed");
        }
    }

    private synchronized Iterator<Signal<String>> openIterator() {
        if (closed) {
            return null;
        }
        if (iterator == null) {
            blockingStream = signals.toStream();
            iterator = blockingStream.iterator();
        }
        return iterator;
    }
}
