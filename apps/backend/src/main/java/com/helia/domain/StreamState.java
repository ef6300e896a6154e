package com.helia.domain;

import java.time.Instant;

/**
 * Accumulator for the chunks of one in-flight turn. Never persisted itself;
 * its content becomes the assistant message.
 */
public final class StreamState {

    private final String sessionId;
    private final Instant startedAt;
    private final StringBuilder partialContent = new StringBuilder(1024);
    private int chunkCount;

    public StreamState(String sessionId, Instant startedAt) {
        this.sessionId = sessionId;
        this.startedAt = startedAt;
    }

    public synchronized void append(String chunk) {
        partialContent.append(chunk);
        chunkCount++;
    }

    public synchronized String content() {
        return partialContent.toString();
    }

    public synchronized int chunkCount() {
        return chunkCount;
    }

    public synchronized boolean isEmpty() {
        return chunkCount == 0;
    }

    public String sessionId() {
        return sessionId;
    }

    public Instant startedAt() {
        return startedAt;
    }
}
