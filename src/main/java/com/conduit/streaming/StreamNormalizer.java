package com.conduit.streaming;

import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Per-session state machine turning one provider's SSE lines into OpenAI stream events.
 * Instances are single-use and not thread-safe; the processor feeds lines in order.
 */
public interface StreamNormalizer {

    /**
     * Interpret one complete SSE line.
     */
    List<StreamEvent> onLine(String line);

    /**
     * Called once after the upstream body ends. May perform follow-up I/O.
     */
    Flux<StreamEvent> onComplete();

    StreamState getState();
}
