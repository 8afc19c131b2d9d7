package com.conduit.streaming;

import com.conduit.exception.ErrorPayloads;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;

/**
 * Drives a {@link StreamNormalizer} over the text fragments of one upstream stream.
 * <p>
 * Fragments are reassembled into lines, each line is fed to the normalizer, and the
 * normalizer's completion hook runs after the body ends. Any failure, at open time or
 * mid-stream, becomes one final error event and the sequence completes. Nothing is
 * emitted after the first error event.
 */
@Slf4j
public final class SseStreamProcessor {

    private SseStreamProcessor() {
    }

    public static Flux<StreamEvent> process(Flux<String> fragments, StreamNormalizer normalizer) {
        return normalize(fragments, normalizer)
                .onErrorResume(error -> {
                    log.error("Upstream stream failed: {}", error.toString());
                    return Flux.just(StreamEvent.error(ErrorPayloads.fromThrowable(error)));
                })
                .takeUntil(StreamEvent::isError);
    }

    /**
     * Same pipeline without error conversion: transport failures propagate as exceptions.
     */
    public static Flux<StreamEvent> normalize(Flux<String> fragments, StreamNormalizer normalizer) {
        return Flux.defer(() -> {
            SseLineBuffer buffer = new SseLineBuffer();
            return fragments
                    .concatMapIterable(buffer::append)
                    .concatWith(Flux.defer(() -> Flux.fromIterable(buffer.drain())))
                    .concatMapIterable(normalizer::onLine)
                    .concatWith(Flux.defer(normalizer::onComplete));
        });
    }
}
