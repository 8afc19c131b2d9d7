package com.conduit.streaming;

import com.conduit.model.ChatCompletionChunk;
import com.conduit.model.Delta;
import com.conduit.model.ErrorResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;

/**
 * SSE line handling shared by the provider normalizers.
 * <p>
 * {@code event:} lines update the current event type, {@code data:} lines are parsed as JSON
 * and handed to {@link #handleData}. Empty data lines are heartbeats. Records that fail to
 * parse are logged and dropped; the stream carries on. The first chunk of a session is
 * preceded by a synthetic {@code delta.role="assistant"} chunk unless it already carries a role.
 */
@Slf4j
public abstract class AbstractStreamNormalizer implements StreamNormalizer {

    private static final String EVENT_PREFIX = "event:";
    private static final String DATA_PREFIX = "data:";

    protected final ObjectMapper objectMapper;
    protected final StreamSession session;

    private StreamState state = StreamState.AWAITING_DATA;
    private String currentEventType;
    private boolean hasEmittedStart;

    protected AbstractStreamNormalizer(ObjectMapper objectMapper, StreamSession session) {
        this.objectMapper = objectMapper;
        this.session = session;
    }

    @Override
    public final List<StreamEvent> onLine(String line) {
        if (state == StreamState.FAILED || line == null) {
            return List.of();
        }

        if (line.startsWith(EVENT_PREFIX)) {
            currentEventType = line.substring(EVENT_PREFIX.length()).trim();
            return List.of();
        }

        if (!line.startsWith(DATA_PREFIX)) {
            // blank record separators, comments and id:/retry: fields
            return List.of();
        }

        String payload = line.substring(DATA_PREFIX.length()).trim();
        if (payload.isEmpty()) {
            return List.of();
        }

        List<StreamEvent> out = new ArrayList<>(2);
        if (!payload.startsWith("{")) {
            handleNonJsonData(payload, out);
            return out;
        }

        JsonNode data;
        try {
            data = objectMapper.readTree(payload);
        } catch (Exception e) {
            log.warn("Dropping malformed SSE record on {} stream: {}", platformName(), e.getMessage());
            return List.of();
        }

        if (state == StreamState.AWAITING_DATA) {
            state = StreamState.IN_PROGRESS;
        }
        handleData(currentEventType, data, out);
        return out;
    }

    @Override
    public Flux<StreamEvent> onComplete() {
        return Flux.empty();
    }

    @Override
    public StreamState getState() {
        return state;
    }

    protected abstract String platformName();

    /**
     * Interpret one parsed data record.
     *
     * @param eventType value of the last {@code event:} line, or null
     */
    protected abstract void handleData(String eventType, JsonNode data, List<StreamEvent> out);

    /**
     * Non-JSON data payloads such as {@code [DONE]}. Ignored by default.
     */
    protected void handleNonJsonData(String payload, List<StreamEvent> out) {
        if (!"[DONE]".equals(payload) && !"\"[DONE]\"".equals(payload)) {
            log.warn("Dropping non-JSON SSE record on {} stream", platformName());
        }
    }

    protected void emitChunk(List<StreamEvent> out, ChatCompletionChunk chunk) {
        Delta delta = chunk.firstDelta();
        ensureStarted(out, delta != null && delta.getRole() != null);
        out.add(StreamEvent.chunk(chunk));
    }

    /**
     * Upstream record forwarded untouched.
     *
     * @param carriesRole whether the record already announces the assistant role
     */
    protected void emitRaw(List<StreamEvent> out, JsonNode record, boolean carriesRole) {
        ensureStarted(out, carriesRole);
        out.add(StreamEvent.raw(record));
    }

    private void ensureStarted(List<StreamEvent> out, boolean carriesRole) {
        if (hasEmittedStart) {
            return;
        }
        hasEmittedStart = true;
        if (!carriesRole) {
            out.add(StreamEvent.chunk(ChunkFactory.start(session)));
        }
    }

    protected void emitContent(List<StreamEvent> out, String content) {
        emitChunk(out, ChunkFactory.content(session, content));
    }

    protected void emitStop(List<StreamEvent> out, String finishReason) {
        emitChunk(out, ChunkFactory.stop(session, finishReason));
        state = StreamState.COMPLETED;
    }

    protected void markCompleted() {
        state = StreamState.COMPLETED;
    }

    protected void emitError(List<StreamEvent> out, ErrorResponse error) {
        out.add(StreamEvent.error(error));
        state = StreamState.FAILED;
    }

    protected static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isTextual() ? value.asText() : null;
    }
}
