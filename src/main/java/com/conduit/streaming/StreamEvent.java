package com.conduit.streaming;

import com.conduit.model.ChatCompletionChunk;
import com.conduit.model.ErrorResponse;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One unit emitted by a streaming session: a normalized chunk, an upstream record passed
 * through untouched, or a terminal error payload.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class StreamEvent {

    public enum Kind {
        CHUNK,
        RAW,
        ERROR
    }

    private final Kind kind;
    private final ChatCompletionChunk chunk;
    private final JsonNode raw;
    private final ErrorResponse error;

    public static StreamEvent chunk(ChatCompletionChunk chunk) {
        return new StreamEvent(Kind.CHUNK, chunk, null, null);
    }

    public static StreamEvent raw(JsonNode raw) {
        return new StreamEvent(Kind.RAW, null, raw, null);
    }

    public static StreamEvent error(ErrorResponse error) {
        return new StreamEvent(Kind.ERROR, null, null, error);
    }

    public boolean isError() {
        return kind == Kind.ERROR;
    }

    /**
     * Object to serialize as the SSE {@code data} payload.
     */
    public Object payload() {
        return switch (kind) {
            case CHUNK -> chunk;
            case RAW -> raw;
            case ERROR -> error;
        };
    }
}
