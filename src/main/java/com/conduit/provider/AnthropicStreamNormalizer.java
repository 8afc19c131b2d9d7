package com.conduit.provider;

import com.conduit.exception.ErrorType;
import com.conduit.model.ErrorResponse;
import com.conduit.streaming.AbstractStreamNormalizer;
import com.conduit.streaming.ChunkFactory;
import com.conduit.streaming.StreamEvent;
import com.conduit.streaming.StreamSession;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

/**
 * Normalizes the Anthropic Messages streaming protocol
 * ({@code message_start}, {@code content_block_delta}, {@code message_delta},
 * {@code message_stop}, {@code error}) into OpenAI chunks.
 */
public class AnthropicStreamNormalizer extends AbstractStreamNormalizer {

    private String stopReason;

    public AnthropicStreamNormalizer(ObjectMapper objectMapper, StreamSession session) {
        super(objectMapper, session);
    }

    @Override
    protected String platformName() {
        return "anthropic";
    }

    @Override
    protected void handleData(String eventType, JsonNode data, List<StreamEvent> out) {
        String type = data.hasNonNull("type") ? data.get("type").asText() : eventType;
        if (type == null) {
            return;
        }

        switch (type) {
            case "message_start" -> emitChunk(out, ChunkFactory.start(session));
            case "content_block_delta" -> {
                JsonNode delta = data.path("delta");
                if (delta.hasNonNull("text")) {
                    emitContent(out, delta.get("text").asText());
                }
            }
            case "message_delta" -> {
                String reason = text(data.path("delta"), "stop_reason");
                if (reason != null) {
                    stopReason = reason;
                }
            }
            case "message_stop" -> emitStop(out, AnthropicAdapter.mapStopReason(stopReason));
            case "error" -> {
                JsonNode error = data.path("error");
                emitError(out, ErrorResponse.of(
                        error.path("message").asText("Anthropic stream error"),
                        ErrorType.PLATFORM.getValue(),
                        error.path("type").asText("api_error")));
            }
            default -> {
                // ping, content_block_start, content_block_stop
            }
        }
    }
}
