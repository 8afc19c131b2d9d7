package com.conduit.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * OpenAI-compatible streaming chat completion chunk.
 * Sent as SSE events during streaming responses.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatCompletionChunk {

    public static final String OBJECT = "chat.completion.chunk";

    @JsonProperty("id")
    private String id;

    @JsonProperty("object")
    private String object;

    @JsonProperty("created")
    private Long created;

    @JsonProperty("model")
    private String model;

    @JsonProperty("choices")
    private List<ChunkChoice> choices;

    @JsonProperty("system_fingerprint")
    private String systemFingerprint;

    /**
     * Choice for streaming chunk with delta instead of message.
     * {@code finish_reason} is serialized as an explicit null until the final chunk.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ChunkChoice {

        @JsonProperty("index")
        private Integer index;

        @JsonProperty("delta")
        private Delta delta;

        @JsonProperty("finish_reason")
        @JsonInclude(JsonInclude.Include.ALWAYS)
        private String finishReason;
    }

    /**
     * Delta of the first choice, or null when the chunk has no choices.
     */
    public Delta firstDelta() {
        if (choices == null || choices.isEmpty()) {
            return null;
        }
        return choices.get(0).getDelta();
    }
}
