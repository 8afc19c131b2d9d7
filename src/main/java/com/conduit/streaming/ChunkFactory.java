package com.conduit.streaming;

import com.conduit.model.ChatCompletionChunk;
import com.conduit.model.Delta;

import java.util.List;

/**
 * Builds the OpenAI {@code chat.completion.chunk} shapes used by every normalizer.
 */
public final class ChunkFactory {

    private ChunkFactory() {
    }

    /**
     * First chunk of a session, announcing the assistant role.
     */
    public static ChatCompletionChunk start(StreamSession session) {
        return chunk(session, Delta.builder().role("assistant").build(), null);
    }

    public static ChatCompletionChunk content(StreamSession session, String content) {
        return chunk(session, Delta.builder().content(content).build(), null);
    }

    /**
     * Keep-alive chunk carrying no new content.
     */
    public static ChatCompletionChunk empty(StreamSession session) {
        return chunk(session, Delta.builder().build(), null);
    }

    public static ChatCompletionChunk stop(StreamSession session, String finishReason) {
        return chunk(session, Delta.builder().build(), finishReason != null ? finishReason : "stop");
    }

    private static ChatCompletionChunk chunk(StreamSession session, Delta delta, String finishReason) {
        return ChatCompletionChunk.builder()
                .id(session.getId())
                .object(ChatCompletionChunk.OBJECT)
                .created(session.getCreated())
                .model(session.getModel())
                .choices(List.of(
                        ChatCompletionChunk.ChunkChoice.builder()
                                .index(0)
                                .delta(delta)
                                .finishReason(finishReason)
                                .build()
                ))
                .build();
    }
}
