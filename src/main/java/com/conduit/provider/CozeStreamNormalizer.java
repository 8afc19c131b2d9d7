package com.conduit.provider;

import com.conduit.exception.ErrorType;
import com.conduit.model.ErrorResponse;
import com.conduit.streaming.AbstractStreamNormalizer;
import com.conduit.streaming.ChunkFactory;
import com.conduit.streaming.StreamEvent;
import com.conduit.streaming.StreamSession;
import com.conduit.streaming.StreamState;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes the Coze v3 chat stream.
 * <p>
 * Chat records carry a {@code status}: {@code in_progress} yields an empty keep-alive chunk,
 * {@code completed} the stop chunk and {@code failed} an error. Answer deltas yield content
 * chunks. When the stream delivered ids but no answer text, the answer is fetched from the
 * message list after the body ends and emitted ahead of the stop chunk.
 */
@Slf4j
public class CozeStreamNormalizer extends AbstractStreamNormalizer {

    static final String MESSAGE_DELTA = "conversation.message.delta";
    static final String MESSAGE_COMPLETED = "conversation.message.completed";
    private static final String CHAT_EVENT_PREFIX = "conversation.chat.";

    private final CozeMessageClient messageClient;

    private String conversationId;
    private String chatId;
    private boolean contentEmitted;
    private boolean stopPending;
    private final StringBuilder answer = new StringBuilder();

    /**
     * @param messageClient used to recover the answer after the stream ends, or null to skip recovery
     */
    public CozeStreamNormalizer(ObjectMapper objectMapper, StreamSession session, CozeMessageClient messageClient) {
        super(objectMapper, session);
        this.messageClient = messageClient;
    }

    @Override
    protected String platformName() {
        return "coze";
    }

    @Override
    protected void handleData(String eventType, JsonNode data, List<StreamEvent> out) {
        captureIds(eventType, data);

        if (MESSAGE_COMPLETED.equals(eventType)) {
            // full-message repeat of the deltas already streamed
            return;
        }

        String status = text(data, "status");
        if ("failed".equals(status)) {
            emitError(out, failure(data.path("last_error")));
            return;
        }

        String content = extractContent(eventType, data);
        if (content != null && !content.isEmpty()) {
            contentEmitted = true;
            answer.append(content);
            emitContent(out, content);
            return;
        }

        if ("in_progress".equals(status)) {
            emitChunk(out, ChunkFactory.empty(session));
        } else if ("completed".equals(status) && getState() != StreamState.COMPLETED && !stopPending) {
            if (recoveryPossible()) {
                stopPending = true;
            } else {
                emitStop(out, "stop");
            }
        }
    }

    @Override
    public Flux<StreamEvent> onComplete() {
        if (getState() == StreamState.FAILED) {
            return Flux.empty();
        }
        if (!recoveryPossible()) {
            return stopPending ? Flux.defer(this::stop) : Flux.empty();
        }

        log.info("Coze stream ended without answer text, fetching conversation={} chat={}", conversationId, chatId);
        Flux<StreamEvent> recovered = messageClient.fetchAnswer(conversationId, chatId)
                .filter(text -> !text.isEmpty())
                .flatMapIterable(text -> {
                    List<StreamEvent> out = new ArrayList<>(2);
                    contentEmitted = true;
                    answer.append(text);
                    emitContent(out, text);
                    return out;
                })
                .onErrorResume(error -> {
                    log.warn("Coze answer recovery failed: {}", error.getMessage());
                    return Flux.empty();
                });

        return stopPending ? recovered.concatWith(Flux.defer(this::stop)) : recovered;
    }

    public String getConversationId() {
        return conversationId;
    }

    public String getChatId() {
        return chatId;
    }

    /**
     * All answer text emitted so far, inline or recovered.
     */
    public String getAnswer() {
        return answer.toString();
    }

    private Flux<StreamEvent> stop() {
        stopPending = false;
        List<StreamEvent> out = new ArrayList<>(2);
        emitStop(out, "stop");
        return Flux.fromIterable(out);
    }

    private boolean recoveryPossible() {
        return messageClient != null && !contentEmitted && conversationId != null && chatId != null;
    }

    private void captureIds(String eventType, JsonNode data) {
        String conversation = text(data, "conversation_id");
        if (conversation != null) {
            conversationId = conversation;
        }
        String chat = text(data, "chat_id");
        if (chat == null && (data.has("status") || (eventType != null && eventType.startsWith(CHAT_EVENT_PREFIX)))) {
            chat = text(data, "id");
        }
        if (chat != null) {
            chatId = chat;
        }
    }

    private static String extractContent(String eventType, JsonNode data) {
        JsonNode message = data.path("message");
        if (message.hasNonNull("content")) {
            return message.get("content").asText();
        }
        if (eventType != null && !MESSAGE_DELTA.equals(eventType)) {
            return null;
        }
        String type = text(data, "type");
        if (type != null && !"answer".equals(type)) {
            return null;
        }
        return text(data, "content");
    }

    private static ErrorResponse failure(JsonNode lastError) {
        JsonNode code = lastError.path("code");
        Object errorCode = code.isNumber() ? (Object) code.asInt()
                : code.isTextual() ? code.asText() : "coze_chat_failed";
        String message = lastError.path("msg").asText("");
        return ErrorResponse.of(message.isEmpty() ? "Coze chat failed" : message,
                ErrorType.PLATFORM.getValue(), errorCode);
    }
}
