package com.conduit.provider;

import com.conduit.client.PlatformHttpClient;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fetches the final answer of a Coze chat from the message list APIs.
 * The v3 chat-scoped listing is tried first, then the v1 conversation listing.
 */
@Slf4j
public class CozeMessageClient {

    private final PlatformHttpClient httpClient;
    private final String baseUrl;
    private final Map<String, String> headers;

    public CozeMessageClient(PlatformHttpClient httpClient, String baseUrl, Map<String, String> headers) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl;
        this.headers = headers;
    }

    /**
     * Answer text of the chat, or empty if neither endpoint yields one.
     */
    public Mono<String> fetchAnswer(String conversationId, String chatId) {
        Map<String, String> chatParams = new LinkedHashMap<>();
        chatParams.put("conversation_id", conversationId);
        chatParams.put("chat_id", chatId);

        Mono<String> chatMessages = fetch(
                PlatformHttpClient.buildUri(baseUrl + "/v3/chat/message/list", chatParams), false);
        Mono<String> conversationMessages = Mono.defer(() -> fetch(
                PlatformHttpClient.buildUri(baseUrl + "/v1/conversation/message/list",
                        Map.of("conversation_id", conversationId)), true));

        return chatMessages
                .onErrorResume(error -> {
                    log.warn("Coze chat message list failed, trying conversation list: {}", error.getMessage());
                    return Mono.empty();
                })
                .switchIfEmpty(conversationMessages);
    }

    private Mono<String> fetch(URI uri, boolean newestFirst) {
        return httpClient.exchange(HttpMethod.GET, uri, headers, null)
                .flatMap(response -> {
                    if (!response.isSuccessful() || !response.hasJson()) {
                        log.warn("Coze message list returned status {}", response.getStatusCode());
                        return Mono.empty();
                    }
                    JsonNode json = response.getJson();
                    if (json.path("code").asInt(0) != 0) {
                        log.warn("Coze message list returned code {}: {}",
                                json.path("code").asInt(), json.path("msg").asText(""));
                        return Mono.empty();
                    }
                    return Mono.justOrEmpty(findAnswer(json.path("data"), newestFirst));
                });
    }

    static String findAnswer(JsonNode messages, boolean newestFirst) {
        if (!messages.isArray()) {
            return null;
        }
        String answer = null;
        for (JsonNode message : messages) {
            if ("assistant".equals(message.path("role").asText())
                    && "answer".equals(message.path("type").asText())
                    && message.hasNonNull("content")) {
                answer = message.get("content").asText();
                if (newestFirst) {
                    return answer;
                }
            }
        }
        return answer;
    }
}
