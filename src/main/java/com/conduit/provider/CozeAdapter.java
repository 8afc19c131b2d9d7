package com.conduit.provider;

import com.conduit.client.PlatformHttpClient;
import com.conduit.client.UpstreamResponse;
import com.conduit.config.ConduitProperties;
import com.conduit.exception.PlatformRejectedException;
import com.conduit.exception.TransformException;
import com.conduit.exception.ValidationException;
import com.conduit.model.AdapterModelInfo;
import com.conduit.model.ProviderType;
import com.conduit.model.Usage;
import com.conduit.streaming.SseStreamProcessor;
import com.conduit.streaming.StreamNormalizer;
import com.conduit.streaming.StreamSession;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Coze v3 chat adapter. The bot is addressed through the request's {@code model}
 * ({@code "bot-<id>"} or the bare id).
 */
@Slf4j
public class CozeAdapter extends AbstractPlatformAdapter {

    private static final String BOT_PREFIX = "bot-";
    private static final String DEFAULT_USER = "default_user";

    public CozeAdapter(
            ConduitProperties.ProviderConfig config,
            WebClient webClient,
            ObjectMapper objectMapper) {
        super(config, webClient, objectMapper);
    }

    @Override
    public ProviderType getType() {
        return ProviderType.COZE;
    }

    @Override
    public Set<String> getSupportedEndpoints() {
        return Set.of(CHAT_COMPLETIONS);
    }

    static String deriveBotId(String model) {
        String botId = model == null ? "" : model.trim();
        if (botId.startsWith(BOT_PREFIX)) {
            botId = botId.substring(BOT_PREFIX.length());
        }
        if (botId.isEmpty()) {
            throw new ValidationException("Cannot derive Coze bot_id from model '" + model + "'", "model");
        }
        return botId;
    }

    @Override
    public JsonNode transformRequest(String endpoint, JsonNode openAiRequest) {
        String botId = deriveBotId(openAiRequest.path("model").asText(""));

        JsonNode messages = openAiRequest.path("messages");
        if (!messages.isArray() || messages.isEmpty()) {
            throw new ValidationException("messages must not be empty", "messages");
        }

        ArrayNode additionalMessages = objectMapper.createArrayNode();
        int last = messages.size() - 1;
        for (int i = 0; i < last; i++) {
            JsonNode message = messages.get(i);
            String role = "assistant".equals(message.path("role").asText()) ? "assistant" : "user";
            additionalMessages.add(cozeMessage(role, message.path("content").asText("")));
        }
        // the final message is always sent as the user's query
        additionalMessages.add(cozeMessage("user", messages.get(last).path("content").asText("")));

        ObjectNode cozeRequest = objectMapper.createObjectNode();
        cozeRequest.put("bot_id", botId);
        cozeRequest.put("user_id", openAiRequest.hasNonNull("user")
                ? openAiRequest.get("user").asText()
                : DEFAULT_USER);
        cozeRequest.set("additional_messages", additionalMessages);
        cozeRequest.put("stream", openAiRequest.path("stream").asBoolean(false));

        log.debug("Coze request: bot_id={}, messages={}", botId, additionalMessages.size());
        return cozeRequest;
    }

    private ObjectNode cozeMessage(String role, String content) {
        ObjectNode message = objectMapper.createObjectNode();
        message.put("role", role);
        message.put("content", content);
        message.put("content_type", "text");
        return message;
    }

    @Override
    protected JsonNode convertResponse(String endpoint, JsonNode cozeResponse) {
        String content;
        JsonNode messages = cozeResponse.path("messages");
        if (messages.isArray()) {
            content = findAnswer(messages);
        } else if (cozeResponse.hasNonNull("answer")) {
            content = cozeResponse.get("answer").asText();
        } else if (cozeResponse.path("content").isTextual()) {
            content = cozeResponse.get("content").asText();
        } else {
            throw new TransformException("Coze response has no messages, answer or content");
        }

        String conversationId = textOrNull(cozeResponse, "conversation_id");
        String id = conversationId != null
                ? "chatcmpl-" + conversationId
                : "chatcmpl-" + DigestUtils.sha256Hex(content).substring(0, 24);
        long created = cozeResponse.path("created_at").isNumber()
                ? cozeResponse.get("created_at").asLong()
                : Instant.now().getEpochSecond();

        return completion(id, created, null, content, "stop", Usage.zero());
    }

    /**
     * Content of the {@code type=answer} message. Untyped message lists fall back to the
     * last assistant message.
     */
    static String findAnswer(JsonNode messages) {
        boolean anyTyped = false;
        String lastAssistant = "";
        for (JsonNode message : messages) {
            if (message.hasNonNull("type")) {
                anyTyped = true;
                if ("answer".equals(message.get("type").asText())) {
                    return message.path("content").asText("");
                }
            } else if ("assistant".equals(message.path("role").asText())) {
                lastAssistant = message.path("content").asText("");
            }
        }
        return anyTyped ? "" : lastAssistant;
    }

    /**
     * The v3 chat endpoint answers non-streaming calls before the bot has replied, so the
     * call runs over the stream and the answer is aggregated into a {@code messages} response.
     */
    @Override
    public Mono<UpstreamResponse> makeRequest(String endpoint, HttpMethod method, String model,
                                              JsonNode platformRequest, Map<String, String> headers) {
        ObjectNode streamingRequest = platformRequest.deepCopy();
        streamingRequest.put("stream", true);

        Map<String, String> merged = PlatformHttpClient.prepareHeaders(config.getDefaultHeaders(), headers);
        merged.putAll(authenticationHeaders());
        URI uri = PlatformHttpClient.buildUri(resolveUrl(endpoint, model), authenticationQueryParams());

        CozeStreamNormalizer normalizer = (CozeStreamNormalizer) newStreamNormalizer(StreamSession.start(model));
        return SseStreamProcessor.normalize(httpClient.stream(HttpMethod.POST, uri, merged, streamingRequest), normalizer)
                .filter(event -> event.isError())
                .next()
                .<UpstreamResponse>flatMap(event -> Mono.error(new PlatformRejectedException(event.getError())))
                .switchIfEmpty(Mono.fromSupplier(() -> aggregate(normalizer)));
    }

    private UpstreamResponse aggregate(CozeStreamNormalizer normalizer) {
        ObjectNode response = objectMapper.createObjectNode();
        if (normalizer.getConversationId() != null) {
            response.put("conversation_id", normalizer.getConversationId());
        }
        if (normalizer.getChatId() != null) {
            response.put("chat_id", normalizer.getChatId());
        }
        response.put("created_at", Instant.now().getEpochSecond());
        ObjectNode answer = response.putArray("messages").addObject();
        answer.put("role", "assistant");
        answer.put("type", "answer");
        answer.put("content", normalizer.getAnswer());
        answer.put("content_type", "text");

        return new UpstreamResponse(200, new HttpHeaders(),
                response.toString().getBytes(StandardCharsets.UTF_8), response);
    }

    @Override
    protected String resolveUrl(String endpoint, String model) {
        return baseUrl() + "/v3/chat";
    }

    @Override
    protected Map<String, String> authenticationHeaders() {
        return Map.of("Authorization", "Bearer " + config.getApiKey());
    }

    @Override
    protected boolean streamsNatively() {
        return true;
    }

    @Override
    protected StreamNormalizer newStreamNormalizer(StreamSession session) {
        CozeMessageClient messageClient = new CozeMessageClient(httpClient, baseUrl(), authenticationHeaders());
        return new CozeStreamNormalizer(objectMapper, session, messageClient);
    }

    @Override
    protected boolean supportsFunctionCalling() {
        return false;
    }

    @Override
    public AdapterModelInfo getModelInfo() {
        AdapterModelInfo info = super.getModelInfo();
        info.setBotId(config.getBotId());
        return info;
    }
}
