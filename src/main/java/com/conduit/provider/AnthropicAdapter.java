package com.conduit.provider;

import com.conduit.config.ConduitProperties;
import com.conduit.exception.TransformException;
import com.conduit.model.ProviderType;
import com.conduit.model.Usage;
import com.conduit.streaming.StreamNormalizer;
import com.conduit.streaming.StreamSession;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Anthropic (Claude) Messages API adapter.
 */
@Slf4j
public class AnthropicAdapter extends AbstractPlatformAdapter {

    static final String ANTHROPIC_VERSION = "2023-06-01";
    static final int DEFAULT_MAX_TOKENS = 4096;

    public AnthropicAdapter(
            ConduitProperties.ProviderConfig config,
            WebClient webClient,
            ObjectMapper objectMapper) {
        super(config, webClient, objectMapper);
    }

    @Override
    public ProviderType getType() {
        return ProviderType.ANTHROPIC;
    }

    @Override
    public Set<String> getSupportedEndpoints() {
        return Set.of(CHAT_COMPLETIONS);
    }

    /**
     * Convert OpenAI request to Anthropic format.
     */
    @Override
    public JsonNode transformRequest(String endpoint, JsonNode openAiRequest) {
        ObjectNode anthropicRequest = objectMapper.createObjectNode();
        anthropicRequest.put("model", resolveModel(openAiRequest.path("model").asText(null)));

        // Anthropic takes system prompts outside the message list
        List<String> systemParts = new ArrayList<>();
        ArrayNode messages = objectMapper.createArrayNode();
        for (JsonNode message : openAiRequest.path("messages")) {
            if ("system".equals(message.path("role").asText())) {
                systemParts.add(message.path("content").asText(""));
            } else {
                messages.add(message.deepCopy());
            }
        }
        anthropicRequest.set("messages", messages);

        if (!systemParts.isEmpty()) {
            anthropicRequest.put("system", String.join("\n\n", systemParts));
        }

        anthropicRequest.put("max_tokens", openAiRequest.hasNonNull("max_tokens")
                ? openAiRequest.get("max_tokens").asInt()
                : DEFAULT_MAX_TOKENS);

        if (openAiRequest.hasNonNull("temperature")) {
            anthropicRequest.set("temperature", openAiRequest.get("temperature"));
        }
        if (openAiRequest.hasNonNull("top_p")) {
            anthropicRequest.set("top_p", openAiRequest.get("top_p"));
        }

        JsonNode stop = openAiRequest.path("stop");
        if (stop.isTextual()) {
            anthropicRequest.set("stop_sequences", objectMapper.createArrayNode().add(stop.asText()));
        } else if (stop.isArray() && !stop.isEmpty()) {
            anthropicRequest.set("stop_sequences", stop.deepCopy());
        }

        if (openAiRequest.path("stream").asBoolean(false)) {
            anthropicRequest.put("stream", true);
        }

        log.debug("Anthropic request: model={}, messages={}, system={}",
                anthropicRequest.path("model").asText(), messages.size(), !systemParts.isEmpty());
        return anthropicRequest;
    }

    /**
     * Convert Anthropic response to OpenAI format.
     */
    @Override
    protected JsonNode convertResponse(String endpoint, JsonNode anthropicResponse) {
        JsonNode content = anthropicResponse.path("content");
        if (!content.isArray()) {
            throw new TransformException("Anthropic response has no content blocks");
        }

        StringBuilder contentBuilder = new StringBuilder();
        for (JsonNode item : content) {
            if ("text".equals(item.path("type").asText("text"))) {
                contentBuilder.append(item.path("text").asText(""));
            }
        }

        JsonNode usageNode = anthropicResponse.path("usage");
        int inputTokens = usageNode.path("input_tokens").asInt(0);
        int outputTokens = usageNode.path("output_tokens").asInt(0);
        Usage usage = Usage.builder()
                .promptTokens(inputTokens)
                .completionTokens(outputTokens)
                .totalTokens(inputTokens + outputTokens)
                .build();

        String id = anthropicResponse.hasNonNull("id")
                ? "chatcmpl-" + anthropicResponse.get("id").asText()
                : "chatcmpl-" + UUID.randomUUID().toString().substring(0, 8);

        return completion(
                id,
                Instant.now().getEpochSecond(),
                textOrNull(anthropicResponse, "model"),
                contentBuilder.toString(),
                mapStopReason(textOrNull(anthropicResponse, "stop_reason")),
                usage);
    }

    /**
     * Map Claude stop reasons to OpenAI finish reasons.
     */
    static String mapStopReason(String stopReason) {
        if (stopReason == null) {
            return "stop";
        }
        return switch (stopReason) {
            case "max_tokens" -> "length";
            case "tool_use" -> "tool_calls";
            default -> "stop";
        };
    }

    @Override
    protected String resolveUrl(String endpoint, String model) {
        return baseUrl() + "/messages";
    }

    @Override
    protected Map<String, String> authenticationHeaders() {
        return Map.of(
                "x-api-key", config.getApiKey(),
                "anthropic-version", ANTHROPIC_VERSION);
    }

    @Override
    protected boolean streamsNatively() {
        return true;
    }

    @Override
    protected StreamNormalizer newStreamNormalizer(StreamSession session) {
        return new AnthropicStreamNormalizer(objectMapper, session);
    }
}
