package com.conduit.provider;

import com.conduit.config.ConduitProperties;
import com.conduit.exception.TransformException;
import com.conduit.model.ProviderType;
import com.conduit.model.Usage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Google Gemini {@code generateContent} adapter. Streams are synthesized from full responses.
 */
@Slf4j
public class GoogleAdapter extends AbstractPlatformAdapter {

    public GoogleAdapter(
            ConduitProperties.ProviderConfig config,
            WebClient webClient,
            ObjectMapper objectMapper) {
        super(config, webClient, objectMapper);
    }

    @Override
    public ProviderType getType() {
        return ProviderType.GOOGLE;
    }

    @Override
    public Set<String> getSupportedEndpoints() {
        return Set.of(CHAT_COMPLETIONS);
    }

    @Override
    public JsonNode transformRequest(String endpoint, JsonNode openAiRequest) {
        ObjectNode googleRequest = objectMapper.createObjectNode();

        ArrayNode contents = googleRequest.putArray("contents");
        for (JsonNode message : openAiRequest.path("messages")) {
            String role = "assistant".equals(message.path("role").asText()) ? "model" : "user";
            ObjectNode content = contents.addObject();
            content.put("role", role);
            content.putArray("parts").addObject().put("text", message.path("content").asText(""));
        }

        ObjectNode generationConfig = objectMapper.createObjectNode();
        if (openAiRequest.hasNonNull("max_tokens")) {
            generationConfig.put("maxOutputTokens", openAiRequest.get("max_tokens").asInt());
        }
        if (openAiRequest.hasNonNull("temperature")) {
            generationConfig.set("temperature", openAiRequest.get("temperature"));
        }
        if (openAiRequest.hasNonNull("top_p")) {
            generationConfig.set("topP", openAiRequest.get("top_p"));
        }
        JsonNode stop = openAiRequest.path("stop");
        if (stop.isTextual()) {
            generationConfig.putArray("stopSequences").add(stop.asText());
        } else if (stop.isArray() && !stop.isEmpty()) {
            generationConfig.set("stopSequences", stop.deepCopy());
        }
        if (!generationConfig.isEmpty()) {
            googleRequest.set("generationConfig", generationConfig);
        }

        log.debug("Google request: contents={}, generationConfig={}", contents.size(), generationConfig.size());
        return googleRequest;
    }

    @Override
    protected JsonNode convertResponse(String endpoint, JsonNode googleResponse) {
        JsonNode candidates = googleResponse.path("candidates");
        if (!candidates.isArray()) {
            throw new TransformException("Google response has no candidates");
        }

        JsonNode candidate = candidates.path(0);
        String content = candidate.path("content").path("parts").path(0).path("text").asText("");
        String finishReason = candidate.path("finishReason").asText("STOP").toLowerCase(Locale.ROOT);

        JsonNode usageMetadata = googleResponse.path("usageMetadata");
        Usage usage = Usage.builder()
                .promptTokens(usageMetadata.path("promptTokenCount").asInt(0))
                .completionTokens(usageMetadata.path("candidatesTokenCount").asInt(0))
                .totalTokens(usageMetadata.path("totalTokenCount").asInt(0))
                .build();

        return completion(
                "google-" + DigestUtils.sha256Hex(content).substring(0, 16),
                Instant.now().getEpochSecond(),
                textOrNull(googleResponse, "modelVersion"),
                content,
                finishReason,
                usage);
    }

    @Override
    protected String resolveUrl(String endpoint, String model) {
        return baseUrl() + "/models/" + resolveModel(model) + ":generateContent";
    }

    @Override
    protected Map<String, String> authenticationHeaders() {
        return Map.of();
    }

    @Override
    protected Map<String, String> authenticationQueryParams() {
        return Map.of("key", config.getApiKey());
    }

    @Override
    protected boolean streamsNatively() {
        return false;
    }
}
