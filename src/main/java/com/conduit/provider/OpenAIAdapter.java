package com.conduit.provider;

import com.conduit.config.ConduitProperties;
import com.conduit.exception.TransformException;
import com.conduit.model.ProviderType;
import com.conduit.streaming.StreamNormalizer;
import com.conduit.streaming.StreamSession;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Map;
import java.util.Set;

/**
 * Pass-through adapter for OpenAI and OpenAI-compatible APIs (Azure OpenAI, custom deployments).
 * The wire format already matches, so both transforms are the identity.
 */
@Slf4j
public class OpenAIAdapter extends AbstractPlatformAdapter {

    private static final Set<String> ENDPOINTS = Set.of(CHAT_COMPLETIONS, COMPLETIONS, EMBEDDINGS);

    private final ProviderType type;

    public OpenAIAdapter(
            ProviderType type,
            ConduitProperties.ProviderConfig config,
            WebClient webClient,
            ObjectMapper objectMapper) {
        super(config, webClient, objectMapper);
        this.type = type;
    }

    @Override
    public ProviderType getType() {
        return type;
    }

    @Override
    public Set<String> getSupportedEndpoints() {
        return ENDPOINTS;
    }

    @Override
    public JsonNode transformRequest(String endpoint, JsonNode openAiRequest) {
        if (!StringUtils.hasText(config.getActualModelName())) {
            return openAiRequest;
        }
        ObjectNode request = openAiRequest.deepCopy();
        request.put("model", config.getActualModelName());
        return request;
    }

    @Override
    protected JsonNode convertResponse(String endpoint, JsonNode platformResponse) {
        if (CHAT_COMPLETIONS.equals(endpoint) && !platformResponse.path("choices").isArray()) {
            throw new TransformException("chat completion response has no choices");
        }
        return platformResponse;
    }

    @Override
    protected Map<String, String> authenticationHeaders() {
        if (type == ProviderType.AZURE_OPENAI) {
            return Map.of("api-key", config.getApiKey());
        }
        return Map.of("Authorization", "Bearer " + config.getApiKey());
    }

    @Override
    protected boolean streamsNatively() {
        return true;
    }

    @Override
    protected StreamNormalizer newStreamNormalizer(StreamSession session) {
        return new OpenAIStreamNormalizer(objectMapper, session, getPlatformName());
    }
}
