package com.conduit.provider;

import com.conduit.client.PlatformHttpClient;
import com.conduit.client.UpstreamResponse;
import com.conduit.config.ConduitProperties;
import com.conduit.exception.ConfigurationException;
import com.conduit.exception.TransformException;
import com.conduit.model.AdapterModelInfo;
import com.conduit.model.ChatCompletionResponse;
import com.conduit.model.ChatMessage;
import com.conduit.model.Choice;
import com.conduit.model.Role;
import com.conduit.model.Usage;
import com.conduit.streaming.SseStreamProcessor;
import com.conduit.streaming.StreamEvent;
import com.conduit.streaming.StreamNormalizer;
import com.conduit.streaming.StreamSession;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Abstract base class for adapters with common transport, authentication and fallback handling.
 */
@Slf4j
public abstract class AbstractPlatformAdapter implements PlatformAdapter {

    static final String FALLBACK_CONTENT = "Sorry, I encountered an error processing your request.";

    protected final ConduitProperties.ProviderConfig config;
    protected final PlatformHttpClient httpClient;
    protected final ObjectMapper objectMapper;

    protected AbstractPlatformAdapter(
            ConduitProperties.ProviderConfig config,
            WebClient webClient,
            ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.httpClient = new PlatformHttpClient(webClient, objectMapper, config.getTimeout());
    }

    @Override
    public String getPlatformName() {
        return getType().getTag();
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled();
    }

    @Override
    public boolean validateConfig() {
        if (!StringUtils.hasText(config.getApiKey())) {
            log.error("Provider {} is missing api-key", getPlatformName());
            return false;
        }
        if (!StringUtils.hasText(config.getBaseUrl())) {
            log.error("Provider {} is missing base-url", getPlatformName());
            return false;
        }
        return true;
    }

    /**
     * Native streaming capability, narrowed by the {@code supports-streaming} override.
     */
    @Override
    public boolean supportsStreaming() {
        return streamsNatively() && !Boolean.FALSE.equals(config.getSupportsStreaming());
    }

    @Override
    public final JsonNode transformResponse(String endpoint, JsonNode platformResponse) {
        try {
            return convertResponse(endpoint, platformResponse);
        } catch (TransformException e) {
            log.warn("Unrecognized {} response shape, returning fallback: {}", getPlatformName(), e.getMessage());
            return fallbackResponse(platformResponse);
        }
    }

    @Override
    public Mono<UpstreamResponse> makeRequest(String endpoint, HttpMethod method, String model,
                                              JsonNode platformRequest, Map<String, String> headers) {
        Map<String, String> merged = PlatformHttpClient.prepareHeaders(config.getDefaultHeaders(), headers);
        merged.putAll(authenticationHeaders());
        URI uri = PlatformHttpClient.buildUri(resolveUrl(endpoint, model), authenticationQueryParams());
        return httpClient.exchange(method, uri, merged, platformRequest);
    }

    @Override
    public Flux<StreamEvent> makeStreamRequest(String endpoint, String model, JsonNode platformRequest,
                                               Map<String, String> headers, StreamSession session) {
        if (!supportsStreaming()) {
            return Flux.error(new ConfigurationException(getPlatformName() + " does not support streaming"));
        }
        Map<String, String> merged = PlatformHttpClient.prepareHeaders(config.getDefaultHeaders(), headers);
        merged.putAll(authenticationHeaders());
        URI uri = PlatformHttpClient.buildUri(resolveUrl(endpoint, model), authenticationQueryParams());
        return SseStreamProcessor.process(
                httpClient.stream(HttpMethod.POST, uri, merged, platformRequest),
                newStreamNormalizer(session));
    }

    @Override
    public AdapterModelInfo getModelInfo() {
        return AdapterModelInfo.builder()
                .platform(getPlatformName())
                .enabled(isEnabled())
                .actualName(config.getActualModelName())
                .displayName(StringUtils.hasText(config.getDisplayName()) ? config.getDisplayName() : getPlatformName())
                .description(config.getDescription())
                .maxTokens(config.getMaxTokens())
                .supportsStreaming(supportsStreaming())
                .supportsFunctionCalling(supportsFunctionCalling())
                .build();
    }

    /**
     * Convert a recognized provider response.
     *
     * @throws TransformException if the response has none of the expected shapes
     */
    protected abstract JsonNode convertResponse(String endpoint, JsonNode platformResponse);

    protected abstract Map<String, String> authenticationHeaders();

    protected Map<String, String> authenticationQueryParams() {
        return Map.of();
    }

    protected String resolveUrl(String endpoint, String model) {
        return baseUrl() + endpoint;
    }

    protected abstract boolean streamsNatively();

    protected StreamNormalizer newStreamNormalizer(StreamSession session) {
        throw new UnsupportedOperationException(getPlatformName() + " has no stream normalizer");
    }

    protected boolean supportsFunctionCalling() {
        return true;
    }

    protected String baseUrl() {
        String baseUrl = config.getBaseUrl();
        return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    /**
     * Model to send upstream: the configured actual model name, if any, else the requested one.
     */
    protected String resolveModel(String requestedModel) {
        return StringUtils.hasText(config.getActualModelName()) ? config.getActualModelName() : requestedModel;
    }

    protected JsonNode fallbackResponse(JsonNode platformResponse) {
        String model = platformResponse != null ? platformResponse.path("model").asText(null) : null;
        ChatCompletionResponse fallback = ChatCompletionResponse.builder()
                .id("chatcmpl-" + UUID.randomUUID().toString().replace("-", "").substring(0, 24))
                .object(ChatCompletionResponse.OBJECT)
                .created(Instant.now().getEpochSecond())
                .model(model)
                .choices(List.of(Choice.builder()
                        .index(0)
                        .message(ChatMessage.builder()
                                .role(Role.ASSISTANT)
                                .content(FALLBACK_CONTENT)
                                .build())
                        .finishReason("stop")
                        .build()))
                .usage(Usage.zero())
                .build();
        return objectMapper.valueToTree(fallback);
    }

    protected JsonNode completion(String id, long created, String model, String content,
                                  String finishReason, Usage usage) {
        ChatCompletionResponse response = ChatCompletionResponse.builder()
                .id(id)
                .object(ChatCompletionResponse.OBJECT)
                .created(created)
                .model(model)
                .choices(List.of(Choice.builder()
                        .index(0)
                        .message(ChatMessage.builder()
                                .role(Role.ASSISTANT)
                                .content(content)
                                .build())
                        .finishReason(finishReason)
                        .build()))
                .usage(usage)
                .build();
        return objectMapper.valueToTree(response);
    }

    protected static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isValueNode() && !value.isNull() ? value.asText() : null;
    }
}
