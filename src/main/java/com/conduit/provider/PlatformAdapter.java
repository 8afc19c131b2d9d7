package com.conduit.provider;

import com.conduit.client.UpstreamResponse;
import com.conduit.model.AdapterModelInfo;
import com.conduit.model.ProviderType;
import com.conduit.streaming.StreamEvent;
import com.conduit.streaming.StreamSession;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpMethod;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Set;

/**
 * Translation unit for one upstream provider.
 * Implementations convert OpenAI-shaped payloads to the provider's native schema and back,
 * and know how to authenticate and call the provider.
 */
public interface PlatformAdapter {

    String CHAT_COMPLETIONS = "/chat/completions";
    String COMPLETIONS = "/completions";
    String EMBEDDINGS = "/embeddings";

    ProviderType getType();

    /**
     * Get platform name used in logs and model metadata (e.g., "anthropic").
     *
     * @return platform name
     */
    String getPlatformName();

    /**
     * OpenAI endpoints this adapter can serve.
     *
     * @return endpoint paths such as {@link #CHAT_COMPLETIONS}
     */
    Set<String> getSupportedEndpoints();

    /**
     * Convert an OpenAI request into the provider request. Pure, performs no I/O.
     *
     * @param endpoint      OpenAI endpoint path
     * @param openAiRequest request in OpenAI format
     * @return request in the provider's native format
     * @throws com.conduit.exception.ValidationException if the request cannot be translated
     */
    JsonNode transformRequest(String endpoint, JsonNode openAiRequest);

    /**
     * Convert a provider response into an OpenAI response. Pure, performs no I/O.
     * Unrecognized shapes degrade to an apologetic fallback completion.
     *
     * @param endpoint         OpenAI endpoint path
     * @param platformResponse parsed provider response
     * @return response in OpenAI format
     */
    JsonNode transformResponse(String endpoint, JsonNode platformResponse);

    /**
     * Execute a single upstream call. Non-2xx statuses are returned in the envelope.
     *
     * @param model model requested by the caller, for providers that address models by URL
     */
    Mono<UpstreamResponse> makeRequest(String endpoint, HttpMethod method, String model,
                                       JsonNode platformRequest, Map<String, String> headers);

    /**
     * Execute a streaming upstream call and normalize it into OpenAI stream events.
     * The sequence always terminates; failures end it with a single error event.
     */
    Flux<StreamEvent> makeStreamRequest(String endpoint, String model, JsonNode platformRequest,
                                        Map<String, String> headers, StreamSession session);

    /**
     * Check that the configuration carries everything needed to call the provider.
     *
     * @return true if the adapter can be activated
     */
    boolean validateConfig();

    AdapterModelInfo getModelInfo();

    /**
     * Check if the provider streams natively. Callers synthesize a stream otherwise.
     *
     * @return true if {@link #makeStreamRequest} is available
     */
    boolean supportsStreaming();

    boolean isEnabled();
}
