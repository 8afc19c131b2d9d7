package com.conduit.service;

import com.conduit.client.UpstreamResponse;
import com.conduit.config.ConduitProperties;
import com.conduit.exception.ErrorPayloads;
import com.conduit.exception.ErrorType;
import com.conduit.model.AdapterModelInfo;
import com.conduit.model.ErrorResponse;
import com.conduit.provider.AdapterRegistry;
import com.conduit.provider.PlatformAdapter;
import com.conduit.streaming.StreamEvent;
import com.conduit.streaming.StreamSession;
import com.conduit.streaming.StreamSynthesizer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the active adapter and routes OpenAI requests through it.
 * <p>
 * Every call runs transform, dispatch and transform against the adapter that was active
 * when it started. Failures never escape as exceptions: non-streaming calls answer with the
 * OpenAI error envelope, streams end with a single error event.
 */
@Slf4j
@Service
public class AdapterManager {

    private final AdapterRegistry registry;
    private final ConduitProperties properties;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final RequestAuditSink auditSink;
    private final StreamSynthesizer synthesizer;

    private final AtomicReference<PlatformAdapter> current = new AtomicReference<>();

    public AdapterManager(AdapterRegistry registry,
                          ConduitProperties properties,
                          WebClient webClient,
                          ObjectMapper objectMapper,
                          RequestAuditSink auditSink) {
        this.registry = registry;
        this.properties = properties;
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.auditSink = auditSink;
        this.synthesizer = new StreamSynthesizer(objectMapper);
    }

    @PostConstruct
    public void init() {
        if (!reload()) {
            log.warn("No provider adapter active; requests are rejected until a valid configuration is reloaded");
        }
    }

    /**
     * Instantiate and validate an adapter, replacing the active one on success.
     *
     * @return false if the type is unknown or the configuration is invalid
     */
    public boolean initialize(String type, ConduitProperties.ProviderConfig config) {
        Optional<PlatformAdapter> created = registry.create(type, config, webClient, objectMapper);
        if (created.isEmpty()) {
            return false;
        }

        PlatformAdapter adapter = created.get();
        if (!adapter.validateConfig()) {
            log.error("Invalid configuration for provider {}", adapter.getPlatformName());
            return false;
        }

        PlatformAdapter previous = current.getAndSet(adapter);
        log.info("Initialized {} adapter (base-url={}, streaming={}){}",
                adapter.getPlatformName(), config.getBaseUrl(), adapter.supportsStreaming(),
                previous != null ? ", replacing " + previous.getPlatformName() : "");
        return true;
    }

    /**
     * Rebuild the adapter from the bound {@code conduit.provider} configuration.
     */
    public boolean reload() {
        ConduitProperties.ProviderConfig config = properties.getProvider().copy();
        return initialize(config.getType(), config);
    }

    public Optional<PlatformAdapter> getCurrentAdapter() {
        return Optional.ofNullable(current.get());
    }

    public List<String> getSupportedPlatforms() {
        return registry.listPlatforms();
    }

    public AdapterModelInfo getModelInfo() {
        PlatformAdapter adapter = current.get();
        return adapter != null ? adapter.getModelInfo() : null;
    }

    /**
     * Process a non-streaming request. Always completes with an OpenAI response or error envelope.
     */
    public Mono<JsonNode> processRequest(String endpoint, HttpMethod method, JsonNode openAiRequest,
                                         Map<String, String> headers) {
        PlatformAdapter adapter = current.get();
        ErrorResponse unavailable = checkAvailable(adapter, endpoint);
        if (unavailable != null) {
            return Mono.just(toTree(unavailable));
        }

        String model = openAiRequest.path("model").asText(null);
        long start = System.currentTimeMillis();
        log.info("Routing {} model={} to {}", endpoint, model, adapter.getPlatformName());

        return Mono.defer(() -> {
                    JsonNode platformRequest = adapter.transformRequest(endpoint, openAiRequest);
                    return adapter.makeRequest(endpoint, method, model, platformRequest, headers);
                })
                .map(response -> toOpenAiResponse(adapter, endpoint, model, response))
                .onErrorResume(error -> {
                    log.error("Error processing {} request on {}: {}",
                            endpoint, adapter.getPlatformName(), error.toString());
                    return Mono.just(toTree(ErrorPayloads.fromThrowable(error)));
                })
                .doOnNext(response -> audit(adapter, endpoint, model, false, start, openAiRequest, response,
                        response.path("error").path("type").asText(null)));
    }

    /**
     * Process a streaming request. The sequence always terminates; a failure ends it with one error event.
     * Providers without native streaming are called once and replayed as start, content and stop chunks.
     */
    public Flux<StreamEvent> processStreamRequest(String endpoint, JsonNode openAiRequest,
                                                  Map<String, String> headers) {
        PlatformAdapter adapter = current.get();
        ErrorResponse unavailable = checkAvailable(adapter, endpoint);
        if (unavailable != null) {
            return Flux.just(StreamEvent.error(unavailable));
        }

        String model = openAiRequest.path("model").asText(null);

        if (!adapter.supportsStreaming()) {
            log.info("{} has no native streaming, synthesizing stream for model={}", adapter.getPlatformName(), model);
            ObjectNode fullRequest = openAiRequest.deepCopy();
            fullRequest.put("stream", false);
            return processRequest(endpoint, HttpMethod.POST, fullRequest, headers)
                    .flatMapMany(response -> synthesizer.synthesize(response, model));
        }

        long start = System.currentTimeMillis();
        log.info("Routing streaming {} model={} to {}", endpoint, model, adapter.getPlatformName());
        AtomicReference<String> errorType = new AtomicReference<>();

        return Flux.defer(() -> {
                    JsonNode platformRequest = adapter.transformRequest(endpoint, openAiRequest);
                    return adapter.makeStreamRequest(endpoint, model, platformRequest, headers,
                            StreamSession.start(model));
                })
                .onErrorResume(error -> {
                    log.error("Error opening {} stream on {}: {}",
                            endpoint, adapter.getPlatformName(), error.toString());
                    return Flux.just(StreamEvent.error(ErrorPayloads.fromThrowable(error)));
                })
                .doOnNext(event -> {
                    if (event.isError()) {
                        errorType.set(event.getError().getError().getType());
                    }
                })
                .doOnComplete(() -> audit(adapter, endpoint, model, true, start, openAiRequest, null,
                        errorType.get()));
    }

    private ErrorResponse checkAvailable(PlatformAdapter adapter, String endpoint) {
        if (adapter == null) {
            return ErrorPayloads.serviceUnavailable("No adapter initialized");
        }
        if (!adapter.isEnabled()) {
            return ErrorPayloads.serviceUnavailable("Adapter " + adapter.getPlatformName() + " is disabled");
        }
        if (!adapter.getSupportedEndpoints().contains(endpoint)) {
            return ErrorResponse.of(
                    "Endpoint " + endpoint + " not supported by " + adapter.getPlatformName(),
                    ErrorType.INVALID_REQUEST.getValue(),
                    "unsupported_endpoint");
        }
        return null;
    }

    private JsonNode toOpenAiResponse(PlatformAdapter adapter, String endpoint, String model,
                                      UpstreamResponse response) {
        if (response.getStatusCode() >= 400) {
            log.error("Platform API error: platform={}, status={}", adapter.getPlatformName(), response.getStatusCode());
            return toTree(ErrorPayloads.platformError(response.getStatusCode()));
        }
        if (!response.hasJson()) {
            log.error("Platform {} returned a non-JSON body", adapter.getPlatformName());
            return toTree(ErrorPayloads.invalidResponse());
        }

        JsonNode openAiResponse = adapter.transformResponse(endpoint, response.getJson());
        if (openAiResponse instanceof ObjectNode objectNode && !objectNode.hasNonNull("model") && model != null) {
            objectNode.put("model", model);
        }
        return openAiResponse;
    }

    private JsonNode toTree(ErrorResponse error) {
        return objectMapper.valueToTree(error);
    }

    private void audit(PlatformAdapter adapter, String endpoint, String model, boolean stream, long start,
                       JsonNode request, JsonNode response, String errorType) {
        try {
            auditSink.record(AuditRecord.builder()
                    .endpoint(endpoint)
                    .model(model)
                    .platform(adapter.getPlatformName())
                    .stream(stream)
                    .errorType(errorType)
                    .durationMs(System.currentTimeMillis() - start)
                    .request(request)
                    .response(response)
                    .build());
        } catch (RuntimeException e) {
            log.warn("Audit sink failed for {}: {}", endpoint, e.toString());
        }
    }
}
