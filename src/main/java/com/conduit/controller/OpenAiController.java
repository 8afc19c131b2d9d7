package com.conduit.controller;

import com.conduit.exception.ErrorType;
import com.conduit.model.ChatCompletionRequest;
import com.conduit.model.CompletionRequest;
import com.conduit.model.EmbeddingRequest;
import com.conduit.model.ModelListResponse;
import com.conduit.provider.PlatformAdapter;
import com.conduit.service.AdapterManager;
import com.conduit.service.ModelCatalogService;
import com.conduit.service.RequestValidator;
import com.conduit.streaming.StreamEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * OpenAI-compatible surface: chat completions, legacy completions, embeddings and model listing.
 * Supports both regular JSON responses and SSE streaming.
 */
@Slf4j
@RestController
@RequestMapping("/v1")
public class OpenAiController {

    private static final String DONE = "[DONE]";

    private final AdapterManager adapterManager;
    private final ModelCatalogService modelCatalog;
    private final RequestValidator requestValidator;
    private final ObjectMapper objectMapper;

    public OpenAiController(AdapterManager adapterManager,
                            ModelCatalogService modelCatalog,
                            RequestValidator requestValidator,
                            ObjectMapper objectMapper) {
        this.adapterManager = adapterManager;
        this.modelCatalog = modelCatalog;
        this.requestValidator = requestValidator;
        this.objectMapper = objectMapper;
    }

    /**
     * Chat completions endpoint.
     */
    @PostMapping(value = "/chat/completions", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<? extends ResponseEntity<?>> createChatCompletion(
            @RequestBody ChatCompletionRequest request,
            @RequestHeader HttpHeaders headers) {

        log.info("Received chat completion request for model: {}, stream: {}",
                request.getModel(), request.getStream());

        requestValidator.validate(request);
        request.setModel(modelCatalog.resolve(request.getModel()));

        return dispatch(PlatformAdapter.CHAT_COMPLETIONS, objectMapper.valueToTree(request),
                Boolean.TRUE.equals(request.getStream()), headers);
    }

    @PostMapping(value = "/completions", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<? extends ResponseEntity<?>> createCompletion(
            @RequestBody CompletionRequest request,
            @RequestHeader HttpHeaders headers) {

        log.info("Received completion request for model: {}, stream: {}", request.getModel(), request.getStream());

        requestValidator.validate(request);
        request.setModel(modelCatalog.resolve(request.getModel()));

        return dispatch(PlatformAdapter.COMPLETIONS, objectMapper.valueToTree(request),
                Boolean.TRUE.equals(request.getStream()), headers);
    }

    @PostMapping(value = "/embeddings", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<JsonNode>> createEmbedding(
            @RequestBody EmbeddingRequest request,
            @RequestHeader HttpHeaders headers) {

        log.info("Received embedding request for model: {}", request.getModel());

        requestValidator.validate(request);
        request.setModel(modelCatalog.resolve(request.getModel()));

        return handleRegularRequest(PlatformAdapter.EMBEDDINGS, objectMapper.valueToTree(request),
                forwardableHeaders(headers));
    }

    @GetMapping("/models")
    public ModelListResponse listModels() {
        String ownedBy = adapterManager.getCurrentAdapter()
                .map(PlatformAdapter::getPlatformName)
                .orElse("conduit");
        return ModelListResponse.of(modelCatalog.listModels(ownedBy));
    }

    private Mono<? extends ResponseEntity<?>> dispatch(String endpoint, JsonNode payload, boolean stream,
                                                       HttpHeaders headers) {
        Map<String, String> forwarded = forwardableHeaders(headers);
        return stream
                ? handleStreamingRequest(endpoint, payload, forwarded)
                : handleRegularRequest(endpoint, payload, forwarded);
    }

    /**
     * Handle regular (non-streaming) request. Error envelopes carry their mapped HTTP status.
     */
    private Mono<ResponseEntity<JsonNode>> handleRegularRequest(
            String endpoint, JsonNode payload, Map<String, String> headers) {
        return adapterManager.processRequest(endpoint, HttpMethod.POST, payload, headers)
                .map(response -> ResponseEntity.status(statusFor(response)).body(response));
    }

    /**
     * Handle streaming request with SSE. The stream ends with {@code [DONE]} unless it ended in an error.
     */
    private Mono<ResponseEntity<Flux<ServerSentEvent<String>>>> handleStreamingRequest(
            String endpoint, JsonNode payload, Map<String, String> headers) {
        Flux<ServerSentEvent<String>> body = Flux.defer(() -> {
            AtomicBoolean failed = new AtomicBoolean();
            return adapterManager.processStreamRequest(endpoint, payload, headers)
                    .doOnNext(event -> {
                        if (event.isError()) {
                            failed.set(true);
                        }
                    })
                    .map(this::toServerSentEvent)
                    .concatWith(Flux.defer(() -> failed.get()
                            ? Flux.<ServerSentEvent<String>>empty()
                            : Flux.just(ServerSentEvent.builder(DONE).build())));
        });

        HttpHeaders responseHeaders = new HttpHeaders();
        responseHeaders.setContentType(MediaType.TEXT_EVENT_STREAM);
        responseHeaders.setCacheControl("no-cache");
        return Mono.just(ResponseEntity.ok().headers(responseHeaders).body(body));
    }

    private ServerSentEvent<String> toServerSentEvent(StreamEvent event) {
        try {
            return ServerSentEvent.builder(objectMapper.writeValueAsString(event.payload())).build();
        } catch (JsonProcessingException e) {
            log.error("Error serializing stream event", e);
            return ServerSentEvent.builder(
                    "{\"error\":{\"message\":\"serialization_error\",\"type\":\"internal_error\"}}").build();
        }
    }

    static HttpStatus statusFor(JsonNode response) {
        JsonNode error = response.path("error");
        if (!error.isObject()) {
            return HttpStatus.OK;
        }
        ErrorType type = ErrorType.fromValue(error.path("type").asText());
        if (type == null) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        if (type == ErrorType.PLATFORM && error.path("code").isInt()) {
            HttpStatus upstream = HttpStatus.resolve(error.path("code").asInt());
            if (upstream != null && upstream.isError()) {
                return upstream;
            }
        }
        return type.getStatus();
    }

    /**
     * Caller headers worth passing upstream: OpenAI org/project selectors and {@code x-} extensions.
     */
    private static Map<String, String> forwardableHeaders(HttpHeaders headers) {
        Map<String, String> forwarded = new LinkedHashMap<>();
        headers.forEach((name, values) -> {
            String lower = name.toLowerCase(Locale.ROOT);
            if ((lower.startsWith("openai-") || lower.startsWith("x-")) && !values.isEmpty()) {
                forwarded.put(name, values.get(0));
            }
        });
        return forwarded;
    }
}
