package com.conduit.client;

import com.conduit.exception.PlatformRejectedException;
import com.conduit.exception.UpstreamHttpException;
import com.conduit.exception.UpstreamTimeoutException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * HTTP transport shared by all adapters. Executes either a single request/response call,
 * returning an {@link UpstreamResponse}, or a streaming call exposing the body as text fragments.
 * Authentication is supplied by the calling adapter through the headers and query parameters.
 */
@Slf4j
public class PlatformHttpClient {

    private static final Set<String> STRIPPED_HEADERS = Set.of(
            "authorization", "host", "content-length", "x-api-key", "x-goog-api-key");

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public PlatformHttpClient(WebClient webClient, ObjectMapper objectMapper, Duration timeout) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.timeout = timeout != null ? timeout : Duration.ofSeconds(300);
    }

    /**
     * Merge configured default headers with caller headers, dropping caller-supplied
     * credentials, Host and Content-Length so they cannot override provider auth.
     */
    public static Map<String, String> prepareHeaders(Map<String, String> defaultHeaders,
                                                     Map<String, String> callerHeaders) {
        Map<String, String> merged = new LinkedHashMap<>();
        if (defaultHeaders != null) {
            merged.putAll(defaultHeaders);
        }
        if (callerHeaders != null) {
            callerHeaders.forEach((name, value) -> {
                if (!STRIPPED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                    merged.put(name, value);
                }
            });
        }
        return merged;
    }

    public static URI buildUri(String url, Map<String, String> queryParams) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(url);
        if (queryParams != null) {
            queryParams.forEach(builder::queryParam);
        }
        return builder.encode().build().toUri();
    }

    /**
     * Single request/response call. Non-2xx statuses are returned in the envelope, not raised.
     */
    public Mono<UpstreamResponse> exchange(HttpMethod method, URI uri, Map<String, String> headers, JsonNode body) {
        log.debug("Upstream request: {} {}", method, redact(uri));

        return buildRequest(method, uri, headers, body, MediaType.APPLICATION_JSON)
                .exchangeToMono(this::toEnvelope)
                .timeout(timeout)
                .onErrorMap(PlatformHttpClient::isTimeout, e -> new UpstreamTimeoutException(redact(uri), timeout, e))
                .doOnNext(response -> log.debug("Upstream response: status={}, json={}",
                        response.getStatusCode(), response.hasJson()));
    }

    /**
     * Streaming call. The returned Flux is lazy and single-pass: the connection opens on
     * subscription and closes when the body ends or the subscriber cancels. A non-2xx status
     * at open time is raised as {@link UpstreamHttpException}; the per-call timeout applies
     * to the wait for each fragment.
     */
    public Flux<String> stream(HttpMethod method, URI uri, Map<String, String> headers, JsonNode body) {
        log.debug("Upstream stream request: {} {}", method, redact(uri));

        return Flux.defer(() -> {
            Utf8FragmentDecoder decoder = new Utf8FragmentDecoder();
            return buildRequest(method, uri, headers, body, MediaType.TEXT_EVENT_STREAM)
                    .exchangeToFlux(response -> {
                        if (response.statusCode().isError()) {
                            return response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMapMany(errorBody -> Flux.error(
                                            new UpstreamHttpException(response.statusCode().value(), errorBody)));
                        }
                        if (isJson(response)) {
                            return response.bodyToMono(byte[].class)
                                    .defaultIfEmpty(new byte[0])
                                    .flatMapMany(bytes -> rejectOrPassThrough(bytes, decoder));
                        }
                        return response.bodyToFlux(DataBuffer.class)
                                .map(buffer -> decoder.decode(toBytes(buffer)))
                                .concatWith(Mono.fromSupplier(decoder::flush))
                                .filter(fragment -> !fragment.isEmpty());
                    })
                    .timeout(timeout)
                    .onErrorMap(PlatformHttpClient::isTimeout, e -> new UpstreamTimeoutException(redact(uri), timeout, e));
        });
    }

    private static boolean isJson(ClientResponse response) {
        return response.headers().contentType()
                .map(type -> type.isCompatibleWith(MediaType.APPLICATION_JSON))
                .orElse(false);
    }

    /**
     * A 2xx JSON body on a streaming call is an in-band error when it carries a non-zero
     * {@code code} (Coze) or an {@code error} object. Anything else is handed on as text.
     */
    private Flux<String> rejectOrPassThrough(byte[] bytes, Utf8FragmentDecoder decoder) {
        JsonNode json = parseJsonOrNull(bytes);
        if (json != null && json.path("code").isNumber() && json.get("code").asInt() != 0) {
            return Flux.error(new PlatformRejectedException(json.get("code").asInt(),
                    json.path("msg").asText("Platform reported error code " + json.get("code").asInt())));
        }
        if (json != null && json.path("error").isObject()) {
            JsonNode error = json.get("error");
            Object code = error.path("code").isInt()
                    ? Integer.valueOf(error.get("code").asInt())
                    : error.path("code").asText(null);
            return Flux.error(new PlatformRejectedException(code,
                    error.path("message").asText("Platform reported an error")));
        }
        String text = decoder.decode(bytes) + decoder.flush();
        return text.isEmpty() ? Flux.empty() : Flux.just(text);
    }

    /**
     * Reactor's per-call timeout, or a read timeout raised by the underlying netty channel.
     */
    static boolean isTimeout(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof TimeoutException
                    || current instanceof io.netty.handler.timeout.TimeoutException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    private WebClient.RequestBodySpec buildRequest(HttpMethod method, URI uri, Map<String, String> headers,
                                                  JsonNode body, MediaType accept) {
        WebClient.RequestBodySpec spec = webClient.method(method)
                .uri(uri)
                .headers(httpHeaders -> {
                    if (headers != null) {
                        headers.forEach(httpHeaders::set);
                    }
                    httpHeaders.setContentType(MediaType.APPLICATION_JSON);
                    if (!httpHeaders.containsKey(HttpHeaders.ACCEPT)) {
                        httpHeaders.setAccept(List.of(accept, MediaType.APPLICATION_JSON));
                    }
                });
        if (body != null && method != HttpMethod.GET) {
            spec.bodyValue(body.toString());
        }
        return spec;
    }

    private Mono<UpstreamResponse> toEnvelope(ClientResponse response) {
        return response.bodyToMono(byte[].class)
                .defaultIfEmpty(new byte[0])
                .map(bytes -> new UpstreamResponse(
                        response.statusCode().value(),
                        response.headers().asHttpHeaders(),
                        bytes,
                        parseJsonOrNull(bytes)));
    }

    private JsonNode parseJsonOrNull(byte[] bytes) {
        if (bytes.length == 0) {
            return null;
        }
        try {
            return objectMapper.readTree(bytes);
        } catch (Exception e) {
            log.warn("Failed to parse upstream response as JSON: {}", e.getMessage());
            return null;
        }
    }

    private static byte[] toBytes(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }

    // Google carries the API key in the query string
    private static String redact(URI uri) {
        String text = uri.toString();
        return text.replaceAll("([?&]key=)[^&]*", "$1***");
    }
}
