package com.conduit.client;

import com.conduit.config.JacksonConfiguration;
import com.conduit.exception.PlatformRejectedException;
import com.conduit.exception.UpstreamHttpException;
import com.conduit.exception.UpstreamTimeoutException;
import com.conduit.support.StubWebClients;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.handler.timeout.ReadTimeoutException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PlatformHttpClientTest {

    private final ObjectMapper objectMapper = JacksonConfiguration.createObjectMapper();

    @Test
    void testPrepareHeadersStripsCallerCredentialsHostAndLength() {
        Map<String, String> merged = PlatformHttpClient.prepareHeaders(
                Map.of("X-Default", "d"),
                Map.of("authorization", "Bearer caller",
                        "Host", "evil.example",
                        "Content-Length", "12",
                        "x-api-key", "caller-anthropic",
                        "X-Goog-Api-Key", "caller-google",
                        "X-Request-Id", "abc"));

        assertEquals("d", merged.get("X-Default"));
        assertEquals("abc", merged.get("X-Request-Id"));
        assertFalse(merged.containsKey("authorization"));
        assertFalse(merged.containsKey("Host"));
        assertFalse(merged.containsKey("Content-Length"));
        assertFalse(merged.containsKey("x-api-key"));
        assertFalse(merged.containsKey("X-Goog-Api-Key"));
    }

    @Test
    void testBuildUriAppendsQueryParams() {
        URI uri = PlatformHttpClient.buildUri(
                "https://generativelanguage.googleapis.com/v1beta/models/gemini-pro:generateContent",
                Map.of("key", "secret"));

        assertEquals("key=secret", uri.getQuery());
        assertTrue(uri.getPath().endsWith("gemini-pro:generateContent"));
    }

    @Test
    void testExchangeParsesJsonAndSendsHeaders() {
        List<ClientRequest> captured = new ArrayList<>();
        PlatformHttpClient client = new PlatformHttpClient(
                StubWebClients.json(HttpStatus.OK, "{\"ok\":true}", captured), objectMapper, Duration.ofSeconds(5));

        UpstreamResponse response = client.exchange(HttpMethod.POST, URI.create("http://upstream/chat/completions"),
                Map.of("Authorization", "Bearer key"), objectMapper.createObjectNode().put("model", "gpt-4"))
                .block();

        assertNotNull(response);
        assertTrue(response.isSuccessful());
        assertTrue(response.getJson().path("ok").asBoolean());
        assertEquals("Bearer key", captured.get(0).headers().getFirst(HttpHeaders.AUTHORIZATION));
        assertEquals(MediaType.APPLICATION_JSON, captured.get(0).headers().getContentType());
    }

    @Test
    void testExchangeReturnsErrorStatusInEnvelope() {
        PlatformHttpClient client = new PlatformHttpClient(
                StubWebClients.json(HttpStatus.SERVICE_UNAVAILABLE, "{\"error\":\"busy\"}", null),
                objectMapper, Duration.ofSeconds(5));

        UpstreamResponse response = client.exchange(HttpMethod.POST, URI.create("http://upstream/x"), Map.of(), null)
                .block();

        assertNotNull(response);
        assertEquals(503, response.getStatusCode());
        assertFalse(response.isSuccessful());
    }

    @Test
    void testExchangeNonJsonBodyHasNullJson() {
        PlatformHttpClient client = new PlatformHttpClient(
                StubWebClients.text(HttpStatus.OK, "<html>gateway</html>", null), objectMapper, Duration.ofSeconds(5));

        UpstreamResponse response = client.exchange(HttpMethod.GET, URI.create("http://upstream/x"), Map.of(), null)
                .block();

        assertNotNull(response);
        assertFalse(response.hasJson());
        assertEquals("<html>gateway</html>", new String(response.getRawBytes(), StandardCharsets.UTF_8));
    }

    @Test
    void testExchangeTimesOut() {
        PlatformHttpClient client = new PlatformHttpClient(
                StubWebClients.never(null), objectMapper, Duration.ofMillis(100));

        StepVerifier.create(client.exchange(HttpMethod.POST, URI.create("http://upstream/x"), Map.of(), null))
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(UpstreamTimeoutException.class, error);
                    assertTrue(error.getMessage().contains("after 100ms"));
                })
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void testNettyReadTimeoutIsReportedAsTimeout() {
        URI uri = URI.create("http://upstream/x");
        WebClient webClient = StubWebClients.respond(null, request -> Mono.error(
                new WebClientRequestException(ReadTimeoutException.INSTANCE, HttpMethod.POST, uri, new HttpHeaders())));
        PlatformHttpClient client = new PlatformHttpClient(webClient, objectMapper, Duration.ofSeconds(5));

        StepVerifier.create(client.exchange(HttpMethod.POST, uri, Map.of(), null))
                .expectError(UpstreamTimeoutException.class)
                .verify(Duration.ofSeconds(5));
        StepVerifier.create(client.stream(HttpMethod.POST, uri, Map.of(), null))
                .expectError(UpstreamTimeoutException.class)
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void testStreamReassemblesSplitMultiByteCharacters() {
        byte[] bytes = "data: héllo\n\n".getBytes(StandardCharsets.UTF_8);
        int split = "data: h".length() + 1; // inside the two-byte é
        WebClient webClient = StubWebClients.respond(null, request -> Mono.just(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_EVENT_STREAM_VALUE)
                .body(StubWebClients.byteBuffers(List.of(
                        Arrays.copyOfRange(bytes, 0, split),
                        Arrays.copyOfRange(bytes, split, bytes.length))))
                .build()));
        PlatformHttpClient client = new PlatformHttpClient(webClient, objectMapper, Duration.ofSeconds(5));

        List<String> fragments = client.stream(HttpMethod.POST, URI.create("http://upstream/x"), Map.of(), null)
                .collectList()
                .block();

        assertNotNull(fragments);
        assertEquals("data: héllo\n\n", String.join("", fragments));
        assertFalse(fragments.stream().anyMatch(fragment -> fragment.contains("�")));
    }

    @Test
    void testStreamRaisesUpstreamStatus() {
        PlatformHttpClient client = new PlatformHttpClient(
                StubWebClients.json(HttpStatus.TOO_MANY_REQUESTS, "{\"error\":\"slow down\"}", null),
                objectMapper, Duration.ofSeconds(5));

        StepVerifier.create(client.stream(HttpMethod.POST, URI.create("http://upstream/x"), Map.of(), null))
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(UpstreamHttpException.class, error);
                    assertEquals(429, ((UpstreamHttpException) error).getStatusCode());
                })
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void testStreamRaisesInBandErrorOnJsonBody() {
        PlatformHttpClient client = new PlatformHttpClient(
                StubWebClients.json(HttpStatus.OK, "{\"code\":4100,\"msg\":\"authentication is invalid\"}", null),
                objectMapper, Duration.ofSeconds(5));

        StepVerifier.create(client.stream(HttpMethod.POST, URI.create("http://upstream/v3/chat"), Map.of(), null))
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(PlatformRejectedException.class, error);
                    assertEquals(4100, ((PlatformRejectedException) error).getCode());
                    assertEquals("authentication is invalid", error.getMessage());
                })
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void testStreamPassesThroughJsonBodyWithZeroCode() {
        PlatformHttpClient client = new PlatformHttpClient(
                StubWebClients.json(HttpStatus.OK, "{\"code\":0,\"msg\":\"\"}", null),
                objectMapper, Duration.ofSeconds(5));

        List<String> fragments = client.stream(HttpMethod.POST, URI.create("http://upstream/v3/chat"), Map.of(), null)
                .collectList()
                .block();

        assertEquals(List.of("{\"code\":0,\"msg\":\"\"}"), fragments);
    }
}
