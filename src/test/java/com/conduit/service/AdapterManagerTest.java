package com.conduit.service;

import com.conduit.config.ConduitProperties;
import com.conduit.config.JacksonConfiguration;
import com.conduit.provider.AdapterRegistry;
import com.conduit.provider.PlatformAdapter;
import com.conduit.streaming.StreamEvent;
import com.conduit.support.StubWebClients;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AdapterManagerTest {

    private static final String CHAT_REQUEST =
            "{\"model\":\"gpt-4\",\"messages\":[{\"role\":\"user\",\"content\":\"Hi\"}]}";

    private ObjectMapper objectMapper;
    private ConduitProperties properties;
    private List<AuditRecord> audits;
    private List<ClientRequest> captured;

    @BeforeEach
    void setUp() {
        objectMapper = JacksonConfiguration.createObjectMapper();
        properties = new ConduitProperties();
        properties.getProvider().setType("openai");
        properties.getProvider().setApiKey("sk-test");
        properties.getProvider().setBaseUrl("https://api.openai.com/v1");
        audits = new ArrayList<>();
        captured = new ArrayList<>();
    }

    private AdapterManager manager(WebClient webClient) {
        AdapterManager manager = new AdapterManager(new AdapterRegistry(), properties, webClient, objectMapper,
                audits::add);
        manager.init();
        return manager;
    }

    private JsonNode chatRequest() throws Exception {
        return objectMapper.readTree(CHAT_REQUEST);
    }

    @Test
    void testSuccessfulRequestIsAudited() throws Exception {
        AdapterManager manager = manager(StubWebClients.json(HttpStatus.OK, """
                {"id":"chatcmpl-1","object":"chat.completion","created":1,"model":"gpt-4",
                 "choices":[{"index":0,"message":{"role":"assistant","content":"Hello"},"finish_reason":"stop"}]}
                """, captured));

        JsonNode response = manager.processRequest(PlatformAdapter.CHAT_COMPLETIONS, HttpMethod.POST,
                chatRequest(), Map.of()).block();

        assertNotNull(response);
        assertEquals("Hello", response.path("choices").path(0).path("message").path("content").asText());
        assertEquals(1, audits.size());
        assertNull(audits.get(0).getErrorType());
        assertEquals("openai", audits.get(0).getPlatform());
        assertFalse(audits.get(0).isStream());
    }

    @Test
    void testUpstream503BecomesPlatformError() throws Exception {
        AdapterManager manager = manager(StubWebClients.json(HttpStatus.SERVICE_UNAVAILABLE,
                "{\"error\":{\"message\":\"overloaded\"}}", captured));

        JsonNode response = manager.processRequest(PlatformAdapter.CHAT_COMPLETIONS, HttpMethod.POST,
                chatRequest(), Map.of()).block();

        assertNotNull(response);
        assertEquals("platform_error", response.path("error").path("type").asText());
        assertEquals(503, response.path("error").path("code").asInt());
        assertTrue(response.path("error").path("code").isInt());
        assertEquals("platform_error", audits.get(0).getErrorType());
    }

    @Test
    void testNonJsonBodyBecomesInvalidResponse() throws Exception {
        AdapterManager manager = manager(StubWebClients.text(HttpStatus.OK, "<html></html>", captured));

        JsonNode response = manager.processRequest(PlatformAdapter.CHAT_COMPLETIONS, HttpMethod.POST,
                chatRequest(), Map.of()).block();

        assertNotNull(response);
        assertEquals("invalid_response", response.path("error").path("type").asText());
    }

    @Test
    void testTimeoutBecomesTimeoutError() throws Exception {
        properties.getProvider().setTimeout(Duration.ofMillis(100));
        AdapterManager manager = manager(StubWebClients.never(captured));

        JsonNode response = manager.processRequest(PlatformAdapter.CHAT_COMPLETIONS, HttpMethod.POST,
                chatRequest(), Map.of()).block(Duration.ofSeconds(5));

        assertNotNull(response);
        assertEquals("timeout_error", response.path("error").path("type").asText());
        assertEquals("timeout", response.path("error").path("code").asText());
    }

    @Test
    void testUnsupportedEndpoint() throws Exception {
        properties.getProvider().setType("anthropic");
        AdapterManager manager = manager(StubWebClients.never(captured));

        JsonNode response = manager.processRequest(PlatformAdapter.EMBEDDINGS, HttpMethod.POST,
                objectMapper.readTree("{\"model\":\"m\",\"input\":\"x\"}"), Map.of()).block();

        assertNotNull(response);
        assertEquals("invalid_request_error", response.path("error").path("type").asText());
        assertEquals("unsupported_endpoint", response.path("error").path("code").asText());
        assertTrue(captured.isEmpty());
    }

    @Test
    void testUnknownOrUnimplementedTypeLeavesNoAdapter() throws Exception {
        properties.getProvider().setType("cohere");
        AdapterManager manager = manager(StubWebClients.never(captured));

        assertTrue(manager.getCurrentAdapter().isEmpty());
        assertFalse(manager.initialize("mistral", properties.getProvider()));
        assertNull(manager.getModelInfo());

        JsonNode response = manager.processRequest(PlatformAdapter.CHAT_COMPLETIONS, HttpMethod.POST,
                chatRequest(), Map.of()).block();
        assertNotNull(response);
        assertEquals("service_unavailable", response.path("error").path("type").asText());
    }

    @Test
    void testInvalidConfigKeepsPreviousAdapter() {
        AdapterManager manager = manager(StubWebClients.never(captured));
        ConduitProperties.ProviderConfig invalid = new ConduitProperties.ProviderConfig();
        invalid.setBaseUrl("https://api.anthropic.com/v1");

        assertFalse(manager.initialize("anthropic", invalid));
        assertEquals("openai", manager.getCurrentAdapter().orElseThrow().getPlatformName());
    }

    @Test
    void testReloadSwitchesProvider() {
        AdapterManager manager = manager(StubWebClients.never(captured));
        properties.getProvider().setType("google");

        assertTrue(manager.reload());
        assertEquals("google", manager.getCurrentAdapter().orElseThrow().getPlatformName());
        assertTrue(manager.getSupportedPlatforms().contains("anthropic"));
    }

    @Test
    void testDisabledAdapterRejectsRequests() throws Exception {
        properties.getProvider().setEnabled(false);
        AdapterManager manager = manager(StubWebClients.never(captured));

        List<StreamEvent> events = manager.processStreamRequest(PlatformAdapter.CHAT_COMPLETIONS, chatRequest(),
                Map.of()).collectList().block();

        assertNotNull(events);
        assertEquals(1, events.size());
        assertEquals("service_unavailable", events.get(0).getError().getError().getType());
    }

    @Test
    void testNonStreamingProviderSynthesizesThreeChunks() throws Exception {
        properties.getProvider().setType("google");
        properties.getProvider().setBaseUrl("https://generativelanguage.googleapis.com/v1beta");
        AdapterManager manager = manager(StubWebClients.json(HttpStatus.OK, """
                {"candidates":[{"content":{"parts":[{"text":"Streamed anyway"}]},"finishReason":"STOP"}]}
                """, captured));
        JsonNode request = objectMapper.readTree(
                "{\"model\":\"gemini-pro\",\"stream\":true,\"messages\":[{\"role\":\"user\",\"content\":\"Hi\"}]}");

        List<StreamEvent> events = manager.processStreamRequest(PlatformAdapter.CHAT_COMPLETIONS, request, Map.of())
                .collectList().block();

        assertNotNull(events);
        assertEquals(3, events.size());
        assertEquals("assistant", events.get(0).getChunk().firstDelta().getRole());
        assertEquals("Streamed anyway", events.get(1).getChunk().firstDelta().getContent());
        assertEquals("stop", events.get(2).getChunk().getChoices().get(0).getFinishReason());
        assertEquals("gemini-pro", events.get(0).getChunk().getModel());
        assertTrue(captured.get(0).url().getPath().endsWith("/models/gemini-pro:generateContent"));
    }

    @Test
    void testNonStreamingProviderErrorBecomesSingleErrorEvent() throws Exception {
        properties.getProvider().setType("google");
        AdapterManager manager = manager(StubWebClients.json(HttpStatus.TOO_MANY_REQUESTS, "{}", captured));

        List<StreamEvent> events = manager.processStreamRequest(PlatformAdapter.CHAT_COMPLETIONS, chatRequest(),
                Map.of()).collectList().block();

        assertNotNull(events);
        assertEquals(1, events.size());
        assertEquals(429, events.get(0).getError().getError().getCode());
    }

    @Test
    void testStreamOpenFailureEndsWithErrorEvent() throws Exception {
        AdapterManager manager = manager(StubWebClients.json(HttpStatus.UNAUTHORIZED,
                "{\"error\":{\"message\":\"bad key\"}}", captured));

        List<StreamEvent> events = manager.processStreamRequest(PlatformAdapter.CHAT_COMPLETIONS, chatRequest(),
                Map.of()).collectList().block();

        assertNotNull(events);
        assertEquals(1, events.size());
        assertEquals("platform_error", events.get(0).getError().getError().getType());
        assertEquals(401, events.get(0).getError().getError().getCode());
        assertEquals(1, audits.size());
        assertTrue(audits.get(0).isStream());
        assertEquals("platform_error", audits.get(0).getErrorType());
    }

    @Test
    void testCozeValidationErrorSurfacesAsEnvelope() throws Exception {
        properties.getProvider().setType("coze");
        properties.getProvider().setBaseUrl("https://api.coze.com");
        AdapterManager manager = manager(StubWebClients.never(captured));

        JsonNode response = manager.processRequest(PlatformAdapter.CHAT_COMPLETIONS, HttpMethod.POST,
                objectMapper.readTree("{\"model\":\"bot-\",\"messages\":[{\"role\":\"user\",\"content\":\"Hi\"}]}"),
                Map.of()).block();

        assertNotNull(response);
        assertEquals("invalid_request_error", response.path("error").path("type").asText());
        assertEquals("model", response.path("error").path("param").asText());
        assertTrue(captured.isEmpty());
    }

    @Test
    void testCozeInBandErrorFailsNonStreamingCall() throws Exception {
        properties.getProvider().setType("coze");
        properties.getProvider().setBaseUrl("https://api.coze.com");
        AdapterManager manager = manager(StubWebClients.json(HttpStatus.OK,
                "{\"code\":4100,\"msg\":\"authentication is invalid\"}", captured));

        JsonNode response = manager.processRequest(PlatformAdapter.CHAT_COMPLETIONS, HttpMethod.POST,
                objectMapper.readTree("{\"model\":\"bot-7342\",\"messages\":[{\"role\":\"user\",\"content\":\"Hi\"}]}"),
                Map.of()).block();

        assertNotNull(response);
        assertFalse(response.has("choices"));
        assertEquals("platform_error", response.path("error").path("type").asText());
        assertEquals(4100, response.path("error").path("code").asInt());
        assertEquals("authentication is invalid", response.path("error").path("message").asText());
    }

    @Test
    void testCozeInBandErrorEndsStreamWithErrorEvent() throws Exception {
        properties.getProvider().setType("coze");
        properties.getProvider().setBaseUrl("https://api.coze.com");
        AdapterManager manager = manager(StubWebClients.json(HttpStatus.OK,
                "{\"code\":4100,\"msg\":\"authentication is invalid\"}", captured));

        List<StreamEvent> events = manager.processStreamRequest(PlatformAdapter.CHAT_COMPLETIONS,
                objectMapper.readTree("{\"model\":\"bot-7342\",\"stream\":true,"
                        + "\"messages\":[{\"role\":\"user\",\"content\":\"Hi\"}]}"),
                Map.of()).collectList().block();

        assertNotNull(events);
        assertEquals(1, events.size());
        assertTrue(events.get(0).isError());
        assertEquals(4100, events.get(0).getError().getError().getCode());
        assertEquals("platform_error", audits.get(0).getErrorType());
    }
}
