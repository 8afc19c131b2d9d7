package com.conduit.provider;

import com.conduit.config.ConduitProperties;
import com.conduit.config.JacksonConfiguration;
import com.conduit.support.StubWebClients;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AnthropicAdapterTest {

    private ObjectMapper objectMapper;
    private ConduitProperties.ProviderConfig config;
    private AnthropicAdapter adapter;

    @BeforeEach
    void setUp() {
        objectMapper = JacksonConfiguration.createObjectMapper();
        config = new ConduitProperties.ProviderConfig();
        config.setType("anthropic");
        config.setApiKey("sk-ant-test");
        config.setBaseUrl("https://api.anthropic.com/v1/");
        adapter = new AnthropicAdapter(config, StubWebClients.never(null), objectMapper);
    }

    @Test
    void testSystemMessageMovesToSystemField() throws Exception {
        JsonNode request = objectMapper.readTree("""
                {"model":"claude-3-haiku","messages":[{"role":"system","content":"Be terse"},{"role":"user","content":"Hi"}]}
                """);

        JsonNode transformed = adapter.transformRequest(PlatformAdapter.CHAT_COMPLETIONS, request);

        assertEquals("Be terse", transformed.path("system").asText());
        assertEquals(objectMapper.readTree("[{\"role\":\"user\",\"content\":\"Hi\"}]"), transformed.path("messages"));
        assertEquals(4096, transformed.path("max_tokens").asInt());
        assertEquals("claude-3-haiku", transformed.path("model").asText());
        assertFalse(transformed.has("stream"));
    }

    @Test
    void testCopiesSamplingParametersAndStop() throws Exception {
        JsonNode request = objectMapper.readTree("""
                {"model":"claude-3-haiku","messages":[{"role":"user","content":"Hi"}],
                 "max_tokens":50,"temperature":0.2,"top_p":0.9,"stop":"END","stream":true}
                """);

        JsonNode transformed = adapter.transformRequest(PlatformAdapter.CHAT_COMPLETIONS, request);

        assertEquals(50, transformed.path("max_tokens").asInt());
        assertEquals(0.2, transformed.path("temperature").asDouble());
        assertEquals(0.9, transformed.path("top_p").asDouble());
        assertEquals("END", transformed.path("stop_sequences").path(0).asText());
        assertTrue(transformed.path("stream").asBoolean());
        assertFalse(transformed.has("system"));
    }

    @Test
    void testJoinsMultipleSystemMessages() throws Exception {
        JsonNode request = objectMapper.readTree("""
                {"messages":[{"role":"system","content":"One"},{"role":"system","content":"Two"},{"role":"user","content":"Hi"}]}
                """);

        JsonNode transformed = adapter.transformRequest(PlatformAdapter.CHAT_COMPLETIONS, request);

        assertEquals("One\n\nTwo", transformed.path("system").asText());
        assertEquals(1, transformed.path("messages").size());
    }

    @Test
    void testConvertsResponse() throws Exception {
        JsonNode response = objectMapper.readTree("""
                {"id":"msg_01","type":"message","role":"assistant","model":"claude-3-haiku-20240307",
                 "content":[{"type":"text","text":"Hello"},{"type":"text","text":" world"}],
                 "stop_reason":"end_turn","usage":{"input_tokens":10,"output_tokens":5}}
                """);

        JsonNode converted = adapter.transformResponse(PlatformAdapter.CHAT_COMPLETIONS, response);

        assertEquals("chatcmpl-msg_01", converted.path("id").asText());
        assertEquals("chat.completion", converted.path("object").asText());
        assertEquals("claude-3-haiku-20240307", converted.path("model").asText());
        assertEquals("Hello world", converted.path("choices").path(0).path("message").path("content").asText());
        assertEquals("assistant", converted.path("choices").path(0).path("message").path("role").asText());
        assertEquals("stop", converted.path("choices").path(0).path("finish_reason").asText());
        assertEquals(15, converted.path("usage").path("total_tokens").asInt());
    }

    @Test
    void testUnrecognizedResponseReturnsFallback() throws Exception {
        JsonNode converted = adapter.transformResponse(PlatformAdapter.CHAT_COMPLETIONS,
                objectMapper.readTree("{\"unexpected\":true}"));

        assertEquals(AbstractPlatformAdapter.FALLBACK_CONTENT,
                converted.path("choices").path(0).path("message").path("content").asText());
        assertEquals(0, converted.path("usage").path("total_tokens").asInt());
    }

    @Test
    void testMapStopReason() {
        assertEquals("length", AnthropicAdapter.mapStopReason("max_tokens"));
        assertEquals("tool_calls", AnthropicAdapter.mapStopReason("tool_use"));
        assertEquals("stop", AnthropicAdapter.mapStopReason("end_turn"));
        assertEquals("stop", AnthropicAdapter.mapStopReason(null));
    }

    @Test
    void testRequestCarriesAnthropicHeaders() {
        List<ClientRequest> captured = new ArrayList<>();
        adapter = new AnthropicAdapter(config,
                StubWebClients.json(HttpStatus.OK, "{\"content\":[]}", captured), objectMapper);

        adapter.makeRequest(PlatformAdapter.CHAT_COMPLETIONS, HttpMethod.POST, "claude-3-haiku",
                objectMapper.createObjectNode(), Map.of("Authorization", "Bearer caller-key")).block();

        ClientRequest request = captured.get(0);
        assertEquals("https://api.anthropic.com/v1/messages", request.url().toString());
        assertEquals("sk-ant-test", request.headers().getFirst("x-api-key"));
        assertEquals(AnthropicAdapter.ANTHROPIC_VERSION, request.headers().getFirst("anthropic-version"));
        assertNull(request.headers().getFirst("Authorization"));
    }

    @Test
    void testValidateConfigRequiresApiKey() {
        assertTrue(adapter.validateConfig());
        config.setApiKey("");
        assertFalse(adapter.validateConfig());
    }
}
