package com.conduit.provider;

import com.conduit.config.ConduitProperties;
import com.conduit.config.JacksonConfiguration;
import com.conduit.model.ProviderType;
import com.conduit.support.StubWebClients;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AdapterRegistryTest {

    private AdapterRegistry registry;
    private ConduitProperties.ProviderConfig config;
    private WebClient webClient;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        registry = new AdapterRegistry();
        config = new ConduitProperties.ProviderConfig();
        config.setApiKey("k");
        config.setBaseUrl("http://upstream");
        webClient = StubWebClients.never(null);
        objectMapper = JacksonConfiguration.createObjectMapper();
    }

    @Test
    void testCreatesAdapterForEachRegisteredType() {
        assertInstanceOf(OpenAIAdapter.class, registry.create("openai", config, webClient, objectMapper).orElseThrow());
        assertInstanceOf(OpenAIAdapter.class, registry.create("azure-openai", config, webClient, objectMapper).orElseThrow());
        assertInstanceOf(OpenAIAdapter.class, registry.create("custom", config, webClient, objectMapper).orElseThrow());
        assertInstanceOf(AnthropicAdapter.class, registry.create("Anthropic", config, webClient, objectMapper).orElseThrow());
        assertInstanceOf(GoogleAdapter.class, registry.create("google", config, webClient, objectMapper).orElseThrow());
        assertInstanceOf(CozeAdapter.class, registry.create("coze", config, webClient, objectMapper).orElseThrow());
    }

    @Test
    void testUnknownAndUnimplementedTypes() {
        assertTrue(registry.create("mistral", config, webClient, objectMapper).isEmpty());
        assertFalse(registry.isSupported("cohere"));
        assertTrue(registry.create("cohere", config, webClient, objectMapper).isEmpty());
        assertFalse(registry.listPlatforms().contains("cohere"));
        assertTrue(registry.listPlatforms().contains("coze"));
    }

    @Test
    void testRegisterAddsFactory() {
        registry.register(ProviderType.COHERE, (cfg, client, mapper) ->
                new OpenAIAdapter(ProviderType.CUSTOM, cfg, client, mapper));

        Optional<PlatformAdapter> adapter = registry.create("cohere", config, webClient, objectMapper);

        assertTrue(adapter.isPresent());
        assertTrue(registry.isSupported("cohere"));
    }
}
