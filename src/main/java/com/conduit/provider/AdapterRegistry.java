package com.conduit.provider;

import com.conduit.config.ConduitProperties;
import com.conduit.model.ProviderType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps provider type tags to adapter constructors.
 */
@Slf4j
@Component
public class AdapterRegistry {

    /**
     * Builds an adapter for one provider configuration.
     */
    @FunctionalInterface
    public interface AdapterFactory {
        PlatformAdapter create(ConduitProperties.ProviderConfig config, WebClient webClient, ObjectMapper objectMapper);
    }

    private final Map<ProviderType, AdapterFactory> factories = new EnumMap<>(ProviderType.class);

    public AdapterRegistry() {
        register(ProviderType.OPENAI, (config, webClient, mapper) ->
                new OpenAIAdapter(ProviderType.OPENAI, config, webClient, mapper));
        register(ProviderType.AZURE_OPENAI, (config, webClient, mapper) ->
                new OpenAIAdapter(ProviderType.AZURE_OPENAI, config, webClient, mapper));
        register(ProviderType.CUSTOM, (config, webClient, mapper) ->
                new OpenAIAdapter(ProviderType.CUSTOM, config, webClient, mapper));
        register(ProviderType.ANTHROPIC, AnthropicAdapter::new);
        register(ProviderType.GOOGLE, GoogleAdapter::new);
        register(ProviderType.COZE, CozeAdapter::new);
    }

    public void register(ProviderType type, AdapterFactory factory) {
        factories.put(type, factory);
    }

    public boolean isSupported(String tag) {
        ProviderType type = ProviderType.fromTag(tag);
        return type != null && factories.containsKey(type);
    }

    /**
     * Create an adapter, or empty if the tag is unknown or has no adapter.
     */
    public Optional<PlatformAdapter> create(String tag, ConduitProperties.ProviderConfig config,
                                            WebClient webClient, ObjectMapper objectMapper) {
        ProviderType type = ProviderType.fromTag(tag);
        if (type == null || !factories.containsKey(type)) {
            log.error("No adapter registered for provider type '{}'", tag);
            return Optional.empty();
        }
        return Optional.of(factories.get(type).create(config, webClient, objectMapper));
    }

    public List<String> listPlatforms() {
        return factories.keySet().stream().map(ProviderType::getTag).toList();
    }
}
