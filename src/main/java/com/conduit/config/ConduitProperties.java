package com.conduit.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration properties for Conduit.
 */
@Data
@Component
@ConfigurationProperties(prefix = "conduit")
public class ConduitProperties {

    private ProviderConfig provider = new ProviderConfig();
    private ModelsConfig models = new ModelsConfig();
    private AuthConfig auth = new AuthConfig();
    private HttpConfig http = new HttpConfig();

    /**
     * The single upstream provider this deployment forwards to.
     */
    @Data
    public static class ProviderConfig {
        private String type = "openai";
        private String apiKey;
        private String baseUrl;
        private Duration timeout = Duration.ofSeconds(300);
        private boolean enabled = true;
        private String actualModelName;
        private String botId;  // Coze only, informational
        private Map<String, String> defaultHeaders = new HashMap<>();
        private String displayName;
        private String description;
        private Integer maxTokens = 4096;
        private Boolean supportsStreaming;  // null means the adapter decides

        public ProviderConfig copy() {
            ProviderConfig copy = new ProviderConfig();
            copy.setType(type);
            copy.setApiKey(apiKey);
            copy.setBaseUrl(baseUrl);
            copy.setTimeout(timeout);
            copy.setEnabled(enabled);
            copy.setActualModelName(actualModelName);
            copy.setBotId(botId);
            copy.setDefaultHeaders(defaultHeaders != null ? new HashMap<>(defaultHeaders) : new HashMap<>());
            copy.setDisplayName(displayName);
            copy.setDescription(description);
            copy.setMaxTokens(maxTokens);
            copy.setSupportsStreaming(supportsStreaming);
            return copy;
        }
    }

    @Data
    public static class ModelsConfig {
        private List<String> available = new ArrayList<>(List.of(
                "gpt-4", "gpt-4-turbo", "gpt-4o", "gpt-4o-mini", "gpt-3.5-turbo",
                "text-embedding-ada-002", "text-embedding-3-small", "text-embedding-3-large"));
        private Map<String, String> mappings = new LinkedHashMap<>();
        private boolean validate = true;
        private boolean allowUnknown = false;
    }

    @Data
    public static class AuthConfig {
        private boolean enabled = false;
        // inbound api key -> permissions (chat, completion, embedding, admin)
        private Map<String, Set<String>> apiKeys = new HashMap<>();
    }

    @Data
    public static class HttpConfig {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private int maxInMemorySize = 16 * 1024 * 1024;
    }
}
