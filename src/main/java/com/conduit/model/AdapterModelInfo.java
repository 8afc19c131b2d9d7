package com.conduit.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Capability metadata reported by the active adapter.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AdapterModelInfo {

    @JsonProperty("platform")
    private String platform;

    @JsonProperty("enabled")
    private boolean enabled;

    @JsonProperty("actual_name")
    private String actualName;

    @JsonProperty("display_name")
    private String displayName;

    @JsonProperty("description")
    private String description;

    @JsonProperty("max_tokens")
    private Integer maxTokens;

    @JsonProperty("supports_streaming")
    private boolean supportsStreaming;

    @JsonProperty("supports_function_calling")
    private boolean supportsFunctionCalling;

    @JsonProperty("bot_id")
    private String botId;
}
