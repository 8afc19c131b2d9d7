package com.conduit.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Entry of the OpenAI {@code GET /models} listing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ModelInfo {

    @JsonProperty("id")
    private String id;

    @JsonProperty("object")
    @Builder.Default
    private String object = "model";

    @JsonProperty("created")
    private Long created;

    @JsonProperty("owned_by")
    private String ownedBy;
}
