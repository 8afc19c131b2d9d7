package com.conduit.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ModelListResponse {

    @JsonProperty("object")
    private String object = "list";

    @JsonProperty("data")
    private List<ModelInfo> data;

    public static ModelListResponse of(List<ModelInfo> data) {
        return new ModelListResponse("list", data);
    }
}
