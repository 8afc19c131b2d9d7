package com.conduit.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * OpenAI error envelope: {@code {"error": {"message", "type", "param", "code"}}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    @JsonProperty("error")
    private ErrorDetail error;

    public static ErrorResponse of(String message, String type, Object code) {
        return new ErrorResponse(ErrorDetail.builder()
                .message(message)
                .type(type)
                .code(code)
                .build());
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorDetail {

        @JsonProperty("message")
        private String message;

        @JsonProperty("type")
        private String type;

        @JsonProperty("param")
        private String param;

        @JsonProperty("code")
        private Object code; // upstream status code (int) or a short string code
    }
}
