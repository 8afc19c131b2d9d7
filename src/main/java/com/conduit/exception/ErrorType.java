package com.conduit.exception;

import org.springframework.http.HttpStatus;

/**
 * OpenAI error {@code type} values produced by the gateway, with the HTTP status each maps to.
 */
public enum ErrorType {
    INVALID_REQUEST("invalid_request_error", HttpStatus.BAD_REQUEST),
    AUTHENTICATION("authentication_error", HttpStatus.UNAUTHORIZED),
    PERMISSION("permission_error", HttpStatus.FORBIDDEN),
    PLATFORM("platform_error", HttpStatus.BAD_GATEWAY),
    INVALID_RESPONSE("invalid_response", HttpStatus.BAD_GATEWAY),
    TIMEOUT("timeout_error", HttpStatus.GATEWAY_TIMEOUT),
    SERVICE_UNAVAILABLE("service_unavailable", HttpStatus.SERVICE_UNAVAILABLE),
    INTERNAL("internal_error", HttpStatus.INTERNAL_SERVER_ERROR),
    SERVER("server_error", HttpStatus.INTERNAL_SERVER_ERROR);

    private final String value;
    private final HttpStatus status;

    ErrorType(String value, HttpStatus status) {
        this.value = value;
        this.status = status;
    }

    public String getValue() {
        return value;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public static ErrorType fromValue(String value) {
        for (ErrorType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        return null;
    }
}
