package com.conduit.exception;

import com.conduit.model.ErrorResponse;

import java.util.concurrent.TimeoutException;

/**
 * Converts any failure into the OpenAI error envelope.
 */
public final class ErrorPayloads {

    private ErrorPayloads() {
    }

    public static ErrorResponse fromThrowable(Throwable error) {
        if (error instanceof GatewayException gatewayException) {
            return gatewayException.toErrorResponse();
        }
        if (error instanceof TimeoutException) {
            return ErrorResponse.of("Upstream request timed out", ErrorType.TIMEOUT.getValue(), "timeout");
        }
        String detail = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return ErrorResponse.of("Internal error: " + detail,
                ErrorType.INTERNAL.getValue(), "processing_error");
    }

    public static ErrorResponse serviceUnavailable(String message) {
        return ErrorResponse.of(message, ErrorType.SERVICE_UNAVAILABLE.getValue(), "adapter_unavailable");
    }

    public static ErrorResponse platformError(int statusCode) {
        return ErrorResponse.of("Platform API error: " + statusCode, ErrorType.PLATFORM.getValue(), statusCode);
    }

    public static ErrorResponse invalidResponse() {
        return ErrorResponse.of("Invalid response from platform", ErrorType.INVALID_RESPONSE.getValue(), "no_json");
    }
}
