package com.conduit.exception;

import com.conduit.model.ErrorResponse;

/**
 * Base class for failures the gateway reports to callers as an OpenAI error envelope.
 */
public abstract class GatewayException extends RuntimeException {

    protected GatewayException(String message) {
        super(message);
    }

    protected GatewayException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorType getErrorType();

    /**
     * Value of the {@code code} field: a short string, or the upstream status code.
     */
    public abstract Object getCode();

    public ErrorResponse toErrorResponse() {
        return ErrorResponse.of(getMessage(), getErrorType().getValue(), getCode());
    }
}
