package com.conduit.exception;

import com.conduit.model.ErrorResponse;

/**
 * Malformed inbound request, e.g. missing model or a bot id that cannot be derived.
 */
public class ValidationException extends GatewayException {

    private final String param;
    private final String code;

    public ValidationException(String message) {
        this(message, null, "invalid_request");
    }

    public ValidationException(String message, String param) {
        this(message, param, "invalid_request");
    }

    public ValidationException(String message, String param, String code) {
        super(message);
        this.param = param;
        this.code = code;
    }

    public String getParam() {
        return param;
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.INVALID_REQUEST;
    }

    @Override
    public Object getCode() {
        return code;
    }

    @Override
    public ErrorResponse toErrorResponse() {
        ErrorResponse response = super.toErrorResponse();
        response.getError().setParam(param);
        return response;
    }
}
