package com.conduit.exception;

/**
 * Provider answered with a non-2xx status.
 */
public class UpstreamHttpException extends GatewayException {

    private final int statusCode;
    private final String responseBody;

    public UpstreamHttpException(int statusCode, String responseBody) {
        super("Platform API error: " + statusCode);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.PLATFORM;
    }

    @Override
    public Object getCode() {
        return statusCode;
    }
}
