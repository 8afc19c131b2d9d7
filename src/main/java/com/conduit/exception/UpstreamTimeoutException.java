package com.conduit.exception;

import java.time.Duration;

/**
 * Provider did not answer within the configured per-call timeout.
 */
public class UpstreamTimeoutException extends GatewayException {

    public UpstreamTimeoutException(String url, Duration timeout, Throwable cause) {
        super("Upstream request timed out after " + timeout.toMillis() + "ms: " + url, cause);
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.TIMEOUT;
    }

    @Override
    public Object getCode() {
        return "timeout";
    }
}
