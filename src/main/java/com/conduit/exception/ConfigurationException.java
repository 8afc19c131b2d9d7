package com.conduit.exception;

/**
 * Adapter could not be initialized from the supplied provider configuration.
 */
public class ConfigurationException extends GatewayException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.SERVICE_UNAVAILABLE;
    }

    @Override
    public Object getCode() {
        return "configuration_error";
    }
}
