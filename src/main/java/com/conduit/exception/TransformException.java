package com.conduit.exception;

/**
 * Provider response did not have any of the shapes an adapter recognizes.
 * Adapters catch this and fall back to an apologetic assistant message.
 */
public class TransformException extends GatewayException {

    public TransformException(String message) {
        super(message);
    }

    public TransformException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.INVALID_RESPONSE;
    }

    @Override
    public Object getCode() {
        return "transform_error";
    }
}
