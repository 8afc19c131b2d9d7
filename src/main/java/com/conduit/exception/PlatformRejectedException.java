package com.conduit.exception;

import com.conduit.model.ErrorResponse;

/**
 * Provider accepted the call but reported a failure in-band, e.g. a Coze chat ending in {@code failed}
 * or a {@code {"code":4100,"msg":...}} body on a 200 response.
 */
public class PlatformRejectedException extends GatewayException {

    private final Object code;

    public PlatformRejectedException(ErrorResponse error) {
        super(error.getError() != null ? error.getError().getMessage() : "Platform reported a failure");
        this.code = error.getError() != null ? error.getError().getCode() : null;
    }

    public PlatformRejectedException(Object code, String message) {
        super(message);
        this.code = code;
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.PLATFORM;
    }

    @Override
    public Object getCode() {
        return code;
    }
}
