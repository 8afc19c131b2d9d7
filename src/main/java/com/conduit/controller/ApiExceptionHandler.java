package com.conduit.controller;

import com.conduit.exception.ErrorType;
import com.conduit.exception.GatewayException;
import com.conduit.model.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;
import org.springframework.web.server.UnsupportedMediaTypeStatusException;

/**
 * Renders controller failures as OpenAI error envelopes.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<ErrorResponse> handleGateway(GatewayException ex) {
        log.warn("Rejected request: {}", ex.getMessage());
        return ResponseEntity.status(ex.getErrorType().getStatus())
                .body(ex.toErrorResponse());
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleInput(ServerWebInputException ex) {
        String reason = ex.getReason() != null ? ex.getReason() : "Malformed request body";
        return ResponseEntity.status(ErrorType.INVALID_REQUEST.getStatus())
                .body(ErrorResponse.of(reason, ErrorType.INVALID_REQUEST.getValue(), "invalid_json"));
    }

    @ExceptionHandler(UnsupportedMediaTypeStatusException.class)
    public ResponseEntity<ErrorResponse> handleMediaType(UnsupportedMediaTypeStatusException ex) {
        return ResponseEntity.status(ex.getStatusCode())
                .body(ErrorResponse.of(ex.getMessage(), ErrorType.INVALID_REQUEST.getValue(), "unsupported_media_type"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unhandled error", ex);
        return ResponseEntity.status(ErrorType.SERVER.getStatus())
                .body(ErrorResponse.of("Internal server error", ErrorType.SERVER.getValue(), "server_error"));
    }
}
