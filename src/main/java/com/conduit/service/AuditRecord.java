package com.conduit.service;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

/**
 * One proxied call as handed to a {@link RequestAuditSink}.
 */
@Value
@Builder
public class AuditRecord {

    String endpoint;
    String model;
    String platform;
    boolean stream;
    /** OpenAI error type, null on success. */
    String errorType;
    long durationMs;
    JsonNode request;
    /** Final response, null for streams. */
    JsonNode response;
}
