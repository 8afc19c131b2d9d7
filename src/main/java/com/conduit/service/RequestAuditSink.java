package com.conduit.service;

/**
 * Receives one record per proxied call. Implementations must not block.
 */
public interface RequestAuditSink {

    void record(AuditRecord record);
}
