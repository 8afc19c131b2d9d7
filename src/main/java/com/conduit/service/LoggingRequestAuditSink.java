package com.conduit.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default audit sink writing one log line per call. Payloads are logged at DEBUG only.
 */
@Slf4j
@Component
public class LoggingRequestAuditSink implements RequestAuditSink {

    @Override
    public void record(AuditRecord record) {
        log.info("Proxied {} model={} platform={} stream={} outcome={} duration={}ms",
                record.getEndpoint(),
                record.getModel(),
                record.getPlatform(),
                record.isStream(),
                record.getErrorType() != null ? record.getErrorType() : "ok",
                record.getDurationMs());

        if (log.isDebugEnabled()) {
            log.debug("Audit payloads for {}: request={}, response={}",
                    record.getEndpoint(), record.getRequest(), record.getResponse());
        }
    }
}
