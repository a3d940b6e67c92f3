package com.fileflow.adapter.out.audit;

import com.fileflow.application.port.out.AuditSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes audit lines to the dedicated {@code com.fileflow.audit} logger
 */
public class Slf4jAuditSink implements AuditSink {

    private static final Logger audit = LoggerFactory.getLogger("com.fileflow.audit");

    @Override
    public void record(String actor, String action) {
        audit.info("{} - {}", actor, action);
    }
}
