package com.fileflow.application.port.out;

/**
 * Output port - receives human-readable descriptions of workflow actions
 */
public interface AuditSink {

    void record(String actor, String action);
}
