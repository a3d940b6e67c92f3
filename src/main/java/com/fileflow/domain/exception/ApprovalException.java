package com.fileflow.domain.exception;

/**
 * Base type for workflow failures surfaced to callers through failed futures
 */
public abstract class ApprovalException extends RuntimeException {

    protected ApprovalException(String message) {
        super(message);
    }

    protected ApprovalException(String message, Throwable cause) {
        super(message, cause);
    }
}
