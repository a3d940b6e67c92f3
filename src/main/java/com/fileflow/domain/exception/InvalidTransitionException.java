package com.fileflow.domain.exception;

import com.fileflow.domain.model.ApprovalStatus;

/**
 * The attempted action is not legal for the record's current status or the actor's role.
 * Never retried by the engine.
 */
public class InvalidTransitionException extends ApprovalException {

    private final ApprovalStatus currentStatus;

    public InvalidTransitionException(ApprovalStatus currentStatus, String message) {
        super(message);
        this.currentStatus = currentStatus;
    }

    public ApprovalStatus getCurrentStatus() {
        return currentStatus;
    }
}
