package com.fileflow.domain.model;

/**
 * Reviewer verdict on a pending submission
 */
public enum Decision {
    APPROVE,
    REJECT
}
