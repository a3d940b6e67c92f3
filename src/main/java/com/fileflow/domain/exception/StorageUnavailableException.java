package com.fileflow.domain.exception;

/**
 * A persisted document could not be read or written
 */
public class StorageUnavailableException extends ApprovalException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageUnavailableException(String message) {
        super(message);
    }
}
