package com.fileflow.domain.exception;

/**
 * The user already has a pending submission for this filename
 */
public class DuplicateSubmissionException extends ApprovalException {

    private final String filename;

    public DuplicateSubmissionException(String userId, String filename) {
        super("User " + userId + " already has a pending submission for " + filename);
        this.filename = filename;
    }

    public String getFilename() {
        return filename;
    }
}
