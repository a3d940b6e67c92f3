package com.fileflow.domain.exception;

public class RecordNotFoundException extends ApprovalException {

    private final String fileId;

    public RecordNotFoundException(String fileId) {
        super("Approval record not found: " + fileId);
        this.fileId = fileId;
    }

    public String getFileId() {
        return fileId;
    }
}
