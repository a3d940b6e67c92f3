package com.fileflow.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * The three record collections a submission can live in.
 * Each collection only admits a fixed set of statuses.
 */
public enum RecordCollection {
    ACTIVE_QUEUE("approval_queue",
            EnumSet.of(ApprovalStatus.PENDING_TEAM_LEADER, ApprovalStatus.PENDING_ADMIN)),
    APPROVED_ARCHIVE("approved_files",
            EnumSet.of(ApprovalStatus.APPROVED)),
    REJECTED_ARCHIVE("rejected_files",
            EnumSet.of(ApprovalStatus.REJECTED_TEAM_LEADER, ApprovalStatus.REJECTED_ADMIN,
                    ApprovalStatus.CHANGES_REQUESTED, ApprovalStatus.WITHDRAWN));

    private final String documentName;
    private final Set<ApprovalStatus> admittedStatuses;

    RecordCollection(String documentName, Set<ApprovalStatus> admittedStatuses) {
        this.documentName = documentName;
        this.admittedStatuses = admittedStatuses;
    }

    public String getDocumentName() {
        return documentName;
    }

    public boolean admits(ApprovalStatus status) {
        return status != null && admittedStatuses.contains(status);
    }

    /**
     * Collection a record with the given status belongs to
     */
    public static RecordCollection forStatus(ApprovalStatus status) {
        for (RecordCollection collection : values()) {
            if (collection.admits(status)) {
                return collection;
            }
        }
        throw new IllegalArgumentException("No collection admits status: " + status);
    }
}
