package com.fileflow.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Submitter-side cache of one file's approval state, keyed by filename in the user's overlay
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UserOverlayEntry {
    private String fileId;
    private ApprovalStatus status;
    private boolean submittedForApproval;
    private LocalDateTime submissionDate;
    private String description;

    @Builder.Default
    @JsonDeserialize(as = LinkedHashSet.class)
    private Set<String> tags = new LinkedHashSet<>();

    @Builder.Default
    private List<ReviewComment> adminComments = new ArrayList<>();

    @Builder.Default
    private List<WorkflowHistoryEntry> statusHistory = new ArrayList<>();

    private LocalDateTime withdrawnDate;
    private LocalDateTime resubmissionDate;
    private LocalDateTime lastUpdated;

    /**
     * True while the overlay believes the file is waiting on a reviewer
     */
    @JsonIgnore
    public boolean isAwaitingReview() {
        return submittedForApproval && status != null && status.isPending();
    }

    public UserOverlayEntry normalize() {
        if (tags == null) {
            tags = new LinkedHashSet<>();
        }
        if (adminComments == null) {
            adminComments = new ArrayList<>();
        }
        if (statusHistory == null) {
            statusHistory = new ArrayList<>();
        }
        if (description == null) {
            description = "";
        }
        return this;
    }
}
