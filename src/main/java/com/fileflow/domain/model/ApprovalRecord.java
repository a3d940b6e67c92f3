package com.fileflow.domain.model;

import com.fasterxml.jackson.annotation.JsonAlias;
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
 * Approval record - one per submission attempt
 * A resubmission always produces a new record with a fresh fileId
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalRecord {
    private String fileId;
    private String originalFilename;
    private String filePath;

    @JsonAlias("user_id")
    private String owningUserId;

    @JsonAlias("user_team")
    private String owningTeam;

    private Long fileSize;
    private String description;

    @Builder.Default
    @JsonDeserialize(as = LinkedHashSet.class)
    private Set<String> tags = new LinkedHashSet<>();

    private ApprovalStatus status;
    private LocalDateTime submissionDate;

    private String teamLeaderApprovedBy;
    private LocalDateTime teamLeaderApprovedDate;

    // Terminal decision (approval, rejection or change request)
    private String decidedBy;
    private LocalDateTime decidedDate;
    private String rejectionReason;

    private LocalDateTime withdrawnDate;

    @Builder.Default
    private List<WorkflowHistoryEntry> workflowHistory = new ArrayList<>();

    public boolean isOwnedBy(String userId) {
        return owningUserId != null && owningUserId.equals(userId);
    }

    public boolean isForFile(String userId, String filename) {
        return isOwnedBy(userId) && filename != null && filename.equals(originalFilename);
    }

    @JsonIgnore
    public boolean isPending() {
        return status != null && status.isPending();
    }

    /**
     * Fill in defaults for optional collections after deserialization
     */
    public ApprovalRecord normalize() {
        if (tags == null) {
            tags = new LinkedHashSet<>();
        }
        if (workflowHistory == null) {
            workflowHistory = new ArrayList<>();
        }
        if (description == null) {
            description = "";
        }
        return this;
    }
}
