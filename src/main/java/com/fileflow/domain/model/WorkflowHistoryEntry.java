package com.fileflow.domain.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One accepted transition in a record's append-only workflow history
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowHistoryEntry {
    private ApprovalStatus status;
    private String action;  // submitted, approved, rejected, changes_requested, withdrawn, resubmitted
    private LocalDateTime timestamp;

    @JsonAlias("admin_id")
    private String actor;

    private String comment;
}
