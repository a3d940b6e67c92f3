package com.fileflow.domain.workflow;

import com.fileflow.domain.exception.InvalidTransitionException;
import com.fileflow.domain.model.ActorRole;
import com.fileflow.domain.model.ApprovalRecord;
import com.fileflow.domain.model.ApprovalStatus;
import com.fileflow.domain.model.Decision;
import com.fileflow.domain.model.RecordCollection;
import com.fileflow.domain.model.Reviewer;
import com.fileflow.domain.model.WorkflowHistoryEntry;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Legal status transitions of the two-tier review workflow.
 *
 * <pre>
 *   submit -> PENDING_TEAM_LEADER --TL approve--> PENDING_ADMIN --admin approve--> APPROVED
 *                      |                               |
 *                      +--TL reject--> REJECTED_TEAM_LEADER / CHANGES_REQUESTED
 *                                                      +--admin reject--> REJECTED_ADMIN / CHANGES_REQUESTED
 *   owner withdraw (either pending status) -> WITHDRAWN
 * </pre>
 *
 * Every method is pure: the input record is never modified, a changed copy is returned with
 * exactly one new workflow history entry.
 */
public class ApprovalStateMachine {

    private final Clock clock;

    public ApprovalStateMachine() {
        this(Clock.systemDefaultZone());
    }

    public ApprovalStateMachine(Clock clock) {
        this.clock = clock;
    }

    /**
     * Build the initial record of a submission (or resubmission)
     */
    public ApprovalRecord submission(NewSubmission submission) {
        LocalDateTime now = LocalDateTime.now(clock);
        String comment = submission.resubmission()
                ? "File resubmitted for Team Leader review"
                : "File submitted for Team Leader review";

        List<WorkflowHistoryEntry> history = new ArrayList<>();
        history.add(WorkflowHistoryEntry.builder()
                .status(ApprovalStatus.PENDING_TEAM_LEADER)
                .action(submission.resubmission() ? "resubmitted" : "submitted")
                .timestamp(now)
                .actor(submission.userId())
                .comment(comment)
                .build());

        return ApprovalRecord.builder()
                .fileId(submission.fileId())
                .originalFilename(submission.filename())
                .filePath(submission.filePath())
                .owningUserId(submission.userId())
                .owningTeam(submission.team())
                .fileSize(submission.fileSize())
                .description(submission.description() == null ? "" : submission.description())
                .tags(submission.tags() == null ? new LinkedHashSet<>() : new LinkedHashSet<>(submission.tags()))
                .status(ApprovalStatus.PENDING_TEAM_LEADER)
                .submissionDate(now)
                .workflowHistory(history)
                .build();
    }

    /**
     * Apply a reviewer decision.
     *
     * @throws InvalidTransitionException if the actor's role does not match the record's stage,
     *                                    or a team leader acts outside their team
     * @throws IllegalArgumentException   if a rejection carries no reason
     */
    public TransitionResult transition(ApprovalRecord record, Reviewer actor, Decision decision,
                                       String reason, boolean requestChanges) {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(decision, "decision");

        ApprovalStatus current = record.getStatus();
        ApprovalStatus expected = expectedStatusFor(actor.getRole(), current);

        if (current != expected) {
            throw new InvalidTransitionException(current, String.format(
                    "File %s has status '%s', %s cannot decide on it",
                    record.getFileId(), current == null ? null : current.getValue(), actor.getRole().getValue()));
        }
        if (actor.getRole() == ActorRole.TEAM_LEADER && !Objects.equals(actor.getTeam(), record.getOwningTeam())) {
            throw new InvalidTransitionException(current, String.format(
                    "Team leader %s of team %s cannot review file %s of team %s",
                    actor.getUserId(), actor.getTeam(), record.getFileId(), record.getOwningTeam()));
        }

        LocalDateTime now = LocalDateTime.now(clock);
        ApprovalRecord.ApprovalRecordBuilder updated = record.toBuilder();
        ApprovalStatus next;
        String action;
        String comment;

        if (decision == Decision.APPROVE) {
            if (actor.getRole() == ActorRole.TEAM_LEADER) {
                next = ApprovalStatus.PENDING_ADMIN;
                comment = "Approved by Team Leader - forwarded to Admin";
                updated.teamLeaderApprovedBy(actor.getUserId())
                        .teamLeaderApprovedDate(now);
            } else {
                next = ApprovalStatus.APPROVED;
                comment = "Final approval by Admin";
                updated.decidedBy(actor.getUserId())
                        .decidedDate(now);
            }
            action = "approved";
            if (reason != null && !reason.isBlank()) {
                comment = comment + ": " + reason.trim();
            }
        } else {
            if (reason == null || reason.isBlank()) {
                throw new IllegalArgumentException("A reason is required to reject file " + record.getFileId());
            }
            String who = actor.getRole() == ActorRole.TEAM_LEADER ? "Team Leader" : "Admin";
            if (requestChanges) {
                next = ApprovalStatus.CHANGES_REQUESTED;
                action = "changes_requested";
                comment = "Changes requested by " + who + ": " + reason.trim();
            } else {
                next = actor.getRole() == ActorRole.TEAM_LEADER
                        ? ApprovalStatus.REJECTED_TEAM_LEADER
                        : ApprovalStatus.REJECTED_ADMIN;
                action = "rejected";
                comment = "Rejected by " + who + ": " + reason.trim();
            }
            updated.decidedBy(actor.getUserId())
                    .decidedDate(now)
                    .rejectionReason(reason.trim());
        }

        updated.status(next)
                .workflowHistory(appendHistory(record, next, action, now, actor.getUserId(), comment));

        return new TransitionResult(updated.build(), current, next, RecordCollection.forStatus(next));
    }

    /**
     * Withdraw a pending submission on behalf of its owner
     *
     * @throws InvalidTransitionException if the user does not own the record or it is no longer pending
     */
    public ApprovalRecord withdraw(ApprovalRecord record, String userId) {
        ApprovalStatus current = record.getStatus();
        if (!record.isOwnedBy(userId)) {
            throw new InvalidTransitionException(current,
                    "User " + userId + " does not own file " + record.getFileId());
        }
        if (current == null || !current.isPending()) {
            throw new InvalidTransitionException(current,
                    "Cannot withdraw file with status: " + (current == null ? null : current.getValue()));
        }

        LocalDateTime now = LocalDateTime.now(clock);
        return record.toBuilder()
                .status(ApprovalStatus.WITHDRAWN)
                .withdrawnDate(now)
                .workflowHistory(appendHistory(record, ApprovalStatus.WITHDRAWN, "withdrawn", now, userId,
                        "Submission withdrawn by user"))
                .build();
    }

    /**
     * @throws InvalidTransitionException unless the status allows a resubmission
     */
    public void requireResubmittable(String filename, ApprovalStatus current) {
        if (current == null || !current.isResubmittable()) {
            throw new InvalidTransitionException(current, String.format(
                    "File %s cannot be resubmitted from status '%s'",
                    filename, current == null ? null : current.getValue()));
        }
    }

    private ApprovalStatus expectedStatusFor(ActorRole role, ApprovalStatus current) {
        switch (role) {
            case TEAM_LEADER:
                return ApprovalStatus.PENDING_TEAM_LEADER;
            case ADMIN:
                return ApprovalStatus.PENDING_ADMIN;
            default:
                throw new InvalidTransitionException(current, "Role " + role.getValue() + " cannot review files");
        }
    }

    private List<WorkflowHistoryEntry> appendHistory(ApprovalRecord record, ApprovalStatus status, String action,
                                                     LocalDateTime timestamp, String actor, String comment) {
        List<WorkflowHistoryEntry> history = record.getWorkflowHistory() == null
                ? new ArrayList<>()
                : new ArrayList<>(record.getWorkflowHistory());
        history.add(WorkflowHistoryEntry.builder()
                .status(status)
                .action(action)
                .timestamp(timestamp)
                .actor(actor)
                .comment(comment)
                .build());
        return history;
    }

    /**
     * Everything needed to open a new approval record
     */
    public record NewSubmission(
            String fileId,
            String filename,
            String filePath,
            String userId,
            String team,
            Long fileSize,
            String description,
            Set<String> tags,
            boolean resubmission
    ) {}
}
