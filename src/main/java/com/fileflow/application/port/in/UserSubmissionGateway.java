package com.fileflow.application.port.in;

import com.fileflow.domain.model.ApprovalStatus;
import com.fileflow.domain.model.ReviewComment;
import com.fileflow.domain.model.WorkflowHistoryEntry;
import io.vertx.core.Future;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Inbound port - submitter-facing side of the approval workflow, bound to one user
 */
public interface UserSubmissionGateway {

    String getUserId();

    /**
     * Submit an uploaded file for team leader review
     * @param filename Name of the uploaded file
     * @param description Optional description
     * @param tags Optional tags, order preserved
     * @return Future with the new fileId; fails with DuplicateSubmissionException when the file
     *         is already pending, IllegalArgumentException when the file does not exist
     */
    Future<String> submit(String filename, String description, Set<String> tags);

    /**
     * Withdraw a pending submission
     * @return Future completing once the record is archived as withdrawn;
     *         fails with InvalidTransitionException unless the file is pending
     */
    Future<Void> withdraw(String filename);

    /**
     * Submit again after a rejection or change request. Always mints a new fileId.
     * Blank description or empty tags keep those of the previous submission.
     * @return Future with the new fileId; fails with InvalidTransitionException from any other status
     */
    Future<String> resubmit(String filename, String description, Set<String> tags);

    /**
     * Every file this user has submitted, with its best-known status, newest first.
     * Records found only in the canonical store are copied back into the overlay.
     */
    Future<List<SubmissionView>> getSubmissions();

    /**
     * Reconciled state of a single file
     */
    Future<Optional<SubmissionView>> getSubmission(String filename);

    /**
     * Submitter's view of one file
     */
    record SubmissionView(
            String filename,
            String fileId,
            ApprovalStatus status,
            boolean submittedForApproval,
            LocalDateTime submissionDate,
            String description,
            Set<String> tags,
            List<ReviewComment> adminComments,
            List<WorkflowHistoryEntry> statusHistory
    ) {}
}
