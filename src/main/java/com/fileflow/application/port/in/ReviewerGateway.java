package com.fileflow.application.port.in;

import com.fileflow.domain.model.ApprovalRecord;
import com.fileflow.domain.model.ApprovalStatus;
import com.fileflow.domain.model.Decision;
import com.fileflow.domain.model.RecordCollection;
import com.fileflow.domain.model.ReviewComment;
import com.fileflow.domain.model.Reviewer;
import com.fileflow.domain.model.TeamStatistics;
import io.vertx.core.Future;

import java.util.List;
import java.util.Map;

/**
 * Inbound port - team leader and administrator side of the approval workflow
 */
public interface ReviewerGateway {

    /**
     * Files of one team waiting on their team leader
     */
    Future<List<ApprovalRecord>> listPendingForTeamLeader(String team);

    Future<List<ApprovalRecord>> listPendingForTeamLeader(String team, ReviewFilter filter);

    /**
     * Files of every team waiting on an administrator
     */
    Future<List<ApprovalRecord>> listPendingForAdmin();

    Future<List<ApprovalRecord>> listPendingForAdmin(ReviewFilter filter);

    Future<List<ApprovalRecord>> listApprovedByTeam(String team);

    Future<List<ApprovalRecord>> listRejectedByTeam(String team);

    /**
     * Queue and both archives, for one team
     */
    Future<List<ApprovalRecord>> listAllByTeam(String team);

    Future<TeamStatistics> teamStatistics(String team);

    /**
     * Apply a decision to a pending file.
     * @param fileId Record identifier
     * @param actor Deciding team leader or administrator
     * @param decision Approve or reject
     * @param reason Required when rejecting; also stored as a review comment when present
     * @param requestChanges When rejecting, route to CHANGES_REQUESTED so the owner may resubmit
     * @return Future with the outcome; fails with RecordNotFoundException for an unknown fileId,
     *         InvalidTransitionException when the actor may not decide the file in its current status
     */
    Future<DecisionResult> decide(String fileId, Reviewer actor, Decision decision, String reason,
                                  boolean requestChanges);

    /**
     * Best-effort: a failure is logged and reported as {@code false}, never as a failed future
     */
    Future<Boolean> addComment(String fileId, String actor, String text);

    Future<List<ReviewComment>> getComments(String fileId);

    Future<Map<String, List<ReviewComment>>> loadComments();

    /**
     * Outcome of an accepted decision
     */
    record DecisionResult(
            ApprovalRecord record,
            ApprovalStatus oldStatus,
            ApprovalStatus newStatus,
            RecordCollection collection
    ) {}

    /**
     * Optional narrowing of a review list
     * @param search Case-insensitive text matched against filename, owner and description
     * @param status Only records with this status, or null for all
     */
    record ReviewFilter(String search, ApprovalStatus status) {

        public static ReviewFilter none() {
            return new ReviewFilter(null, null);
        }

        public boolean matches(ApprovalRecord record) {
            if (status != null && record.getStatus() != status) {
                return false;
            }
            if (search == null || search.isBlank()) {
                return true;
            }
            String needle = search.trim().toLowerCase();
            return contains(record.getOriginalFilename(), needle)
                    || contains(record.getOwningUserId(), needle)
                    || contains(record.getDescription(), needle);
        }

        private static boolean contains(String haystack, String needle) {
            return haystack != null && haystack.toLowerCase().contains(needle);
        }
    }
}
