package com.fileflow.application.service;

import com.fileflow.application.port.in.NotificationCenter;
import com.fileflow.application.port.in.ReviewerGateway;
import com.fileflow.application.port.out.ApprovalRecordStore;
import com.fileflow.application.port.out.AuditSink;
import com.fileflow.application.port.out.UserOverlayRepository;
import com.fileflow.domain.exception.InvalidTransitionException;
import com.fileflow.domain.exception.RecordNotFoundException;
import com.fileflow.domain.model.ApprovalRecord;
import com.fileflow.domain.model.ApprovalStatus;
import com.fileflow.domain.model.Decision;
import com.fileflow.domain.model.Notification;
import com.fileflow.domain.model.RecordCollection;
import com.fileflow.domain.model.ReviewComment;
import com.fileflow.domain.model.Reviewer;
import com.fileflow.domain.model.TeamStatistics;
import com.fileflow.domain.workflow.ApprovalStateMachine;
import com.fileflow.domain.workflow.TransitionResult;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Team leader and administrator side of the workflow.
 *
 * A decision is committed under the lock of every collection it touches and re-validated there,
 * so of two competing decisions on one file the second always sees the first one's result.
 * Comments, notifications, overlay synchronisation and audit follow the commit and never undo it.
 */
@Slf4j
public class ReviewerGatewayImpl implements ReviewerGateway {

    private static final Comparator<ApprovalRecord> OLDEST_FIRST =
            Comparator.comparing(ApprovalRecord::getSubmissionDate, Comparator.nullsLast(Comparator.naturalOrder()));

    private final ApprovalRecordStore store;
    private final UserOverlayRepository overlays;
    private final NotificationCenter notifications;
    private final ApprovalStateMachine stateMachine;
    private final OverlayReconciler reconciler;
    private final BackgroundTaskQueue tasks;
    private final AuditSink audit;
    private final Clock clock;

    public ReviewerGatewayImpl(
            ApprovalRecordStore store,
            UserOverlayRepository overlays,
            NotificationCenter notifications,
            ApprovalStateMachine stateMachine,
            BackgroundTaskQueue tasks,
            AuditSink audit,
            Clock clock
    ) {
        this.store = store;
        this.overlays = overlays;
        this.notifications = notifications;
        this.stateMachine = stateMachine;
        this.reconciler = new OverlayReconciler();
        this.tasks = tasks;
        this.audit = audit;
        this.clock = clock;
    }

    @Override
    public Future<List<ApprovalRecord>> listPendingForTeamLeader(String team) {
        return listPendingForTeamLeader(team, ReviewFilter.none());
    }

    @Override
    public Future<List<ApprovalRecord>> listPendingForTeamLeader(String team, ReviewFilter filter) {
        return store.load(RecordCollection.ACTIVE_QUEUE)
                .map(queue -> select(queue.values().stream()
                        .filter(record -> record.getStatus() == ApprovalStatus.PENDING_TEAM_LEADER)
                        .filter(record -> Objects.equals(team, record.getOwningTeam())), filter));
    }

    @Override
    public Future<List<ApprovalRecord>> listPendingForAdmin() {
        return listPendingForAdmin(ReviewFilter.none());
    }

    @Override
    public Future<List<ApprovalRecord>> listPendingForAdmin(ReviewFilter filter) {
        return store.load(RecordCollection.ACTIVE_QUEUE)
                .map(queue -> select(queue.values().stream()
                        .filter(record -> record.getStatus() == ApprovalStatus.PENDING_ADMIN), filter));
    }

    @Override
    public Future<List<ApprovalRecord>> listApprovedByTeam(String team) {
        return listByTeam(RecordCollection.APPROVED_ARCHIVE, team);
    }

    @Override
    public Future<List<ApprovalRecord>> listRejectedByTeam(String team) {
        return listByTeam(RecordCollection.REJECTED_ARCHIVE, team);
    }

    @Override
    public Future<List<ApprovalRecord>> listAllByTeam(String team) {
        return store.loadAll()
                .map(snapshot -> select(snapshot.all()
                        .filter(record -> Objects.equals(team, record.getOwningTeam())), ReviewFilter.none()));
    }

    @Override
    public Future<TeamStatistics> teamStatistics(String team) {
        return listAllByTeam(team).map(records -> {
            Map<ApprovalStatus, Integer> counts = new EnumMap<>(ApprovalStatus.class);
            records.forEach(record -> counts.merge(record.getStatus(), 1, Integer::sum));
            return TeamStatistics.of(team, counts);
        });
    }

    @Override
    public Future<DecisionResult> decide(String fileId, Reviewer actor, Decision decision, String reason,
                                         boolean requestChanges) {
        log.info("{} {} requests {} on {}", actor.getRole().getValue(), actor.getUserId(), decision, fileId);

        return store.loadAll()
                .compose(snapshot -> {
                    Optional<RecordCollection> location = snapshot.locate(fileId);
                    if (location.isEmpty()) {
                        return Future.<TransitionResult>failedFuture(new RecordNotFoundException(fileId));
                    }
                    ApprovalRecord current = snapshot.get(location.get()).get(fileId);
                    if (location.get() != RecordCollection.ACTIVE_QUEUE) {
                        return Future.<TransitionResult>failedFuture(new InvalidTransitionException(current.getStatus(),
                                "File " + fileId + " has already been decided: " + current.getStatus().getValue()));
                    }

                    // Validates actor, status and reason before any lock is taken
                    TransitionResult planned = stateMachine.transition(current, actor, decision, reason, requestChanges);
                    return commit(fileId, actor, decision, reason, requestChanges, planned.target());
                })
                .compose(result -> afterCommit(actor, reason, result)
                        .map(new DecisionResult(result.record(), result.oldStatus(), result.newStatus(), result.target())))
                .onSuccess(result -> log.info("File {} moved from {} to {} by {}",
                        fileId, result.oldStatus().getValue(), result.newStatus().getValue(), actor.getUserId()))
                .onFailure(error -> log.warn("Decision on {} by {} refused: {}", fileId, actor.getUserId(), error.getMessage()));
    }

    @Override
    public Future<Boolean> addComment(String fileId, String actor, String text) {
        if (text == null || text.isBlank()) {
            log.warn("Ignoring empty comment by {} on {}", actor, fileId);
            return Future.succeededFuture(false);
        }

        ReviewComment comment = ReviewComment.builder()
                .actor(actor)
                .comment(text.trim())
                .timestamp(LocalDateTime.now(clock))
                .build();

        return store.appendComment(fileId, comment)
                .compose(v -> store.loadAll())
                .compose(snapshot -> {
                    Optional<ApprovalRecord> record = snapshot.find(fileId);
                    if (record.isEmpty()) {
                        return Future.succeededFuture(true);
                    }
                    enqueueOverlaySync(record.get());
                    return notifyOwner(record.get(), Notification.commentAdded(record.get().getOriginalFilename(),
                            actor, comment.getComment(), comment.getTimestamp()))
                            .map(true);
                })
                .onSuccess(v -> enqueueAudit(actor, "Commented on " + fileId))
                .recover(error -> {
                    log.error("Failed to add comment by {} on {}: {}", actor, fileId, error.getMessage());
                    return Future.succeededFuture(false);
                });
    }

    @Override
    public Future<List<ReviewComment>> getComments(String fileId) {
        return store.loadComments().map(all -> List.copyOf(all.getOrDefault(fileId, List.of())));
    }

    @Override
    public Future<Map<String, List<ReviewComment>>> loadComments() {
        return store.loadComments();
    }

    /**
     * Re-run the transition under the collection locks and persist it.
     * A record that left the queue or changed status since it was read is reported as InvalidTransition.
     */
    private Future<TransitionResult> commit(String fileId, Reviewer actor, Decision decision, String reason,
                                            boolean requestChanges, RecordCollection target) {
        if (target == RecordCollection.ACTIVE_QUEUE) {
            return store.mutate(RecordCollection.ACTIVE_QUEUE, queue -> {
                ApprovalRecord current = queue.get(fileId);
                if (current == null) {
                    throw decidedConcurrently(fileId);
                }
                TransitionResult result = stateMachine.transition(current, actor, decision, reason, requestChanges);
                requireTarget(result, target);
                queue.put(fileId, result.record());
                return result;
            });
        }

        AtomicReference<TransitionResult> committed = new AtomicReference<>();
        return store.moveRecord(RecordCollection.ACTIVE_QUEUE, target, fileId, current -> {
                    TransitionResult result = stateMachine.transition(current, actor, decision, reason, requestChanges);
                    requireTarget(result, target);
                    committed.set(result);
                    return result.record();
                })
                .map(moved -> committed.get())
                .recover(error -> Future.failedFuture(error instanceof RecordNotFoundException
                        ? decidedConcurrently(fileId)
                        : error));
    }

    private void requireTarget(TransitionResult result, RecordCollection expected) {
        if (result.target() != expected) {
            throw new InvalidTransitionException(result.oldStatus(), String.format(
                    "File %s changed status while the decision was being made", result.record().getFileId()));
        }
    }

    private InvalidTransitionException decidedConcurrently(String fileId) {
        return new InvalidTransitionException(null, "File " + fileId + " was decided concurrently");
    }

    /**
     * Auxiliary effects of a committed decision; none of them can fail it
     */
    private Future<Void> afterCommit(Reviewer actor, String reason, TransitionResult result) {
        ApprovalRecord record = result.record();
        LocalDateTime now = LocalDateTime.now(clock);

        Future<Void> comment = Future.succeededFuture();
        if (reason != null && !reason.isBlank()) {
            comment = store.appendComment(record.getFileId(), ReviewComment.builder()
                            .actor(actor.getUserId())
                            .comment(reason.trim())
                            .timestamp(now)
                            .build())
                    .recover(error -> {
                        log.error("Failed to store decision comment on {}: {}", record.getFileId(), error.getMessage());
                        return Future.succeededFuture();
                    });
        }

        // The owner hears about outcomes only: a team leader approval keeps the file in the queue
        return comment
                .compose(v -> !result.movesFrom(RecordCollection.ACTIVE_QUEUE)
                        ? Future.<Void>succeededFuture()
                        : notifyOwner(record, Notification.statusUpdate(record.getOriginalFilename(),
                                result.oldStatus(), result.newStatus(), actor.getUserId(),
                                reason == null || reason.isBlank() ? null : reason.trim(), now)))
                .onComplete(ar -> {
                    enqueueOverlaySync(record);
                    enqueueAudit(actor.getUserId(), String.format("%s %s (%s): %s -> %s",
                            verbFor(result.newStatus()), record.getOriginalFilename(), record.getFileId(),
                            result.oldStatus().getValue(), result.newStatus().getValue()));
                });
    }

    private static String verbFor(ApprovalStatus status) {
        switch (status) {
            case PENDING_ADMIN:
            case APPROVED:
                return "Approved";
            case CHANGES_REQUESTED:
                return "Requested changes on";
            default:
                return "Rejected";
        }
    }

    private Future<Void> notifyOwner(ApprovalRecord record, Notification notification) {
        if (record.getOwningUserId() == null) {
            log.warn("Record {} has no owner, notification dropped", record.getFileId());
            return Future.succeededFuture();
        }
        return notifications.append(record.getOwningUserId(), notification)
                .recover(error -> {
                    log.error("Failed to notify {} about {}: {}",
                            record.getOwningUserId(), record.getFileId(), error.getMessage());
                    return Future.succeededFuture();
                });
    }

    private void enqueueOverlaySync(ApprovalRecord record) {
        if (record.getOwningUserId() == null) {
            return;
        }
        tasks.enqueue("overlay-sync:" + record.getFileId(), () -> store.loadComments()
                .compose(comments -> overlays.<Void>mutate(record.getOwningUserId(), overlay -> {
                    reconciler.sync(overlay, record, comments.get(record.getFileId()), LocalDateTime.now(clock));
                    return null;
                })));
    }

    private void enqueueAudit(String actor, String action) {
        tasks.enqueue("audit", () -> {
            audit.record(actor, action);
            return Future.succeededFuture();
        });
    }

    private Future<List<ApprovalRecord>> listByTeam(RecordCollection collection, String team) {
        return store.load(collection)
                .map(records -> select(records.values().stream()
                        .filter(record -> Objects.equals(team, record.getOwningTeam())), ReviewFilter.none()));
    }

    private List<ApprovalRecord> select(Stream<ApprovalRecord> records, ReviewFilter filter) {
        ReviewFilter effective = filter == null ? ReviewFilter.none() : filter;
        return records.filter(effective::matches)
                .sorted(OLDEST_FIRST)
                .collect(Collectors.toList());
    }
}
