package com.fileflow.application.service;

import com.fileflow.application.port.in.UserSubmissionGateway;
import com.fileflow.application.port.out.ApprovalRecordStore;
import com.fileflow.application.port.out.AuditSink;
import com.fileflow.application.port.out.FileInspector;
import com.fileflow.application.port.out.NamedLocks;
import com.fileflow.application.port.out.TeamDirectory;
import com.fileflow.application.port.out.UserOverlayRepository;
import com.fileflow.domain.exception.DuplicateSubmissionException;
import com.fileflow.domain.exception.InvalidTransitionException;
import com.fileflow.domain.exception.RecordNotFoundException;
import com.fileflow.domain.model.ApprovalRecord;
import com.fileflow.domain.model.ApprovalStatus;
import com.fileflow.domain.model.RecordCollection;
import com.fileflow.domain.model.RecordSnapshot;
import com.fileflow.domain.model.UserOverlayEntry;
import com.fileflow.domain.model.WorkflowHistoryEntry;
import com.fileflow.domain.workflow.ApprovalStateMachine;
import com.fileflow.domain.workflow.ApprovalStateMachine.NewSubmission;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Submitter-side workflow for one user.
 *
 * Submit, withdraw and resubmit of the same user run one at a time under the user's submission
 * lock. The overlay entry of a submission is written before the queue entry; if the queue write
 * fails the overlay entry is put back the way it was.
 */
@Slf4j
public class UserSubmissionGatewayImpl implements UserSubmissionGateway {

    private static final Comparator<ApprovalRecord> BY_SUBMISSION_DATE =
            Comparator.comparing(ApprovalRecord::getSubmissionDate, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final String userId;
    private final ApprovalRecordStore store;
    private final UserOverlayRepository overlays;
    private final FileInspector files;
    private final TeamDirectory teams;
    private final NamedLocks locks;
    private final ApprovalStateMachine stateMachine;
    private final OverlayReconciler reconciler;
    private final SubmissionValidator validator;
    private final BackgroundTaskQueue tasks;
    private final AuditSink audit;
    private final Clock clock;

    public UserSubmissionGatewayImpl(
            String userId,
            ApprovalRecordStore store,
            UserOverlayRepository overlays,
            FileInspector files,
            TeamDirectory teams,
            NamedLocks locks,
            ApprovalStateMachine stateMachine,
            BackgroundTaskQueue tasks,
            AuditSink audit,
            Clock clock
    ) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        this.userId = userId;
        this.store = store;
        this.overlays = overlays;
        this.files = files;
        this.teams = teams;
        this.locks = locks;
        this.stateMachine = stateMachine;
        this.reconciler = new OverlayReconciler();
        this.validator = new SubmissionValidator();
        this.tasks = tasks;
        this.audit = audit;
        this.clock = clock;
    }

    @Override
    public String getUserId() {
        return userId;
    }

    @Override
    public Future<String> submit(String filename, String description, Set<String> tags) {
        log.info("Submit request from {} for {}", userId, filename);

        ValidationResult validation = validator.validate(filename, description, tags);
        if (!validation.isValid()) {
            log.warn("Rejected submission of {} by {}: {}", filename, userId, validation.message());
            return Future.failedFuture(new IllegalArgumentException(validation.message()));
        }

        return serialized(() -> store.load(RecordCollection.ACTIVE_QUEUE)
                .compose(queue -> {
                    if (findPending(queue, filename).isPresent()) {
                        return Future.<String>failedFuture(new DuplicateSubmissionException(userId, filename));
                    }
                    return create(filename, description, tags, false, null);
                }))
                .onSuccess(fileId -> log.info("User {} submitted {} as {}", userId, filename, fileId))
                .onFailure(error -> log.warn("Submission of {} by {} failed: {}", filename, userId, error.getMessage()));
    }

    @Override
    public Future<Void> withdraw(String filename) {
        log.info("Withdraw request from {} for {}", userId, filename);

        return serialized(() -> store.loadAll()
                .compose(snapshot -> {
                    Optional<ApprovalRecord> pending = findPending(snapshot.activeQueue(), filename);
                    if (pending.isEmpty()) {
                        ApprovalStatus current = latestRecord(snapshot, filename)
                                .map(ApprovalRecord::getStatus)
                                .orElse(null);
                        return Future.<ApprovalRecord>failedFuture(new InvalidTransitionException(current, String.format(
                                "Cannot withdraw %s with status: %s", filename,
                                current == null ? "not submitted" : current.getValue())));
                    }

                    String fileId = pending.get().getFileId();
                    return store.moveRecord(RecordCollection.ACTIVE_QUEUE, RecordCollection.REJECTED_ARCHIVE, fileId,
                                    record -> stateMachine.withdraw(record, userId))
                            .recover(error -> Future.<ApprovalRecord>failedFuture(error instanceof RecordNotFoundException
                                    ? new InvalidTransitionException(null,
                                            "File " + filename + " was decided before it could be withdrawn")
                                    : error));
                })
                .compose(withdrawn -> markWithdrawn(filename, withdrawn)
                        .onSuccess(v -> enqueueAudit("Withdrew submission " + filename + " (" + withdrawn.getFileId() + ")"))))
                .onSuccess(v -> log.info("User {} withdrew {}", userId, filename))
                .onFailure(error -> log.warn("Withdrawal of {} by {} failed: {}", filename, userId, error.getMessage()));
    }

    @Override
    public Future<String> resubmit(String filename, String description, Set<String> tags) {
        log.info("Resubmit request from {} for {}", userId, filename);

        ValidationResult validation = validator.validate(filename, description, tags);
        if (!validation.isValid()) {
            log.warn("Rejected resubmission of {} by {}: {}", filename, userId, validation.message());
            return Future.failedFuture(new IllegalArgumentException(validation.message()));
        }

        return serialized(() -> store.loadAll()
                .compose(snapshot -> overlays.load(userId)
                        .compose(overlay -> {
                            Optional<ApprovalRecord> previous = latestRecord(snapshot, filename);
                            UserOverlayEntry entry = overlay.get(filename);

                            // Canonical status first; the overlay is only a fallback
                            ApprovalStatus current = previous.map(ApprovalRecord::getStatus)
                                    .orElse(entry == null ? null : entry.getStatus());
                            stateMachine.requireResubmittable(filename, current);

                            String effectiveDescription = description;
                            if (description == null || description.isBlank()) {
                                effectiveDescription = previous.map(ApprovalRecord::getDescription)
                                        .orElse(entry == null ? "" : entry.getDescription());
                            }
                            Set<String> effectiveTags = tags;
                            if (tags == null || tags.isEmpty()) {
                                effectiveTags = previous.map(ApprovalRecord::getTags)
                                        .orElse(entry == null ? Set.of() : entry.getTags());
                            }
                            return create(filename, effectiveDescription, effectiveTags, true, entry);
                        })))
                .onSuccess(fileId -> log.info("User {} resubmitted {} as {}", userId, filename, fileId))
                .onFailure(error -> log.warn("Resubmission of {} by {} failed: {}", filename, userId, error.getMessage()));
    }

    @Override
    public Future<List<SubmissionView>> getSubmissions() {
        return store.loadAll()
                .compose(snapshot -> store.loadComments()
                        .compose(comments -> overlays.load(userId)
                                .compose(overlay -> {
                                    List<ApprovalRecord> owned = snapshot.all()
                                            .filter(record -> record.isOwnedBy(userId))
                                            .collect(Collectors.toList());
                                    LocalDateTime now = LocalDateTime.now(clock);

                                    if (!reconciler.reconcile(overlay, owned, comments, now)) {
                                        return Future.succeededFuture(reconciler.views(overlay));
                                    }

                                    List<SubmissionView> healed = reconciler.views(overlay);
                                    return overlays.mutate(userId, stored -> {
                                                reconciler.reconcile(stored, owned, comments, now);
                                                return reconciler.views(stored);
                                            })
                                            .recover(error -> {
                                                log.error("Could not persist healed overlay for {}: {}",
                                                        userId, error.getMessage());
                                                return Future.succeededFuture(healed);
                                            });
                                })));
    }

    @Override
    public Future<Optional<SubmissionView>> getSubmission(String filename) {
        return getSubmissions().map(views -> views.stream()
                .filter(view -> view.filename().equals(filename))
                .findFirst());
    }

    /**
     * Check the file, write the overlay entry, then the queue entry
     */
    private Future<String> create(String filename, String description, Set<String> tags, boolean resubmission,
                                  UserOverlayEntry previousEntry) {
        String path;
        try {
            path = files.pathFor(userId, filename);
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }

        return files.sizeOf(path)
                .compose(size -> size.isPresent()
                        ? Future.succeededFuture(size.get())
                        : Future.<Long>failedFuture(new IllegalArgumentException("File not found: " + filename)))
                .compose(size -> teams.teamOf(userId)
                        .compose(team -> {
                            String fileId = UUID.randomUUID().toString();
                            ApprovalRecord record = stateMachine.submission(new NewSubmission(
                                    fileId, filename, path, userId, team, size, description, tags, resubmission));
                            UserOverlayEntry entry = overlayEntryFor(record, resubmission, previousEntry);

                            return overlays.mutate(userId, overlay -> Optional.ofNullable(overlay.put(filename, entry)))
                                    .compose(replaced -> enqueue(record)
                                            .recover(error -> restoreOverlay(filename, fileId, replaced)
                                                    .transform(ignored -> Future.<Void>failedFuture(error))))
                                    .map(v -> {
                                        enqueueAudit((resubmission ? "Resubmitted " : "Submitted ") + filename
                                                + " for approval (" + fileId + ", team " + team + ")");
                                        return fileId;
                                    });
                        }));
    }

    private Future<Void> enqueue(ApprovalRecord record) {
        return store.mutate(RecordCollection.ACTIVE_QUEUE, queue -> {
            if (findPending(queue, record.getOriginalFilename()).isPresent()) {
                throw new DuplicateSubmissionException(userId, record.getOriginalFilename());
            }
            queue.put(record.getFileId(), record);
            return null;
        });
    }

    private UserOverlayEntry overlayEntryFor(ApprovalRecord record, boolean resubmission, UserOverlayEntry previous) {
        List<WorkflowHistoryEntry> history = new ArrayList<>();
        if (resubmission && previous != null) {
            history.addAll(previous.getStatusHistory());
        }
        history.addAll(record.getWorkflowHistory());

        return UserOverlayEntry.builder()
                .fileId(record.getFileId())
                .status(record.getStatus())
                .submittedForApproval(true)
                .submissionDate(record.getSubmissionDate())
                .description(record.getDescription())
                .tags(new LinkedHashSet<>(record.getTags()))
                .statusHistory(history)
                .resubmissionDate(resubmission ? record.getSubmissionDate() : null)
                .lastUpdated(record.getSubmissionDate())
                .build();
    }

    /**
     * Undo the overlay write of a submission whose queue write failed
     */
    private Future<Void> restoreOverlay(String filename, String fileId, Optional<UserOverlayEntry> replaced) {
        return overlays.<Void>mutate(userId, overlay -> {
                    UserOverlayEntry current = overlay.get(filename);
                    if (current != null && fileId.equals(current.getFileId())) {
                        if (replaced.isPresent()) {
                            overlay.put(filename, replaced.get());
                        } else {
                            overlay.remove(filename);
                        }
                    }
                    return null;
                })
                .onSuccess(v -> log.warn("Restored overlay entry for {} after failed queue write", filename))
                .onFailure(error -> log.error("Overlay entry for {} of {} left ahead of the queue: {}",
                        filename, userId, error.getMessage()));
    }

    private Future<Void> markWithdrawn(String filename, ApprovalRecord withdrawn) {
        LocalDateTime now = LocalDateTime.now(clock);
        return overlays.<Void>mutate(userId, overlay -> {
                    UserOverlayEntry entry = overlay.computeIfAbsent(filename, key -> UserOverlayEntry.builder()
                            .submissionDate(withdrawn.getSubmissionDate())
                            .description(withdrawn.getDescription())
                            .tags(new LinkedHashSet<>(withdrawn.getTags()))
                            .build());
                    List<WorkflowHistoryEntry> history = new ArrayList<>(entry.getStatusHistory());
                    for (WorkflowHistoryEntry step : withdrawn.getWorkflowHistory()) {
                        if (!history.contains(step)) {
                            history.add(step);
                        }
                    }
                    entry.setStatusHistory(history);
                    entry.setFileId(withdrawn.getFileId());
                    entry.setStatus(ApprovalStatus.WITHDRAWN);
                    entry.setSubmittedForApproval(false);
                    entry.setWithdrawnDate(withdrawn.getWithdrawnDate());
                    entry.setLastUpdated(now);
                    return null;
                })
                .recover(error -> {
                    // The withdrawal is committed; the overlay catches up on the next read
                    log.error("Could not update overlay of {} after withdrawing {}: {}",
                            userId, filename, error.getMessage());
                    return Future.succeededFuture();
                });
    }

    private Optional<ApprovalRecord> findPending(Map<String, ApprovalRecord> queue, String filename) {
        return queue.values().stream()
                .filter(record -> record.isForFile(userId, filename) && record.isPending())
                .findFirst();
    }

    private Optional<ApprovalRecord> latestRecord(RecordSnapshot snapshot, String filename) {
        return snapshot.all()
                .filter(record -> record.isForFile(userId, filename))
                .max(BY_SUBMISSION_DATE);
    }

    private <R> Future<R> serialized(Supplier<Future<R>> action) {
        return locks.withLock(List.of("submission:" + userId), action);
    }

    private void enqueueAudit(String action) {
        tasks.enqueue("audit", () -> {
            audit.record(userId, action);
            return Future.succeededFuture();
        });
    }
}
