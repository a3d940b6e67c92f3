package com.fileflow.application.service;

import com.fileflow.adapter.out.persistence.DocumentCodec;
import com.fileflow.adapter.out.persistence.JsonDocumentStore;
import com.fileflow.adapter.out.persistence.JsonFileApprovalRecordStore;
import com.fileflow.adapter.out.persistence.JsonFileNotificationRepository;
import com.fileflow.adapter.out.persistence.JsonFileUserOverlayRepository;
import com.fileflow.application.port.in.NotificationCenter;
import com.fileflow.application.port.in.ReviewerGateway;
import com.fileflow.application.port.in.ReviewerGateway.DecisionResult;
import com.fileflow.application.port.in.ReviewerGateway.ReviewFilter;
import com.fileflow.application.port.out.AuditSink;
import com.fileflow.domain.exception.InvalidTransitionException;
import com.fileflow.domain.exception.RecordNotFoundException;
import com.fileflow.domain.model.ApprovalRecord;
import com.fileflow.domain.model.ApprovalStatus;
import com.fileflow.domain.model.Decision;
import com.fileflow.domain.model.Notification;
import com.fileflow.domain.model.NotificationType;
import com.fileflow.domain.model.RecordCollection;
import com.fileflow.domain.model.RecordSnapshot;
import com.fileflow.domain.model.Reviewer;
import com.fileflow.domain.model.TeamStatistics;
import com.fileflow.domain.model.UserOverlayEntry;
import com.fileflow.domain.model.WorkflowHistoryEntry;
import com.fileflow.domain.workflow.ApprovalStateMachine;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static com.fileflow.support.Await.failure;
import static com.fileflow.support.Await.result;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReviewerGatewayImplTest {

    private static final LocalDateTime BASE = LocalDateTime.of(2025, 3, 1, 9, 0);

    @TempDir
    Path tempDir;

    @Mock
    private AuditSink audit;

    private Vertx vertx;
    private AutoCloseable mocks;
    private JsonFileApprovalRecordStore store;
    private JsonFileUserOverlayRepository overlays;
    private NotificationCenter notifications;
    private ApprovalStateMachine stateMachine;
    private BackgroundTaskQueue tasks;
    private ReviewerGateway reviewers;

    @BeforeEach
    void setUp() throws Exception {
        mocks = MockitoAnnotations.openMocks(this);
        vertx = Vertx.vertx();

        JsonDocumentStore documents = new JsonDocumentStore(vertx, new DocumentCodec(), 2000);
        String usersDir = tempDir.resolve("uploads").toString();
        store = new JsonFileApprovalRecordStore(documents, tempDir.resolve("data").toString());
        overlays = new JsonFileUserOverlayRepository(documents, usersDir);
        notifications = new NotificationCenterImpl(new JsonFileNotificationRepository(documents, usersDir), 50,
                Clock.systemDefaultZone());
        stateMachine = new ApprovalStateMachine();
        tasks = new BackgroundTaskQueue(vertx, 2, 10);
        reviewers = gateway(notifications);
        result(store.initialize());
    }

    @AfterEach
    void tearDown() throws Exception {
        result(tasks.drain());
        result(vertx.close());
        mocks.close();
    }

    @Test
    void listPendingForTeamLeader_shouldOnlyReturnOwnTeamOldestFirst() throws Exception {
        // Given
        seed(pending("f-new", "alice", "ENG", ApprovalStatus.PENDING_TEAM_LEADER, BASE.plusHours(2)));
        seed(pending("f-old", "carol", "ENG", ApprovalStatus.PENDING_TEAM_LEADER, BASE));
        seed(pending("f-ops", "dave", "OPS", ApprovalStatus.PENDING_TEAM_LEADER, BASE));
        seed(pending("f-admin", "erin", "ENG", ApprovalStatus.PENDING_ADMIN, BASE));

        // When
        List<ApprovalRecord> eng = result(reviewers.listPendingForTeamLeader("ENG"));

        // Then
        assertEquals(List.of("f-old", "f-new"), ids(eng));
        assertEquals(List.of("f-admin"), ids(result(reviewers.listPendingForAdmin())));
    }

    @Test
    void listPendingForAdmin_shouldApplyFilter() throws Exception {
        seed(pending("f-1", "alice", "ENG", ApprovalStatus.PENDING_ADMIN, BASE));
        seed(pending("f-2", "carol", "OPS", ApprovalStatus.PENDING_ADMIN, BASE.plusHours(1)));

        List<ApprovalRecord> matched = result(reviewers.listPendingForAdmin(new ReviewFilter("CAROL", null)));

        assertEquals(List.of("f-2"), ids(matched));
    }

    @Test
    void decide_teamLeaderApproval_shouldStayInQueueWithoutNotification() throws Exception {
        // Given
        seed(pending("f-1", "alice", "ENG", ApprovalStatus.PENDING_TEAM_LEADER, BASE));

        // When
        DecisionResult result = result(reviewers.decide("f-1", Reviewer.teamLeader("bob", "ENG"),
                Decision.APPROVE, null, false));

        // Then
        assertEquals(ApprovalStatus.PENDING_TEAM_LEADER, result.oldStatus());
        assertEquals(ApprovalStatus.PENDING_ADMIN, result.newStatus());
        assertEquals(RecordCollection.ACTIVE_QUEUE, result.collection());
        assertEquals("bob", result.record().getTeamLeaderApprovedBy());

        RecordSnapshot snapshot = result(store.loadAll());
        assertEquals(ApprovalStatus.PENDING_ADMIN, snapshot.activeQueue().get("f-1").getStatus());
        assertTrue(result(notifications.list("alice")).isEmpty());
    }

    @Test
    void decide_adminRejection_shouldArchiveNotifyAndComment() throws Exception {
        // Given
        seed(pending("f-1", "alice", "ENG", ApprovalStatus.PENDING_ADMIN, BASE));

        // When
        DecisionResult result = result(reviewers.decide("f-1", Reviewer.admin("root"),
                Decision.REJECT, "Missing title block", false));

        // Then
        assertEquals(ApprovalStatus.REJECTED_ADMIN, result.newStatus());
        RecordSnapshot snapshot = result(store.loadAll());
        assertFalse(snapshot.activeQueue().containsKey("f-1"));
        assertEquals("Missing title block", snapshot.rejectedArchive().get("f-1").getRejectionReason());

        List<Notification> feed = result(notifications.list("alice"));
        assertEquals(1, feed.size());
        assertEquals(NotificationType.STATUS_UPDATE, feed.get(0).getType());
        assertEquals(ApprovalStatus.PENDING_ADMIN, feed.get(0).getOldStatus());
        assertEquals(ApprovalStatus.REJECTED_ADMIN, feed.get(0).getNewStatus());

        assertEquals("Missing title block", result(reviewers.getComments("f-1")).get(0).getComment());

        result(tasks.drain());
        verify(audit).record(eq("root"), contains("Rejected"));
    }

    @Test
    void decide_shouldSyncTrackedOverlayEntry() throws Exception {
        // Given
        ApprovalRecord record = pending("f-1", "alice", "ENG", ApprovalStatus.PENDING_ADMIN, BASE);
        seed(record);
        result(overlays.mutate("alice", overlay -> overlay.put("f-1.dwg", UserOverlayEntry.builder()
                .fileId("f-1")
                .status(ApprovalStatus.PENDING_ADMIN)
                .submittedForApproval(true)
                .submissionDate(BASE)
                .build())));

        // When
        result(reviewers.decide("f-1", Reviewer.admin("root"), Decision.APPROVE, "Looks good", false));
        result(tasks.drain());

        // Then
        UserOverlayEntry entry = result(overlays.load("alice")).get("f-1.dwg");
        assertEquals(ApprovalStatus.APPROVED, entry.getStatus());
        assertFalse(entry.isSubmittedForApproval());
        assertEquals("Looks good", entry.getAdminComments().get(0).getComment());
    }

    @Test
    void decide_unknownFile_shouldFailWithRecordNotFound() throws Exception {
        Throwable error = failure(reviewers.decide("missing", Reviewer.admin("root"), Decision.APPROVE, null, false));

        assertInstanceOf(RecordNotFoundException.class, error);
    }

    @Test
    void decide_wrongRoleOrTeam_shouldFailWithoutMutation() throws Exception {
        // Given
        seed(pending("f-1", "alice", "ENG", ApprovalStatus.PENDING_TEAM_LEADER, BASE));

        // When
        Throwable adminTooEarly = failure(reviewers.decide("f-1", Reviewer.admin("root"), Decision.APPROVE, null, false));
        Throwable otherTeam = failure(reviewers.decide("f-1", Reviewer.teamLeader("olga", "OPS"),
                Decision.APPROVE, null, false));

        // Then
        assertInstanceOf(InvalidTransitionException.class, adminTooEarly);
        assertInstanceOf(InvalidTransitionException.class, otherTeam);
        ApprovalRecord unchanged = result(store.load(RecordCollection.ACTIVE_QUEUE)).get("f-1");
        assertEquals(ApprovalStatus.PENDING_TEAM_LEADER, unchanged.getStatus());
        assertEquals(1, unchanged.getWorkflowHistory().size());
    }

    @Test
    void decide_rejectWithoutReason_shouldFail() throws Exception {
        seed(pending("f-1", "alice", "ENG", ApprovalStatus.PENDING_ADMIN, BASE));

        Throwable error = failure(reviewers.decide("f-1", Reviewer.admin("root"), Decision.REJECT, " ", false));

        assertInstanceOf(IllegalArgumentException.class, error);
    }

    @Test
    void decide_archivedFile_shouldFailWithInvalidTransition() throws Exception {
        seed(pending("f-1", "alice", "ENG", ApprovalStatus.PENDING_ADMIN, BASE));
        result(reviewers.decide("f-1", Reviewer.admin("root"), Decision.APPROVE, null, false));

        InvalidTransitionException error = (InvalidTransitionException) failure(
                reviewers.decide("f-1", Reviewer.admin("root"), Decision.APPROVE, null, false));

        assertEquals(ApprovalStatus.APPROVED, error.getCurrentStatus());
    }

    @Test
    void decide_concurrentDecisions_shouldLetExactlyOneWin() throws Exception {
        // Given
        seed(pending("f-1", "alice", "ENG", ApprovalStatus.PENDING_ADMIN, BASE));

        // When
        Future<DecisionResult> approve = reviewers.decide("f-1", Reviewer.admin("root"), Decision.APPROVE, null, false);
        Future<DecisionResult> reject = reviewers.decide("f-1", Reviewer.admin("sam"), Decision.REJECT, "No", false);
        result(Future.join(approve, reject).recover(error -> Future.succeededFuture()));

        // Then
        assertTrue(approve.succeeded() ^ reject.succeeded());
        Throwable loser = approve.failed() ? approve.cause() : reject.cause();
        assertInstanceOf(InvalidTransitionException.class, loser);

        RecordSnapshot snapshot = result(store.loadAll());
        ApprovalRecord decided = snapshot.find("f-1").orElseThrow();
        assertEquals(2, decided.getWorkflowHistory().size());
        assertEquals(1, snapshot.all().filter(record -> record.getFileId().equals("f-1")).count());
        assertEquals(1, result(notifications.list("alice")).size());
    }

    @Test
    void decide_notificationFailure_shouldNotFailCommittedDecision() throws Exception {
        // Given
        NotificationCenter broken = mock(NotificationCenter.class);
        when(broken.append(anyString(), any())).thenReturn(Future.failedFuture(new IllegalStateException("disk full")));
        seed(pending("f-1", "alice", "ENG", ApprovalStatus.PENDING_ADMIN, BASE));

        // When
        DecisionResult result = result(gateway(broken).decide("f-1", Reviewer.admin("root"),
                Decision.APPROVE, null, false));

        // Then
        assertEquals(ApprovalStatus.APPROVED, result.newStatus());
        assertTrue(result(store.load(RecordCollection.APPROVED_ARCHIVE)).containsKey("f-1"));
        verify(broken).append(eq("alice"), any());
    }

    @Test
    void addComment_shouldStoreCommentAndNotifyOwner() throws Exception {
        // Given
        seed(pending("f-1", "alice", "ENG", ApprovalStatus.PENDING_TEAM_LEADER, BASE));

        // When
        boolean added = result(reviewers.addComment("f-1", "bob", "  Please add units  "));
        boolean blank = result(reviewers.addComment("f-1", "bob", "   "));

        // Then
        assertTrue(added);
        assertFalse(blank);
        assertEquals("Please add units", result(reviewers.getComments("f-1")).get(0).getComment());

        List<Notification> feed = result(notifications.list("alice"));
        assertEquals(1, feed.size());
        assertEquals(NotificationType.COMMENT_ADDED, feed.get(0).getType());
        assertEquals("bob", feed.get(0).getActor());
    }

    @Test
    void teamStatistics_shouldCountEveryCollection() throws Exception {
        // Given
        seed(pending("f-1", "alice", "ENG", ApprovalStatus.PENDING_TEAM_LEADER, BASE));
        seed(pending("f-2", "alice", "ENG", ApprovalStatus.PENDING_ADMIN, BASE));
        seed(pending("f-3", "dave", "OPS", ApprovalStatus.PENDING_ADMIN, BASE));
        result(reviewers.decide("f-2", Reviewer.admin("root"), Decision.APPROVE, null, false));

        // When
        TeamStatistics stats = result(reviewers.teamStatistics("ENG"));

        // Then
        assertEquals(2, stats.total());
        assertEquals(1, stats.count(ApprovalStatus.PENDING_TEAM_LEADER));
        assertEquals(1, stats.count(ApprovalStatus.APPROVED));
        assertEquals(0, stats.count(ApprovalStatus.PENDING_ADMIN));
        assertEquals(List.of("f-2"), ids(result(reviewers.listApprovedByTeam("ENG"))));
    }

    private ReviewerGateway gateway(NotificationCenter center) {
        return new ReviewerGatewayImpl(store, overlays, center, stateMachine, tasks, audit, Clock.systemDefaultZone());
    }

    private ApprovalRecord pending(String fileId, String owner, String team, ApprovalStatus status,
                                   LocalDateTime submitted) {
        List<WorkflowHistoryEntry> history = new ArrayList<>();
        history.add(WorkflowHistoryEntry.builder()
                .status(status)
                .action("submitted")
                .actor(owner)
                .timestamp(submitted)
                .build());
        return ApprovalRecord.builder()
                .fileId(fileId)
                .originalFilename(fileId + ".dwg")
                .owningUserId(owner)
                .owningTeam(team)
                .status(status)
                .submissionDate(submitted)
                .workflowHistory(history)
                .build();
    }

    private void seed(ApprovalRecord record) throws Exception {
        result(store.mutate(RecordCollection.ACTIVE_QUEUE, queue -> queue.put(record.getFileId(), record)));
    }

    private List<String> ids(List<ApprovalRecord> records) {
        return records.stream().map(ApprovalRecord::getFileId).collect(Collectors.toList());
    }
}
