package com.fileflow.application.service;

import com.fileflow.application.port.in.UserSubmissionGateway.SubmissionView;
import com.fileflow.domain.model.ApprovalRecord;
import com.fileflow.domain.model.ApprovalStatus;
import com.fileflow.domain.model.ReviewComment;
import com.fileflow.domain.model.UserOverlayEntry;
import com.fileflow.domain.model.WorkflowHistoryEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OverlayReconcilerTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2025, 3, 1, 9, 0);
    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 2, 9, 0);

    private OverlayReconciler reconciler;
    private Map<String, UserOverlayEntry> overlay;

    @BeforeEach
    void setUp() {
        reconciler = new OverlayReconciler();
        overlay = new LinkedHashMap<>();
    }

    @Test
    void reconcile_shouldRestoreEntryKnownOnlyToCanonicalStore() {
        // Given
        ApprovalRecord record = record("f-1", "a.txt", ApprovalStatus.PENDING_ADMIN, T0);

        // When
        boolean changed = reconciler.reconcile(overlay, List.of(record), Map.of(), NOW);

        // Then
        assertTrue(changed);
        UserOverlayEntry entry = overlay.get("a.txt");
        assertEquals("f-1", entry.getFileId());
        assertEquals(ApprovalStatus.PENDING_ADMIN, entry.getStatus());
        assertTrue(entry.isSubmittedForApproval());
        assertEquals(record.getWorkflowHistory(), entry.getStatusHistory());
        assertEquals(NOW, entry.getLastUpdated());
    }

    @Test
    void reconcile_shouldPreferCanonicalStatusAndComments() {
        // Given
        ApprovalRecord record = record("f-1", "a.txt", ApprovalStatus.REJECTED_ADMIN, T0);
        overlay.put("a.txt", entry("f-1", ApprovalStatus.PENDING_TEAM_LEADER, T0));
        List<ReviewComment> thread = List.of(ReviewComment.builder().actor("carol").comment("No").timestamp(T0).build());

        // When
        boolean changed = reconciler.reconcile(overlay, List.of(record), Map.of("f-1", thread), NOW);

        // Then
        assertTrue(changed);
        UserOverlayEntry entry = overlay.get("a.txt");
        assertEquals(ApprovalStatus.REJECTED_ADMIN, entry.getStatus());
        assertFalse(entry.isSubmittedForApproval());
        assertEquals(thread, entry.getAdminComments());
    }

    @Test
    void reconcile_shouldReportNoChangeWhenInSync() {
        ApprovalRecord record = record("f-1", "a.txt", ApprovalStatus.PENDING_TEAM_LEADER, T0);
        reconciler.reconcile(overlay, List.of(record), Map.of(), NOW);

        assertFalse(reconciler.reconcile(overlay, List.of(record), Map.of(), NOW.plusDays(1)));
        assertEquals(NOW, overlay.get("a.txt").getLastUpdated());
    }

    @Test
    void reconcile_shouldKeepNewerOverlayEntryUnknownToStore() {
        // Given an overlay written ahead of a queue write that never happened
        ApprovalRecord old = record("f-1", "a.txt", ApprovalStatus.CHANGES_REQUESTED, T0);
        overlay.put("a.txt", entry("f-2", ApprovalStatus.PENDING_TEAM_LEADER, T0.plusHours(1)));

        // When
        boolean changed = reconciler.reconcile(overlay, List.of(old), Map.of(), NOW);

        // Then
        assertFalse(changed);
        assertEquals("f-2", overlay.get("a.txt").getFileId());
    }

    @Test
    void sync_shouldIgnoreRecordNoLongerTracked() {
        overlay.put("a.txt", entry("f-2", ApprovalStatus.PENDING_TEAM_LEADER, T0));

        boolean changed = reconciler.sync(overlay, record("f-1", "a.txt", ApprovalStatus.APPROVED, T0), null, NOW);

        assertFalse(changed);
        assertEquals(ApprovalStatus.PENDING_TEAM_LEADER, overlay.get("a.txt").getStatus());
    }

    @Test
    void views_shouldListNewestFirst() {
        overlay.put("old.txt", entry("f-1", ApprovalStatus.APPROVED, T0));
        overlay.put("new.txt", entry("f-2", ApprovalStatus.PENDING_ADMIN, T0.plusDays(1)));

        List<SubmissionView> views = reconciler.views(overlay);

        assertEquals("new.txt", views.get(0).filename());
        assertEquals("old.txt", views.get(1).filename());
    }

    private ApprovalRecord record(String fileId, String filename, ApprovalStatus status, LocalDateTime submitted) {
        List<WorkflowHistoryEntry> history = new ArrayList<>();
        history.add(WorkflowHistoryEntry.builder()
                .status(ApprovalStatus.PENDING_TEAM_LEADER).action("submitted").actor("alice").timestamp(submitted).build());
        if (status != ApprovalStatus.PENDING_TEAM_LEADER) {
            history.add(WorkflowHistoryEntry.builder()
                    .status(status).action("decided").actor("carol").timestamp(submitted.plusMinutes(5)).build());
        }
        return ApprovalRecord.builder()
                .fileId(fileId)
                .originalFilename(filename)
                .owningUserId("alice")
                .owningTeam("ENG")
                .status(status)
                .submissionDate(submitted)
                .workflowHistory(history)
                .build();
    }

    private UserOverlayEntry entry(String fileId, ApprovalStatus status, LocalDateTime submitted) {
        return UserOverlayEntry.builder()
                .fileId(fileId)
                .status(status)
                .submittedForApproval(status.isPending())
                .submissionDate(submitted)
                .description("")
                .build();
    }
}
