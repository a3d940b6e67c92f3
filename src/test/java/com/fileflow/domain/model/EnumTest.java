package com.fileflow.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for enums
 */
class EnumTest {

    @Test
    void testApprovalStatus() {
        // Test fromValue
        assertEquals(ApprovalStatus.PENDING_TEAM_LEADER, ApprovalStatus.fromValue("pending_team_leader"));
        assertEquals(ApprovalStatus.CHANGES_REQUESTED, ApprovalStatus.fromValue("changes_requested"));

        // Test case insensitivity
        assertEquals(ApprovalStatus.PENDING_ADMIN, ApprovalStatus.fromValue("PENDING_ADMIN"));

        // Test isValid
        assertTrue(ApprovalStatus.isValid("withdrawn"));
        assertFalse(ApprovalStatus.isValid("pending_review"));

        // Test legacy value
        assertEquals(ApprovalStatus.PENDING_TEAM_LEADER, ApprovalStatus.lookup("pending"));

        // Test lenient lookup
        assertNull(ApprovalStatus.lookup("archived"));
        assertNull(ApprovalStatus.lookup(null));

        // Test invalid value
        assertThrows(IllegalArgumentException.class, () -> ApprovalStatus.fromValue("INVALID"));
    }

    @Test
    void testApprovalStatusGroups() {
        assertTrue(ApprovalStatus.PENDING_TEAM_LEADER.isPending());
        assertTrue(ApprovalStatus.PENDING_ADMIN.isPending());
        assertFalse(ApprovalStatus.APPROVED.isPending());
        assertTrue(ApprovalStatus.WITHDRAWN.isTerminal());

        assertTrue(ApprovalStatus.REJECTED_TEAM_LEADER.isResubmittable());
        assertTrue(ApprovalStatus.REJECTED_ADMIN.isResubmittable());
        assertTrue(ApprovalStatus.CHANGES_REQUESTED.isResubmittable());
        assertFalse(ApprovalStatus.APPROVED.isResubmittable());
        assertFalse(ApprovalStatus.WITHDRAWN.isResubmittable());
        assertFalse(ApprovalStatus.PENDING_ADMIN.isResubmittable());
    }

    @Test
    void testRecordCollection() {
        // Every status belongs to exactly one collection
        for (ApprovalStatus status : ApprovalStatus.values()) {
            int owners = 0;
            for (RecordCollection collection : RecordCollection.values()) {
                if (collection.admits(status)) {
                    owners++;
                }
            }
            assertEquals(1, owners, "status " + status);
        }

        assertEquals(RecordCollection.ACTIVE_QUEUE, RecordCollection.forStatus(ApprovalStatus.PENDING_ADMIN));
        assertEquals(RecordCollection.APPROVED_ARCHIVE, RecordCollection.forStatus(ApprovalStatus.APPROVED));
        assertEquals(RecordCollection.REJECTED_ARCHIVE, RecordCollection.forStatus(ApprovalStatus.WITHDRAWN));
        assertFalse(RecordCollection.ACTIVE_QUEUE.admits(null));
        assertThrows(IllegalArgumentException.class, () -> RecordCollection.forStatus(null));

        assertEquals("approval_queue", RecordCollection.ACTIVE_QUEUE.getDocumentName());
        assertEquals("approved_files", RecordCollection.APPROVED_ARCHIVE.getDocumentName());
        assertEquals("rejected_files", RecordCollection.REJECTED_ARCHIVE.getDocumentName());
    }

    @Test
    void testActorRole() {
        assertEquals(ActorRole.TEAM_LEADER, ActorRole.fromValue("team_leader"));
        assertTrue(ActorRole.isValid("ADMIN"));
        assertFalse(ActorRole.isValid("GUEST"));
        assertTrue(ActorRole.ADMIN.isReviewer());
        assertFalse(ActorRole.USER.isReviewer());
        assertThrows(IllegalArgumentException.class, () -> ActorRole.fromValue("GUEST"));
    }

    @Test
    void testNotificationType() {
        assertEquals(NotificationType.COMMENT_ADDED, NotificationType.fromValue("comment_added"));

        // Legacy and unknown values
        assertEquals(NotificationType.STATUS_UPDATE, NotificationType.fromValue("approval_status"));
        assertEquals(NotificationType.SYSTEM, NotificationType.fromValue("something_else"));
    }
}
