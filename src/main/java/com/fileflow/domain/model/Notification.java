package com.fileflow.domain.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Entry in a user's notification feed
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Notification {
    private NotificationType type;
    private String title;       // system notifications only
    private String filename;
    private ApprovalStatus oldStatus;
    private ApprovalStatus newStatus;

    @JsonAlias("admin_id")
    private String actor;

    @JsonAlias({"reason", "message"})
    private String comment;

    private LocalDateTime timestamp;
    private boolean read;

    public static Notification statusUpdate(String filename, ApprovalStatus oldStatus, ApprovalStatus newStatus,
                                            String actor, String comment, LocalDateTime timestamp) {
        return Notification.builder()
                .type(NotificationType.STATUS_UPDATE)
                .filename(filename)
                .oldStatus(oldStatus)
                .newStatus(newStatus)
                .actor(actor)
                .comment(comment)
                .timestamp(timestamp)
                .read(false)
                .build();
    }

    public static Notification commentAdded(String filename, String actor, String comment, LocalDateTime timestamp) {
        return Notification.builder()
                .type(NotificationType.COMMENT_ADDED)
                .filename(filename)
                .actor(actor)
                .comment(comment)
                .timestamp(timestamp)
                .read(false)
                .build();
    }
}
