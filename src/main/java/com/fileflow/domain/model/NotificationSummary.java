package com.fileflow.domain.model;

/**
 * Per-type counts over a user's notification feed
 */
public record NotificationSummary(int total, int unread, int statusUpdates, int comments, int system) {

    public static NotificationSummary empty() {
        return new NotificationSummary(0, 0, 0, 0, 0);
    }
}
