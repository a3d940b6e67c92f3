package com.fileflow.application.port.in;

import com.fileflow.domain.model.Notification;
import com.fileflow.domain.model.NotificationSummary;
import io.vertx.core.Future;

import java.time.Duration;
import java.util.List;

/**
 * Inbound port - per-user feed of workflow events, most recent first and capped in size
 */
public interface NotificationCenter {

    /**
     * Insert at the head of the user's feed, dropping the oldest entries beyond the cap
     */
    Future<Void> append(String userId, Notification notification);

    Future<List<Notification>> list(String userId);

    /**
     * @return Future with false when the index is out of range
     */
    Future<Boolean> markRead(String userId, int index);

    /**
     * @return Future with the number of entries that changed from unread to read
     */
    Future<Integer> markAllRead(String userId);

    Future<Integer> unreadCount(String userId);

    Future<NotificationSummary> summary(String userId);

    Future<Void> sendSystemNotification(String userId, String title, String message);

    /**
     * Drop entries older than the given age; entries without a timestamp are kept
     * @return Future with the number of removed entries
     */
    Future<Integer> cleanupOlderThan(String userId, Duration age);
}
