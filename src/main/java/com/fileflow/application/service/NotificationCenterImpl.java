package com.fileflow.application.service;

import com.fileflow.application.port.in.NotificationCenter;
import com.fileflow.application.port.out.NotificationRepository;
import com.fileflow.domain.model.Notification;
import com.fileflow.domain.model.NotificationSummary;
import com.fileflow.domain.model.NotificationType;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Notification feed service
 * Persistence is independent from the approval records: a feed failure never touches workflow state
 */
@Slf4j
public class NotificationCenterImpl implements NotificationCenter {

    private final NotificationRepository repository;
    private final int maxEntries;
    private final Clock clock;

    public NotificationCenterImpl(NotificationRepository repository, int maxEntries, Clock clock) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive");
        }
        this.repository = repository;
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    @Override
    public Future<Void> append(String userId, Notification notification) {
        Objects.requireNonNull(notification, "notification");
        if (notification.getTimestamp() == null) {
            notification.setTimestamp(LocalDateTime.now(clock));
        }
        if (notification.getType() == null) {
            notification.setType(NotificationType.SYSTEM);
        }

        return repository.<Void>mutate(userId, feed -> {
                    feed.add(0, notification);
                    while (feed.size() > maxEntries) {
                        feed.remove(feed.size() - 1);
                    }
                    return null;
                })
                .onSuccess(v -> log.debug("Notification {} for {} on {}",
                        notification.getType().getValue(), userId, notification.getFilename()))
                .onFailure(error -> log.error("Failed to append notification for {}: {}", userId, error.getMessage()));
    }

    @Override
    public Future<List<Notification>> list(String userId) {
        return repository.load(userId);
    }

    @Override
    public Future<Boolean> markRead(String userId, int index) {
        return repository.mutate(userId, feed -> {
            if (index < 0 || index >= feed.size()) {
                log.debug("Notification index {} out of range for {} ({} entries)", index, userId, feed.size());
                return false;
            }
            feed.get(index).setRead(true);
            return true;
        });
    }

    @Override
    public Future<Integer> markAllRead(String userId) {
        return repository.mutate(userId, feed -> {
            int changed = 0;
            for (Notification notification : feed) {
                if (!notification.isRead()) {
                    notification.setRead(true);
                    changed++;
                }
            }
            return changed;
        });
    }

    @Override
    public Future<Integer> unreadCount(String userId) {
        return repository.load(userId)
                .map(feed -> (int) feed.stream().filter(notification -> !notification.isRead()).count());
    }

    @Override
    public Future<NotificationSummary> summary(String userId) {
        return repository.load(userId).map(feed -> {
            int unread = 0;
            int statusUpdates = 0;
            int comments = 0;
            int system = 0;
            for (Notification notification : feed) {
                if (!notification.isRead()) {
                    unread++;
                }
                NotificationType type = notification.getType() == null ? NotificationType.SYSTEM : notification.getType();
                switch (type) {
                    case STATUS_UPDATE:
                        statusUpdates++;
                        break;
                    case COMMENT_ADDED:
                        comments++;
                        break;
                    default:
                        system++;
                }
            }
            return new NotificationSummary(feed.size(), unread, statusUpdates, comments, system);
        });
    }

    @Override
    public Future<Void> sendSystemNotification(String userId, String title, String message) {
        return append(userId, Notification.builder()
                .type(NotificationType.SYSTEM)
                .title(title)
                .comment(message)
                .timestamp(LocalDateTime.now(clock))
                .read(false)
                .build());
    }

    @Override
    public Future<Integer> cleanupOlderThan(String userId, Duration age) {
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(age);
        return repository.mutate(userId, feed -> {
                    int before = feed.size();
                    feed.removeIf(notification -> notification.getTimestamp() != null
                            && notification.getTimestamp().isBefore(cutoff));
                    return before - feed.size();
                })
                .onSuccess(removed -> {
                    if (removed > 0) {
                        log.info("Cleaned up {} old notifications for {}", removed, userId);
                    }
                });
    }
}
