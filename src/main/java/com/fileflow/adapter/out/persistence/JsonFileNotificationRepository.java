package com.fileflow.adapter.out.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fileflow.application.port.out.NotificationRepository;
import com.fileflow.domain.model.Notification;
import com.fileflow.domain.model.NotificationType;
import io.vertx.core.Future;
import lombok.RequiredArgsConstructor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Stores each user's feed as {@code <users-dir>/<user>/approval_notifications.json}
 */
@RequiredArgsConstructor
public class JsonFileNotificationRepository implements NotificationRepository {

    static final String FILE_NAME = "approval_notifications.json";
    private static final TypeReference<List<Notification>> FEED = new TypeReference<>() {};

    private final JsonDocumentStore documents;
    private final String usersDir;

    @Override
    public Future<List<Notification>> load(String userId) {
        try {
            return documents.read(documentFor(userId));
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }
    }

    @Override
    public <R> Future<R> mutate(String userId, Function<List<Notification>, R> mutation) {
        try {
            return documents.update(documentFor(userId), mutation);
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }
    }

    private JsonDocument<List<Notification>> documentFor(String userId) {
        PathSegments.requireSafe(userId, "userId");
        return new JsonDocument<>(
                "notifications:" + userId,
                Path.of(usersDir, userId, FILE_NAME).toString(),
                FEED,
                ArrayList::new,
                JsonFileNotificationRepository::sanitize);
    }

    private static List<Notification> sanitize(List<Notification> feed) {
        List<Notification> cleaned = new ArrayList<>(feed);
        cleaned.removeIf(Objects::isNull);
        cleaned.forEach(notification -> {
            if (notification.getType() == null) {
                notification.setType(NotificationType.SYSTEM);
            }
        });
        return cleaned;
    }
}
