package com.fileflow.application.port.out;

import com.fileflow.domain.model.Notification;
import io.vertx.core.Future;

import java.util.List;
import java.util.function.Function;

/**
 * Output port - per-user notification feed, most recent first
 */
public interface NotificationRepository {

    /**
     * @return Future with the feed; empty when missing or unreadable
     */
    Future<List<Notification>> load(String userId);

    /**
     * Read-modify-write the user's feed under its lock
     */
    <R> Future<R> mutate(String userId, Function<List<Notification>, R> mutation);
}
