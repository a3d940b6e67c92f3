package com.fileflow.application.port.out;

import com.fileflow.domain.model.UserOverlayEntry;
import io.vertx.core.Future;

import java.util.Map;
import java.util.function.Function;

/**
 * Output port - per-user overlay of approval state, keyed by filename
 */
public interface UserOverlayRepository {

    /**
     * @return Future with filename -> entry; empty when the overlay is missing or unreadable
     */
    Future<Map<String, UserOverlayEntry>> load(String userId);

    /**
     * Read-modify-write the user's overlay under its lock
     */
    <R> Future<R> mutate(String userId, Function<Map<String, UserOverlayEntry>, R> mutation);
}
