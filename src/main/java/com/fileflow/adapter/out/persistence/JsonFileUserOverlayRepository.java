package com.fileflow.adapter.out.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fileflow.application.port.out.UserOverlayRepository;
import com.fileflow.domain.model.UserOverlayEntry;
import io.vertx.core.Future;
import lombok.RequiredArgsConstructor;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Stores each user's overlay as {@code <users-dir>/<user>/file_approval_status.json}
 */
@RequiredArgsConstructor
public class JsonFileUserOverlayRepository implements UserOverlayRepository {

    static final String FILE_NAME = "file_approval_status.json";
    private static final TypeReference<Map<String, UserOverlayEntry>> OVERLAY = new TypeReference<>() {};

    private final JsonDocumentStore documents;
    private final String usersDir;

    @Override
    public Future<Map<String, UserOverlayEntry>> load(String userId) {
        try {
            return documents.read(documentFor(userId));
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }
    }

    @Override
    public <R> Future<R> mutate(String userId, Function<Map<String, UserOverlayEntry>, R> mutation) {
        try {
            return documents.update(documentFor(userId), mutation);
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }
    }

    private JsonDocument<Map<String, UserOverlayEntry>> documentFor(String userId) {
        PathSegments.requireSafe(userId, "userId");
        return new JsonDocument<>(
                "overlay:" + userId,
                Path.of(usersDir, userId, FILE_NAME).toString(),
                OVERLAY,
                LinkedHashMap::new,
                JsonFileUserOverlayRepository::sanitize);
    }

    private static Map<String, UserOverlayEntry> sanitize(Map<String, UserOverlayEntry> overlay) {
        overlay.values().removeIf(entry -> entry == null);
        overlay.values().forEach(UserOverlayEntry::normalize);
        return overlay;
    }
}
