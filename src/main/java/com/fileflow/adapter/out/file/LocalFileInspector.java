package com.fileflow.adapter.out.file;

import com.fileflow.adapter.out.persistence.PathSegments;
import com.fileflow.application.port.out.FileInspector;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Inspects uploaded files in {@code <users-dir>/<user>/<filename>} on the local file system
 */
@Slf4j
@RequiredArgsConstructor
public class LocalFileInspector implements FileInspector {

    private final Vertx vertx;
    private final String usersDir;

    @Override
    public String pathFor(String userId, String filename) {
        PathSegments.requireSafe(userId, "userId");
        PathSegments.requireSafe(filename, "filename");
        return Path.of(usersDir, userId, filename).toString();
    }

    @Override
    public Future<Optional<Long>> sizeOf(String path) {
        return vertx.fileSystem().exists(path)
                .compose(exists -> {
                    if (!exists) {
                        log.debug("No file at {}", path);
                        return Future.succeededFuture(Optional.<Long>empty());
                    }
                    return vertx.fileSystem().props(path)
                            .map(props -> props.isRegularFile()
                                    ? Optional.of(props.size())
                                    : Optional.<Long>empty());
                });
    }
}
