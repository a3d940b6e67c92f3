package com.fileflow.application.port.out;

import io.vertx.core.Future;

import java.util.Optional;

/**
 * Output port - existence and size of uploaded files, consulted at submission time
 */
public interface FileInspector {

    /**
     * Location of a user's uploaded file
     */
    String pathFor(String userId, String filename);

    /**
     * @param path File location
     * @return Future with the size in bytes, or empty if no regular file exists at that path
     */
    Future<Optional<Long>> sizeOf(String path);
}
