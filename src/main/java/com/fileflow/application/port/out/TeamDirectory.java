package com.fileflow.application.port.out;

import io.vertx.core.Future;

/**
 * Output port - resolves the team a user belongs to
 */
public interface TeamDirectory {

    /**
     * Implementations must not fail: when the directory cannot be consulted they
     * answer with their configured default team.
     */
    Future<String> teamOf(String userId);
}
