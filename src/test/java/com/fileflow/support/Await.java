package com.fileflow.support;

import io.vertx.core.Future;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.fail;

/**
 * Blocking helpers for asserting on Vert.x futures from test threads
 */
public final class Await {

    private static final long TIMEOUT_SECONDS = 10;

    private Await() {
    }

    public static <T> T result(Future<T> future) throws Exception {
        try {
            return future.toCompletionStage().toCompletableFuture().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            throw new AssertionError("Future failed: " + e.getCause(), e.getCause());
        }
    }

    public static Throwable failure(Future<?> future) throws Exception {
        try {
            Object value = future.toCompletionStage().toCompletableFuture().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
            return fail("Expected failure but succeeded with " + value);
        } catch (ExecutionException e) {
            return e.getCause();
        }
    }
}
