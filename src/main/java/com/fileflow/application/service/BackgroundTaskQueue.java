package com.fileflow.application.service;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Tracked queue for side effects that must not block or fail the operation that triggered them.
 *
 * Tasks run with at-least-once semantics: a failed attempt is retried after a fixed delay until
 * the attempt limit is reached. Handlers must therefore be idempotent.
 */
@Slf4j
public class BackgroundTaskQueue {

    private final Vertx vertx;
    private final int maxAttempts;
    private final long retryDelayMs;
    private final Set<Future<Void>> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicLong sequence = new AtomicLong();

    public BackgroundTaskQueue(Vertx vertx, int maxAttempts, long retryDelayMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.vertx = vertx;
        this.maxAttempts = maxAttempts;
        this.retryDelayMs = retryDelayMs;
    }

    /**
     * Schedule a task
     * @param name Label used in logs
     * @param handler Produces one attempt; invoked again on failure
     * @return Future completing when the task succeeded or ran out of attempts
     */
    public Future<Void> enqueue(String name, Supplier<Future<Void>> handler) {
        String label = name + "#" + sequence.incrementAndGet();
        Promise<Void> promise = Promise.promise();
        Future<Void> task = promise.future();

        inFlight.add(task);
        task.onComplete(ar -> inFlight.remove(task));

        vertx.runOnContext(v -> attempt(label, handler, 1, promise));
        return task;
    }

    public int pendingCount() {
        return inFlight.size();
    }

    /**
     * Wait for every task enqueued so far, successful or not
     */
    public Future<Void> drain() {
        List<Future<Void>> pending = new ArrayList<>(inFlight);
        if (pending.isEmpty()) {
            return Future.succeededFuture();
        }
        log.info("Draining {} background tasks", pending.size());
        return Future.join(pending).<Void>mapEmpty().recover(error -> Future.succeededFuture());
    }

    private void attempt(String label, Supplier<Future<Void>> handler, int attempt, Promise<Void> promise) {
        Future<Void> result;
        try {
            result = handler.get();
        } catch (RuntimeException e) {
            result = Future.failedFuture(e);
        }

        result.onSuccess(v -> {
            log.debug("Task {} completed on attempt {}", label, attempt);
            promise.complete();
        }).onFailure(error -> {
            if (attempt >= maxAttempts) {
                log.error("Task {} failed after {} attempts: {}", label, attempt, error.getMessage());
                promise.fail(error);
                return;
            }
            log.warn("Task {} attempt {} failed, retrying in {}ms: {}", label, attempt, retryDelayMs, error.getMessage());
            vertx.setTimer(Math.max(1, retryDelayMs), id -> attempt(label, handler, attempt + 1, promise));
        });
    }
}
