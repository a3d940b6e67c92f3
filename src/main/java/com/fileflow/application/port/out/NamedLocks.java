package com.fileflow.application.port.out;

import io.vertx.core.Future;

import java.util.Collection;
import java.util.function.Supplier;

/**
 * Output port - process-wide named locks held across an asynchronous action
 */
public interface NamedLocks {

    /**
     * Run the action while holding every named lock; the locks are released when its future completes.
     * Locks are not reentrant: an action must not ask again for a lock it already holds.
     */
    <R> Future<R> withLock(Collection<String> names, Supplier<Future<R>> action);
}
