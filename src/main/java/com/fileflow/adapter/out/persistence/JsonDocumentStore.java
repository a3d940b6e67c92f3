package com.fileflow.adapter.out.persistence;

import com.fileflow.application.port.out.NamedLocks;
import com.fileflow.domain.exception.StorageUnavailableException;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.file.CopyOptions;
import io.vertx.core.file.FileSystem;
import io.vertx.core.shareddata.Lock;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Lock-guarded, atomically written JSON documents on the local file system.
 *
 * Each document is guarded by a Vert.x local lock named after it. Operations spanning several
 * documents take their locks in name order. Writes go to a temporary file which is then renamed
 * over the document, so readers only ever see a complete document.
 */
@Slf4j
public class JsonDocumentStore implements NamedLocks {

    private static final String LOCK_PREFIX = "fileflow:";

    private final Vertx vertx;
    private final DocumentCodec codec;
    private final long lockTimeoutMs;

    public JsonDocumentStore(Vertx vertx, DocumentCodec codec, long lockTimeoutMs) {
        this.vertx = vertx;
        this.codec = codec;
        this.lockTimeoutMs = lockTimeoutMs;
    }

    /**
     * Lenient read: a missing, unreadable or corrupt document yields its empty value
     */
    public <T> Future<T> read(JsonDocument<T> document) {
        return withLock(List.of(document.name()), () -> readHeld(document))
                .recover(error -> {
                    log.warn("Reading {} failed, treating it as empty: {}", document.path(), error.getMessage());
                    return Future.succeededFuture(document.empty().get());
                });
    }

    /**
     * Lenient read for a caller already holding the document's lock through {@link #withLock}.
     * Used to compose consistent multi-document snapshots.
     */
    public <T> Future<T> readHeld(JsonDocument<T> document) {
        return readRaw(document)
                .map(raw -> raw.map(buffer -> document.lenient().apply(codec.decode(document, buffer)))
                        .orElseGet(() -> document.empty().get()))
                .recover(error -> {
                    log.warn("Reading {} failed, treating it as empty: {}", document.path(), error.getMessage());
                    return Future.succeededFuture(document.empty().get());
                });
    }

    /**
     * Read-modify-write one document under its lock.
     * The mutation edits the decoded value in place; if it throws nothing is written.
     */
    public <T, R> Future<R> update(JsonDocument<T> document, Function<T, R> mutation) {
        return withLock(List.of(document.name()), () -> readForUpdate(document)
                .compose(value -> {
                    R result = mutation.apply(value);
                    return writeAtomically(document, value).map(result);
                }));
    }

    /**
     * Read-modify-write two documents under both locks.
     * {@code first} is written before {@code second}; if writing {@code second} fails,
     * {@code first} is restored to its previous content and the update fails.
     */
    public <A, B, R> Future<R> update(JsonDocument<A> first, JsonDocument<B> second, BiFunction<A, B, R> mutation) {
        return withLock(List.of(first.name(), second.name()), () -> readRaw(first)
                .compose(rawFirst -> readRaw(second)
                        .compose(rawSecond -> {
                            A firstValue = decodeForUpdate(first, rawFirst);
                            B secondValue = decodeForUpdate(second, rawSecond);
                            R result = mutation.apply(firstValue, secondValue);

                            return writeAtomically(first, firstValue)
                                    .compose(v -> writeAtomically(second, secondValue)
                                            .recover(error -> restore(first, rawFirst)
                                                    .transform(ignored -> Future.<Void>failedFuture(error))))
                                    .map(result);
                        })));
    }

    /**
     * Create the document with its empty value unless it already exists
     */
    public <T> Future<Void> createIfMissing(JsonDocument<T> document) {
        return withLock(List.of(document.name()), () -> vertx.fileSystem().exists(document.path())
                .compose(exists -> exists
                        ? Future.<Void>succeededFuture()
                        : writeAtomically(document, document.empty().get())));
    }

    public Future<Void> ensureDirectory(String directory) {
        return vertx.fileSystem().mkdirs(directory)
                .recover(error -> Future.failedFuture(
                        new StorageUnavailableException("Cannot create directory " + directory, error)));
    }

    /**
     * Locks are acquired in name order and released once the action's future completes
     */
    @Override
    public <R> Future<R> withLock(Collection<String> names, Supplier<Future<R>> action) {
        List<String> ordered = names.stream().distinct().sorted().collect(Collectors.toList());

        return acquire(ordered, 0, new ArrayList<>())
                .compose(locks -> {
                    Future<R> result;
                    try {
                        result = action.get();
                    } catch (RuntimeException e) {
                        result = Future.failedFuture(e);
                    }
                    return result.onComplete(ar -> release(locks));
                });
    }

    private Future<List<Lock>> acquire(List<String> names, int index, List<Lock> held) {
        if (index == names.size()) {
            return Future.succeededFuture(held);
        }
        String name = names.get(index);
        return vertx.sharedData().getLocalLockWithTimeout(LOCK_PREFIX + name, lockTimeoutMs)
                .recover(error -> {
                    release(held);
                    return Future.failedFuture(
                            new StorageUnavailableException("Timed out waiting for lock " + name, error));
                })
                .compose(lock -> {
                    held.add(lock);
                    return acquire(names, index + 1, held);
                });
    }

    private void release(List<Lock> locks) {
        List<Lock> reversed = new ArrayList<>(locks);
        Collections.reverse(reversed);
        reversed.forEach(Lock::release);
    }

    /**
     * Missing document => empty value; unreadable, corrupt or not safely rewritable => StorageUnavailableException
     */
    private <T> Future<T> readForUpdate(JsonDocument<T> document) {
        return readRaw(document).map(raw -> decodeForUpdate(document, raw));
    }

    private <T> Future<Optional<Buffer>> readRaw(JsonDocument<T> document) {
        FileSystem fs = vertx.fileSystem();
        return fs.exists(document.path())
                .compose(exists -> exists
                        ? fs.readFile(document.path()).<Optional<Buffer>>map(Optional::of)
                        : Future.succeededFuture(Optional.<Buffer>empty()))
                .recover(error -> Future.failedFuture(error instanceof StorageUnavailableException
                        ? error
                        : new StorageUnavailableException("Cannot read " + document.path(), error)));
    }

    private <T> T decodeForUpdate(JsonDocument<T> document, Optional<Buffer> raw) {
        return raw.map(buffer -> document.strict().apply(codec.decode(document, buffer)))
                .orElseGet(() -> document.empty().get());
    }

    private <T> Future<Void> writeAtomically(JsonDocument<T> document, T value) {
        Buffer buffer;
        try {
            buffer = codec.encode(document, value);
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }
        return writeBuffer(document, buffer);
    }

    private Future<Void> writeBuffer(JsonDocument<?> document, Buffer buffer) {
        FileSystem fs = vertx.fileSystem();
        String temporary = document.temporaryPath();
        Path parent = Path.of(document.path()).toAbsolutePath().getParent();

        Future<Void> directory = parent == null ? Future.succeededFuture() : fs.mkdirs(parent.toString());
        return directory
                .compose(v -> fs.writeFile(temporary, buffer))
                .compose(v -> fs.move(temporary, document.path(),
                        new CopyOptions().setReplaceExisting(true).setAtomicMove(true)))
                .onSuccess(v -> log.debug("Wrote {} ({} bytes)", document.path(), buffer.length()))
                .recover(error -> {
                    log.error("Failed to write {}: {}", document.path(), error.getMessage());
                    return discardTemporary(temporary)
                            .transform(ignored -> Future.failedFuture(
                                    new StorageUnavailableException("Cannot write " + document.path(), error)));
                });
    }

    private Future<Void> restore(JsonDocument<?> document, Optional<Buffer> previous) {
        Future<Void> restored = previous.isPresent()
                ? writeBuffer(document, previous.get())
                : vertx.fileSystem().delete(document.path());
        return restored
                .onSuccess(v -> log.warn("Restored {} after a failed two-document update", document.path()))
                .onFailure(error -> log.error("Could not restore {}: {}", document.path(), error.getMessage()));
    }

    private Future<Void> discardTemporary(String temporary) {
        FileSystem fs = vertx.fileSystem();
        return fs.exists(temporary)
                .compose(exists -> exists ? fs.delete(temporary) : Future.<Void>succeededFuture())
                .onFailure(error -> log.warn("Could not remove temporary file {}: {}", temporary, error.getMessage()));
    }
}
