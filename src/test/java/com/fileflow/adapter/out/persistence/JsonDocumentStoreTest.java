package com.fileflow.adapter.out.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fileflow.domain.exception.StorageUnavailableException;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.fileflow.support.Await.failure;
import static com.fileflow.support.Await.result;
import static org.junit.jupiter.api.Assertions.*;

class JsonDocumentStoreTest {

    private static final TypeReference<Map<String, Integer>> COUNTERS = new TypeReference<>() {};

    @TempDir
    Path tempDir;

    private Vertx vertx;
    private JsonDocumentStore store;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        store = new JsonDocumentStore(vertx, new DocumentCodec(), 200);
    }

    @AfterEach
    void tearDown() throws Exception {
        result(vertx.close());
    }

    @Test
    void update_shouldPersistAtomicallyAndLeaveNoTemporaryFile() throws Exception {
        // Given
        JsonDocument<Map<String, Integer>> document = counters("counters");

        // When
        Integer returned = result(store.update(document, counters -> {
            counters.put("a", 1);
            return 42;
        }));

        // Then
        assertEquals(42, returned);
        assertEquals(Map.of("a", 1), result(store.read(document)));
        assertTrue(Files.readString(Path.of(document.path())).contains("\"a\""));
        assertFalse(Files.exists(Path.of(document.temporaryPath())));
    }

    @Test
    void read_shouldTreatMissingOrCorruptDocumentAsEmpty() throws Exception {
        JsonDocument<Map<String, Integer>> missing = counters("missing");
        assertTrue(result(store.read(missing)).isEmpty());

        JsonDocument<Map<String, Integer>> corrupt = counters("corrupt");
        Files.writeString(Path.of(corrupt.path()), "{ not json");
        assertTrue(result(store.read(corrupt)).isEmpty());
    }

    @Test
    void update_shouldNotOverwriteCorruptDocument() throws Exception {
        // Given
        JsonDocument<Map<String, Integer>> corrupt = counters("corrupt");
        Files.writeString(Path.of(corrupt.path()), "{ not json");

        // When
        Throwable error = failure(store.update(corrupt, counters -> counters.put("a", 1)));

        // Then
        assertInstanceOf(StorageUnavailableException.class, error);
        assertEquals("{ not json", Files.readString(Path.of(corrupt.path())));
    }

    @Test
    void update_shouldWriteNothingWhenMutationThrows() throws Exception {
        JsonDocument<Map<String, Integer>> document = counters("counters");
        result(store.update(document, counters -> counters.put("a", 1)));

        Throwable error = failure(store.update(document, counters -> {
            counters.put("a", 99);
            throw new IllegalStateException("refused");
        }));

        assertInstanceOf(IllegalStateException.class, error);
        assertEquals(Map.of("a", 1), result(store.read(document)));
    }

    @Test
    void update_twoDocuments_shouldRestoreFirstWhenSecondWriteFails() throws Exception {
        // Given a second document whose parent directory is a regular file
        JsonDocument<Map<String, Integer>> first = counters("first");
        result(store.update(first, counters -> counters.put("kept", 1)));
        Files.writeString(tempDir.resolve("blocker"), "not a directory");
        JsonDocument<Map<String, Integer>> second = new JsonDocument<>("second",
                tempDir.resolve("blocker").resolve("second.json").toString(), COUNTERS, LinkedHashMap::new);

        // When
        Throwable error = failure(store.update(first, second, (a, b) -> {
            a.put("moved", 2);
            b.put("moved", 2);
            return null;
        }));

        // Then
        assertInstanceOf(StorageUnavailableException.class, error);
        assertEquals(Map.of("kept", 1), result(store.read(first)));
    }

    @Test
    void update_twoDocuments_shouldWriteBoth() throws Exception {
        JsonDocument<Map<String, Integer>> first = counters("first");
        JsonDocument<Map<String, Integer>> second = counters("second");
        result(store.update(second, counters -> counters.put("x", 1)));

        result(store.update(first, second, (a, b) -> a.put("x", b.remove("x"))));

        assertEquals(Map.of("x", 1), result(store.read(first)));
        assertTrue(result(store.read(second)).isEmpty());
    }

    @Test
    void update_shouldSerializeConcurrentWriters() throws Exception {
        // Given
        JsonDocument<Map<String, Integer>> document = counters("counters");
        List<Future<Integer>> updates = new ArrayList<>();

        // When
        for (int i = 0; i < 20; i++) {
            updates.add(store.update(document, counters -> counters.merge("count", 1, Integer::sum)));
        }
        result(Future.all(updates));

        // Then
        assertEquals(20, result(store.read(document)).get("count"));
    }

    @Test
    void withLock_shouldTimeOutWhileLockIsHeld() throws Exception {
        // Given a lock held until the promise completes
        JsonDocument<Map<String, Integer>> document = counters("counters");
        Promise<Void> acquired = Promise.promise();
        Promise<Void> holder = Promise.promise();
        Future<Void> held = store.withLock(List.of(document.name()), () -> {
            acquired.complete();
            return holder.future();
        });
        result(acquired.future());

        // When
        Throwable error = failure(store.update(document, counters -> counters.put("a", 1)));

        // Then
        assertInstanceOf(StorageUnavailableException.class, error);
        holder.complete();
        result(held);
        result(store.update(document, counters -> counters.put("a", 1)));
    }

    @Test
    void readHeld_shouldComposeSnapshotUnderHeldLocks() throws Exception {
        JsonDocument<Map<String, Integer>> first = counters("first");
        JsonDocument<Map<String, Integer>> second = counters("second");
        result(store.update(second, counters -> counters.put("b", 2)));

        List<Map<String, Integer>> values = result(store.withLock(List.of(first.name(), second.name()),
                () -> store.readHeld(first)
                        .compose(a -> store.readHeld(second).map(b -> List.of(a, b)))));

        assertEquals(Map.of(), values.get(0));
        assertEquals(Map.of("b", 2), values.get(1));
    }

    @Test
    void update_shouldApplyStrictSanitizerAndReadShouldApplyLenientOne() throws Exception {
        // Given a document whose negative entries readers skip and writers refuse
        JsonDocument<Map<String, Integer>> document = new JsonDocument<>("guarded",
                tempDir.resolve("guarded.json").toString(), COUNTERS, LinkedHashMap::new,
                counters -> {
                    counters.values().removeIf(value -> value < 0);
                    return counters;
                },
                counters -> {
                    if (counters.values().stream().anyMatch(value -> value < 0)) {
                        throw new StorageUnavailableException("negative counter");
                    }
                    return counters;
                });
        Files.writeString(Path.of(document.path()), "{\"a\": 1, \"b\": -1}");

        // When
        Map<String, Integer> read = result(store.read(document));
        Throwable error = failure(store.update(document, counters -> counters.put("c", 3)));

        // Then
        assertEquals(Map.of("a", 1), read);
        assertInstanceOf(StorageUnavailableException.class, error);
        assertEquals("{\"a\": 1, \"b\": -1}", Files.readString(Path.of(document.path())));
    }

    @Test
    void createIfMissing_shouldKeepExistingContent() throws Exception {
        JsonDocument<Map<String, Integer>> document = counters("counters");
        result(store.update(document, counters -> counters.put("a", 1)));

        result(store.createIfMissing(document));

        assertEquals(Map.of("a", 1), result(store.read(document)));
    }

    private JsonDocument<Map<String, Integer>> counters(String name) {
        return new JsonDocument<>(name, tempDir.resolve(name + ".json").toString(), COUNTERS, LinkedHashMap::new);
    }
}
