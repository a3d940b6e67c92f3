package com.fileflow.adapter.out.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fileflow.application.port.out.ApprovalRecordStore;
import com.fileflow.domain.exception.RecordNotFoundException;
import com.fileflow.domain.exception.StorageUnavailableException;
import com.fileflow.domain.model.ApprovalRecord;
import com.fileflow.domain.model.ApprovalStatus;
import com.fileflow.domain.model.RecordCollection;
import com.fileflow.domain.model.RecordSnapshot;
import com.fileflow.domain.model.ReviewComment;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * JSON-file implementation of ApprovalRecordStore.
 * One document per collection under the data directory, plus the comments document.
 */
@Slf4j
public class JsonFileApprovalRecordStore implements ApprovalRecordStore {

    private static final TypeReference<Map<String, ApprovalRecord>> RECORDS = new TypeReference<>() {};
    private static final TypeReference<Map<String, List<ReviewComment>>> COMMENTS = new TypeReference<>() {};
    private static final String COMMENTS_DOCUMENT = "file_comments";

    private final JsonDocumentStore documents;
    private final String dataDir;
    private final Map<RecordCollection, JsonDocument<Map<String, ApprovalRecord>>> collections =
            new EnumMap<>(RecordCollection.class);
    private final JsonDocument<Map<String, List<ReviewComment>>> comments;

    public JsonFileApprovalRecordStore(JsonDocumentStore documents, String dataDir) {
        this.documents = documents;
        this.dataDir = dataDir;
        for (RecordCollection collection : RecordCollection.values()) {
            collections.put(collection, new JsonDocument<>(
                    collection.getDocumentName(),
                    Path.of(dataDir, collection.getDocumentName() + ".json").toString(),
                    RECORDS,
                    LinkedHashMap::new,
                    records -> readable(collection, records),
                    records -> rewritable(collection, records)));
        }
        this.comments = new JsonDocument<>(
                COMMENTS_DOCUMENT,
                Path.of(dataDir, COMMENTS_DOCUMENT + ".json").toString(),
                COMMENTS,
                LinkedHashMap::new,
                JsonFileApprovalRecordStore::sanitizeComments);
    }

    @Override
    public Future<Void> initialize() {
        log.info("Initializing approval record store in {}", dataDir);

        Future<Void> future = documents.ensureDirectory(dataDir);
        for (JsonDocument<Map<String, ApprovalRecord>> document : collections.values()) {
            future = future.compose(v -> documents.createIfMissing(document));
        }
        return future
                .compose(v -> documents.createIfMissing(comments))
                .onSuccess(v -> log.info("Approval record store ready"))
                .onFailure(error -> log.error("Failed to initialize approval record store", error));
    }

    @Override
    public Future<Map<String, ApprovalRecord>> load(RecordCollection collection) {
        return documents.read(documentFor(collection));
    }

    @Override
    public Future<RecordSnapshot> loadAll() {
        JsonDocument<Map<String, ApprovalRecord>> active = documentFor(RecordCollection.ACTIVE_QUEUE);
        JsonDocument<Map<String, ApprovalRecord>> approved = documentFor(RecordCollection.APPROVED_ARCHIVE);
        JsonDocument<Map<String, ApprovalRecord>> rejected = documentFor(RecordCollection.REJECTED_ARCHIVE);

        return documents.withLock(List.of(active.name(), approved.name(), rejected.name()),
                        () -> documents.readHeld(active)
                                .compose(queue -> documents.readHeld(approved)
                                        .compose(approvedFiles -> documents.readHeld(rejected)
                                                .map(rejectedFiles -> new RecordSnapshot(queue, approvedFiles, rejectedFiles)))))
                .recover(error -> {
                    log.warn("Snapshot of the record collections failed, treating them as empty: {}", error.getMessage());
                    return Future.succeededFuture(new RecordSnapshot(
                            new LinkedHashMap<>(), new LinkedHashMap<>(), new LinkedHashMap<>()));
                });
    }

    @Override
    public <R> Future<R> mutate(RecordCollection collection, Function<Map<String, ApprovalRecord>, R> mutation) {
        return documents.update(documentFor(collection), records -> {
            Map<String, ApprovalStatus> before = statuses(records);
            R result = mutation.apply(records);
            requirePartition(collection, before, records);
            return result;
        });
    }

    @Override
    public Future<ApprovalRecord> moveRecord(RecordCollection from, RecordCollection to, String fileId,
                                             UnaryOperator<ApprovalRecord> transform) {
        if (from == to) {
            return Future.failedFuture(new IllegalArgumentException("Source and destination are both " + from));
        }

        // Destination is written first so a failure never loses the record
        return documents.update(documentFor(to), documentFor(from), (destination, source) -> {
                    ApprovalRecord current = source.get(fileId);
                    if (current == null) {
                        throw new RecordNotFoundException(fileId);
                    }
                    ApprovalRecord moved = transform.apply(current);
                    if (!Objects.equals(fileId, moved.getFileId())) {
                        throw new IllegalStateException("Record " + fileId + " changed identity while moving");
                    }
                    requireAdmitted(to, moved);

                    source.remove(fileId);
                    destination.put(fileId, moved);
                    return moved;
                })
                .onSuccess(moved -> log.info("Moved record {} from {} to {} (status {})",
                        fileId, from, to, moved.getStatus().getValue()));
    }

    @Override
    public Future<Map<String, List<ReviewComment>>> loadComments() {
        return documents.read(comments);
    }

    @Override
    public Future<Void> appendComment(String fileId, ReviewComment comment) {
        return documents.<Map<String, List<ReviewComment>>, Void>update(comments, all -> {
                    all.computeIfAbsent(fileId, key -> new ArrayList<>()).add(comment);
                    return null;
                })
                .onSuccess(v -> log.debug("Added comment by {} on {}", comment.getActor(), fileId));
    }

    private JsonDocument<Map<String, ApprovalRecord>> documentFor(RecordCollection collection) {
        return collections.get(collection);
    }

    private static Map<String, ApprovalStatus> statuses(Map<String, ApprovalRecord> records) {
        Map<String, ApprovalStatus> statuses = new HashMap<>();
        records.forEach((fileId, record) -> statuses.put(fileId, record.getStatus()));
        return statuses;
    }

    /**
     * Records added or changed by a mutation must carry a status the collection admits.
     * Untouched records are not re-validated.
     */
    private static void requirePartition(RecordCollection collection, Map<String, ApprovalStatus> before,
                                         Map<String, ApprovalRecord> after) {
        after.forEach((fileId, record) -> {
            boolean touched = !before.containsKey(fileId) || before.get(fileId) != record.getStatus();
            if (touched) {
                requireAdmitted(collection, record);
            }
        });
    }

    private static void requireAdmitted(RecordCollection collection, ApprovalRecord record) {
        if (!collection.admits(record.getStatus())) {
            throw new IllegalStateException(String.format("%s does not admit record %s with status %s",
                    collection, record.getFileId(),
                    record.getStatus() == null ? null : record.getStatus().getValue()));
        }
    }

    /**
     * Records handed to readers: unreadable records and records whose status the collection
     * does not admit are left out (and stay untouched on disk)
     */
    private static Map<String, ApprovalRecord> readable(RecordCollection collection,
                                                        Map<String, ApprovalRecord> records) {
        Iterator<Map.Entry<String, ApprovalRecord>> entries = records.entrySet().iterator();
        while (entries.hasNext()) {
            Map.Entry<String, ApprovalRecord> entry = entries.next();
            ApprovalRecord record = entry.getValue();
            if (record == null || record.getStatus() == null) {
                log.warn("Skipping unreadable record {} in {}", entry.getKey(), collection);
                entries.remove();
            } else if (!collection.admits(record.getStatus())) {
                log.warn("Skipping record {} in {}: status {} belongs elsewhere",
                        entry.getKey(), collection, record.getStatus().getValue());
                entries.remove();
            } else {
                normalize(entry.getKey(), record);
            }
        }
        return records;
    }

    /**
     * Records about to be written back: every record is kept, misplaced ones included.
     * A record that could not be decoded would be lost by the rewrite, so the write is refused.
     */
    private static Map<String, ApprovalRecord> rewritable(RecordCollection collection,
                                                          Map<String, ApprovalRecord> records) {
        records.forEach((fileId, record) -> {
            if (record == null || record.getStatus() == null) {
                throw new StorageUnavailableException(String.format(
                        "%s holds unreadable record %s; refusing to rewrite the collection", collection, fileId));
            }
            normalize(fileId, record);
        });
        return records;
    }

    private static void normalize(String fileId, ApprovalRecord record) {
        if (record.getFileId() == null) {
            record.setFileId(fileId);
        }
        record.normalize();
    }

    private static Map<String, List<ReviewComment>> sanitizeComments(Map<String, List<ReviewComment>> all) {
        all.values().removeIf(Objects::isNull);
        all.replaceAll((fileId, thread) -> {
            List<ReviewComment> cleaned = new ArrayList<>(thread);
            cleaned.removeIf(Objects::isNull);
            return cleaned;
        });
        return all;
    }
}
