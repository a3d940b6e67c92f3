package com.fileflow.domain.model;

import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Consistent view of the three record collections taken under all of their locks
 */
public record RecordSnapshot(
        Map<String, ApprovalRecord> activeQueue,
        Map<String, ApprovalRecord> approvedArchive,
        Map<String, ApprovalRecord> rejectedArchive
) {

    public Map<String, ApprovalRecord> get(RecordCollection collection) {
        switch (collection) {
            case ACTIVE_QUEUE:
                return activeQueue;
            case APPROVED_ARCHIVE:
                return approvedArchive;
            case REJECTED_ARCHIVE:
                return rejectedArchive;
            default:
                throw new IllegalArgumentException("Unknown collection: " + collection);
        }
    }

    /**
     * Collection currently holding the given fileId
     */
    public Optional<RecordCollection> locate(String fileId) {
        for (RecordCollection collection : RecordCollection.values()) {
            if (get(collection).containsKey(fileId)) {
                return Optional.of(collection);
            }
        }
        return Optional.empty();
    }

    public Optional<ApprovalRecord> find(String fileId) {
        return locate(fileId).map(collection -> get(collection).get(fileId));
    }

    public Stream<ApprovalRecord> all() {
        return Stream.of(activeQueue, approvedArchive, rejectedArchive)
                .flatMap(records -> records.values().stream());
    }
}
