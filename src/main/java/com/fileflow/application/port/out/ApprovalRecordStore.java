package com.fileflow.application.port.out;

import com.fileflow.domain.model.ApprovalRecord;
import com.fileflow.domain.model.RecordCollection;
import com.fileflow.domain.model.RecordSnapshot;
import com.fileflow.domain.model.ReviewComment;
import io.vertx.core.Future;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Output port - durable, lock-guarded access to the approval record collections and comments
 */
public interface ApprovalRecordStore {

    /**
     * Prepare the underlying storage (directories, empty documents)
     */
    Future<Void> initialize();

    /**
     * Current snapshot of one collection.
     * Never fails: an unreadable document is reported as an empty collection.
     * @param collection The collection to read
     * @return Future with a mutable copy of fileId -> record
     */
    Future<Map<String, ApprovalRecord>> load(RecordCollection collection);

    /**
     * Snapshot of all three collections taken while holding all three locks.
     * Never fails, like {@link #load(RecordCollection)}.
     */
    Future<RecordSnapshot> loadAll();

    /**
     * Read-modify-write one collection under its exclusive lock.
     * The mutation edits the map in place; the whole document is then persisted atomically.
     * If the mutation throws, nothing is written and the future fails with that exception.
     * @param collection The collection to modify
     * @param mutation In-place edit returning the operation's result
     * @return Future with the mutation's result
     */
    <R> Future<R> mutate(RecordCollection collection, Function<Map<String, ApprovalRecord>, R> mutation);

    /**
     * Move a record between collections while holding both collections' locks, so the record
     * is never observable in neither or both collections.
     * @param from Source collection
     * @param to Destination collection
     * @param fileId Record identifier
     * @param transform Applied to the record under lock; may throw to abort the move
     * @return Future with the record as stored in the destination
     */
    Future<ApprovalRecord> moveRecord(RecordCollection from, RecordCollection to, String fileId,
                                      UnaryOperator<ApprovalRecord> transform);

    /**
     * All reviewer comments, keyed by fileId. Never fails.
     */
    Future<Map<String, List<ReviewComment>>> loadComments();

    /**
     * Append a comment to a record's comment thread, independent of its status
     */
    Future<Void> appendComment(String fileId, ReviewComment comment);
}
