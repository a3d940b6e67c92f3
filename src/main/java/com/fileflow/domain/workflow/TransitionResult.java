package com.fileflow.domain.workflow;

import com.fileflow.domain.model.ApprovalRecord;
import com.fileflow.domain.model.ApprovalStatus;
import com.fileflow.domain.model.RecordCollection;

/**
 * Outcome of an accepted reviewer decision
 *
 * @param record    the updated record, history already appended
 * @param oldStatus status before the decision
 * @param newStatus status after the decision
 * @param target    collection the updated record belongs in
 */
public record TransitionResult(
        ApprovalRecord record,
        ApprovalStatus oldStatus,
        ApprovalStatus newStatus,
        RecordCollection target
) {

    public boolean movesFrom(RecordCollection source) {
        return target != source;
    }
}
