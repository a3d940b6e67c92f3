package com.fileflow.application.service;

import com.fileflow.application.port.in.UserSubmissionGateway.SubmissionView;
import com.fileflow.domain.model.ApprovalRecord;
import com.fileflow.domain.model.ReviewComment;
import com.fileflow.domain.model.UserOverlayEntry;
import com.fileflow.domain.model.WorkflowHistoryEntry;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Merges a user's overlay with the canonical approval records.
 *
 * The canonical record wins wherever both know the same submission. An overlay entry is only
 * trusted on its own when the canonical store holds nothing newer for that filename.
 * All methods edit the overlay map in place and report whether anything changed.
 */
@Slf4j
public class OverlayReconciler {

    private static final Comparator<ApprovalRecord> BY_SUBMISSION_DATE =
            Comparator.comparing(ApprovalRecord::getSubmissionDate, Comparator.nullsFirst(Comparator.naturalOrder()));

    /**
     * Bring every filename of the user's records up to date with the canonical store
     * @param overlay The user's overlay, edited in place
     * @param ownedRecords Every canonical record owned by the user, from all collections
     * @param comments Review comments keyed by fileId
     * @param now Timestamp for changed entries
     * @return true if the overlay changed
     */
    public boolean reconcile(Map<String, UserOverlayEntry> overlay, Collection<ApprovalRecord> ownedRecords,
                             Map<String, List<ReviewComment>> comments, LocalDateTime now) {
        Map<String, List<ApprovalRecord>> byFilename = new LinkedHashMap<>();
        for (ApprovalRecord record : ownedRecords) {
            if (record.getOriginalFilename() != null) {
                byFilename.computeIfAbsent(record.getOriginalFilename(), key -> new ArrayList<>()).add(record);
            }
        }

        boolean changed = false;
        for (Map.Entry<String, List<ApprovalRecord>> group : byFilename.entrySet()) {
            String filename = group.getKey();
            UserOverlayEntry entry = overlay.get(filename);
            Optional<ApprovalRecord> canonical = currentRecord(entry, group.getValue());
            if (canonical.isEmpty()) {
                continue;
            }

            ApprovalRecord record = canonical.get();
            if (entry == null) {
                log.info("Restoring missing overlay entry for {} from record {}", filename, record.getFileId());
                entry = fromRecord(record);
                overlay.put(filename, entry);
                apply(entry, record, comments.get(record.getFileId()), now);
                changed = true;
            } else if (apply(entry, record, comments.get(record.getFileId()), now)) {
                log.info("Healed overlay entry for {} from record {} ({})",
                        filename, record.getFileId(), record.getStatus().getValue());
                changed = true;
            }
        }
        return changed;
    }

    /**
     * Copy one record's state into the overlay, but only if the overlay still tracks that record
     * @return true if the overlay changed
     */
    public boolean sync(Map<String, UserOverlayEntry> overlay, ApprovalRecord record,
                        List<ReviewComment> comments, LocalDateTime now) {
        UserOverlayEntry entry = overlay.get(record.getOriginalFilename());
        if (entry == null || !Objects.equals(entry.getFileId(), record.getFileId())) {
            log.debug("Overlay no longer tracks record {}, nothing to sync", record.getFileId());
            return false;
        }
        return apply(entry, record, comments, now);
    }

    /**
     * Submitter views of the overlay, newest submission first
     */
    public List<SubmissionView> views(Map<String, UserOverlayEntry> overlay) {
        List<SubmissionView> views = new ArrayList<>();
        overlay.forEach((filename, entry) -> views.add(view(filename, entry)));
        views.sort(Comparator.comparing(SubmissionView::submissionDate,
                Comparator.nullsLast(Comparator.reverseOrder())));
        return views;
    }

    public SubmissionView view(String filename, UserOverlayEntry entry) {
        return new SubmissionView(
                filename,
                entry.getFileId(),
                entry.getStatus(),
                entry.isSubmittedForApproval(),
                entry.getSubmissionDate(),
                entry.getDescription(),
                new LinkedHashSet<>(entry.getTags()),
                List.copyOf(entry.getAdminComments()),
                List.copyOf(entry.getStatusHistory()));
    }

    /**
     * The record the overlay entry refers to, or failing that the newest record not older than the entry
     */
    private Optional<ApprovalRecord> currentRecord(UserOverlayEntry entry, List<ApprovalRecord> candidates) {
        if (entry != null && entry.getFileId() != null) {
            for (ApprovalRecord candidate : candidates) {
                if (entry.getFileId().equals(candidate.getFileId())) {
                    return Optional.of(candidate);
                }
            }
        }

        Optional<ApprovalRecord> newest = candidates.stream().max(BY_SUBMISSION_DATE);
        if (newest.isEmpty() || entry == null || entry.getSubmissionDate() == null) {
            return newest;
        }
        LocalDateTime recordDate = newest.get().getSubmissionDate();
        return recordDate != null && !recordDate.isBefore(entry.getSubmissionDate()) ? newest : Optional.empty();
    }

    private UserOverlayEntry fromRecord(ApprovalRecord record) {
        return UserOverlayEntry.builder()
                .fileId(record.getFileId())
                .status(record.getStatus())
                .submittedForApproval(record.isPending())
                .submissionDate(record.getSubmissionDate())
                .description(record.getDescription())
                .tags(new LinkedHashSet<>(record.getTags()))
                .build();
    }

    private boolean apply(UserOverlayEntry entry, ApprovalRecord record, List<ReviewComment> comments,
                          LocalDateTime now) {
        boolean changed = false;

        if (!Objects.equals(entry.getFileId(), record.getFileId())) {
            entry.setFileId(record.getFileId());
            entry.setSubmissionDate(record.getSubmissionDate());
            entry.setDescription(record.getDescription());
            entry.setTags(new LinkedHashSet<>(record.getTags()));
            entry.setAdminComments(new ArrayList<>());
            changed = true;
        }
        if (entry.getStatus() != record.getStatus()) {
            entry.setStatus(record.getStatus());
            changed = true;
        }
        if (entry.isSubmittedForApproval() != record.isPending()) {
            entry.setSubmittedForApproval(record.isPending());
            changed = true;
        }
        if (record.getWithdrawnDate() != null && !record.getWithdrawnDate().equals(entry.getWithdrawnDate())) {
            entry.setWithdrawnDate(record.getWithdrawnDate());
            changed = true;
        }

        List<WorkflowHistoryEntry> history = new ArrayList<>(entry.getStatusHistory());
        for (WorkflowHistoryEntry step : record.getWorkflowHistory()) {
            if (!history.contains(step)) {
                history.add(step);
            }
        }
        if (history.size() != entry.getStatusHistory().size()) {
            entry.setStatusHistory(history);
            changed = true;
        }

        if (comments != null && !comments.isEmpty() && !comments.equals(entry.getAdminComments())) {
            entry.setAdminComments(new ArrayList<>(comments));
            changed = true;
        }

        if (changed) {
            entry.setLastUpdated(now);
        }
        return changed;
    }
}
