package com.fileflow.domain.model;

import java.util.Collections;
import java.util.Map;

/**
 * Number of a team's submissions per status, across the queue and both archives
 */
public record TeamStatistics(String team, Map<ApprovalStatus, Integer> countsByStatus) {

    public int count(ApprovalStatus status) {
        return countsByStatus.getOrDefault(status, 0);
    }

    public int total() {
        return countsByStatus.values().stream().mapToInt(Integer::intValue).sum();
    }

    public static TeamStatistics of(String team, Map<ApprovalStatus, Integer> counts) {
        return new TeamStatistics(team, Collections.unmodifiableMap(counts));
    }
}
