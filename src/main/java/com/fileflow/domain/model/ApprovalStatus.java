package com.fileflow.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Review status of a submitted file
 */
public enum ApprovalStatus {
    PENDING_TEAM_LEADER("pending_team_leader"),
    PENDING_ADMIN("pending_admin"),
    APPROVED("approved"),
    REJECTED_TEAM_LEADER("rejected_team_leader"),
    REJECTED_ADMIN("rejected_admin"),
    CHANGES_REQUESTED("changes_requested"),
    WITHDRAWN("withdrawn");

    // Written by older releases before the two review tiers existed
    private static final String LEGACY_PENDING = "pending";

    private static final Set<ApprovalStatus> PENDING = EnumSet.of(PENDING_TEAM_LEADER, PENDING_ADMIN);
    private static final Set<ApprovalStatus> RESUBMITTABLE =
            EnumSet.of(REJECTED_TEAM_LEADER, REJECTED_ADMIN, CHANGES_REQUESTED);

    private final String value;

    ApprovalStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isPending() {
        return PENDING.contains(this);
    }

    public boolean isTerminal() {
        return !isPending();
    }

    public boolean isResubmittable() {
        return RESUBMITTABLE.contains(this);
    }

    public static ApprovalStatus fromValue(String value) {
        ApprovalStatus status = lookup(value);
        if (status == null) {
            throw new IllegalArgumentException("Unknown approval status: " + value);
        }
        return status;
    }

    public static boolean isValid(String value) {
        return lookup(value) != null;
    }

    /**
     * Lenient variant used when reading persisted documents: unknown values map to null
     * so the owning record can be dropped instead of failing the whole document.
     * The legacy value {@code pending} reads as PENDING_TEAM_LEADER.
     */
    @JsonCreator
    public static ApprovalStatus lookup(String value) {
        if (LEGACY_PENDING.equalsIgnoreCase(value)) {
            return PENDING_TEAM_LEADER;
        }
        for (ApprovalStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        return null;
    }
}
