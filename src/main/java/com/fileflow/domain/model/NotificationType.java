package com.fileflow.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of entry in a user's notification feed
 */
public enum NotificationType {
    STATUS_UPDATE("status_update"),
    COMMENT_ADDED("comment_added"),
    SYSTEM("system");

    private final String value;

    NotificationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    // Older feeds used "approval_status" for decisions; anything unrecognised is treated as system
    @JsonCreator
    public static NotificationType fromValue(String value) {
        if ("approval_status".equalsIgnoreCase(value)) {
            return STATUS_UPDATE;
        }
        for (NotificationType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        return SYSTEM;
    }
}
