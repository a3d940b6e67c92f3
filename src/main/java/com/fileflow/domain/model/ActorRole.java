package com.fileflow.domain.model;

/**
 * Role of the user performing a workflow action
 */
public enum ActorRole {
    USER("USER"),
    TEAM_LEADER("TEAM_LEADER"),
    ADMIN("ADMIN");

    private final String value;

    ActorRole(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isReviewer() {
        return this == TEAM_LEADER || this == ADMIN;
    }

    public static ActorRole fromValue(String value) {
        for (ActorRole role : values()) {
            if (role.value.equalsIgnoreCase(value)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown actor role: " + value);
    }

    public static boolean isValid(String value) {
        for (ActorRole role : values()) {
            if (role.value.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
