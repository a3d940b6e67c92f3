package com.fileflow.application.service;

import java.util.Collections;
import java.util.List;

/**
 * Result of validating a submission request
 */
public record ValidationResult(boolean isValid, List<String> errors) {

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * All errors joined into one message
     */
    public String message() {
        return String.join("; ", errors);
    }

    public static ValidationResult valid() {
        return new ValidationResult(true, Collections.emptyList());
    }

    public static ValidationResult invalid(List<String> errors) {
        return new ValidationResult(false, Collections.unmodifiableList(errors));
    }
}
