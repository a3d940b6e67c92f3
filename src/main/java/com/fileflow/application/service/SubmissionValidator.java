package com.fileflow.application.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Validates the user-supplied part of a submission before any storage is touched
 */
public class SubmissionValidator {

    static final int MAX_FILENAME_LENGTH = 255;
    static final int MAX_DESCRIPTION_LENGTH = 2000;
    static final int MAX_TAGS = 20;
    static final int MAX_TAG_LENGTH = 50;

    public ValidationResult validate(String filename, String description, Set<String> tags) {
        List<String> errors = new ArrayList<>();

        validateFilename(filename, errors);
        validateDescription(description, errors);
        validateTags(tags, errors);

        if (errors.isEmpty()) {
            return ValidationResult.valid();
        } else {
            return ValidationResult.invalid(errors);
        }
    }

    private void validateFilename(String filename, List<String> errors) {
        if (isBlank(filename)) {
            errors.add("filename is required");
            return;
        }
        if (filename.length() > MAX_FILENAME_LENGTH) {
            errors.add("filename must be at most " + MAX_FILENAME_LENGTH + " characters");
        }
        if (filename.contains("/") || filename.contains("\\") || filename.indexOf('\0') >= 0) {
            errors.add("filename must not contain path separators");
        }
        if (filename.equals(".") || filename.equals("..")) {
            errors.add("filename must name a file");
        }
    }

    private void validateDescription(String description, List<String> errors) {
        if (description != null && description.length() > MAX_DESCRIPTION_LENGTH) {
            errors.add("description must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
        }
    }

    private void validateTags(Set<String> tags, List<String> errors) {
        if (tags == null) {
            return;
        }
        if (tags.size() > MAX_TAGS) {
            errors.add("at most " + MAX_TAGS + " tags are allowed");
        }
        for (String tag : tags) {
            if (isBlank(tag)) {
                errors.add("tags must not be blank");
            } else if (tag.length() > MAX_TAG_LENGTH) {
                errors.add("tag '" + tag + "' must be at most " + MAX_TAG_LENGTH + " characters");
            }
        }
    }

    private boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
