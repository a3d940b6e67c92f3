package com.fileflow.adapter.out.persistence;

/**
 * Guards user-supplied names that become part of a file path
 */
public final class PathSegments {

    private PathSegments() {
    }

    public static String requireSafe(String segment, String what) {
        if (segment == null || segment.isBlank()) {
            throw new IllegalArgumentException(what + " is required");
        }
        if (segment.contains("/") || segment.contains("\\") || segment.equals(".") || segment.equals("..")
                || segment.indexOf('\0') >= 0) {
            throw new IllegalArgumentException(what + " contains illegal path characters: " + segment);
        }
        return segment;
    }
}
