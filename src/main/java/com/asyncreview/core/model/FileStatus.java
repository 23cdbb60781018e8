package com.asyncreview.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Status of a file within a change set.
 */
public enum FileStatus {
    ADDED, REMOVED, MODIFIED, RENAMED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse of provider status strings. Unknown or missing values map to {@link #MODIFIED}.
     */
    @JsonCreator
    public static FileStatus fromWire(String value) {
        if (value == null) {
            return MODIFIED;
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "added", "new" -> ADDED;
            case "removed", "deleted" -> REMOVED;
            case "renamed" -> RENAMED;
            default -> MODIFIED;
        };
    }
}
