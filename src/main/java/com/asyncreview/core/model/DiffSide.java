package com.asyncreview.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Which side of a diff a selection or citation refers to.
 */
public enum DiffSide {
    ADDITIONS, DELETIONS, UNIFIED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DiffSide fromWire(String value) {
        if (value == null || value.isBlank()) {
            return UNIFIED;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
