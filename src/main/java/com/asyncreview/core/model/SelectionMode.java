package com.asyncreview.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SelectionMode {
    RANGE, SINGLE_LINE, HUNK, FILE, CHANGESET;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    @JsonCreator
    public static SelectionMode fromWire(String value) {
        if (value == null || value.isBlank()) {
            return CHANGESET;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
