package com.asyncreview.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One round of the reasoning/execution loop. Immutable once appended to a trace.
 *
 * @param index         1-based round number
 * @param maxIterations the iteration cap the round ran under
 * @param reasoning     the model's reasoning text
 * @param code          the code the model asked to execute
 * @param output        captured output, already truncated to the configured bound
 * @param artifacts     extra values produced by the round (e.g. submitted fields)
 */
public record IterationRecord(
    int index,
    int maxIterations,
    String reasoning,
    String code,
    String output,
    Map<String, Object> artifacts
) {
    public IterationRecord {
        artifacts = artifacts == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(artifacts));
    }
}
