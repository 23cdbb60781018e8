package com.asyncreview.core.engine;

import com.asyncreview.core.model.IterationRecord;
import com.asyncreview.core.trace.Trace;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a finished run.
 *
 * @param answer     final answer text, empty when cancelled
 * @param references raw value of the references output field (list, string or {@code null})
 * @param outputs    every output field as submitted or extracted
 * @param iterations the rounds that ran
 * @param exhausted  {@code true} when the answer came from the fallback extraction
 * @param cancelled  {@code true} when the run stopped on a cancellation request
 * @param llmCalls   number of model calls made
 * @param trace      the run's trace
 */
public record LoopOutcome(
    String answer,
    Object references,
    Map<String, Object> outputs,
    List<IterationRecord> iterations,
    boolean exhausted,
    boolean cancelled,
    int llmCalls,
    Trace trace
) {
    public LoopOutcome {
        outputs = outputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        iterations = List.copyOf(iterations);
    }

    /** The references output as a list of strings, split on commas when a single string was given. */
    public List<String> referenceList() {
        return ReasoningLoop.referenceStrings(references);
    }

    public String traceId() {
        return trace == null ? null : trace.getId();
    }
}
