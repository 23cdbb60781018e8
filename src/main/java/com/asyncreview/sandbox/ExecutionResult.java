package com.asyncreview.sandbox;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of running one code cell.
 *
 * @param output    captured stdout and stderr
 * @param submitted fields passed to {@code SUBMIT(...)}, or {@code null} if the cell did not submit
 */
public record ExecutionResult(
    String output,
    Map<String, Object> submitted
) {
    public ExecutionResult {
        output = output == null ? "" : output;
        submitted = submitted == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(submitted));
    }

    public static ExecutionResult output(String output) {
        return new ExecutionResult(output, null);
    }

    public boolean isFinal() {
        return submitted != null;
    }
}
