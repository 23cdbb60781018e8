package com.asyncreview.core.llm;

import com.asyncreview.core.model.IterationRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the reasoning model sees when asked for its next step.
 *
 * @param task          one-line description of what the run must produce
 * @param inputs        named text inputs, also present as sandbox variables
 * @param sideChannels  names of extra sandbox variables not shown in the prompt
 * @param outputFields  fields the final answer must provide, {@code answer} first
 * @param history       rounds completed so far
 * @param iteration     1-based number of the round being requested
 * @param maxIterations iteration cap of the run
 */
public record PromptState(
    String task,
    Map<String, String> inputs,
    List<String> sideChannels,
    List<String> outputFields,
    List<IterationRecord> history,
    int iteration,
    int maxIterations
) {
    public PromptState {
        inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        sideChannels = List.copyOf(sideChannels);
        outputFields = List.copyOf(outputFields);
        history = List.copyOf(history);
    }

    /** Name of the output field carrying references (sources or citations). */
    public String referencesField() {
        return outputFields.size() > 1 ? outputFields.get(1) : "sources";
    }
}
