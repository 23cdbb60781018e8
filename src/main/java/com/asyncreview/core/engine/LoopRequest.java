package com.asyncreview.core.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Input to one run of the {@link ReasoningLoop}.
 *
 * @param kind         run category used for metrics ("codebase", "diff")
 * @param sessionRef   repository path or session id recorded in the trace
 * @param question     the user's question
 * @param task         one-line description of what the run must produce
 * @param inputs       named text inputs, shown to the model and defined in the sandbox
 * @param sideChannels extra sandbox variables not shown to the model
 * @param outputFields fields the final answer provides, {@code answer} first
 */
public record LoopRequest(
    String kind,
    String sessionRef,
    String question,
    String task,
    Map<String, String> inputs,
    Map<String, Object> sideChannels,
    List<String> outputFields
) {
    public LoopRequest {
        inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        sideChannels = Collections.unmodifiableMap(new LinkedHashMap<>(sideChannels));
        outputFields = List.copyOf(outputFields);
        if (outputFields.isEmpty() || !"answer".equals(outputFields.get(0))) {
            throw new IllegalArgumentException("Output fields must start with 'answer': " + outputFields);
        }
    }

    /** Name of the output field carrying references, e.g. {@code sources}. */
    public String referencesField() {
        return outputFields.size() > 1 ? outputFields.get(1) : "sources";
    }
}
