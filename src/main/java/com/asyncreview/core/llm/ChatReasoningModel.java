package com.asyncreview.core.llm;

import com.asyncreview.core.config.AsyncReviewProperties;
import com.asyncreview.core.model.IterationRecord;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link ReasoningModel} backed by the main chat model through {@link LlmService}.
 * <p>
 * Inputs are shown as bounded previews; the model reads full values from the
 * sandbox variables of the same name and ends the run by calling {@code SUBMIT(...)}.
 */
@Component
public class ChatReasoningModel implements ReasoningModel {

    static final String ACTION_SYSTEM_PROMPT = """
            You are a senior engineer answering questions about source code by writing Python.
            You work in a persistent Python REPL. Every input listed below is already defined as
            a Python variable of the same name; the prompt only shows a preview of each.

            Each step, reply with your reasoning and one block of Python code. Use print() to see
            values; only printed output comes back to you. Variables persist between steps.
            Explore before answering: search, slice and read the variables instead of guessing.

            When you are confident, call SUBMIT(%s) in your code with the final values.
            The answer is markdown and may contain fenced code blocks.
            %s
            """;

    static final String FALLBACK_SYSTEM_PROMPT = """
            You are a senior engineer. A code-exploration session ran out of steps before it
            submitted an answer. Using only the inputs and the exploration history below, write
            the best final answer you can. State plainly what remains uncertain.
            %s
            """;

    private final LlmService llmService;
    private final int previewChars;

    /** Fallback extraction target. */
    record FallbackExtraction(
        @JsonPropertyDescription("Final markdown answer")
        String answer,
        @JsonPropertyDescription("References supporting the answer, each as 'path:start-end'")
        List<String> references
    ) {}

    public ChatReasoningModel(LlmService llmService, AsyncReviewProperties properties) {
        this.llmService = llmService;
        this.previewChars = properties.getLoop().getVariablePreviewChars();
    }

    @Override
    public ModelAction generate(PromptState state) {
        String system = ACTION_SYSTEM_PROMPT.formatted(submitSignature(state), referencesHint(state));
        var user = new StringBuilder();
        user.append("Task: ").append(state.task()).append("\n\n");
        appendVariables(user, state);
        appendHistory(user, state.history());
        user.append("Iteration: ").append(state.iteration()).append('/').append(state.maxIterations());
        return llmService.structuredCall(system, user.toString(), ModelAction.class);
    }

    @Override
    public Map<String, Object> extractFallback(PromptState state) {
        String system = FALLBACK_SYSTEM_PROMPT.formatted(referencesHint(state));
        var user = new StringBuilder();
        user.append("Task: ").append(state.task()).append("\n\n");
        appendVariables(user, state);
        appendHistory(user, state.history());

        FallbackExtraction extraction = llmService.structuredCall(system, user.toString(), FallbackExtraction.class);
        var outputs = new LinkedHashMap<String, Object>();
        outputs.put("answer", extraction.answer() == null ? "" : extraction.answer());
        outputs.put(state.referencesField(), extraction.references() == null ? List.of() : extraction.references());
        return outputs;
    }

    private static String submitSignature(PromptState state) {
        return String.join(", ", state.outputFields().stream().map(f -> f + "=...").toList());
    }

    private static String referencesHint(PromptState state) {
        return "The `" + state.referencesField() + "` output is a list of strings like 'path:12-30' "
                + "pointing at the lines that support the answer.";
    }

    private void appendVariables(StringBuilder sb, PromptState state) {
        sb.append("## Variables\n");
        for (Map.Entry<String, String> input : state.inputs().entrySet()) {
            String value = input.getValue() == null ? "" : input.getValue();
            if (state.sideChannels().contains(input.getKey())) {
                sb.append("### ").append(input.getKey()).append(" (dict, overview shown)\n");
            } else {
                sb.append("### ").append(input.getKey())
                  .append(" (str, ").append(value.length()).append(" chars)\n");
            }
            if (value.length() > previewChars) {
                sb.append(value, 0, previewChars).append("\n... (truncated, read the variable for the rest)\n");
            } else {
                sb.append(value).append('\n');
            }
            sb.append('\n');
        }
        for (String name : state.sideChannels()) {
            if (state.inputs().containsKey(name)) {
                continue;
            }
            sb.append("### ").append(name).append(" (dict, not shown)\n\n");
        }
    }

    private static void appendHistory(StringBuilder sb, List<IterationRecord> history) {
        if (history.isEmpty()) {
            sb.append("## History\nNo steps taken yet.\n\n");
            return;
        }
        sb.append("## History\n");
        for (IterationRecord step : history) {
            sb.append("=== Step ").append(step.index()).append(" ===\n")
              .append("Reasoning: ").append(step.reasoning()).append('\n')
              .append("Code:\n```python\n").append(step.code()).append("\n```\n")
              .append("Output:\n").append(step.output().isEmpty() ? "(no output)" : step.output())
              .append("\n\n");
        }
    }
}
