package com.asyncreview.core.llm;

import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * One step proposed by the reasoning model: its reasoning and the code to run next.
 */
public record ModelAction(
    @JsonPropertyDescription("Step-by-step reasoning about what to do next")
    String reasoning,
    @JsonPropertyDescription("Python code to execute in the REPL for this step")
    String code
) {
    /** The code with a surrounding markdown fence removed, if present. */
    public String executableCode() {
        if (code == null) {
            return "";
        }
        String trimmed = code.strip();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        int firstNewline = trimmed.indexOf('\n');
        if (firstNewline < 0) {
            return "";
        }
        String body = trimmed.substring(firstNewline + 1);
        if (body.endsWith("```")) {
            body = body.substring(0, body.length() - 3);
        }
        return body.strip();
    }
}
