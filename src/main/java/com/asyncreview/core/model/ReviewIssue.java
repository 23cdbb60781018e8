package com.asyncreview.core.model;

import java.util.List;

/**
 * A finding from the single-pass review.
 *
 * @param severity "low", "medium", "high" or "critical"
 * @param category "bug", "investigation" or "informational"
 */
public record ReviewIssue(
    String title,
    String severity,
    String category,
    String explanation,
    List<Citation> citations,
    List<String> fixSuggestions,
    List<String> testsToAdd
) {
    public ReviewIssue {
        citations = citations == null ? List.of() : List.copyOf(citations);
        fixSuggestions = fixSuggestions == null ? List.of() : List.copyOf(fixSuggestions);
        testsToAdd = testsToAdd == null ? List.of() : List.copyOf(testsToAdd);
    }
}
