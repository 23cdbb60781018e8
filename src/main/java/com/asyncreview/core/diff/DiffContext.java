package com.asyncreview.core.diff;

/**
 * Rendered diff context plus the index of lines it shows.
 *
 * @param text         the prompt text
 * @param visibleLines lines a citation may legitimately point at
 */
public record DiffContext(
    String text,
    VisibleLines visibleLines
) {}
