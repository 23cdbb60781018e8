package com.asyncreview.core.model;

/**
 * A user's selection in the diff viewer, supplied with a question.
 */
public record DiffSelection(
    String path,
    DiffSide side,
    int startLine,
    int endLine,
    SelectionMode mode
) {
    public DiffSelection {
        if (side == null) {
            side = DiffSide.UNIFIED;
        }
        if (mode == null) {
            mode = SelectionMode.CHANGESET;
        }
    }

    /** Prompt text describing the selection. */
    public String describe() {
        return String.format("Selected: %s (%s) lines %d-%d (%s)",
                path, side.wireName(), startLine, endLine, mode.wireName());
    }
}
