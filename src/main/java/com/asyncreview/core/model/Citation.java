package com.asyncreview.core.model;

/**
 * A pointer from an answer into a file or diff.
 *
 * @param path      file path
 * @param side      diff side the line numbers refer to
 * @param startLine first cited line, 1-based
 * @param endLine   last cited line, never before {@code startLine}
 * @param label     optional short label
 * @param reason    optional explanation, empty when absent
 */
public record Citation(
    String path,
    DiffSide side,
    int startLine,
    int endLine,
    String label,
    String reason
) {
    public Citation {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Citation path is required");
        }
        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException(
                    "Invalid citation range " + startLine + "-" + endLine + " for " + path);
        }
        if (side == null) {
            side = DiffSide.UNIFIED;
        }
        if (reason == null) {
            reason = "";
        }
    }

    public static Citation of(String path, int startLine, int endLine) {
        return new Citation(path, DiffSide.UNIFIED, startLine, endLine, null, "");
    }

    @Override
    public String toString() {
        return path + ":" + startLine + "-" + endLine;
    }
}
