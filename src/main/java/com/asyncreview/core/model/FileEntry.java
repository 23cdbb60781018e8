package com.asyncreview.core.model;

import java.util.List;

/**
 * One file included in a {@link Snapshot}.
 *
 * @param path      path relative to the snapshot root, always {@code /}-separated
 * @param language  detected language tag (e.g. "python", "text")
 * @param sizeBytes size on disk in bytes
 * @param sha1      hex SHA-1 of the raw bytes
 * @param lines     the decoded text split on {@code \n}
 * @param symbols   symbol tags sorted by (line, name)
 */
public record FileEntry(
    String path,
    String language,
    long sizeBytes,
    String sha1,
    List<String> lines,
    List<SymbolTag> symbols
) {
    public FileEntry {
        lines = List.copyOf(lines);
        symbols = List.copyOf(symbols);
    }

    public String text() {
        return String.join("\n", lines);
    }
}
