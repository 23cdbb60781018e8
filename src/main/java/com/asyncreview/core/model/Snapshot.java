package com.asyncreview.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded, prioritized textual representation of a repository.
 * <p>
 * {@code files} preserves inclusion order, which is always a prefix of the
 * priority-then-alphabetical order of {@code fileTree}.
 *
 * @param root       absolute repository root
 * @param fileTree   every discovered path in priority order, including files that were not included
 * @param files      included files keyed by relative path, in inclusion order
 * @param languages  number of included files per language
 * @param totalBytes sum of the sizes of included files
 */
public record Snapshot(
    String root,
    List<String> fileTree,
    Map<String, FileEntry> files,
    Map<String, Integer> languages,
    long totalBytes
) {
    public Snapshot {
        fileTree = List.copyOf(fileTree);
        files = Collections.unmodifiableMap(new LinkedHashMap<>(files));
        languages = Collections.unmodifiableMap(new LinkedHashMap<>(languages));
    }

    public int totalFiles() {
        return files.size();
    }

    /** Path to full text, the form handed to the sandbox. */
    public Map<String, String> contents() {
        var result = new LinkedHashMap<String, String>();
        files.forEach((path, entry) -> result.put(path, entry.text()));
        return result;
    }
}
