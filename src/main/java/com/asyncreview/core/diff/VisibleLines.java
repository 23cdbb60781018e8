package com.asyncreview.core.diff;

import com.asyncreview.core.model.DiffSide;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Index of the (path, side, line) triples an assembler actually rendered into the prompt.
 * {@link DiffSide#ADDITIONS} holds new-side line numbers, {@link DiffSide#DELETIONS} old-side ones.
 */
public class VisibleLines {

    private final Map<String, Set<Integer>> newSide = new HashMap<>();
    private final Map<String, Set<Integer>> oldSide = new HashMap<>();

    public void add(String path, DiffSide side, int line) {
        switch (side) {
            case ADDITIONS -> newSide.computeIfAbsent(path, k -> new HashSet<>()).add(line);
            case DELETIONS -> oldSide.computeIfAbsent(path, k -> new HashSet<>()).add(line);
            case UNIFIED -> {
                add(path, DiffSide.ADDITIONS, line);
                add(path, DiffSide.DELETIONS, line);
            }
        }
    }

    public void addRange(String path, DiffSide side, int firstLine, int lastLine) {
        for (int line = firstLine; line <= lastLine; line++) {
            add(path, side, line);
        }
    }

    public boolean isVisible(String path, DiffSide side, int line) {
        return switch (side) {
            case ADDITIONS -> contains(newSide, path, line);
            case DELETIONS -> contains(oldSide, path, line);
            case UNIFIED -> contains(newSide, path, line) || contains(oldSide, path, line);
        };
    }

    /** Returns {@code true} when every line of {@code startLine..endLine} is visible on {@code side}. */
    public boolean covers(String path, DiffSide side, int startLine, int endLine) {
        for (int line = startLine; line <= endLine; line++) {
            if (!isVisible(path, side, line)) {
                return false;
            }
        }
        return true;
    }

    public boolean hasFile(String path) {
        return newSide.containsKey(path) || oldSide.containsKey(path);
    }

    private static boolean contains(Map<String, Set<Integer>> index, String path, int line) {
        Set<Integer> lines = index.get(path);
        return lines != null && lines.contains(line);
    }
}
