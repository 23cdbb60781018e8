package com.asyncreview.core.diff;

import com.asyncreview.core.model.DiffSide;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads unified-diff hunks and records which old/new line numbers they show.
 */
final class PatchHunks {

    private static final Pattern HUNK_HEADER =
            Pattern.compile("^@@ -(\\d+)(?:,\\d+)? \\+(\\d+)(?:,\\d+)? @@.*");

    private PatchHunks() {}

    static void index(String path, String patch, VisibleLines visible) {
        if (patch == null || patch.isEmpty()) {
            return;
        }
        boolean inHunk = false;
        int oldLine = 0;
        int newLine = 0;
        for (String line : patch.split("\n", -1)) {
            Matcher header = HUNK_HEADER.matcher(line);
            if (header.matches()) {
                oldLine = Integer.parseInt(header.group(1));
                newLine = Integer.parseInt(header.group(2));
                inHunk = true;
                continue;
            }
            if (!inHunk || line.startsWith("\\")) {
                continue;
            }
            if (line.startsWith("+")) {
                visible.add(path, DiffSide.ADDITIONS, newLine++);
            } else if (line.startsWith("-")) {
                visible.add(path, DiffSide.DELETIONS, oldLine++);
            } else if (line.startsWith(" ")) {
                visible.add(path, DiffSide.ADDITIONS, newLine++);
                visible.add(path, DiffSide.DELETIONS, oldLine++);
            }
        }
    }
}
