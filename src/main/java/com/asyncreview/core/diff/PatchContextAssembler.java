package com.asyncreview.core.diff;

import com.asyncreview.core.model.DiffFileContext;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders every file as its raw unified-diff patch. Used by the single-pass review,
 * where citations must stay inside the hunks shown.
 */
@Component
public class PatchContextAssembler implements DiffContextAssembler {

    @Override
    public DiffContext assemble(List<DiffFileContext> files) {
        var parts = new ArrayList<String>();
        var visible = new VisibleLines();

        parts.add("## Metadata: Analyzing " + files.size() + " files based on git patches:");
        for (DiffFileContext f : files) {
            parts.add(summaryLine(f));
        }
        parts.add("---\n");

        for (DiffFileContext f : files) {
            parts.add("## File: " + f.path() + " (" + f.status().wireName() + ")");
            parts.add("Stats: +" + f.additions() + " -" + f.deletions());
            if (f.patch() != null && !f.patch().isEmpty()) {
                parts.add("\n### Diff Patch:");
                parts.add(f.patch());
                PatchHunks.index(f.path(), f.patch(), visible);
            } else {
                parts.add("\n(No patch available - likely binary or too large)");
            }
            parts.add("\n---\n");
        }
        return new DiffContext(String.join("\n", parts), visible);
    }

    static String summaryLine(DiffFileContext f) {
        return "- " + f.path() + " (" + f.status().wireName() + ") +" + f.additions() + " -" + f.deletions();
    }
}
