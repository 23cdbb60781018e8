package com.asyncreview.core.diff;

import com.asyncreview.core.config.AsyncReviewProperties;
import com.asyncreview.core.model.DiffFileContext;
import com.asyncreview.core.model.DiffSide;
import com.asyncreview.core.model.FileContents;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders old/new file contents (bounded per file) for the first files of a change set.
 * Files past the visible limit get a header only; their full text stays reachable through
 * the {@code file_data} map built by {@link #sideChannel(List)}.
 */
@Component
public class ContentContextAssembler implements DiffContextAssembler {

    public static final String SIDE_CHANNEL_NAME = "file_data";

    private final AsyncReviewProperties.Diff config;

    public ContentContextAssembler(AsyncReviewProperties properties) {
        this.config = properties.getDiff();
    }

    @Override
    public DiffContext assemble(List<DiffFileContext> files) {
        var parts = new ArrayList<String>();
        var visible = new VisibleLines();

        parts.add("## Metadata: Found " + files.size() + " files in this PR (listing all):");
        for (DiffFileContext f : files) {
            parts.add(PatchContextAssembler.summaryLine(f));
        }
        parts.add("\nNOTE: Full content for ALL files is available in the python global variable `"
                + SIDE_CHANNEL_NAME + "`.\n");
        parts.add("---\n");

        for (int i = 0; i < files.size(); i++) {
            DiffFileContext f = files.get(i);
            parts.add("## File: " + f.path() + " (" + f.status().wireName() + ")");

            if (i >= config.getMaxVisibleFiles()) {
                parts.add("(Content truncated in prompt. Use `print(" + SIDE_CHANNEL_NAME
                        + "['" + f.path() + "']['new'])` to read)");
                parts.add("\n---\n");
                continue;
            }

            parts.add("Changes: +" + f.additions() + " -" + f.deletions());
            if (f.oldFile() != null && f.newFile() != null) {
                parts.add("\n### Old Version:");
                parts.add(renderContent(f.path(), f.oldFile(), DiffSide.DELETIONS, visible));
                parts.add("\n### New Version:");
                parts.add(renderContent(f.path(), f.newFile(), DiffSide.ADDITIONS, visible));
            } else if (f.newFile() != null) {
                parts.add("\n### Added File:");
                parts.add(renderContent(f.path(), f.newFile(), DiffSide.ADDITIONS, visible));
            } else if (f.oldFile() != null) {
                parts.add("\n### Deleted File:");
                parts.add(renderContent(f.path(), f.oldFile(), DiffSide.DELETIONS, visible));
            } else if (f.patch() != null && !f.patch().isEmpty()) {
                String patch = truncate(f.patch(), config.getPatchCharCap());
                parts.add("\n### Patch:");
                parts.add(patch);
                PatchHunks.index(f.path(), patch, visible);
            }
            parts.add("\n---\n");
        }
        return new DiffContext(String.join("\n", parts), visible);
    }

    /**
     * Builds the {@code file_data} map: path to {@code {old, new, status}}, with empty
     * strings for absent sides so the sandbox always sees string values.
     */
    public static Map<String, Object> sideChannel(List<DiffFileContext> files) {
        var data = new LinkedHashMap<String, Object>();
        for (DiffFileContext f : files) {
            var entry = new LinkedHashMap<String, String>();
            entry.put("old", f.oldFile() != null ? f.oldFile().text() : "");
            entry.put("new", f.newFile() != null ? f.newFile().text() : "");
            entry.put("status", f.status().wireName());
            data.put(f.path(), entry);
        }
        return data;
    }

    private String renderContent(String path, FileContents contents, DiffSide side, VisibleLines visible) {
        String text = truncate(contents.text() == null ? "" : contents.text(), config.getContentCharCap());
        if (!text.isEmpty()) {
            visible.addRange(path, side, 1, text.split("\n", -1).length);
        }
        return text;
    }

    private static String truncate(String text, int cap) {
        return text.length() <= cap ? text : text.substring(0, cap);
    }
}
