package com.asyncreview.core.snapshot;

import com.asyncreview.core.model.FileEntry;
import com.asyncreview.core.model.Snapshot;
import com.asyncreview.core.model.SymbolTag;

import java.util.Map;

/**
 * Renders the bounded textual overview of a snapshot handed to the model as the
 * {@code codebase} input. Full file contents travel separately in the side channel.
 */
public final class SnapshotOverview {

    private SnapshotOverview() {}

    public static String render(Snapshot snapshot, int maxChars) {
        var sb = new StringBuilder();
        sb.append("## Repository: ").append(snapshot.root()).append('\n');
        sb.append("Files included: ").append(snapshot.totalFiles())
          .append(" of ").append(snapshot.fileTree().size())
          .append(" (").append(snapshot.totalBytes()).append(" bytes)\n");
        sb.append("Languages: ");
        boolean first = true;
        for (Map.Entry<String, Integer> e : snapshot.languages().entrySet()) {
            if (!first) sb.append(", ");
            sb.append(e.getKey()).append(" (").append(e.getValue()).append(')');
            first = false;
        }
        sb.append("\n\n## File tree\n");
        for (String path : snapshot.fileTree()) {
            sb.append(snapshot.files().containsKey(path) ? "- " : "- (not loaded) ").append(path).append('\n');
        }
        sb.append("\n## Symbols\n");
        for (FileEntry entry : snapshot.files().values()) {
            if (entry.symbols().isEmpty()) continue;
            sb.append(entry.path()).append(":\n");
            for (SymbolTag tag : entry.symbols()) {
                sb.append("  ").append(tag.line()).append(' ')
                  .append(tag.kind()).append(' ').append(tag.name()).append('\n');
            }
        }
        sb.append("\nFull file contents are available in the `codebase` variable (path -> content).\n");

        if (sb.length() <= maxChars) {
            return sb.toString();
        }
        String marker = "\n... (overview truncated)\n";
        return sb.substring(0, Math.max(0, maxChars - marker.length())) + marker;
    }
}
