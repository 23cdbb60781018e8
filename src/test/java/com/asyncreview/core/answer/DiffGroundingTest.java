package com.asyncreview.core.answer;

import com.asyncreview.core.diff.DiffContext;
import com.asyncreview.core.diff.PatchContextAssembler;
import com.asyncreview.core.diff.VisibleLines;
import com.asyncreview.core.model.Citation;
import com.asyncreview.core.model.DiffFileContext;
import com.asyncreview.core.model.DiffSide;
import com.asyncreview.core.model.FileStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link DiffGrounding}.
 */
class DiffGroundingTest {

    private static VisibleLines visibleFor(String path, String patch) {
        var file = DiffFileContext.ofPatch(path, FileStatus.MODIFIED, 1, 1, patch);
        DiffContext context = new PatchContextAssembler().assemble(List.of(file));
        return context.visibleLines();
    }

    @Test
    @DisplayName("keeps citations inside rendered hunks and drops the rest")
    void filtersByHunk() {
        VisibleLines visible = visibleFor("svc.py", "@@ -40,2 +40,2 @@\n def handle():\n-    return None\n+    return result");

        var inside = new Citation("svc.py", DiffSide.ADDITIONS, 40, 41, null, "");
        var outside = new Citation("svc.py", DiffSide.ADDITIONS, 41, 60, null, "");
        var otherFile = Citation.of("other.py", 40, 40);

        List<Citation> grounded = DiffGrounding.filter(List.of(inside, outside, otherFile), visible);

        assertEquals(List.of(inside), grounded);
    }

    @Test
    @DisplayName("side matters for additions and deletions")
    void respectsSide() {
        VisibleLines visible = visibleFor("a.py", "@@ -5,1 +5,2 @@\n-x\n+y\n+z");

        var deletedLine6 = new Citation("a.py", DiffSide.DELETIONS, 6, 6, null, "");
        var addedLine6 = new Citation("a.py", DiffSide.ADDITIONS, 6, 6, null, "");
        var unifiedLine5 = Citation.of("a.py", 5, 5);

        List<Citation> grounded = DiffGrounding.filter(List.of(deletedLine6, addedLine6, unifiedLine5), visible);

        assertEquals(List.of(addedLine6, unifiedLine5), grounded);
    }
}
