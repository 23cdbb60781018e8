package com.asyncreview.core.answer;

import com.asyncreview.core.diff.VisibleLines;
import com.asyncreview.core.model.Citation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps only citations whose every line was rendered in the context the model saw.
 * Citations on the {@code unified} side may match either side line by line.
 */
public final class DiffGrounding {

    private static final Logger log = LoggerFactory.getLogger(DiffGrounding.class);

    private DiffGrounding() {}

    public static List<Citation> filter(List<Citation> citations, VisibleLines visible) {
        var grounded = new ArrayList<Citation>();
        for (Citation c : citations) {
            if (visible.covers(c.path(), c.side(), c.startLine(), c.endLine())) {
                grounded.add(c);
            } else {
                log.info("Dropping ungrounded citation {} ({})", c, c.side().wireName());
            }
        }
        return grounded;
    }
}
