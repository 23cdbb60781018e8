package com.asyncreview.core.answer;

import com.asyncreview.core.model.Citation;
import com.asyncreview.core.model.DiffSide;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Turns the loosely-typed citation output of a model into {@link Citation}s.
 * <p>
 * Accepts a list of maps ({@code path, side, startLine, endLine, label, reason}, camel or
 * snake case), a list of strings, or a comma-separated string of {@code path:line} and
 * {@code path:start-end} tokens. Malformed entries are dropped one by one.
 */
public final class CitationParser {

    private static final Logger log = LoggerFactory.getLogger(CitationParser.class);

    private CitationParser() {}

    public static List<Citation> parse(Object raw) {
        var citations = new ArrayList<Citation>();
        if (raw == null) {
            return citations;
        }

        List<?> items;
        if (raw instanceof List<?> list) {
            items = list;
        } else {
            items = Arrays.stream(raw.toString().split(","))
                    .map(String::strip)
                    .filter(s -> !s.isEmpty())
                    .toList();
        }

        for (Object item : items) {
            try {
                Citation citation = item instanceof Map<?, ?> map ? fromMap(map) : fromToken(String.valueOf(item).strip());
                if (citation != null) {
                    citations.add(citation);
                }
            } catch (IllegalArgumentException e) {
                log.debug("Dropping malformed citation {}: {}", item, e.getMessage());
            }
        }
        return citations;
    }

    private static Citation fromMap(Map<?, ?> map) {
        String path = string(map, "path");
        Integer start = integer(map, "startLine", "start_line");
        Integer end = integer(map, "endLine", "end_line");
        int startLine = start != null ? start : 1;
        int endLine = end != null ? end : startLine;
        return new Citation(
                path,
                DiffSide.fromWire(string(map, "side")),
                startLine,
                endLine,
                string(map, "label"),
                string(map, "reason"));
    }

    private static Citation fromToken(String token) {
        int colon = token.lastIndexOf(':');
        if (colon <= 0) {
            log.debug("Dropping citation token without line part: {}", token);
            return null;
        }
        String path = token.substring(0, colon).strip();
        String linePart = token.substring(colon + 1).strip();
        int startLine;
        int endLine;
        int dash = linePart.indexOf('-');
        if (dash >= 0) {
            startLine = Integer.parseInt(linePart.substring(0, dash).strip());
            endLine = Integer.parseInt(linePart.substring(dash + 1).strip());
        } else {
            startLine = Integer.parseInt(linePart);
            endLine = startLine;
        }
        return new Citation(path, DiffSide.UNIFIED, startLine, endLine, null, "");
    }

    private static String string(Map<?, ?> map, String key) {
        Object value = map.get(key);
        return value == null ? null : value.toString();
    }

    private static Integer integer(Map<?, ?> map, String... keys) {
        for (String key : keys) {
            Object value = map.get(key);
            if (value instanceof Number n) {
                long line = n.longValue();
                if (line < Integer.MIN_VALUE || line > Integer.MAX_VALUE) {
                    throw new IllegalArgumentException(key + " out of range: " + value);
                }
                return (int) line;
            }
            if (value != null) {
                return Integer.parseInt(value.toString().strip());
            }
        }
        return null;
    }
}
