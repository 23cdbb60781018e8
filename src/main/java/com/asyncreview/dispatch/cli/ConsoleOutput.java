package com.asyncreview.dispatch.cli;

import com.asyncreview.core.model.AnswerBlock;
import com.asyncreview.core.model.Citation;
import com.asyncreview.core.model.IterationRecord;
import com.asyncreview.core.model.ReviewIssue;
import picocli.CommandLine;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the AsyncReview CLI.
 */
public class ConsoleOutput {

    private static final int PREVIEW_LINES = 8;

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) ASYNCREVIEW v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [ASYNCREVIEW]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    /** One round of the loop: first line of reasoning, then code and output previews. */
    public static void iteration(IterationRecord record) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(blue) [STEP " + record.index() + "/" + record.maxIterations() + "]|@ "
                        + firstLine(record.reasoning())));
        for (String line : preview(record.code())) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|faint " + escape(line) + "|@"));
        }
        for (String line : preview(record.output())) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|fg(magenta) >|@ " + escape(line)));
        }
    }

    public static void answer(List<AnswerBlock> blocks) {
        System.out.println("──────────────────────────────────");
        for (AnswerBlock block : blocks) {
            if (block.isCode()) {
                String fence = "```" + (block.language() == null ? "" : block.language());
                System.out.println(CommandLine.Help.Ansi.AUTO.string("@|faint " + escape(fence) + "|@"));
                for (String line : block.content().split("\n", -1)) {
                    System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(green) " + escape(line) + "|@"));
                }
                System.out.println(CommandLine.Help.Ansi.AUTO.string("@|faint ```|@"));
            } else {
                System.out.println(block.content());
            }
        }
    }

    public static void sources(List<String> sources) {
        if (sources.isEmpty()) {
            return;
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Sources|@"));
        for (String source : sources) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|fg(cyan) -|@ " + escape(source)));
        }
    }

    public static void citations(List<Citation> citations) {
        sources(citations.stream().map(Citation::toString).toList());
    }

    public static void issue(ReviewIssue issue) {
        String color = switch (issue.severity()) {
            case "critical", "high" -> "fg(red)";
            case "medium" -> "fg(yellow)";
            default -> "fg(white)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold," + color + " [" + issue.severity().toUpperCase(Locale.ROOT) + "]|@ "
                        + escape(issue.title()) + " @|faint (" + issue.category() + ")|@"));
        for (String line : issue.explanation().split("\n")) {
            System.out.println("    " + line);
        }
        for (Citation citation : issue.citations()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("    @|fg(cyan) @|@ " + escape(citation.toString())));
        }
        for (String fix : issue.fixSuggestions()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("    @|fg(green) fix:|@ " + escape(fix)));
        }
    }

    public static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }

    static List<String> preview(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> lines = List.of(text.strip().split("\n"));
        if (lines.size() <= PREVIEW_LINES) {
            return lines;
        }
        var head = new ArrayList<>(lines.subList(0, PREVIEW_LINES));
        head.add("... (" + (lines.size() - PREVIEW_LINES) + " more lines)");
        return head;
    }

    static String firstLine(String text) {
        if (text == null) {
            return "";
        }
        int nl = text.indexOf('\n');
        return nl < 0 ? text : text.substring(0, nl);
    }

    /** Keeps picocli markup characters in user text from being interpreted. */
    private static String escape(String text) {
        return text.replace("@|", "@ |");
    }
}
