package com.asyncreview.core.answer;

import com.asyncreview.core.model.AnswerBlock;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits answer text into markdown and fenced code blocks, and renders blocks back to text.
 * <p>
 * A line starting with three backticks opens a code block (the rest of the line is its
 * language) or closes the open one. A fence left open at the end of the text closes there.
 * Blocks that collected no lines are dropped, as are markdown blocks holding only
 * whitespace, such as the newline after a closing fence.
 */
public final class AnswerParser {

    private static final String FENCE = "```";

    private AnswerParser() {}

    public static List<AnswerBlock> parse(String answer) {
        var blocks = new ArrayList<AnswerBlock>();
        if (answer == null || answer.isEmpty()) {
            return blocks;
        }

        var current = new ArrayList<String>();
        boolean inCode = false;
        String language = null;

        for (String line : answer.split("\n", -1)) {
            if (line.startsWith(FENCE) && !inCode) {
                addMarkdown(blocks, current);
                current.clear();
                inCode = true;
                String tag = line.substring(FENCE.length()).strip();
                language = tag.isEmpty() ? null : tag;
            } else if (line.startsWith(FENCE)) {
                if (!current.isEmpty()) {
                    blocks.add(AnswerBlock.code(String.join("\n", current), language));
                    current.clear();
                }
                inCode = false;
                language = null;
            } else {
                current.add(line);
            }
        }

        if (inCode && !current.isEmpty()) {
            blocks.add(AnswerBlock.code(String.join("\n", current), language));
        } else if (!inCode) {
            addMarkdown(blocks, current);
        }
        return blocks;
    }

    private static void addMarkdown(List<AnswerBlock> blocks, List<String> lines) {
        String text = String.join("\n", lines);
        if (!text.isBlank()) {
            blocks.add(AnswerBlock.markdown(text));
        }
    }

    /**
     * Inverse of {@link #parse(String)} for text whose fences are balanced and which has
     * no whitespace-only text between or after blocks.
     */
    public static String render(List<AnswerBlock> blocks) {
        var parts = new ArrayList<String>();
        for (AnswerBlock block : blocks) {
            if (block.isCode()) {
                parts.add(FENCE + (block.language() == null ? "" : block.language()));
                parts.add(block.content());
                parts.add(FENCE);
            } else {
                parts.add(block.content());
            }
        }
        return String.join("\n", parts);
    }
}
