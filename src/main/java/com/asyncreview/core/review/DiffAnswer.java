package com.asyncreview.core.review;

import com.asyncreview.core.model.AnswerBlock;
import com.asyncreview.core.model.Citation;

import java.util.List;

/**
 * Answer to a question about a loaded change set. Citations are already grounded
 * against the context the model saw.
 */
public record DiffAnswer(
    List<AnswerBlock> blocks,
    List<Citation> citations,
    boolean exhausted,
    boolean cancelled,
    String traceId
) {
    public static DiffAnswer cancelled(String traceId) {
        return new DiffAnswer(List.of(), List.of(), false, true, traceId);
    }
}
