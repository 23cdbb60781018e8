package com.asyncreview.core.review;

import com.asyncreview.core.model.AnswerBlock;
import com.asyncreview.core.model.IterationRecord;

import java.util.List;

/**
 * Answer to a question about a local repository.
 *
 * @param answer     the raw markdown answer
 * @param blocks     the answer split into markdown and code blocks
 * @param sources    the references the run returned, as given
 * @param iterations rounds that ran
 * @param exhausted  {@code true} when the budget ran out and the fallback produced the answer
 * @param traceId    id of the persisted trace
 */
public record CodebaseAnswer(
    String answer,
    List<AnswerBlock> blocks,
    List<String> sources,
    List<IterationRecord> iterations,
    boolean exhausted,
    String traceId
) {}
