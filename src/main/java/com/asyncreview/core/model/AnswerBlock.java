package com.asyncreview.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A markdown or code segment of a final answer.
 *
 * @param type     "markdown" or "code"
 * @param content  block text without fence lines
 * @param language fence language tag for code blocks, otherwise {@code null}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnswerBlock(
    String type,
    String content,
    String language
) {
    public static final String MARKDOWN = "markdown";
    public static final String CODE = "code";

    public static AnswerBlock markdown(String content) {
        return new AnswerBlock(MARKDOWN, content, null);
    }

    public static AnswerBlock code(String content, String language) {
        return new AnswerBlock(CODE, content, language);
    }

    public boolean isCode() {
        return CODE.equals(type);
    }
}
