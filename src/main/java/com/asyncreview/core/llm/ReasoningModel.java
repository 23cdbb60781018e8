package com.asyncreview.core.llm;

import java.util.Map;

/**
 * The model collaborator of the reasoning loop.
 */
public interface ReasoningModel {

    /**
     * Proposes the next step given the inputs and the rounds so far.
     *
     * @throws ModelInvocationException when the model fails
     */
    ModelAction generate(PromptState state);

    /**
     * Extracts final output fields directly from the history once the loop is out of
     * budget. Runs no code.
     *
     * @return output field name to value; {@code answer} is always present
     * @throws ModelInvocationException when the model fails
     */
    Map<String, Object> extractFallback(PromptState state);
}
