package com.asyncreview.core.llm;

import com.asyncreview.core.AsyncReviewException;

/**
 * Thrown when a language-model call fails, times out or returns unusable output.
 * Fatal for the run that made the call.
 */
public class ModelInvocationException extends AsyncReviewException {

    public ModelInvocationException(String message) {
        super(message);
    }

    public ModelInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
