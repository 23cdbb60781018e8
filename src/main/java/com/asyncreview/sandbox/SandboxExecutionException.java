package com.asyncreview.sandbox;

import com.asyncreview.core.AsyncReviewException;

/**
 * Thrown when a code cell fails to run or raises. The reasoning loop turns it into
 * an observation for the model and carries on.
 */
public class SandboxExecutionException extends AsyncReviewException {

    public SandboxExecutionException(String message) {
        super(message);
    }

    public SandboxExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
