package com.asyncreview.core;

/**
 * Base type for failures surfaced to callers of AsyncReview operations.
 */
public class AsyncReviewException extends RuntimeException {

    public AsyncReviewException(String message) {
        super(message);
    }

    public AsyncReviewException(String message, Throwable cause) {
        super(message, cause);
    }
}
