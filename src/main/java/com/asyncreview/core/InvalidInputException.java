package com.asyncreview.core;

/**
 * Thrown for bad caller input (URL, path, session id). Reported immediately, never retried.
 */
public class InvalidInputException extends AsyncReviewException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
