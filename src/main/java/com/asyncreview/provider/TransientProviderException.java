package com.asyncreview.provider;

import com.asyncreview.core.AsyncReviewException;

/**
 * Thrown when a hosting provider call fails (network error, timeout, non-success status).
 */
public class TransientProviderException extends AsyncReviewException {

    private final int statusCode;

    public TransientProviderException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public TransientProviderException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status of the failed call, or -1 when no response was received. */
    public int getStatusCode() {
        return statusCode;
    }
}
