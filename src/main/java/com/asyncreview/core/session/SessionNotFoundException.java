package com.asyncreview.core.session;

import com.asyncreview.core.InvalidInputException;

/**
 * Thrown when a review session id is unknown or has been evicted.
 */
public class SessionNotFoundException extends InvalidInputException {

    public SessionNotFoundException(String sessionId) {
        super("Review " + sessionId + " not found");
    }
}
