package com.asyncreview.core.snapshot;

import com.asyncreview.core.InvalidInputException;

/**
 * Thrown when a snapshot root does not exist or is not a directory.
 */
public class InvalidRepositoryException extends InvalidInputException {

    public InvalidRepositoryException(String message) {
        super(message);
    }

    public InvalidRepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
