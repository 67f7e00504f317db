package org.neuralchilli.decision.service;

/**
 * Thrown when a task graph fails validation. The message lists every problem found.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
