package org.neuralchilli.decision.service;

/**
 * One or more kinds could not be loaded.
 */
public class KindLoadException extends RuntimeException {

    public KindLoadException(String message) {
        super(message);
    }

    public KindLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
