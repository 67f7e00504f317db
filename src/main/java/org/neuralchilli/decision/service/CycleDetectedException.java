package org.neuralchilli.decision.service;

/**
 * Thrown when a cycle is detected in a task graph or between kinds.
 * Extends RuntimeException as this is a construction error that aborts the
 * decision run, not something callers recover from.
 */
public class CycleDetectedException extends RuntimeException {

    public CycleDetectedException(String message) {
        super(message);
    }

    public CycleDetectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
