package org.neuralchilli.decision.service;

/**
 * A transform failed. Carries the offending task's label and the transform's name;
 * the decision run is aborted so no partially specified task is scheduled.
 */
public class TransformException extends RuntimeException {

    public static final String UNKNOWN_LABEL = "<unknown>";

    private final String label;
    private final String transform;

    public TransformException(String label, String transform, Throwable cause) {
        super("Transform '" + transform + "' failed for task '" + label + "': " + cause.getMessage(), cause);
        this.label = label;
        this.transform = transform;
    }

    public TransformException(String label, String transform, String message) {
        super("Transform '" + transform + "' failed for task '" + label + "': " + message);
        this.label = label;
        this.transform = transform;
    }

    public String label() {
        return label;
    }

    public String transform() {
        return transform;
    }
}
