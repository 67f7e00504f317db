package org.neuralchilli.decision.service;

/**
 * A task record failed schema validation before submission.
 */
public class SchemaViolationException extends ValidationException {

    private final String label;
    private final String field;

    public SchemaViolationException(String label, String field, String message) {
        super("Task '" + label + "' violates schema at " + field + ": " + message);
        this.label = label;
        this.field = field;
    }

    public String label() {
        return label;
    }

    public String field() {
        return field;
    }
}
