package org.neuralchilli.decision.service;

/**
 * A {@code ${...}} template in a task field could not be interpolated.
 */
public class ExpressionException extends RuntimeException {

    private final String template;

    public ExpressionException(String template, String message) {
        super(message + ": " + template);
        this.template = template;
    }

    public ExpressionException(String template, String message, Throwable cause) {
        super(message + ": " + template + " - " + cause.getMessage(), cause);
        this.template = template;
    }

    public String template() {
        return template;
    }
}
