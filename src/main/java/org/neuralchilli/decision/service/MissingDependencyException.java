package org.neuralchilli.decision.service;

/**
 * A dependency label is neither in the graph nor resolved through the index cache.
 */
public class MissingDependencyException extends ValidationException {

    private final String label;
    private final String dependency;

    public MissingDependencyException(String label, String dependency) {
        super("Task '" + label + "' depends on '" + dependency + "' which does not exist in the graph");
        this.label = label;
        this.dependency = dependency;
    }

    public String label() {
        return label;
    }

    public String dependency() {
        return dependency;
    }
}
