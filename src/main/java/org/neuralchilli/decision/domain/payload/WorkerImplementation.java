package org.neuralchilli.decision.domain.payload;

/**
 * Worker implementations a task payload can target.
 * Each one owns a payload schema; see {@link WorkerPayload}.
 */
public enum WorkerImplementation {
    DOCKER_WORKER("docker-worker"),
    SIGNING("signing"),
    BEETMOVER("beetmover"),
    SUCCEED("succeed");

    private final String value;

    WorkerImplementation(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Parse implementation from its YAML name (case-insensitive)
     */
    public static WorkerImplementation fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Worker implementation cannot be null");
        }
        for (WorkerImplementation implementation : values()) {
            if (implementation.value.equalsIgnoreCase(value)) {
                return implementation;
            }
        }
        throw new IllegalArgumentException(
                "Invalid worker implementation: " + value +
                        ". Valid implementations: docker-worker, signing, beetmover, succeed"
        );
    }
}
