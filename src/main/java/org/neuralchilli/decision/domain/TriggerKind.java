package org.neuralchilli.decision.domain;

/**
 * What started a decision run.
 */
public enum TriggerKind {
    PULL_REQUEST("github-pull-request"),
    PUSH("github-push"),
    RELEASE("github-release"),
    CRON("cron"),
    ACTION("action");

    private final String value;

    TriggerKind(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Parse a trigger from its {@code TASK_FOR} value or enum name (case-insensitive)
     */
    public static TriggerKind fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Trigger kind cannot be null or empty");
        }
        for (TriggerKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException(
                "Unrecognized trigger kind: " + value +
                        ". Valid kinds: github-pull-request, github-push, github-release, cron, action"
        );
    }
}
