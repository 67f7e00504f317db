package org.neuralchilli.decision.domain.payload;

/**
 * Services a payload needs when it is rendered into the worker's wire format.
 */
public interface RenderContext {

    /**
     * Task id already assigned to a label of this run.
     */
    String taskIdFor(String label);

    /**
     * Expiry timestamp for artifacts published by the task being rendered.
     */
    String artifactsExpireAt();

    /**
     * When true the payload is rendered for hashing: time-dependent fields are left out
     * so identical work hashes identically across runs.
     */
    boolean normalized();
}
