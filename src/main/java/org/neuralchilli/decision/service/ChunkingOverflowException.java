package org.neuralchilli.decision.service;

/**
 * A dependency chunk still exceeds the limit after slicing.
 * Indicates a bug in the chunker, never bad input.
 */
public class ChunkingOverflowException extends IllegalStateException {

    public ChunkingOverflowException(String message) {
        super(message);
    }
}
