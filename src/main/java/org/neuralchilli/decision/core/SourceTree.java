package org.neuralchilli.decision.core;

/**
 * Content hashes of directories in the checked-out repository.
 */
public interface SourceTree {

    /**
     * Hash identifying the committed contents of {@code directory} at HEAD.
     */
    String treeHash(String directory);
}
