package org.neuralchilli.decision.service;

/**
 * The index service failed for a reason other than the path being absent.
 * Never treated as a cache miss: rebuilding on an outage would duplicate expensive
 * work and hide the failure.
 */
public class IndexLookupException extends RuntimeException {

    private final String indexPath;

    public IndexLookupException(String indexPath, String message) {
        super("Index lookup failed for '" + indexPath + "': " + message);
        this.indexPath = indexPath;
    }

    public IndexLookupException(String indexPath, String message, Throwable cause) {
        super("Index lookup failed for '" + indexPath + "': " + message, cause);
        this.indexPath = indexPath;
    }

    public String indexPath() {
        return indexPath;
    }
}
