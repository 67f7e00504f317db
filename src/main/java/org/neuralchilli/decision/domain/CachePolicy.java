package org.neuralchilli.decision.domain;

/**
 * How a task is scheduled: always created, or looked up in the index first and only
 * created when no equivalent task exists.
 */
public record CachePolicy(Mode mode, String indexPath) {

    public enum Mode {
        /** Always create a new task. */
        NONE,
        /** Find-or-create under a path derived from worker type and payload. */
        CONTENT_HASH,
        /** Find-or-create under an explicit index path. */
        INDEX_PATH
    }

    private static final CachePolicy NONE = new CachePolicy(Mode.NONE, null);
    private static final CachePolicy CONTENT_HASH = new CachePolicy(Mode.CONTENT_HASH, null);

    public CachePolicy {
        if (mode == null) {
            mode = Mode.NONE;
        }
        if (mode == Mode.INDEX_PATH && (indexPath == null || indexPath.isBlank())) {
            throw new IllegalArgumentException("Index path cannot be null or empty for INDEX_PATH caching");
        }
        if (mode != Mode.INDEX_PATH) {
            indexPath = null;
        }
    }

    public static CachePolicy none() {
        return NONE;
    }

    public static CachePolicy contentHash() {
        return CONTENT_HASH;
    }

    public static CachePolicy indexPath(String indexPath) {
        return new CachePolicy(Mode.INDEX_PATH, indexPath);
    }

    public boolean isCached() {
        return mode != Mode.NONE;
    }
}
