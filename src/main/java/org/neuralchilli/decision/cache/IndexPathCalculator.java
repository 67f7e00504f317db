package org.neuralchilli.decision.cache;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.decision.domain.CachePolicy;
import org.neuralchilli.decision.domain.TaskRecord;
import org.neuralchilli.decision.domain.payload.RenderContext;
import org.neuralchilli.decision.util.Hashes;
import org.neuralchilli.decision.util.Jsons;

import java.util.List;

/**
 * Index paths of cached tasks.
 * <p>
 * The default path is {@code by-task-definition.<sha256>} over the canonical JSON of
 * {@code [workerType, payload]}, with the payload rendered without time-dependent
 * fields. Identical work therefore maps to the same path on every run.
 */
@ApplicationScoped
public class IndexPathCalculator {

    public static final String BY_TASK_DEFINITION = "by-task-definition.";

    /**
     * Path of a cached task, without the project prefix
     */
    public String indexPath(TaskRecord task, RenderContext normalized) {
        if (task.cache().mode() == CachePolicy.Mode.INDEX_PATH) {
            return task.cache().indexPath();
        }
        return BY_TASK_DEFINITION + contentHash(task, normalized);
    }

    public String contentHash(TaskRecord task, RenderContext normalized) {
        if (!normalized.normalized()) {
            throw new IllegalArgumentException("Content hashes must be computed from a normalized rendering");
        }
        String canonical = Jsons.toCanonicalJson(List.of(task.workerType(), task.payload().render(normalized)));
        return Hashes.sha256Hex(canonical);
    }

    public String fullPath(String prefix, String indexPath) {
        if (prefix == null || prefix.isBlank()) {
            return indexPath;
        }
        return prefix + "." + indexPath;
    }
}
