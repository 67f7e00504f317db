package org.neuralchilli.decision.core.transform;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.decision.core.SourceTree;
import org.neuralchilli.decision.domain.CachePolicy;
import org.neuralchilli.decision.domain.TaskRecord;

import java.util.List;
import java.util.Map;

/**
 * Indexes a task by the committed contents of a directory:
 * {@code index-by-source-tree: {prefix: <p>, directory: <dir>}} caches the task under
 * {@code <p>.<tree hash of dir>}, so it reruns only when that directory changes.
 */
@ApplicationScoped
public class IndexBySourceTreeTransform extends TaskTransform {

    public static final String NAME = "index-by-source-tree";
    public static final String ATTRIBUTE = "index-by-source-tree";

    @Inject
    SourceTree sourceTree;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected List<TaskRecord> applyTo(TransformContext context, TaskRecord task) {
        Object setting = task.attribute(ATTRIBUTE);
        if (setting == null) {
            return List.of(task);
        }
        if (!(setting instanceof Map<?, ?> map) || map.get("prefix") == null || map.get("directory") == null) {
            throw new IllegalArgumentException(ATTRIBUTE + " needs 'prefix' and 'directory', got: " + setting);
        }

        String directory = map.get("directory").toString();
        String hash = context.run().treeHash(directory, sourceTree::treeHash);
        return List.of(task.withCache(CachePolicy.indexPath(map.get("prefix") + "." + hash)));
    }
}
