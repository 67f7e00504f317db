package org.neuralchilli.decision.target;

import org.neuralchilli.decision.domain.TaskGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Everything, once per source revision: when a nightly decision task is already indexed
 * for the revision, nothing is selected.
 */
public class NightlyTargetTasks implements TargetTaskMethod {

    private static final Logger log = LoggerFactory.getLogger(NightlyTargetTasks.class);

    public static final String NAME = "nightly";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<String> select(TaskGraph graph, TargetTaskContext context) {
        String indexPath = indexPath(context.indexPrefix(), context.params().gitSha());
        Optional<String> previous = context.index().findTask(indexPath);
        if (previous.isPresent()) {
            log.info("Nightly already ran for {} (decision task {}), selecting nothing",
                    context.params().gitSha(), previous.get());
            return Set.of();
        }
        return new LinkedHashSet<>(graph.labels());
    }

    /**
     * Where the decision task of a nightly run is indexed
     */
    public static String indexPath(String prefix, String revision) {
        return prefix + ".nightly.revision." + revision;
    }
}
