package org.neuralchilli.decision.target;

import org.neuralchilli.decision.domain.TaskGraph;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Everything.
 */
public class ReleaseTargetTasks implements TargetTaskMethod {

    public static final String NAME = "release";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<String> select(TaskGraph graph, TargetTaskContext context) {
        return new LinkedHashSet<>(graph.labels());
    }
}
