package org.neuralchilli.decision.target;

import org.neuralchilli.decision.domain.TaskGraph;

import java.util.Set;

/**
 * Nothing; used when the trigger title asks to skip CI.
 */
public class SkipTargetTasks implements TargetTaskMethod {

    public static final String NAME = "skip";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<String> select(TaskGraph graph, TargetTaskContext context) {
        return Set.of();
    }
}
