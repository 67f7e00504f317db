package org.neuralchilli.decision.target;

import org.neuralchilli.decision.domain.TaskGraph;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Tasks of the {@code ship} phase plus everything promotion selects.
 */
public class ShipTargetTasks implements TargetTaskMethod {

    public static final String NAME = "ship";

    private final PromoteTargetTasks promote = new PromoteTargetTasks();

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<String> select(TaskGraph graph, TargetTaskContext context) {
        Set<String> selected = new LinkedHashSet<>(promote.select(graph, context));
        selected.addAll(PromoteTargetTasks.inPhase(graph, TargetAttributes.PHASE_SHIP));
        return selected;
    }
}
