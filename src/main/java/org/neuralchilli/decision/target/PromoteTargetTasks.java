package org.neuralchilli.decision.target;

import org.neuralchilli.decision.domain.TaskGraph;
import org.neuralchilli.decision.domain.TaskRecord;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Tasks of the {@code promote} shipping phase.
 */
public class PromoteTargetTasks implements TargetTaskMethod {

    public static final String NAME = "promote";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<String> select(TaskGraph graph, TargetTaskContext context) {
        return inPhase(graph, TargetAttributes.PHASE_PROMOTE);
    }

    static Set<String> inPhase(TaskGraph graph, String phase) {
        Set<String> selected = new LinkedHashSet<>();
        for (TaskRecord task : graph) {
            if (phase.equals(task.stringAttribute(TargetAttributes.SHIPPING_PHASE))) {
                selected.add(task.label());
            }
        }
        return selected;
    }
}
