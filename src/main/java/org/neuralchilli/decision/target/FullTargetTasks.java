package org.neuralchilli.decision.target;

import org.neuralchilli.decision.domain.TaskGraph;
import org.neuralchilli.decision.domain.TaskRecord;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * {@code [ci full]} runs: also the tasks regular CI leaves out, except those opted out
 * with {@code full-ci: false} and release-only tasks.
 */
public class FullTargetTasks implements TargetTaskMethod {

    public static final String NAME = "full";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<String> select(TaskGraph graph, TargetTaskContext context) {
        Set<String> selected = new LinkedHashSet<>();
        for (TaskRecord task : graph) {
            if (task.booleanAttribute(TargetAttributes.FULL_CI, true)
                    && !task.booleanAttribute(TargetAttributes.RELEASE_ONLY, false)) {
                selected.add(task.label());
            }
        }
        return selected;
    }
}
