package org.neuralchilli.decision.target;

import org.neuralchilli.decision.domain.TaskGraph;
import org.neuralchilli.decision.domain.TaskRecord;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Regular CI: every task not opted out with {@code normal-ci: false} and not release-only.
 */
public class NormalTargetTasks implements TargetTaskMethod {

    public static final String NAME = "normal";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<String> select(TaskGraph graph, TargetTaskContext context) {
        Set<String> selected = new LinkedHashSet<>();
        for (TaskRecord task : graph) {
            if (task.booleanAttribute(TargetAttributes.NORMAL_CI, true)
                    && !task.booleanAttribute(TargetAttributes.RELEASE_ONLY, false)) {
                selected.add(task.label());
            }
        }
        return selected;
    }
}
