package org.neuralchilli.decision.target;

import org.neuralchilli.decision.domain.TaskGraph;

import java.util.Set;

/**
 * Strategy choosing which tasks of the full graph a run targets.
 * Dependencies of the chosen tasks are added by the selector.
 */
public interface TargetTaskMethod {

    String name();

    Set<String> select(TaskGraph graph, TargetTaskContext context);
}
