package org.neuralchilli.decision.core.transform;

import org.neuralchilli.decision.config.DecisionConfig;
import org.neuralchilli.decision.core.DecisionRunContext;
import org.neuralchilli.decision.domain.KindDefinition;
import org.neuralchilli.decision.domain.RunParameters;
import org.neuralchilli.decision.domain.TaskGraph;

/**
 * What a transform may read while processing one kind.
 *
 * @param upstream tasks of the kinds already loaded in this run
 */
public record TransformContext(
        KindDefinition kind,
        DecisionRunContext run,
        DecisionConfig config,
        TaskGraph upstream
) {
    public TransformContext {
        if (kind == null || run == null || config == null) {
            throw new IllegalArgumentException("Transform context requires a kind, a run context and a config");
        }
        if (upstream == null) {
            upstream = TaskGraph.empty();
        }
    }

    public RunParameters params() {
        return run.params();
    }
}
