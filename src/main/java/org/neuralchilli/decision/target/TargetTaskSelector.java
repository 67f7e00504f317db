package org.neuralchilli.decision.target;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.decision.cache.IndexService;
import org.neuralchilli.decision.config.DecisionConfig;
import org.neuralchilli.decision.core.DependencyChunker;
import org.neuralchilli.decision.core.TaskGraphService;
import org.neuralchilli.decision.domain.RunParameters;
import org.neuralchilli.decision.domain.TaskGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Narrows the full graph to what a run should schedule: the chosen method's tasks plus
 * everything they transitively depend on.
 * Dependency chunks are never targets themselves; they are reached through their parent.
 */
@ApplicationScoped
public class TargetTaskSelector {

    private static final Logger log = LoggerFactory.getLogger(TargetTaskSelector.class);

    @Inject
    TargetTaskRegistry registry;

    @Inject
    TaskGraphService graphService;

    @Inject
    IndexService index;

    @Inject
    DecisionConfig config;

    public TaskGraph select(TaskGraph full, RunParameters params) {
        TargetTaskMethod method = registry.get(registry.methodFor(params));
        Set<String> targets = new LinkedHashSet<>(
                method.select(full, new TargetTaskContext(params, index, config.indexPrefix())));
        targets.removeIf(label -> full.get(label).hasAttribute(DependencyChunker.CHUNK_OF_ATTRIBUTE));
        Set<String> closure = graphService.transitiveClosure(full, targets);

        log.info("Target tasks method '{}': {} targets, {} tasks with dependencies (of {})",
                method.name(), targets.size(), closure.size(), full.size());
        return full.subgraph(closure);
    }
}
