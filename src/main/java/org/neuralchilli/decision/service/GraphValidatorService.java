package org.neuralchilli.decision.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.decision.core.TaskGraphService;
import org.neuralchilli.decision.domain.TaskGraph;
import org.neuralchilli.decision.domain.TaskRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Checks a task graph before it is chunked and again before submission:
 * payload schemas, payload references, dangling dependencies and cycles.
 */
@ApplicationScoped
public class GraphValidatorService {

    private static final Logger log = LoggerFactory.getLogger(GraphValidatorService.class);

    @Inject
    TaskGraphService graphService;

    /**
     * Validate a task graph
     *
     * @throws SchemaViolationException   if a payload is invalid or references a non-dependency
     * @throws MissingDependencyException if a dependency is not in the graph
     * @throws CycleDetectedException     if the graph is cyclic
     */
    public void validateGraph(TaskGraph graph) {
        for (TaskRecord task : graph) {
            validateTask(task);
        }

        // Dangling edges and cycles
        graphService.buildDAG(graph);

        log.debug("Validated {}", graph);
    }

    /**
     * Validate one task on its own
     */
    public void validateTask(TaskRecord task) {
        List<String> violations = task.payload().violations();
        if (!violations.isEmpty()) {
            violations.forEach(violation -> log.error("Task {}: {}", task.label(), violation));
            String first = violations.get(0);
            int separator = first.indexOf(':');
            throw new SchemaViolationException(
                    task.label(),
                    separator > 0 ? first.substring(0, separator) : "payload",
                    separator > 0 ? first.substring(separator + 1).strip() : first
            );
        }

        for (String referenced : task.payload().referencedLabels()) {
            if (!task.dependencies().contains(referenced)) {
                throw new SchemaViolationException(task.label(), "dependencies",
                        "payload references '" + referenced + "' which is not a dependency");
            }
        }
    }
}
