package org.neuralchilli.decision.service;

import org.neuralchilli.decision.domain.DagStatistics;
import org.neuralchilli.decision.domain.TaskGraph;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a decision run.
 *
 * @param targetTasksMethod method that selected the targets
 * @param fullGraph         every task of every kind, after chunking
 * @param targetGraph       what was submitted
 * @param taskIds           label to task id for the submitted graph
 * @param allTaskIds        created and reused task ids, in submission order
 */
public record DecisionResult(
        String targetTasksMethod,
        TaskGraph fullGraph,
        TaskGraph targetGraph,
        Map<String, String> taskIds,
        List<String> allTaskIds,
        int createdCount,
        DagStatistics statistics
) {
    public DecisionResult {
        taskIds = Map.copyOf(taskIds);
        allTaskIds = List.copyOf(allTaskIds);
    }

    public int reusedCount() {
        return targetGraph.size() - createdCount;
    }
}
