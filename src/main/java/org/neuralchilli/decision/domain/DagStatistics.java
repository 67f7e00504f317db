package org.neuralchilli.decision.domain;

import javax.annotation.Nonnull;

/**
 * Shape of a task graph as the external scheduler will see it.
 * Logged once per decision run.
 */
public record DagStatistics(
        int totalTasks,
        int rootTasks,
        int leafTasks,
        int executionLevels,
        int maxParallelism,
        int maxFanIn
) {
    public DagStatistics {
        if (totalTasks < 0) {
            throw new IllegalArgumentException("Total tasks cannot be negative");
        }
        if (rootTasks < 0) {
            throw new IllegalArgumentException("Root tasks cannot be negative");
        }
        if (leafTasks < 0) {
            throw new IllegalArgumentException("Leaf tasks cannot be negative");
        }
        if (executionLevels < 0) {
            throw new IllegalArgumentException("Execution levels cannot be negative");
        }
        if (maxParallelism < 0) {
            throw new IllegalArgumentException("Max parallelism cannot be negative");
        }
        if (maxFanIn < 0) {
            throw new IllegalArgumentException("Max fan-in cannot be negative");
        }
    }

    @Nonnull
    @Override
    public String toString() {
        return String.format(
                "DagStatistics[tasks=%d, levels=%d, max_parallel=%d, max_fan_in=%d, roots=%d, leaves=%d]",
                totalTasks, executionLevels, maxParallelism, maxFanIn, rootTasks, leafTasks
        );
    }
}
