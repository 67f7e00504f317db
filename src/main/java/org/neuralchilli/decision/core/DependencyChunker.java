package org.neuralchilli.decision.core;

import org.neuralchilli.decision.domain.TaskGraph;
import org.neuralchilli.decision.domain.TaskRecord;
import org.neuralchilli.decision.domain.payload.SucceedPayload;
import org.neuralchilli.decision.service.ChunkingOverflowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keeps every task within the scheduler's dependency limit by spreading oversized
 * dependency sets over synthetic {@code <label>-chunk-<i>} tasks.
 * <p>
 * Slices are taken over the sorted dependency list, so identical inputs chunk
 * identically. Dependencies the parent's payload refers to stay on the parent. Chunk tasks run the no-op payload, carry no routes or notification
 * metadata, and are tagged with a {@code chunk-of} attribute naming their parent.
 * Must run after every stage that adds dependencies.
 */
public class DependencyChunker {

    private static final Logger log = LoggerFactory.getLogger(DependencyChunker.class);

    public static final String CHUNK_OF_ATTRIBUTE = "chunk-of";

    private final int maxDependencies;
    private final String chunkWorkerType;

    public DependencyChunker(int maxDependencies, String chunkWorkerType) {
        if (maxDependencies < 2) {
            throw new IllegalArgumentException("Max dependencies must be at least 2, got: " + maxDependencies);
        }
        this.maxDependencies = maxDependencies;
        this.chunkWorkerType = chunkWorkerType;
    }

    public int maxDependencies() {
        return maxDependencies;
    }

    /**
     * New graph where no task has more than the maximum number of dependencies.
     * Chunk tasks are placed just before their parent.
     */
    public TaskGraph chunk(TaskGraph graph) {
        Set<String> labels = new HashSet<>(graph.labels());
        List<TaskRecord> result = new ArrayList<>();
        int chunked = 0;

        for (TaskRecord task : graph) {
            if (task.dependencies().size() <= maxDependencies) {
                result.add(task);
                continue;
            }
            List<TaskRecord> expanded = spread(task, labels);
            result.addAll(expanded);
            chunked++;
        }

        if (chunked > 0) {
            log.info("Chunked {} tasks exceeding {} dependencies ({} -> {} tasks)",
                    chunked, maxDependencies, graph.size(), result.size());
        }
        return new TaskGraph(result);
    }

    private List<TaskRecord> spread(TaskRecord task, Set<String> labels) {
        // Labels the payload points at (image, artifact fetches) must stay direct dependencies
        List<String> direct = new ArrayList<>();
        List<String> remaining = new ArrayList<>();
        Set<String> referenced = task.payload().referencedLabels();
        for (String dependency : task.dependencies()) {
            (referenced.contains(dependency) ? direct : remaining).add(dependency);
        }
        if (!remaining.isEmpty() && direct.size() >= maxDependencies) {
            throw new ChunkingOverflowException(
                    "Task " + task.label() + " references " + direct.size() +
                            " dependencies from its payload, limit is " + maxDependencies);
        }

        List<TaskRecord> out = new ArrayList<>();
        int index = 1;

        // Repeat while the parent still fans in too much (more than M * M dependencies)
        while (direct.size() + remaining.size() > maxDependencies) {
            List<String> sorted = new ArrayList<>(remaining);
            sorted.sort(null);

            List<String> children = new ArrayList<>();
            for (int start = 0; start < sorted.size(); start += maxDependencies) {
                List<String> slice = sorted.subList(start, Math.min(start + maxDependencies, sorted.size()));
                if (slice.size() > maxDependencies) {
                    throw new ChunkingOverflowException(
                            "Chunk of " + task.label() + " holds " + slice.size() +
                                    " dependencies, limit is " + maxDependencies);
                }

                String label = task.label() + "-chunk-" + index++;
                if (!labels.add(label)) {
                    throw new IllegalStateException("Chunk label collides with an existing task: " + label);
                }
                out.add(newChunk(task, label, slice));
                children.add(label);
            }

            log.debug("Task {}: {} dependencies spread over {} chunks ({} kept direct)",
                    task.label(), sorted.size(), children.size(), direct.size());
            remaining = children;
        }

        List<String> parentDependencies = new ArrayList<>(direct);
        parentDependencies.addAll(remaining);
        TaskRecord parent = task.withDependencies(parentDependencies);

        verify(parent);
        out.forEach(this::verify);
        out.add(parent);
        return out;
    }

    private TaskRecord newChunk(TaskRecord parent, String label, List<String> dependencies) {
        return TaskRecord.builder(label)
                .kind(parent.kind())
                .description("Dependency chunk of " + parent.label())
                .provisionerId(parent.provisionerId())
                .workerType(chunkWorkerType)
                .payload(new SucceedPayload())
                .dependencies(dependencies)
                .attributes(Map.of(CHUNK_OF_ATTRIBUTE, parent.label()))
                .deadlineIn(parent.deadlineIn())
                .expiresIn(parent.expiresIn())
                .build();
    }

    private void verify(TaskRecord task) {
        if (task.dependencies().size() > maxDependencies) {
            throw new ChunkingOverflowException(
                    "Task " + task.label() + " still has " + task.dependencies().size() +
                            " dependencies after chunking, limit is " + maxDependencies);
        }
    }
}
