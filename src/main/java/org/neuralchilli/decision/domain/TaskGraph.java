package org.neuralchilli.decision.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Ordered, immutable mapping from label to task record for one decision run.
 * Edges are derived from each record's dependencies. Stages never mutate a graph,
 * they produce a new one.
 */
public final class TaskGraph implements Iterable<TaskRecord> {

    private static final TaskGraph EMPTY = new TaskGraph(List.of());

    private final Map<String, TaskRecord> tasks;

    public TaskGraph(Collection<TaskRecord> records) {
        Map<String, TaskRecord> byLabel = new LinkedHashMap<>();
        for (TaskRecord record : records) {
            TaskRecord previous = byLabel.putIfAbsent(record.label(), record);
            if (previous != null) {
                throw new IllegalArgumentException(
                        "Duplicate task label '" + record.label() + "' (kinds: " +
                                previous.kind() + ", " + record.kind() + ")"
                );
            }
        }
        this.tasks = Collections.unmodifiableMap(byLabel);
    }

    public static TaskGraph empty() {
        return EMPTY;
    }

    public static TaskGraph of(TaskRecord... records) {
        return new TaskGraph(List.of(records));
    }

    public int size() {
        return tasks.size();
    }

    public boolean isEmpty() {
        return tasks.isEmpty();
    }

    public boolean contains(String label) {
        return tasks.containsKey(label);
    }

    public Optional<TaskRecord> find(String label) {
        return Optional.ofNullable(tasks.get(label));
    }

    /**
     * Record for a label that must exist
     */
    public TaskRecord get(String label) {
        TaskRecord record = tasks.get(label);
        if (record == null) {
            throw new IllegalArgumentException("No task labelled '" + label + "' in graph");
        }
        return record;
    }

    public Set<String> labels() {
        return tasks.keySet();
    }

    public List<TaskRecord> tasks() {
        return List.copyOf(tasks.values());
    }

    public List<TaskRecord> tasksOfKind(String kind) {
        return filter(task -> task.kind().equals(kind));
    }

    public List<TaskRecord> filter(Predicate<TaskRecord> predicate) {
        return tasks.values().stream().filter(predicate).toList();
    }

    /**
     * Number of dependency edges
     */
    public int edgeCount() {
        return tasks.values().stream().mapToInt(task -> task.dependencies().size()).sum();
    }

    /**
     * New graph with the given records appended
     */
    public TaskGraph with(Collection<TaskRecord> more) {
        List<TaskRecord> combined = new ArrayList<>(tasks.values());
        combined.addAll(more);
        return new TaskGraph(combined);
    }

    /**
     * New graph restricted to the given labels, keeping this graph's order
     */
    public TaskGraph subgraph(Set<String> labels) {
        return new TaskGraph(filter(task -> labels.contains(task.label())));
    }

    @Override
    public Iterator<TaskRecord> iterator() {
        return tasks.values().iterator();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        TaskGraph that = (TaskGraph) obj;
        return tasks.equals(that.tasks);
    }

    @Override
    public int hashCode() {
        return tasks.hashCode();
    }

    @Override
    public String toString() {
        return "TaskGraph[tasks=" + tasks.size() + ", edges=" + edgeCount() + "]";
    }
}
