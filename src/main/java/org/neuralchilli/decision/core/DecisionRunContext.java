package org.neuralchilli.decision.core;

import org.neuralchilli.decision.domain.RunParameters;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Mutable state of one decision run. Created at the start of the run, passed explicitly
 * to the stages that need it and discarded afterwards; never shared between runs.
 */
public class DecisionRunContext {

    private final RunParameters params;
    private final Instant now;
    private final Map<String, String> foundOrCreated = new HashMap<>();
    private final Map<String, String> taskIdsByLabel = new LinkedHashMap<>();
    private final List<String> allTaskIds = new ArrayList<>();
    private final Set<String> createdTaskIds = new LinkedHashSet<>();
    private final Map<String, String> treeHashes = new HashMap<>();

    public DecisionRunContext(RunParameters params, Instant now) {
        if (params == null) {
            throw new IllegalArgumentException("Run parameters cannot be null");
        }
        this.params = params;
        this.now = now != null ? now : Instant.now();
    }

    public RunParameters params() {
        return params;
    }

    /**
     * The run's fixed "now"; every relative deadline and expiry is computed from it.
     */
    public Instant now() {
        return now;
    }

    public Optional<String> foundOrCreated(String indexPath) {
        return Optional.ofNullable(foundOrCreated.get(indexPath));
    }

    public void recordFoundOrCreated(String indexPath, String taskId) {
        foundOrCreated.put(indexPath, taskId);
    }

    public void assignTaskId(String label, String taskId) {
        String previous = taskIdsByLabel.putIfAbsent(label, taskId);
        if (previous != null) {
            throw new IllegalStateException(
                    "Task '" + label + "' already has task id " + previous);
        }
    }

    public Optional<String> taskIdFor(String label) {
        return Optional.ofNullable(taskIdsByLabel.get(label));
    }

    public Map<String, String> taskIdsByLabel() {
        return Collections.unmodifiableMap(taskIdsByLabel);
    }

    /**
     * A task this run created
     */
    public void recordCreated(String taskId) {
        allTaskIds.add(taskId);
        createdTaskIds.add(taskId);
    }

    /**
     * An existing task this run found in the index
     */
    public void recordFound(String taskId) {
        allTaskIds.add(taskId);
    }

    /**
     * Task ids found or created, in submission order
     */
    public List<String> allTaskIds() {
        return Collections.unmodifiableList(allTaskIds);
    }

    public Set<String> createdTaskIds() {
        return Collections.unmodifiableSet(createdTaskIds);
    }

    /**
     * Memoized source tree hash of a directory
     */
    public String treeHash(String directory, Function<String, String> compute) {
        return treeHashes.computeIfAbsent(directory, compute);
    }
}
