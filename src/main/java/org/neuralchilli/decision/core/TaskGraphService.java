package org.neuralchilli.decision.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.jgrapht.traverse.TopologicalOrderIterator;
import org.neuralchilli.decision.domain.DagStatistics;
import org.neuralchilli.decision.domain.KindDefinition;
import org.neuralchilli.decision.domain.TaskGraph;
import org.neuralchilli.decision.domain.TaskRecord;
import org.neuralchilli.decision.service.CycleDetectedException;
import org.neuralchilli.decision.service.KindLoadException;
import org.neuralchilli.decision.service.MissingDependencyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Graph algorithms over task labels using JGraphT.
 * Edges point from dependency to dependent, so a topological order is a valid
 * submission order.
 */
@ApplicationScoped
public class TaskGraphService {

    private static final Logger log = LoggerFactory.getLogger(TaskGraphService.class);

    /**
     * Build a DAG from a task graph.
     *
     * @throws MissingDependencyException if a dependency is not a label of the graph
     * @throws CycleDetectedException     if the dependencies form a cycle
     */
    public DirectedAcyclicGraph<String, DefaultEdge> buildDAG(TaskGraph graph) {
        log.debug("Building DAG for {}", graph);

        DirectedAcyclicGraph<String, DefaultEdge> dag = new DirectedAcyclicGraph<>(DefaultEdge.class);

        // First pass: vertices, in graph order
        graph.labels().forEach(dag::addVertex);

        // Second pass: edges
        for (TaskRecord task : graph) {
            for (String dependency : task.dependencies()) {
                if (!dag.containsVertex(dependency)) {
                    throw new MissingDependencyException(task.label(), dependency);
                }
                addEdge(dag, dependency, task.label());
            }
        }

        log.debug("DAG built: {} vertices, {} edges", dag.vertexSet().size(), dag.edgeSet().size());
        return dag;
    }

    /**
     * Order kinds so that every kind comes after the kinds it depends on.
     * Ties keep declaration order.
     */
    public List<KindDefinition> orderKinds(Collection<KindDefinition> kinds) {
        Map<String, KindDefinition> byName = new LinkedHashMap<>();
        kinds.forEach(kind -> byName.put(kind.name(), kind));

        DirectedAcyclicGraph<String, DefaultEdge> dag = new DirectedAcyclicGraph<>(DefaultEdge.class);
        byName.keySet().forEach(dag::addVertex);

        for (KindDefinition kind : byName.values()) {
            for (String upstream : kind.kindDependencies()) {
                if (!byName.containsKey(upstream)) {
                    throw new KindLoadException(
                            "Kind '" + kind.name() + "' depends on unknown kind '" + upstream + "'"
                    );
                }
                addEdge(dag, upstream, kind.name());
            }
        }

        List<KindDefinition> ordered = new ArrayList<>();
        topologicalOrder(dag).forEach(name -> ordered.add(byName.get(name)));
        return ordered;
    }

    /**
     * Labels in dependency order: dependencies always precede their dependents.
     */
    public List<String> topologicalOrder(DirectedAcyclicGraph<String, DefaultEdge> dag) {
        List<String> order = new ArrayList<>();
        TopologicalOrderIterator<String, DefaultEdge> iterator = new TopologicalOrderIterator<>(dag);
        while (iterator.hasNext()) {
            order.add(iterator.next());
        }
        return order;
    }

    public List<String> topologicalOrder(TaskGraph graph) {
        return topologicalOrder(buildDAG(graph));
    }

    /**
     * The given labels together with everything they transitively depend on.
     */
    public Set<String> transitiveClosure(TaskGraph graph, Set<String> labels) {
        DirectedAcyclicGraph<String, DefaultEdge> dag = buildDAG(graph);
        Set<String> closure = new LinkedHashSet<>();
        for (String label : labels) {
            if (!dag.containsVertex(label)) {
                throw new IllegalArgumentException("No task labelled '" + label + "' in graph");
            }
            closure.add(label);
            closure.addAll(dag.getAncestors(label));
        }
        log.debug("Closure of {} targets has {} tasks", labels.size(), closure.size());
        return closure;
    }

    public Set<String> getRootTasks(DirectedAcyclicGraph<String, DefaultEdge> dag) {
        Set<String> roots = new LinkedHashSet<>();
        for (String label : dag.vertexSet()) {
            if (dag.inDegreeOf(label) == 0) {
                roots.add(label);
            }
        }
        return roots;
    }

    public Set<String> getLeafTasks(DirectedAcyclicGraph<String, DefaultEdge> dag) {
        Set<String> leaves = new LinkedHashSet<>();
        for (String label : dag.vertexSet()) {
            if (dag.outDegreeOf(label) == 0) {
                leaves.add(label);
            }
        }
        return leaves;
    }

    /**
     * Group labels into levels; every task of a level depends only on earlier levels.
     */
    public List<Set<String>> getExecutionLevels(DirectedAcyclicGraph<String, DefaultEdge> dag) {
        List<Set<String>> levels = new ArrayList<>();
        Set<String> processed = new HashSet<>();
        Set<String> remaining = new LinkedHashSet<>(dag.vertexSet());

        while (!remaining.isEmpty()) {
            Set<String> currentLevel = new LinkedHashSet<>();
            for (String label : remaining) {
                boolean ready = dag.incomingEdgesOf(label).stream()
                        .map(dag::getEdgeSource)
                        .allMatch(processed::contains);
                if (ready) {
                    currentLevel.add(label);
                }
            }

            if (currentLevel.isEmpty()) {
                throw new IllegalStateException("Could not determine execution levels - possible cycle");
            }

            levels.add(currentLevel);
            processed.addAll(currentLevel);
            remaining.removeAll(currentLevel);
        }
        return levels;
    }

    public DagStatistics getStatistics(TaskGraph graph) {
        DirectedAcyclicGraph<String, DefaultEdge> dag = buildDAG(graph);
        List<Set<String>> levels = getExecutionLevels(dag);

        int maxParallelism = levels.stream().mapToInt(Set::size).max().orElse(0);
        int maxFanIn = dag.vertexSet().stream().mapToInt(dag::inDegreeOf).max().orElse(0);

        return new DagStatistics(
                dag.vertexSet().size(),
                getRootTasks(dag).size(),
                getLeafTasks(dag).size(),
                levels.size(),
                maxParallelism,
                maxFanIn
        );
    }

    private void addEdge(DirectedAcyclicGraph<String, DefaultEdge> dag, String from, String to) {
        try {
            dag.addEdge(from, to);
            log.trace("Added edge: {} -> {}", from, to);
        } catch (IllegalArgumentException e) {
            // JGraphT rejects edges that would close a cycle
            throw new CycleDetectedException(
                    "Adding dependency '" + from + "' -> '" + to + "' would create a cycle", e
            );
        }
    }
}
