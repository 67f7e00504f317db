package org.neuralchilli.decision.core;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.junit.jupiter.api.Test;
import org.neuralchilli.decision.domain.DagStatistics;
import org.neuralchilli.decision.domain.KindDefinition;
import org.neuralchilli.decision.domain.TaskGraph;
import org.neuralchilli.decision.service.CycleDetectedException;
import org.neuralchilli.decision.service.KindLoadException;
import org.neuralchilli.decision.service.MissingDependencyException;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;
import static org.neuralchilli.decision.domain.TaskFixtures.task;

@QuarkusTest
class TaskGraphServiceTest {

    @Inject
    TaskGraphService service;

    @Test
    void shouldOrderLinearGraph() {
        // Given: a -> b -> c, declared in reverse
        TaskGraph graph = TaskGraph.of(task("c", "b"), task("b", "a"), task("a"));

        // When: Ordering
        List<String> order = service.topologicalOrder(graph);

        // Then: Dependencies come first
        assertThat(order).containsExactly("a", "b", "c");
    }

    @Test
    void shouldBuildDiamondDAG() {
        // Given: a -> b -> d
        //          -> c ->
        TaskGraph graph = TaskGraph.of(task("a"), task("b", "a"), task("c", "a"), task("d", "b", "c"));

        // When: Building DAG
        DirectedAcyclicGraph<String, DefaultEdge> dag = service.buildDAG(graph);

        // Then: Structure and levels are correct
        assertThat(dag.vertexSet()).hasSize(4);
        assertThat(dag.edgeSet()).hasSize(4);
        assertThat(service.getRootTasks(dag)).containsExactly("a");
        assertThat(service.getLeafTasks(dag)).containsExactly("d");
        assertThat(service.getExecutionLevels(dag)).containsExactly(
                Set.of("a"), Set.of("b", "c"), Set.of("d"));
    }

    @Test
    void shouldRejectMissingDependency() {
        TaskGraph graph = TaskGraph.of(task("a", "ghost"));

        assertThatThrownBy(() -> service.buildDAG(graph))
                .isInstanceOf(MissingDependencyException.class)
                .hasMessageContaining("'a' depends on 'ghost'");
    }

    @Test
    void shouldDetectCycle() {
        // Given: a -> b -> c -> a
        TaskGraph graph = TaskGraph.of(task("a", "c"), task("b", "a"), task("c", "b"));

        assertThatThrownBy(() -> service.buildDAG(graph))
                .isInstanceOf(CycleDetectedException.class)
                .hasMessageContaining("would create a cycle");
    }

    @Test
    void shouldComputeTransitiveClosure() {
        TaskGraph graph = TaskGraph.of(
                task("toolchain"), task("build", "toolchain"), task("test", "build"), task("lint"));

        Set<String> closure = service.transitiveClosure(graph, Set.of("test"));

        assertThat(closure).containsExactlyInAnyOrder("test", "build", "toolchain");
    }

    @Test
    void shouldRejectClosureOfUnknownLabel() {
        TaskGraph graph = TaskGraph.of(task("a"));

        assertThatThrownBy(() -> service.transitiveClosure(graph, Set.of("b")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("No task labelled 'b'");
    }

    @Test
    void shouldComputeStatistics() {
        // Given: Three independent builds fanning into one test
        TaskGraph graph = TaskGraph.of(
                task("b1"), task("b2"), task("b3"), task("test", "b1", "b2", "b3"));

        // When: Computing statistics
        DagStatistics stats = service.getStatistics(graph);

        // Then: Shape is reported
        assertThat(stats.totalTasks()).isEqualTo(4);
        assertThat(stats.rootTasks()).isEqualTo(3);
        assertThat(stats.leafTasks()).isEqualTo(1);
        assertThat(stats.executionLevels()).isEqualTo(2);
        assertThat(stats.maxParallelism()).isEqualTo(3);
        assertThat(stats.maxFanIn()).isEqualTo(3);
    }

    @Test
    void shouldOrderKindsByKindDependencies() {
        KindDefinition test = kind("test", "build");
        KindDefinition build = kind("build", "docker-image");
        KindDefinition images = kind("docker-image");

        List<KindDefinition> ordered = service.orderKinds(List.of(test, build, images));

        assertThat(ordered).extracting(KindDefinition::name)
                .containsExactly("docker-image", "build", "test");
    }

    @Test
    void shouldRejectUnknownKindDependency() {
        KindDefinition test = kind("test", "build");

        assertThatThrownBy(() -> service.orderKinds(List.of(test)))
                .isInstanceOf(KindLoadException.class)
                .hasMessageContaining("unknown kind 'build'");
    }

    private static KindDefinition kind(String name, String... upstream) {
        return new KindDefinition(name, KindDefinition.Loader.TEMPLATES, List.of(upstream), List.of(),
                Map.of(), Map.of("job", Map.of()), null);
    }
}
