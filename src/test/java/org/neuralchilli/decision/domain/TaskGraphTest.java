package org.neuralchilli.decision.domain;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.neuralchilli.decision.domain.TaskFixtures.task;

class TaskGraphTest {

    @Test
    void shouldKeepInsertionOrder() {
        TaskGraph graph = TaskGraph.of(task("c"), task("a"), task("b", "a"));

        assertThat(graph.labels()).containsExactly("c", "a", "b");
        assertThat(graph.size()).isEqualTo(3);
        assertThat(graph.edgeCount()).isEqualTo(1);
    }

    @Test
    void shouldRejectDuplicateLabels() {
        assertThatThrownBy(() -> TaskGraph.of(task("a"), task("a")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate task label 'a'");
    }

    @Test
    void shouldProduceNewGraphs() {
        TaskGraph graph = TaskGraph.of(task("a"));

        TaskGraph extended = graph.with(List.of(task("b", "a")));

        assertThat(graph.size()).isEqualTo(1);
        assertThat(extended.labels()).containsExactly("a", "b");
    }

    @Test
    void shouldRestrictToSubgraph() {
        TaskGraph graph = TaskGraph.of(task("a"), task("b", "a"), task("c"));

        TaskGraph subgraph = graph.subgraph(Set.of("c", "a"));

        assertThat(subgraph.labels()).containsExactly("a", "c");
    }

    @Test
    void shouldLookUpTasks() {
        TaskGraph graph = TaskGraph.of(task("a"));

        assertThat(graph.find("a")).isPresent();
        assertThat(graph.find("b")).isEmpty();
        assertThatThrownBy(() -> graph.get("b"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("No task labelled 'b'");
    }

    @Test
    void shouldFilterByKind() {
        TaskRecord test = task("test-a").toBuilder().kind("test").build();
        TaskGraph graph = TaskGraph.of(task("a"), test);

        assertThat(graph.tasksOfKind("test")).containsExactly(test);
        assertThat(TaskGraph.empty().isEmpty()).isTrue();
    }
}
