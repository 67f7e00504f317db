package org.neuralchilli.decision.target;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.decision.cache.IndexService;
import org.neuralchilli.decision.config.StubDecisionConfig;
import org.neuralchilli.decision.core.DependencyChunker;
import org.neuralchilli.decision.core.TaskGraphService;
import org.neuralchilli.decision.domain.RunParameters;
import org.neuralchilli.decision.domain.TaskFixtures;
import org.neuralchilli.decision.domain.TaskGraph;
import org.neuralchilli.decision.domain.TaskRecord;
import org.neuralchilli.decision.domain.TitleOverrides;
import org.neuralchilli.decision.domain.TriggerKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;
import static org.neuralchilli.decision.domain.TaskFixtures.task;

class TargetTaskSelectorTest {

    // Full graph: lint, a docker image used by an opted-out integration test, and a release task
    private final TaskGraph full = TaskGraph.of(
            task("docker-image-base"),
            task("lint"),
            task("integration", Map.of("normal-ci", false), "docker-image-base"),
            task("publish", Map.of("release-only", true), "lint"));

    private TargetTaskSelector selector;
    private IndexService index;

    @BeforeEach
    void setUp() {
        index = mock(IndexService.class);
        when(index.findTask(anyString())).thenReturn(Optional.empty());
        selector = new TargetTaskSelector();
        selector.registry = TargetTaskRegistry.builtIn();
        selector.graphService = new TaskGraphService();
        selector.index = index;
        selector.config = new StubDecisionConfig().withIndexPrefix("project.app");
    }

    @Test
    void shouldSelectTargetsWithoutUnneededDependencies() {
        TaskGraph target = selector.select(full, TaskFixtures.pullRequest());

        assertThat(target.labels()).containsExactly("lint");
    }

    @Test
    void shouldIncludeDependenciesOfTargets() {
        RunParameters fullCi = RunParameters.builder(TriggerKind.PULL_REQUEST)
                .overrides(new TitleOverrides(true, false, Map.of()))
                .build();

        TaskGraph target = selector.select(full, fullCi);

        assertThat(target.labels()).containsExactly("docker-image-base", "lint", "integration");
    }

    @Test
    void shouldSelectNothingWhenSkipped() {
        RunParameters skip = RunParameters.builder(TriggerKind.PUSH)
                .overrides(new TitleOverrides(false, true, Map.of()))
                .build();

        assertThat(selector.select(full, skip).isEmpty()).isTrue();
    }

    @Test
    void shouldSelectEverythingOnRelease() {
        assertThat(selector.select(full, TaskFixtures.params(TriggerKind.RELEASE))).isEqualTo(full);
    }

    @Test
    void shouldSkipRepeatedNightly() {
        when(index.findTask("project.app.nightly.revision.0123456789abcdef")).thenReturn(Optional.of("Earlier"));

        assertThat(selector.select(full, TaskFixtures.params(TriggerKind.CRON)).isEmpty()).isTrue();
    }

    @Test
    void shouldNotScheduleChunksOfExcludedTasks() {
        // Given: 20 release-only signing tasks feeding a release-only publish task, chunked at 15
        List<TaskRecord> tasks = new ArrayList<>();
        List<String> signing = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            String label = String.format("sign-%02d", i);
            tasks.add(task(label, Map.of("release-only", true)));
            signing.add(label);
        }
        tasks.add(task("publish", Map.of("release-only", true), signing.toArray(new String[0])));
        tasks.add(task("lint"));
        TaskGraph chunked = new DependencyChunker(15, "succeed").chunk(new TaskGraph(tasks));

        // When: Selecting for a pull request
        TaskGraph target = selector.select(chunked, TaskFixtures.pullRequest());

        // Then: Neither the chunks nor what they depend on are scheduled
        assertThat(target.labels()).containsExactly("lint");
    }

    @Test
    void shouldReachChunksThroughTheirParent() {
        List<TaskRecord> tasks = new ArrayList<>();
        List<String> leaves = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            tasks.add(task("leaf-" + i, Map.of("normal-ci", false)));
            leaves.add("leaf-" + i);
        }
        tasks.add(task("aggregate", leaves.toArray(new String[0])));
        TaskGraph chunked = new DependencyChunker(15, "succeed").chunk(new TaskGraph(tasks));

        TaskGraph target = selector.select(chunked, TaskFixtures.pullRequest());

        assertThat(target.labels()).contains("aggregate", "aggregate-chunk-1", "aggregate-chunk-2", "leaf-0")
                .hasSize(23);
    }
}
