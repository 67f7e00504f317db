package org.neuralchilli.decision.service;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.decision.cache.HazelcastTaskStore;
import org.neuralchilli.decision.domain.RunParameters;
import org.neuralchilli.decision.domain.TaskDefinition;
import org.neuralchilli.decision.domain.TaskFixtures;
import org.neuralchilli.decision.domain.TaskGraph;
import org.neuralchilli.decision.domain.TitleOverrides;
import org.neuralchilli.decision.domain.TriggerKind;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@QuarkusTest
class DecisionTaskServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Inject
    DecisionTaskService service;

    @Inject
    HazelcastTaskStore store;

    @BeforeEach
    void setUp() {
        store.clear();
    }

    @Test
    void shouldScheduleNormalPullRequest() {
        // Given: Kinds under src/test/resources/kinds
        RunParameters params = TaskFixtures.pullRequest();

        // When: Running the decision task
        DecisionResult result = service.run(params);

        // Then: Everything but the opted-out base image is scheduled
        assertThat(result.targetTasksMethod()).isEqualTo("normal");
        assertThat(result.fullGraph().labels()).containsExactlyInAnyOrder(
                "docker-image-base", "docker-image-rust",
                "build-places", "build-logins", "build-megazord",
                "test-places", "test-logins");
        assertThat(result.targetGraph().labels()).doesNotContain("docker-image-base").hasSize(6);
        assertThat(result.createdCount()).isEqualTo(6);
        assertThat(store.taskCount()).isEqualTo(6);

        // And: Statistics describe the submitted graph
        assertThat(result.statistics().rootTasks()).isEqualTo(1);
        assertThat(result.statistics().executionLevels()).isEqualTo(3);
        assertThat(result.statistics().maxFanIn()).isEqualTo(3);
    }

    @Test
    void shouldWireTasksTogether() {
        DecisionResult result = service.run(TaskFixtures.pullRequest());
        Map<String, String> ids = result.taskIds();

        // Group task depends on its component build, the shared build and the image
        TaskDefinition test = store.task(ids.get("test-places")).orElseThrow();
        assertThat(test.dependencies()).containsExactlyInAnyOrder(
                "DecisionTaskId000000000", ids.get("build-places"), ids.get("build-megazord"),
                ids.get("docker-image-rust"));
        assertThat(test.metadata().name()).isEqualTo("Test: Test places");
        assertThat(test.payload().get("image")).isEqualTo(Map.of(
                "type", "task-image", "path", "public/image.tar.lz4", "taskId", ids.get("docker-image-rust")));

        // Templates are interpolated and keyed-by values resolved
        TaskDefinition build = store.task(ids.get("build-places")).orElseThrow();
        assertThat(build.metadata().description()).isEqualTo("Build places (github-pull-request)");
        assertThat((List<?>) build.payload().get("command")).last().asString().contains("echo 0123456");
        assertThat(result.targetGraph().get("build-places").attribute("run-tests")).isEqualTo("quick");

        // And: Builds check out the decided revision first
        assertThat(build.payload().get("env")).isEqualTo(Map.of(
                "GIT_URL", "https://github.com/example/app",
                "GIT_REF", "refs/pull/12/head",
                "GIT_SHA", "0123456789abcdef"));
        assertThat((List<?>) build.payload().get("command")).last().asString()
                .startsWith("cd repo\ngit fetch");
    }

    @Test
    void shouldReuseCachedTasksOnNextRun() {
        // Given: A first run created everything
        DecisionResult first = service.run(TaskFixtures.pullRequest());

        // When: The same revision is decided again
        DecisionResult second = service.run(TaskFixtures.pullRequest());

        // Then: The image and the source-tree indexed build are reused
        assertThat(second.taskIds().get("docker-image-rust")).isEqualTo(first.taskIds().get("docker-image-rust"));
        assertThat(second.taskIds().get("build-megazord")).isEqualTo(first.taskIds().get("build-megazord"));
        assertThat(second.taskIds().get("build-places")).isNotEqualTo(first.taskIds().get("build-places"));
        assertThat(second.createdCount()).isEqualTo(4);
        assertThat(second.reusedCount()).isEqualTo(2);
    }

    @Test
    void shouldScheduleNothingWhenSkipped() {
        RunParameters skip = RunParameters.builder(TriggerKind.PUSH)
                .gitUrl("https://github.com/example/app")
                .gitRef("refs/heads/main")
                .gitSha("abc")
                .decisionTaskId("DecisionTaskId000000000")
                .overrides(new TitleOverrides(false, true, Map.of()))
                .build();

        DecisionResult result = service.run(skip);

        assertThat(result.targetTasksMethod()).isEqualTo("skip");
        assertThat(result.targetGraph().isEmpty()).isTrue();
        assertThat(result.statistics().totalTasks()).isZero();
        assertThat(store.taskCount()).isZero();
    }

    @Test
    void shouldRunNightlyOncePerRevision() {
        RunParameters nightly = TaskFixtures.params(TriggerKind.CRON);

        DecisionResult first = service.run(nightly);
        DecisionResult second = service.run(nightly);

        assertThat(first.targetGraph().size()).isEqualTo(7);
        assertThat(store.findTask("test.decision.nightly.revision.0123456789abcdef"))
                .contains("DecisionTaskId000000000");
        assertThat(second.targetGraph().isEmpty()).isTrue();
    }

    @Test
    void shouldGroupSharedTasksAndHonourOptOut() throws IOException {
        // Given: Builds a, a and all, and a from-deps kind over them
        Path kinds = Files.createTempDirectory("kinds");
        writeKind(kinds, "build", """
                job-defaults:
                  worker:
                    implementation: docker-worker
                jobs:
                  a1:
                    attributes: {component: a}
                    worker: {script: make a1}
                  a2:
                    attributes: {component: a}
                    worker: {script: make a2}
                  shared:
                    attributes: {component: all}
                    worker: {script: make shared}
                """);
        writeKind(kinds, "check", """
                loader: from-deps
                kind-dependencies: [build]
                from-deps:
                  kinds: [build]
                  job-template:
                    worker:
                      implementation: docker-worker
                      script: make check
                """);

        // When: Deciding a pull request
        DecisionResult result = service.run(TaskFixtures.pullRequest(), kinds, NOW);

        // Then: One group task depending on all three builds is scheduled
        assertThat(result.fullGraph().get("check-a").dependencies())
                .containsExactly("build-a1", "build-a2", "build-shared");
        assertThat(result.targetGraph().contains("check-a")).isTrue();

        // When: The group task opts out of normal CI
        writeKind(kinds, "check", """
                loader: from-deps
                kind-dependencies: [build]
                from-deps:
                  kinds: [build]
                  job-template:
                    attributes: {normal-ci: false}
                    worker:
                      implementation: docker-worker
                      script: make check
                """);
        store.clear();
        DecisionResult optedOut = service.run(TaskFixtures.pullRequest(), kinds, NOW);

        // Then: It is no longer scheduled
        assertThat(optedOut.fullGraph().contains("check-a")).isTrue();
        assertThat(optedOut.targetGraph().contains("check-a")).isFalse();
        assertThat(optedOut.targetGraph().size()).isEqualTo(3);
    }

    @Test
    void shouldChunkWideFanIn() throws IOException {
        // Given: An aggregate task over 120 builds
        Path kinds = Files.createTempDirectory("kinds");
        StringBuilder yaml = new StringBuilder("""
                job-defaults:
                  worker:
                    implementation: docker-worker
                    script: make
                jobs:
                """);
        List<String> labels = new ArrayList<>();
        for (int i = 0; i < 120; i++) {
            yaml.append(String.format("  part%03d: {}%n", i));
            labels.add(String.format("build-part%03d", i));
        }
        yaml.append("  all:\n    dependencies: [").append(String.join(", ", labels)).append("]\n");
        writeKind(kinds, "build", yaml.toString());

        // When: Deciding
        DecisionResult result = service.run(TaskFixtures.pullRequest(), kinds, NOW);

        // Then: The aggregate depends on two chunks, and the queue sees at most 99 + 1 dependencies
        TaskGraph graph = result.targetGraph();
        assertThat(graph.get("build-all").dependencies()).containsExactly("build-all-chunk-1", "build-all-chunk-2");
        assertThat(graph.get("build-all-chunk-1").dependencies()).hasSize(99);
        assertThat(graph.get("build-all-chunk-2").dependencies()).hasSize(21);
        assertThat(store.taskCount()).isEqualTo(123);
    }

    @Test
    void shouldWriteChainOfTrustOnRelease() throws IOException {
        // Given: A build and a signing task on a tag push
        Path kinds = Files.createTempDirectory("kinds");
        writeKind(kinds, "build", """
                jobs:
                  release:
                    worker:
                      implementation: docker-worker
                      script: ./release.sh
                      artifacts: [/build/app.aar]
                """);
        writeKind(kinds, "signing", """
                kind-dependencies: [build]
                transforms: [require-build-level]
                jobs:
                  release:
                    dependencies: [build-release]
                    worker-type: signing
                    attributes: {min-build-level: 1}
                    worker:
                      implementation: signing
                      formats: [autograph_gpg]
                      upstream-artifacts:
                        - task: build-release
                          paths: [public/app.aar]
                """);
        RunParameters release = RunParameters.builder(TriggerKind.PUSH)
                .gitRef("refs/tags/v3.1.0")
                .gitSha("fedcba")
                .decisionTaskId("DecisionTaskId000000000")
                .build();

        // When: Deciding
        DecisionResult result = service.run(release, kinds, NOW);

        // Then: Everything is scheduled and the chain of trust lists it
        assertThat(result.targetTasksMethod()).isEqualTo("release");
        Path dir = Path.of("target/chain-of-trust");
        String taskGraph = Files.readString(dir.resolve("task-graph.json"));
        assertThat(taskGraph).contains(result.taskIds().get("signing-release"), "autograph_gpg");
        assertThat(Files.readString(dir.resolve("parameters.yml"))).contains("version: 3.1.0");
    }

    @Test
    void shouldAbortBeforeSubmittingOnBrokenKind() throws IOException {
        Path kinds = Files.createTempDirectory("kinds");
        writeKind(kinds, "build", """
                transforms: [no-such-transform]
                jobs:
                  a:
                    worker:
                      implementation: docker-worker
                      script: make
                """);

        assertThatThrownBy(() -> service.run(TaskFixtures.pullRequest(), kinds, NOW))
                .isInstanceOf(KindLoadException.class)
                .hasMessageContaining("no-such-transform");
        assertThat(store.taskCount()).isZero();
    }

    @Test
    void shouldRejectInvalidPayloadBeforeSubmitting() throws IOException {
        Path kinds = Files.createTempDirectory("kinds");
        writeKind(kinds, "build", """
                jobs:
                  a:
                    worker:
                      implementation: docker-worker
                """);

        assertThatThrownBy(() -> service.run(TaskFixtures.pullRequest(), kinds, NOW))
                .isInstanceOf(SchemaViolationException.class)
                .hasMessageContaining("build-a");
        assertThat(store.taskCount()).isZero();
    }

    private static void writeKind(Path kinds, String name, String yaml) throws IOException {
        Path dir = Files.createDirectories(kinds.resolve(name));
        Files.writeString(dir.resolve("kind.yml"), yaml);
    }
}
