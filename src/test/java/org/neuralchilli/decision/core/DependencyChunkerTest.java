package org.neuralchilli.decision.core;

import org.junit.jupiter.api.Test;
import org.neuralchilli.decision.domain.TaskGraph;
import org.neuralchilli.decision.domain.TaskRecord;
import org.neuralchilli.decision.domain.payload.ArtifactFetch;
import org.neuralchilli.decision.domain.payload.DockerImage;
import org.neuralchilli.decision.domain.payload.DockerWorkerPayload;
import org.neuralchilli.decision.domain.payload.SucceedPayload;
import org.neuralchilli.decision.service.ChunkingOverflowException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;
import static org.neuralchilli.decision.domain.TaskFixtures.task;

class DependencyChunkerTest {

    @Test
    void shouldLeaveSmallTasksAlone() {
        TaskGraph graph = withFanIn(5);

        TaskGraph chunked = new DependencyChunker(15, "succeed").chunk(graph);

        assertThat(chunked).isEqualTo(graph);
    }

    @Test
    void shouldSpreadDependenciesOverChunks() {
        // Given: One task with 37 dependencies and a limit of 15
        TaskGraph graph = withFanIn(37);

        // When: Chunking
        TaskGraph chunked = new DependencyChunker(15, "succeed").chunk(graph);

        // Then: Three chunks of 15, 15 and 7 sit between the leaves and the parent
        TaskRecord parent = chunked.get("parent");
        assertThat(parent.dependencies()).containsExactly("parent-chunk-1", "parent-chunk-2", "parent-chunk-3");
        assertThat(chunked.get("parent-chunk-1").dependencies()).hasSize(15);
        assertThat(chunked.get("parent-chunk-2").dependencies()).hasSize(15);
        assertThat(chunked.get("parent-chunk-3").dependencies()).hasSize(7);

        Set<String> union = new HashSet<>();
        for (int i = 1; i <= 3; i++) {
            union.addAll(chunked.get("parent-chunk-" + i).dependencies());
        }
        assertThat(union).isEqualTo(graph.get("parent").dependencies());
    }

    @Test
    void shouldBuildNoOpChunks() {
        TaskGraph chunked = new DependencyChunker(15, "succeed").chunk(withFanIn(20));

        TaskRecord chunk = chunked.get("parent-chunk-1");
        assertThat(chunk.payload()).isInstanceOf(SucceedPayload.class);
        assertThat(chunk.workerType()).isEqualTo("succeed");
        assertThat(chunk.attribute(DependencyChunker.CHUNK_OF_ATTRIBUTE)).isEqualTo("parent");
        assertThat(chunk.routes()).isEmpty();
        assertThat(chunk.hasNotifications()).isFalse();
    }

    @Test
    void shouldPlaceChunksBeforeParent() {
        TaskGraph chunked = new DependencyChunker(15, "succeed").chunk(withFanIn(20));

        List<String> labels = new ArrayList<>(chunked.labels());
        assertThat(labels.indexOf("parent-chunk-2")).isLessThan(labels.indexOf("parent"));
        assertThat(labels.get(labels.size() - 1)).isEqualTo("parent");
    }

    @Test
    void shouldChunkRecursively() {
        // Given: 10 dependencies and a limit of 3
        TaskGraph graph = withFanIn(10);

        // When: Chunking
        TaskGraph chunked = new DependencyChunker(3, "succeed").chunk(graph);

        // Then: The four first-level chunks are chunked again
        for (TaskRecord task : chunked) {
            assertThat(task.dependencies().size()).isLessThanOrEqualTo(3);
        }
        assertThat(chunked.get("parent").dependencies()).containsExactly("parent-chunk-5", "parent-chunk-6");
        assertThat(chunked.get("parent-chunk-5").dependencies())
                .containsExactly("parent-chunk-1", "parent-chunk-2", "parent-chunk-3");
        assertThat(chunked.get("parent-chunk-6").dependencies()).containsExactly("parent-chunk-4");
    }

    @Test
    void shouldKeepImageDependencyOnParent() {
        // Given: 20 leaves and an image task the parent runs in, limit 15
        TaskGraph graph = withImage(withFanIn(20));

        // When: Chunking
        TaskGraph chunked = new DependencyChunker(15, "succeed").chunk(graph);

        // Then: The image stays a direct dependency and only the leaves are chunked
        assertThat(chunked.get("parent").dependencies())
                .containsExactly("docker-image-rust", "parent-chunk-1", "parent-chunk-2");
        assertThat(chunked.get("parent-chunk-1").dependencies()).hasSize(15).doesNotContain("docker-image-rust");
        assertThat(chunked.get("parent-chunk-2").dependencies()).hasSize(5);
    }

    @Test
    void shouldFailWhenPayloadReferencesFillTheLimit() {
        // Given: A parent fetching from one leaf and running in a built image, limit 2
        TaskGraph graph = withImage(withFanIn(4));
        TaskRecord parent = graph.get("parent");
        DockerWorkerPayload payload = ((DockerWorkerPayload) parent.payload())
                .withFetch(new ArtifactFetch("leaf-00", "app.zip", "/build"));
        List<TaskRecord> tasks = new ArrayList<>(graph.tasks());
        tasks.set(tasks.indexOf(parent), parent.withPayload(payload));

        // When/Then: No chunk can be added next to the two direct dependencies
        assertThatThrownBy(() -> new DependencyChunker(2, "succeed").chunk(new TaskGraph(tasks)))
                .isInstanceOf(ChunkingOverflowException.class)
                .hasMessageContaining("parent");
    }

    @Test
    void shouldChunkIdenticallyForIdenticalInput() {
        DependencyChunker chunker = new DependencyChunker(4, "succeed");

        assertThat(chunker.chunk(withFanIn(11))).isEqualTo(chunker.chunk(withFanIn(11)));
    }

    @Test
    void shouldRejectLabelCollision() {
        List<TaskRecord> tasks = new ArrayList<>(withFanIn(5).tasks());
        tasks.add(task("parent-chunk-1"));

        assertThatThrownBy(() -> new DependencyChunker(3, "succeed").chunk(new TaskGraph(tasks)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("parent-chunk-1");
    }

    @Test
    void shouldRejectTinyLimit() {
        assertThatThrownBy(() -> new DependencyChunker(1, "succeed"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static TaskGraph withImage(TaskGraph graph) {
        List<TaskRecord> tasks = new ArrayList<>();
        tasks.add(task("docker-image-rust"));
        for (TaskRecord task : graph) {
            if (task.label().equals("parent")) {
                DockerWorkerPayload payload = (DockerWorkerPayload) task.payload();
                task = task.withPayload(payload.withImage(DockerImage.fromTask("docker-image-rust", null)))
                        .withAddedDependencies(List.of("docker-image-rust"));
            }
            tasks.add(task);
        }
        return new TaskGraph(tasks);
    }

    private static TaskGraph withFanIn(int leaves) {
        List<TaskRecord> tasks = new ArrayList<>();
        List<String> labels = new ArrayList<>();
        for (int i = 0; i < leaves; i++) {
            String label = String.format("leaf-%02d", i);
            tasks.add(task(label));
            labels.add(label);
        }
        tasks.add(task("parent", labels.toArray(new String[0])));
        return new TaskGraph(tasks);
    }
}
