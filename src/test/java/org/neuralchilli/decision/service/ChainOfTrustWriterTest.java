package org.neuralchilli.decision.service;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.neuralchilli.decision.domain.RunParameters;
import org.neuralchilli.decision.domain.TaskDefinition;
import org.neuralchilli.decision.domain.TriggerKind;
import org.neuralchilli.decision.util.Jsons;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ChainOfTrustWriterTest {

    @Test
    void shouldWriteAllThreeFiles() throws IOException {
        // Given: One submitted task of a tag push
        Path dir = Files.createTempDirectory("cot").resolve("public");
        TaskDefinition definition = new TaskDefinition(
                "Decision", List.of("Decision"), "taskcluster-github", "scriptworker-prov-v1", "signing",
                "2026-03-01T10:00:00Z", "2026-03-02T10:00:00Z", "2027-03-01T10:00:00Z",
                new TaskDefinition.Metadata("Sign", "Sign it", "dev@example.com", "https://example.com"),
                Map.of("maxRunTime", 600), List.of(), List.of(), Map.of());
        RunParameters params = RunParameters.builder(TriggerKind.PUSH)
                .gitRef("refs/tags/v2.0.0")
                .gitSha("abc")
                .build();

        // When: Writing
        new ChainOfTrustWriter().write(dir, Map.of("SignTaskId", definition), params);

        // Then: Graph keyed by task id, empty actions and the parameters
        JsonNode graph = Jsons.mapper().readTree(Files.readString(dir.resolve("task-graph.json")));
        assertThat(graph.path("SignTaskId").path("task").path("workerType").asText()).isEqualTo("signing");
        assertThat(Files.readString(dir.resolve("actions.json"))).isEqualTo("{}");

        Map<String, Object> parameters = new Yaml().load(Files.readString(dir.resolve("parameters.yml")));
        assertThat(parameters)
                .containsEntry("version", "2.0.0")
                .containsEntry("git_sha", "abc")
                .containsEntry("release", true);
    }
}
