package org.neuralchilli.decision.domain;

import org.neuralchilli.decision.domain.payload.DockerWorkerPayload;

import java.util.List;
import java.util.Map;

/**
 * Small task records and parameters for tests.
 */
public final class TaskFixtures {

    private TaskFixtures() {
    }

    public static TaskRecord task(String label, String... dependencies) {
        return task(label, Map.of(), dependencies);
    }

    public static TaskRecord task(String label, Map<String, Object> attributes, String... dependencies) {
        return TaskRecord.builder(label)
                .kind("build")
                .description("Task " + label)
                .payload(DockerWorkerPayload.empty().withScript("echo " + label))
                .dependencies(List.of(dependencies))
                .attributes(attributes)
                .build();
    }

    public static RunParameters pullRequest() {
        return RunParameters.builder(TriggerKind.PULL_REQUEST)
                .gitUrl("https://github.com/example/app")
                .gitRef("refs/pull/12/head")
                .gitSha("0123456789abcdef")
                .decisionTaskId("DecisionTaskId000000000")
                .taskOwner("dev@example.com")
                .taskSource("https://github.com/example/app/pull/12")
                .build();
    }

    public static RunParameters params(TriggerKind trigger) {
        return RunParameters.builder(trigger)
                .gitUrl("https://github.com/example/app")
                .gitRef("refs/heads/main")
                .gitSha("0123456789abcdef")
                .decisionTaskId("DecisionTaskId000000000")
                .taskOwner("dev@example.com")
                .taskSource("https://github.com/example/app")
                .build();
    }
}
