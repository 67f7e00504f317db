package org.neuralchilli.decision.core.transform;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.decision.domain.RunParameters;
import org.neuralchilli.decision.domain.TaskRecord;
import org.neuralchilli.decision.domain.payload.DockerWorkerPayload;

import java.util.List;

/**
 * Checks out the run's revision in {@code /repo} before a docker-worker task's own scripts.
 * The image must contain {@code git} and CA certificates.
 */
@ApplicationScoped
public class WithRepoTransform extends TaskTransform {

    public static final String NAME = "with-repo";

    static final String CHECKOUT_SCRIPT = String.join("\n",
            "cd repo",
            "git fetch --quiet --tags \"$GIT_URL\" \"$GIT_REF\"",
            "git reset --hard \"$GIT_SHA\"");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected List<TaskRecord> applyTo(TransformContext context, TaskRecord task) {
        if (!(task.payload() instanceof DockerWorkerPayload payload)) {
            throw new IllegalArgumentException(
                    NAME + " requires a docker-worker payload, got " + task.payload().implementation());
        }

        RunParameters params = context.params();
        return List.of(task.withPayload(payload
                .withEnv("GIT_URL", required("git url", params.gitUrl()))
                .withEnv("GIT_REF", required("git ref", params.gitRef()))
                .withEnv("GIT_SHA", required("git sha", params.gitSha()))
                .withEarlyScript(CHECKOUT_SCRIPT)));
    }

    private static String required(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(NAME + " needs the run's " + name);
        }
        return value;
    }
}
