package org.neuralchilli.decision.core.transform;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.decision.domain.TaskRecord;
import org.neuralchilli.decision.domain.payload.ArtifactFetch;
import org.neuralchilli.decision.domain.payload.DockerWorkerPayload;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Downloads artifacts of other tasks before a docker task's own scripts run.
 * Reads {@code fetch: [{task: <label>, artifact: <name>, directory: <dir>}]} and makes
 * every fetched task a dependency.
 */
@ApplicationScoped
public class FetchUpstreamArtifactsTransform extends TaskTransform {

    public static final String NAME = "fetch-upstream-artifacts";
    public static final String ATTRIBUTE = "fetch";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected List<TaskRecord> applyTo(TransformContext context, TaskRecord task) {
        Object fetch = task.attribute(ATTRIBUTE);
        if (fetch == null) {
            return List.of(task);
        }
        if (!(task.payload() instanceof DockerWorkerPayload payload)) {
            throw new IllegalArgumentException(
                    ATTRIBUTE + " requires a docker-worker payload, got " + task.payload().implementation());
        }
        if (!(fetch instanceof List<?> entries)) {
            throw new IllegalArgumentException(ATTRIBUTE + " must be a list, got: " + fetch);
        }

        List<String> labels = new ArrayList<>();
        for (Object entry : entries) {
            if (!(entry instanceof Map<?, ?> map)) {
                throw new IllegalArgumentException(ATTRIBUTE + " entries must be maps, got: " + entry);
            }
            ArtifactFetch artifactFetch = new ArtifactFetch(
                    stringOrNull(map.get("task")),
                    stringOrNull(map.get("artifact")),
                    stringOrNull(map.get("directory"))
            );
            payload = payload.withFetch(artifactFetch);
            labels.add(artifactFetch.label());
        }

        return List.of(task.withPayload(payload).withAddedDependencies(labels));
    }

    private static String stringOrNull(Object value) {
        return value != null ? value.toString() : null;
    }
}
