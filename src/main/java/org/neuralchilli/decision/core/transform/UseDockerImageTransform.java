package org.neuralchilli.decision.core.transform;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.decision.domain.TaskRecord;
import org.neuralchilli.decision.domain.payload.DockerImage;
import org.neuralchilli.decision.domain.payload.DockerWorkerPayload;

import java.util.List;

/**
 * Runs tasks naming a {@code docker-image} in the image built by {@code docker-image-<name>}.
 */
@ApplicationScoped
public class UseDockerImageTransform extends TaskTransform {

    public static final String NAME = "use-docker-image";
    public static final String ATTRIBUTE = "docker-image";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected List<TaskRecord> applyTo(TransformContext context, TaskRecord task) {
        String image = task.stringAttribute(ATTRIBUTE);
        if (image == null) {
            return List.of(task);
        }
        if (!(task.payload() instanceof DockerWorkerPayload payload)) {
            throw new IllegalArgumentException(
                    ATTRIBUTE + " requires a docker-worker payload, got " + task.payload().implementation());
        }

        String imageTask = DockerImageTransform.LABEL_PREFIX + image;
        return List.of(task
                .withPayload(payload.withImage(DockerImage.fromTask(imageTask, null)))
                .withAddedDependencies(List.of(imageTask)));
    }
}
