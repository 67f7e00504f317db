package org.neuralchilli.decision.core.transform;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.decision.core.DockerfileExpander;
import org.neuralchilli.decision.domain.CachePolicy;
import org.neuralchilli.decision.domain.TaskRecord;
import org.neuralchilli.decision.domain.payload.DockerImage;
import org.neuralchilli.decision.domain.payload.DockerWorkerPayload;
import org.neuralchilli.decision.util.Hashes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns tasks with a {@code dockerfile} attribute into image builds.
 * <p>
 * The expanded Dockerfile is passed in the {@code DOCKERFILE} environment variable and
 * the task is indexed by the hash of those contents, so an unchanged image is built once
 * and reused until it expires.
 */
@ApplicationScoped
public class DockerImageTransform extends TaskTransform {

    private static final Logger log = LoggerFactory.getLogger(DockerImageTransform.class);

    public static final String NAME = "docker-image";
    public static final String ATTRIBUTE = "dockerfile";
    public static final String LABEL_PREFIX = "docker-image-";
    public static final String IMAGE_ARTIFACT = "/image.tar.lz4";

    static final String BUILDER_IMAGE = "servobrowser/taskcluster-bootstrap:image-builder@sha256:"
            + "0a7d012ce444d62ffb9e7f06f0c52fedc24b68c2060711b313263367f7272d9d";

    static final String BUILD_SCRIPT = """
            echo "$DOCKERFILE" | docker build -t taskcluster-built -
            docker save taskcluster-built | lz4 > /image.tar.lz4
            """;

    @Inject
    DockerfileExpander expander;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected List<TaskRecord> applyTo(TransformContext context, TaskRecord task) {
        String dockerfile = task.stringAttribute(ATTRIBUTE);
        if (dockerfile == null) {
            return List.of(task);
        }

        Path path = Path.of(context.config().repositoryRoot()).resolve(dockerfile);
        String imageName = DockerfileExpander.imageName(path);
        String contents = expander.expand(path);
        String digest = Hashes.sha256Hex(contents);

        DockerWorkerPayload payload = DockerWorkerPayload.empty()
                .withImage(DockerImage.named(BUILDER_IMAGE))
                .withMaxRunTimeMinutes(30)
                .withFeatures("dind")
                .withEnv("DOCKERFILE", contents)
                .withArtifacts(List.of(IMAGE_ARTIFACT))
                .withScript(BUILD_SCRIPT);

        log.debug("Docker image {} from {} (sha256 {})", imageName, dockerfile, digest);

        return List.of(task.toBuilder()
                .label(LABEL_PREFIX + imageName)
                .description(task.description().isEmpty() ? "Docker image: " + imageName : task.description())
                .workerType(context.config().dockerImageBuildWorkerType().orElse(task.workerType()))
                .payload(payload)
                .indexAndArtifactsExpireIn(context.config().dockerImagesExpireIn())
                .cache(CachePolicy.indexPath("docker-image." + digest))
                .attributes(withImageName(task, imageName))
                .build());
    }

    private static Map<String, Object> withImageName(TaskRecord task, String imageName) {
        Map<String, Object> attributes = new LinkedHashMap<>(task.attributes());
        attributes.put("image-name", imageName);
        return attributes;
    }
}
