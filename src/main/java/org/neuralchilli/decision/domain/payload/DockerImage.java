package org.neuralchilli.decision.domain.payload;

import java.util.Map;

/**
 * Image a docker-worker task runs in: either a registry reference or an image
 * artifact produced by another task of the same run.
 */
public sealed interface DockerImage permits DockerImage.Named, DockerImage.TaskImage {

    Object render(RenderContext context);

    static DockerImage named(String reference) {
        return new Named(reference);
    }

    static DockerImage fromTask(String label, String path) {
        return new TaskImage(label, path);
    }

    record Named(String reference) implements DockerImage {
        public Named {
            if (reference == null || reference.isBlank()) {
                throw new IllegalArgumentException("Docker image reference cannot be null or empty");
            }
        }

        @Override
        public Object render(RenderContext context) {
            return reference;
        }
    }

    record TaskImage(String label, String path) implements DockerImage {
        public TaskImage {
            if (label == null || label.isBlank()) {
                throw new IllegalArgumentException("Image task label cannot be null or empty");
            }
            if (path == null || path.isBlank()) {
                path = "public/image.tar.lz4";
            }
        }

        @Override
        public Object render(RenderContext context) {
            return Map.of(
                    "type", "task-image",
                    "path", path,
                    "taskId", context.taskIdFor(label)
            );
        }
    }
}
