package org.neuralchilli.decision.domain.payload;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Worker-specific payload of a task. Exactly one variant is active per task and the
 * set of variants is closed.
 */
public sealed interface WorkerPayload
        permits DockerWorkerPayload, SigningPayload, BeetmoverPayload, SucceedPayload {

    WorkerImplementation implementation();

    /**
     * Schema violations as {@code field: message} strings, empty when valid.
     */
    List<String> violations();

    /**
     * Labels of other tasks this payload points at (images, upstream artifacts).
     * Every one of them must also be a dependency of the owning task.
     */
    Set<String> referencedLabels();

    /**
     * Render into the JSON structure the worker expects.
     */
    Map<String, Object> render(RenderContext context);
}
