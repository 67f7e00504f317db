package org.neuralchilli.decision.domain.payload;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Payload of a task that does no work and resolves as soon as its dependencies have.
 * Used for synthetic fan-in tasks.
 */
public record SucceedPayload() implements WorkerPayload {

    @Override
    public WorkerImplementation implementation() {
        return WorkerImplementation.SUCCEED;
    }

    @Override
    public List<String> violations() {
        return List.of();
    }

    @Override
    public Set<String> referencedLabels() {
        return Set.of();
    }

    @Override
    public Map<String, Object> render(RenderContext context) {
        return Map.of();
    }
}
