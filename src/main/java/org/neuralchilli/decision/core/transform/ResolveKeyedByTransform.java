package org.neuralchilli.decision.core.transform;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.decision.core.KeyedByResolver;
import org.neuralchilli.decision.domain.TaskRecord;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves keyed-by attribute values against the run and the task.
 * Attributes are resolved in declaration order, so later ones may be keyed by earlier ones.
 */
@ApplicationScoped
public class ResolveKeyedByTransform extends TaskTransform {

    public static final String NAME = "resolve-keyed-by";

    @Inject
    KeyedByResolver resolver;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected List<TaskRecord> applyTo(TransformContext context, TaskRecord task) {
        TaskRecord current = task;
        for (Map.Entry<String, Object> attribute : task.attributes().entrySet()) {
            Object resolved = resolver.resolve(
                    attribute.getValue(), "attributes." + attribute.getKey(), current, context.params());
            Map<String, Object> updated = new LinkedHashMap<>(current.attributes());
            updated.put(attribute.getKey(), resolved);
            current = current.withAttributes(updated);
        }
        return List.of(current);
    }
}
