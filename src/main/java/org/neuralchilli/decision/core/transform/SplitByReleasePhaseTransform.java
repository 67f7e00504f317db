package org.neuralchilli.decision.core.transform;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.decision.domain.TaskRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One task per entry of the {@code release-phases} attribute, labelled
 * {@code <label>-<phase>} and tagged with {@code shipping-phase}.
 */
@ApplicationScoped
public class SplitByReleasePhaseTransform extends TaskTransform {

    public static final String NAME = "split-by-release-phase";
    public static final String PHASES_ATTRIBUTE = "release-phases";
    public static final String PHASE_ATTRIBUTE = "shipping-phase";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected List<TaskRecord> applyTo(TransformContext context, TaskRecord task) {
        Object phases = task.attribute(PHASES_ATTRIBUTE);
        if (phases == null) {
            return List.of(task);
        }
        if (!(phases instanceof List<?> list) || list.isEmpty()) {
            throw new IllegalArgumentException(PHASES_ATTRIBUTE + " must be a non-empty list, got: " + phases);
        }

        List<TaskRecord> split = new ArrayList<>(list.size());
        for (Object phase : list) {
            Map<String, Object> attributes = new LinkedHashMap<>(task.attributes());
            attributes.remove(PHASES_ATTRIBUTE);
            attributes.put(PHASE_ATTRIBUTE, phase.toString());

            split.add(task.toBuilder()
                    .label(task.label() + "-" + phase)
                    .description(task.description() + " (" + phase + ")")
                    .attributes(attributes)
                    .build());
        }
        return split;
    }
}
