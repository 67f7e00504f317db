package org.neuralchilli.decision.core.transform;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.decision.domain.TaskRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Drops tasks whose {@code min-build-level} is above the run's build level, so untrusted
 * runs never see tasks that need privileged scopes.
 */
@ApplicationScoped
public class RequireBuildLevelTransform extends TaskTransform {

    private static final Logger log = LoggerFactory.getLogger(RequireBuildLevelTransform.class);

    public static final String NAME = "require-build-level";
    public static final String ATTRIBUTE = "min-build-level";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected List<TaskRecord> applyTo(TransformContext context, TaskRecord task) {
        if (!task.hasAttribute(ATTRIBUTE)) {
            return List.of(task);
        }

        int required = Integer.parseInt(task.stringAttribute(ATTRIBUTE));
        if (required > context.params().buildLevel()) {
            log.debug("Dropping {}: needs build level {}, run has {}",
                    task.label(), required, context.params().buildLevel());
            return List.of();
        }
        return List.of(task);
    }
}
