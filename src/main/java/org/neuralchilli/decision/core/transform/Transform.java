package org.neuralchilli.decision.core.transform;

import org.neuralchilli.decision.domain.TaskRecord;

import java.util.List;

/**
 * One step of a kind's pipeline. May map tasks one to one, expand them or drop them.
 */
public interface Transform {

    /**
     * Name used to reference the transform from {@code kind.yml}
     */
    String name();

    List<TaskRecord> apply(TransformContext context, List<TaskRecord> tasks);
}
