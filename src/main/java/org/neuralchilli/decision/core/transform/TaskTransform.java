package org.neuralchilli.decision.core.transform;

import org.neuralchilli.decision.domain.TaskRecord;
import org.neuralchilli.decision.service.TransformException;

import java.util.ArrayList;
import java.util.List;

/**
 * Transform applied to each task independently. Failures are reported against the
 * task being transformed.
 */
public abstract class TaskTransform implements Transform {

    @Override
    public List<TaskRecord> apply(TransformContext context, List<TaskRecord> tasks) {
        List<TaskRecord> result = new ArrayList<>(tasks.size());
        for (TaskRecord task : tasks) {
            try {
                result.addAll(applyTo(context, task));
            } catch (TransformException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new TransformException(task.label(), name(), e);
            }
        }
        return result;
    }

    /**
     * Replacement tasks for {@code task}: itself, changed copies, or none.
     */
    protected abstract List<TaskRecord> applyTo(TransformContext context, TaskRecord task);
}
