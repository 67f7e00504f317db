package org.neuralchilli.decision.core.transform;

import org.neuralchilli.decision.domain.TaskRecord;
import org.neuralchilli.decision.service.TransformException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered transforms; the output of each is the input of the next.
 * Order is part of the contract: a transform may rely on fields set by earlier ones.
 */
public final class TransformPipeline {

    private static final Logger log = LoggerFactory.getLogger(TransformPipeline.class);

    private static final TransformPipeline EMPTY = new TransformPipeline(List.of());

    private final List<Transform> transforms;

    private TransformPipeline(List<Transform> transforms) {
        this.transforms = List.copyOf(transforms);
    }

    public static TransformPipeline empty() {
        return EMPTY;
    }

    public static TransformPipeline of(List<Transform> transforms) {
        return new TransformPipeline(transforms);
    }

    /**
     * New pipeline with {@code next} appended
     */
    public TransformPipeline then(Transform next) {
        List<Transform> extended = new ArrayList<>(transforms);
        extended.add(next);
        return new TransformPipeline(extended);
    }

    public List<String> names() {
        return transforms.stream().map(Transform::name).toList();
    }

    public int size() {
        return transforms.size();
    }

    public List<TaskRecord> run(TransformContext context, List<TaskRecord> tasks) {
        List<TaskRecord> current = List.copyOf(tasks);
        for (Transform transform : transforms) {
            int before = current.size();
            try {
                current = List.copyOf(transform.apply(context, current));
            } catch (TransformException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new TransformException(TransformException.UNKNOWN_LABEL, transform.name(), e);
            }
            log.debug("Kind {}: {} ({} -> {} tasks)",
                    context.kind().name(), transform.name(), before, current.size());
        }
        return current;
    }
}
