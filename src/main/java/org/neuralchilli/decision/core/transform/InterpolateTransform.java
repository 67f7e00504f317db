package org.neuralchilli.decision.core.transform;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.decision.core.ExpressionContext;
import org.neuralchilli.decision.core.ExpressionEvaluator;
import org.neuralchilli.decision.domain.TaskRecord;
import org.neuralchilli.decision.domain.payload.BeetmoverPayload;
import org.neuralchilli.decision.domain.payload.DockerWorkerPayload;
import org.neuralchilli.decision.domain.payload.WorkerPayload;

import java.util.List;

/**
 * Evaluates {@code ${...}} expressions in descriptions, routes and payload strings
 * (docker scripts, env and artifact paths; publish version).
 */
@ApplicationScoped
public class InterpolateTransform extends TaskTransform {

    public static final String NAME = "interpolate";

    @Inject
    ExpressionEvaluator evaluator;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected List<TaskRecord> applyTo(TransformContext context, TaskRecord task) {
        ExpressionContext expressions = ExpressionContext.forTask(context.params(), task);

        return List.of(task.toBuilder()
                .description(evaluator.evaluate(task.description(), expressions))
                .routes(evaluator.evaluateList(task.routes(), expressions))
                .payload(interpolate(task.payload(), expressions))
                .build());
    }

    private WorkerPayload interpolate(WorkerPayload payload, ExpressionContext expressions) {
        if (payload instanceof DockerWorkerPayload docker) {
            return docker
                    .withScripts(evaluator.evaluateList(docker.scripts(), expressions))
                    .withEnv(evaluator.evaluateMap(docker.env(), expressions))
                    .withArtifacts(evaluator.evaluateList(docker.artifacts(), expressions));
        }
        if (payload instanceof BeetmoverPayload beetmover && beetmover.appVersion() != null) {
            return beetmover.withAppVersion(evaluator.evaluate(beetmover.appVersion(), expressions));
        }
        return payload;
    }
}
