package org.neuralchilli.decision.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.decision.cache.IndexService;
import org.neuralchilli.decision.cache.QueueService;
import org.neuralchilli.decision.cache.TaskSubmitter;
import org.neuralchilli.decision.config.DecisionConfig;
import org.neuralchilli.decision.core.DecisionRunContext;
import org.neuralchilli.decision.core.DependencyChunker;
import org.neuralchilli.decision.core.TaskGraphService;
import org.neuralchilli.decision.core.transform.TransformContext;
import org.neuralchilli.decision.core.transform.TransformPipeline;
import org.neuralchilli.decision.core.transform.TransformRegistry;
import org.neuralchilli.decision.domain.DagStatistics;
import org.neuralchilli.decision.domain.KindDefinition;
import org.neuralchilli.decision.domain.RunParameters;
import org.neuralchilli.decision.domain.TaskDefinition;
import org.neuralchilli.decision.domain.TaskGraph;
import org.neuralchilli.decision.domain.TaskRecord;
import org.neuralchilli.decision.target.NightlyTargetTasks;
import org.neuralchilli.decision.target.TargetTaskRegistry;
import org.neuralchilli.decision.target.TargetTaskSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one decision: kinds to full graph, full graph to target graph, target graph
 * to submitted tasks.
 * <p>
 * Stages, in order: load kinds, order them by kind dependencies, build each kind's
 * records and run its pipeline, combine, validate, chunk, validate again, select
 * targets with their dependencies, submit, then write chain-of-trust files on
 * release runs. Any failure aborts the run before further tasks are submitted.
 */
@ApplicationScoped
public class DecisionTaskService {

    private static final Logger log = LoggerFactory.getLogger(DecisionTaskService.class);

    @Inject
    KindLoaderService kindLoader;

    @Inject
    TransformRegistry transforms;

    @Inject
    TaskGraphService graphService;

    @Inject
    GraphValidatorService validator;

    @Inject
    TargetTaskSelector selector;

    @Inject
    TargetTaskRegistry targetTaskMethods;

    @Inject
    TaskSubmitter submitter;

    @Inject
    QueueService queue;

    @Inject
    IndexService index;

    @Inject
    ChainOfTrustWriter chainOfTrust;

    @Inject
    DecisionConfig config;

    public DecisionResult run(RunParameters params) {
        return run(params, Path.of(config.kindsPath()), Instant.now());
    }

    public DecisionResult run(RunParameters params, Path kindsDir, Instant now) {
        log.info("Starting decision run for {} on {}", params.triggerKind().value(), params.gitSha());

        DecisionRunContext run = new DecisionRunContext(params, now);
        TaskGraph full = buildFullGraph(kindsDir, run);

        TaskGraph target = selector.select(full, params);
        validator.validateGraph(target);

        Map<String, String> taskIds = submitter.submit(target, run);

        String method = targetTaskMethods.methodFor(params);
        if (NightlyTargetTasks.NAME.equals(method) && !target.isEmpty() && params.decisionTaskId() != null) {
            index.insertTask(NightlyTargetTasks.indexPath(config.indexPrefix(), params.gitSha()),
                    params.decisionTaskId());
        }

        if (params.isRelease()) {
            writeChainOfTrust(run);
        }

        DagStatistics statistics = target.isEmpty()
                ? new DagStatistics(0, 0, 0, 0, 0, 0)
                : graphService.getStatistics(target);
        log.info("Decision run complete: {}", statistics);

        return new DecisionResult(
                method,
                full,
                target,
                taskIds,
                run.allTaskIds(),
                run.createdTaskIds().size(),
                statistics
        );
    }

    /**
     * Every task of every kind, validated and chunked, nothing submitted
     */
    public TaskGraph buildFullGraph(Path kindsDir, DecisionRunContext run) {
        List<KindDefinition> kinds = graphService.orderKinds(kindLoader.loadKinds(kindsDir));

        TaskGraph graph = TaskGraph.empty();
        for (KindDefinition kind : kinds) {
            List<TaskRecord> initial = kindLoader.initialTasks(kind, graph);
            TransformPipeline pipeline = transforms.pipeline(kind.transforms());
            List<TaskRecord> transformed = pipeline.run(new TransformContext(kind, run, config, graph), initial);

            log.info("Kind {}: {} tasks ({} transforms)", kind.name(), transformed.size(), pipeline.size());
            graph = graph.with(transformed);
        }

        validator.validateGraph(graph);
        TaskGraph chunked = new DependencyChunker(config.maxDependencies(), config.chunkWorkerType()).chunk(graph);
        validator.validateGraph(chunked);

        log.info("Full task graph: {}", chunked);
        return chunked;
    }

    private void writeChainOfTrust(DecisionRunContext run) {
        Map<String, TaskDefinition> tasksById = new LinkedHashMap<>();
        for (String taskId : run.allTaskIds()) {
            tasksById.put(taskId, queue.task(taskId)
                    .orElseThrow(() -> new IllegalStateException("Queue does not know task " + taskId)));
        }
        chainOfTrust.write(Path.of(config.chainOfTrustDir()), tasksById, run.params());
    }
}
