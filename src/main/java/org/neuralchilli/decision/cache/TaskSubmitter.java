package org.neuralchilli.decision.cache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.decision.config.DecisionConfig;
import org.neuralchilli.decision.core.DecisionRunContext;
import org.neuralchilli.decision.core.TaskGraphService;
import org.neuralchilli.decision.domain.TaskGraph;
import org.neuralchilli.decision.domain.TaskRecord;
import org.neuralchilli.decision.util.SlugId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Submits a task graph to the queue in dependency order.
 * <p>
 * Cached tasks go through find-or-create: the run's own cache first, then the index.
 * A hit reuses the indexed task id; a miss creates the task with an {@code index.} route
 * so it is indexed once it succeeds. Index failures propagate and are never treated
 * as misses.
 */
@ApplicationScoped
public class TaskSubmitter {

    private static final Logger log = LoggerFactory.getLogger(TaskSubmitter.class);

    @Inject
    QueueService queue;

    @Inject
    IndexService index;

    @Inject
    IndexPathCalculator indexPaths;

    @Inject
    TaskDefinitionFactory definitions;

    @Inject
    TaskGraphService graphService;

    @Inject
    DecisionConfig config;

    /**
     * @return label to task id, for every task of the graph
     */
    public Map<String, String> submit(TaskGraph graph, DecisionRunContext run) {
        int createdBefore = run.createdTaskIds().size();
        for (String label : graphService.topologicalOrder(graph)) {
            TaskRecord task = graph.get(label);
            String taskId = task.cache().isCached() ? findOrCreate(task, run) : create(task, run);
            run.assignTaskId(label, taskId);
        }

        int created = run.createdTaskIds().size() - createdBefore;
        log.info("Submitted {} tasks: {} created, {} reused", graph.size(), created, graph.size() - created);
        return run.taskIdsByLabel();
    }

    /**
     * Create the task unconditionally
     */
    public String create(TaskRecord task, DecisionRunContext run) {
        String taskId = SlugId.nice();
        queue.createTask(taskId, definitions.create(task, run));
        run.recordCreated(taskId);
        log.debug("Created {} as {}", task.label(), taskId);
        return taskId;
    }

    public String findOrCreate(TaskRecord task, DecisionRunContext run) {
        String indexPath = indexPaths.fullPath(
                config.indexPrefix(),
                indexPaths.indexPath(task, definitions.renderContext(task, run, true))
        );

        Optional<String> known = run.foundOrCreated(indexPath);
        if (known.isPresent()) {
            log.debug("{} already found or created in this run at {}", task.label(), indexPath);
            return known.get();
        }

        String taskId;
        Optional<String> indexed = index.findTask(indexPath);
        if (indexed.isPresent()) {
            taskId = indexed.get();
            run.recordFound(taskId);
            log.debug("Reusing {} for {} from {}", taskId, task.label(), indexPath);
        } else {
            taskId = create(task.withAddedRoute(HazelcastTaskStore.INDEX_ROUTE_PREFIX + indexPath), run);
        }

        run.recordFoundOrCreated(indexPath, taskId);
        return taskId;
    }
}
