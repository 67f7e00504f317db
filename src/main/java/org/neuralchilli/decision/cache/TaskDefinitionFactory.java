package org.neuralchilli.decision.cache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.decision.config.DecisionConfig;
import org.neuralchilli.decision.core.DecisionRunContext;
import org.neuralchilli.decision.domain.RunParameters;
import org.neuralchilli.decision.domain.TaskDefinition;
import org.neuralchilli.decision.domain.TaskRecord;
import org.neuralchilli.decision.domain.payload.RenderContext;
import org.neuralchilli.decision.service.MissingDependencyException;
import org.neuralchilli.decision.util.DurationParser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders task records into the definitions the queue accepts.
 */
@ApplicationScoped
public class TaskDefinitionFactory {

    @Inject
    DecisionConfig config;

    /**
     * Rendering context resolving labels through the run's assigned task ids.
     *
     * @param normalized leave time-dependent fields out, for hashing
     */
    public RenderContext renderContext(TaskRecord task, DecisionRunContext run, boolean normalized) {
        return new RenderContext() {
            @Override
            public String taskIdFor(String label) {
                return run.taskIdFor(label)
                        .orElseThrow(() -> new MissingDependencyException(task.label(), label));
            }

            @Override
            public String artifactsExpireAt() {
                return timestamp(run, task.indexAndArtifactsExpireIn());
            }

            @Override
            public boolean normalized() {
                return normalized;
            }
        };
    }

    /**
     * Definition of {@code task}; every dependency must already have a task id.
     */
    public TaskDefinition create(TaskRecord task, DecisionRunContext run) {
        RunParameters params = run.params();

        List<String> dependencies = new ArrayList<>();
        if (params.decisionTaskId() != null) {
            dependencies.add(params.decisionTaskId());
        }
        for (String label : task.dependencies()) {
            dependencies.add(run.taskIdFor(label)
                    .orElseThrow(() -> new MissingDependencyException(task.label(), label)));
        }

        List<String> scopes = new ArrayList<>(task.scopes());
        scopes.addAll(config.scopesForAllSubtasks().orElse(List.of()));
        List<String> routes = new ArrayList<>(task.routes());
        routes.addAll(config.routesForAllSubtasks().orElse(List.of()));

        Map<String, Object> extra = new LinkedHashMap<>(task.extra());
        if (routes.stream().anyMatch(route -> route.startsWith(HazelcastTaskStore.INDEX_ROUTE_PREFIX))) {
            Map<String, Object> index = new LinkedHashMap<>();
            if (extra.get("index") instanceof Map<?, ?> existing) {
                existing.forEach((k, v) -> index.put(String.valueOf(k), v));
            }
            index.put("expires", timestamp(run, task.indexAndArtifactsExpireIn()));
            extra.put("index", index);
        }

        String name = task.description().isEmpty() ? task.label() : task.description();

        return new TaskDefinition(
                params.decisionTaskId(),
                dependencies,
                config.schedulerId(),
                task.provisionerId(),
                task.workerType(),
                timestamp(run, ""),
                timestamp(run, task.deadlineIn()),
                timestamp(run, task.expiresIn()),
                new TaskDefinition.Metadata(
                        String.format(config.taskNameTemplate(), name),
                        task.description(),
                        params.taskOwner(),
                        params.taskSource()
                ),
                task.payload().render(renderContext(task, run, false)),
                scopes,
                routes,
                extra
        );
    }

    private static String timestamp(DecisionRunContext run, String offset) {
        return DurationParser.fromNow(offset, run.now()).toString();
    }
}
