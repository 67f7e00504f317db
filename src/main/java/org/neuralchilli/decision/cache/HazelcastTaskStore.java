package org.neuralchilli.decision.cache;

import com.hazelcast.core.HazelcastException;
import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.map.IMap;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.decision.domain.TaskDefinition;
import org.neuralchilli.decision.service.IndexLookupException;
import org.neuralchilli.decision.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Queue and index kept in embedded Hazelcast maps, for dry runs and tests.
 * <p>
 * Definitions are stored as JSON. Tasks are indexed as soon as they are created
 * under each of their {@code index.} routes, as if they had already succeeded.
 */
@ApplicationScoped
public class HazelcastTaskStore implements QueueService, IndexService {

    private static final Logger log = LoggerFactory.getLogger(HazelcastTaskStore.class);

    static final String TASKS_MAP = "decision-tasks";
    static final String INDEX_MAP = "decision-index";
    static final String INDEX_ROUTE_PREFIX = "index.";

    @Inject
    HazelcastInstance hazelcast;

    @Override
    public void createTask(String taskId, TaskDefinition definition) {
        if (tasks().putIfAbsent(taskId, Jsons.toJson(definition)) != null) {
            throw new IllegalStateException("Task " + taskId + " already exists");
        }

        for (String route : definition.routes()) {
            if (route.startsWith(INDEX_ROUTE_PREFIX)) {
                insertTask(route.substring(INDEX_ROUTE_PREFIX.length()), taskId);
            }
        }
        log.debug("Created task {} ({})", taskId, definition.metadata().name());
    }

    @Override
    public Optional<TaskDefinition> task(String taskId) {
        String json = tasks().get(taskId);
        return Optional.ofNullable(json).map(value -> Jsons.fromJson(value, TaskDefinition.class));
    }

    @Override
    public Optional<String> findTask(String indexPath) {
        try {
            return Optional.ofNullable(index().get(indexPath));
        } catch (HazelcastException e) {
            throw new IndexLookupException(indexPath, e.getMessage(), e);
        }
    }

    @Override
    public void insertTask(String indexPath, String taskId) {
        index().put(indexPath, taskId);
        log.trace("Indexed {} at {}", taskId, indexPath);
    }

    public int taskCount() {
        return tasks().size();
    }

    /**
     * Remove every task and index entry
     */
    public void clear() {
        tasks().clear();
        index().clear();
    }

    private IMap<String, String> tasks() {
        return hazelcast.getMap(TASKS_MAP);
    }

    private IMap<String, String> index() {
        return hazelcast.getMap(INDEX_MAP);
    }
}
