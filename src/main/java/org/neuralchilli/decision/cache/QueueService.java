package org.neuralchilli.decision.cache;

import org.neuralchilli.decision.domain.TaskDefinition;

import java.util.Optional;

/**
 * Remote task queue: the only place tasks are created.
 */
public interface QueueService {

    void createTask(String taskId, TaskDefinition definition);

    /**
     * Definition of an existing task, if the queue knows it
     */
    Optional<TaskDefinition> task(String taskId);
}
