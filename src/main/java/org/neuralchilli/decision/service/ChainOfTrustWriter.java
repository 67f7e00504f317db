package org.neuralchilli.decision.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.decision.domain.RunParameters;
import org.neuralchilli.decision.domain.TaskDefinition;
import org.neuralchilli.decision.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes the files release workers verify the decision task against:
 * {@code task-graph.json} ({@code {taskId: {task: definition}}}), {@code actions.json}
 * and {@code parameters.yml}.
 */
@ApplicationScoped
public class ChainOfTrustWriter {

    private static final Logger log = LoggerFactory.getLogger(ChainOfTrustWriter.class);

    public static final String TASK_GRAPH_FILE = "task-graph.json";
    public static final String ACTIONS_FILE = "actions.json";
    public static final String PARAMETERS_FILE = "parameters.yml";

    public void write(Path directory, Map<String, TaskDefinition> tasksById, RunParameters params) {
        Map<String, Object> taskGraph = new LinkedHashMap<>();
        tasksById.forEach((taskId, definition) -> taskGraph.put(taskId, Map.of("task", definition)));

        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);

        try {
            Files.createDirectories(directory);
            Files.writeString(directory.resolve(TASK_GRAPH_FILE), Jsons.toJson(taskGraph));
            Files.writeString(directory.resolve(ACTIONS_FILE), "{}");
            Files.writeString(directory.resolve(PARAMETERS_FILE), new Yaml(options).dump(params.toMap()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write chain of trust files to " + directory, e);
        }

        log.info("Wrote chain of trust files for {} tasks to {}", tasksById.size(), directory);
    }
}
