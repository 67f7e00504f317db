package org.neuralchilli.decision.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.decision.config.KindYamlParser;
import org.neuralchilli.decision.core.DependencyGrouper;
import org.neuralchilli.decision.domain.DependencyGroup;
import org.neuralchilli.decision.domain.KindDefinition;
import org.neuralchilli.decision.domain.TaskGraph;
import org.neuralchilli.decision.domain.TaskRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Loads kind definitions from disk and turns a kind into its initial task records.
 * <p>
 * Every {@code <kinds dir>/<name>/kind.yml} is one kind. All kinds are attempted; the
 * run is aborted afterwards if any of them failed to load.
 */
@ApplicationScoped
public class KindLoaderService {

    private static final Logger log = LoggerFactory.getLogger(KindLoaderService.class);

    static final String KIND_FILE = "kind.yml";

    @Inject
    KindYamlParser parser;

    @Inject
    DependencyGrouper grouper;

    /**
     * Load all kinds under {@code kindsDir}, sorted by name
     *
     * @throws KindLoadException if the directory is missing or any kind failed to load
     */
    public List<KindDefinition> loadKinds(Path kindsDir) {
        if (!Files.isDirectory(kindsDir)) {
            throw new KindLoadException("Kinds directory does not exist: " + kindsDir);
        }

        List<Path> kindDirs;
        try (Stream<Path> paths = Files.list(kindsDir)) {
            kindDirs = paths.filter(dir -> Files.isRegularFile(dir.resolve(KIND_FILE))).sorted().toList();
        } catch (IOException e) {
            throw new KindLoadException("Error scanning kinds directory: " + kindsDir, e);
        }

        List<KindDefinition> kinds = new ArrayList<>();
        List<LoadResult> results = new ArrayList<>();
        for (Path dir : kindDirs) {
            String name = dir.getFileName().toString();
            try {
                KindDefinition kind = parser.parseKind(name, Files.readString(dir.resolve(KIND_FILE)));
                kinds.add(kind);
                results.add(LoadResult.loaded(name, kind.jobs().size()));
            } catch (IOException e) {
                log.error("✗ Failed to read kind file: {}", dir, e);
                results.add(LoadResult.failed(name, e));
            } catch (RuntimeException e) {
                log.error("✗ Failed to load kind from: {}", dir, e);
                results.add(LoadResult.failed(name, e));
            }
        }

        logResults(results);
        return kinds;
    }

    /**
     * Initial records of a kind, before its transforms run.
     *
     * @param upstream tasks of the kinds loaded so far
     */
    public List<TaskRecord> initialTasks(KindDefinition kind, TaskGraph upstream) {
        return switch (kind.loader()) {
            case TEMPLATES -> templateTasks(kind);
            case FROM_DEPS -> fromDepsTasks(kind, upstream);
        };
    }

    private List<TaskRecord> templateTasks(KindDefinition kind) {
        List<TaskRecord> tasks = new ArrayList<>();
        for (Map.Entry<String, Map<String, Object>> job : kind.jobs().entrySet()) {
            tasks.add(parser.parseJob(kind.name(), job.getKey(), job.getValue(), kind.jobDefaults()));
        }
        return tasks;
    }

    private List<TaskRecord> fromDepsTasks(KindDefinition kind, TaskGraph upstream) {
        KindDefinition.FromDeps fromDeps = kind.fromDeps();

        List<TaskRecord> candidates = new ArrayList<>();
        for (String upstreamKind : fromDeps.kinds()) {
            candidates.addAll(upstream.tasksOfKind(upstreamKind));
        }

        List<DependencyGroup> groups = grouper.group(candidates, fromDeps.groupBy(), fromDeps.allGroupsValue());
        TaskRecord template = parser.parseJob(kind.name(), "template", fromDeps.jobTemplate(), kind.jobDefaults());

        List<TaskRecord> tasks = grouper.downstreamTasks(template, groups, fromDeps.groupBy());
        log.debug("Kind {}: {} groups from {} upstream tasks", kind.name(), tasks.size(), candidates.size());
        return tasks;
    }

    private void logResults(List<LoadResult> results) {
        long loaded = results.stream().filter(LoadResult::isSuccess).count();
        long failed = results.size() - loaded;

        log.info("Loaded {} kinds: {} succeeded, {} failed", results.size(), loaded, failed);

        if (failed > 0) {
            List<String> errors = new ArrayList<>();
            results.stream()
                    .filter(result -> !result.isSuccess())
                    .forEach(result -> {
                        String error = result.kind() + ": " + result.error().orElse("unknown error");
                        log.warn("  ✗ {}", error);
                        errors.add(error);
                    });
            throw new KindLoadException("Failed to load " + failed + " kinds:\n" + String.join("\n", errors));
        }
    }
}
