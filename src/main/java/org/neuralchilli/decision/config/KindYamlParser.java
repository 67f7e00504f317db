package org.neuralchilli.decision.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.decision.domain.CachePolicy;
import org.neuralchilli.decision.domain.KindDefinition;
import org.neuralchilli.decision.domain.TaskRecord;
import org.neuralchilli.decision.domain.payload.BeetmoverPayload;
import org.neuralchilli.decision.domain.payload.DockerImage;
import org.neuralchilli.decision.domain.payload.DockerWorkerPayload;
import org.neuralchilli.decision.domain.payload.SigningPayload;
import org.neuralchilli.decision.domain.payload.SucceedPayload;
import org.neuralchilli.decision.domain.payload.UpstreamArtifact;
import org.neuralchilli.decision.domain.payload.WorkerImplementation;
import org.neuralchilli.decision.domain.payload.WorkerPayload;
import org.neuralchilli.decision.service.SchemaViolationException;
import org.yaml.snakeyaml.Yaml;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Parses {@code kind.yml} files into kind definitions, and job templates into task records.
 * <p>
 * A job is merged over the kind's {@code job-defaults} (nested maps merged, other values
 * replaced) and labelled {@code <kind>-<job name>}.
 */
@ApplicationScoped
public class KindYamlParser {

    /**
     * Parse a kind definition from YAML; the name comes from the kind's directory
     */
    public KindDefinition parseKind(String name, String yamlContent) {
        Map<String, Object> data = new Yaml().load(yamlContent);
        if (data == null) {
            throw new IllegalArgumentException("Kind '" + name + "' has an empty kind.yml");
        }
        return parseKindFromMap(name, data);
    }

    @SuppressWarnings("unchecked")
    private KindDefinition parseKindFromMap(String name, Map<String, Object> data) {
        KindDefinition.Loader loader = KindDefinition.Loader.fromString(getString(data, "loader", false));
        List<String> kindDependencies = getStringList(data, "kind-dependencies", List.of());
        List<String> transforms = getStringList(data, "transforms", List.of());
        Map<String, Object> jobDefaults = getMap(data, "job-defaults");

        Map<String, Map<String, Object>> jobs = new LinkedHashMap<>();
        getMap(data, "jobs").forEach((jobName, job) -> {
            if (!(job instanceof Map)) {
                throw new IllegalArgumentException("Job '" + jobName + "' of kind '" + name + "' must be a map");
            }
            jobs.put(jobName, (Map<String, Object>) job);
        });

        KindDefinition.FromDeps fromDeps = null;
        if (data.containsKey("from-deps")) {
            Map<String, Object> section = getMap(data, "from-deps");
            fromDeps = new KindDefinition.FromDeps(
                    getStringList(section, "kinds", List.of()),
                    getString(section, "group-by", false),
                    getString(section, "all-groups-value", false),
                    getMap(section, "job-template")
            );
        }

        return new KindDefinition(name, loader, kindDependencies, transforms, jobDefaults, jobs, fromDeps);
    }

    /**
     * Task record of one job template
     */
    public TaskRecord parseJob(String kind, String jobName, Map<String, Object> job, Map<String, Object> defaults) {
        String label = kind + "-" + jobName;
        Map<String, Object> data = merge(defaults, job);

        return TaskRecord.builder(label)
                .kind(kind)
                .description(getString(data, "description", false))
                .provisionerId(getString(data, "provisioner-id", false))
                .workerType(getString(data, "worker-type", false))
                .payload(parsePayload(label, getMap(data, "worker")))
                .dependencies(getStringList(data, "dependencies", List.of()))
                .attributes(getMap(data, "attributes"))
                .routes(getStringList(data, "routes", List.of()))
                .scopes(getStringList(data, "scopes", List.of()))
                .extra(getMap(data, "extra"))
                .cache(parseCache(label, data.get("cache")))
                .deadlineIn(getString(data, "deadline-in", false))
                .expiresIn(getString(data, "expires-in", false))
                .indexAndArtifactsExpireIn(getString(data, "index-and-artifacts-expire-in", false))
                .build();
    }

    WorkerPayload parsePayload(String label, Map<String, Object> worker) {
        String implementation = getString(worker, "implementation", false);
        if (implementation == null) {
            throw new SchemaViolationException(label, "worker.implementation", "is required");
        }

        WorkerImplementation kind;
        try {
            kind = WorkerImplementation.fromString(implementation);
        } catch (IllegalArgumentException e) {
            throw new SchemaViolationException(label, "worker.implementation", e.getMessage());
        }

        return switch (kind) {
            case DOCKER_WORKER -> parseDockerWorker(label, worker);
            case SIGNING -> new SigningPayload(
                    getInt(label, worker, "max-run-time", 0),
                    getStringList(worker, "formats", List.of()),
                    parseUpstreamArtifacts(label, worker)
            );
            case BEETMOVER -> new BeetmoverPayload(
                    getInt(label, worker, "max-run-time", 0),
                    getString(worker, "app-name", false),
                    getString(worker, "app-version", false),
                    getString(worker, "artifact-id", false),
                    parseUpstreamArtifacts(label, worker)
            );
            case SUCCEED -> new SucceedPayload();
        };
    }

    private DockerWorkerPayload parseDockerWorker(String label, Map<String, Object> worker) {
        Object script = worker.get("script");
        List<String> scripts;
        if (script instanceof List<?> list) {
            scripts = list.stream().map(Object::toString).collect(Collectors.toList());
        } else if (script != null) {
            scripts = List.of(script.toString());
        } else {
            scripts = List.of();
        }

        String image = getString(worker, "docker-image", false);

        return new DockerWorkerPayload(
                image != null ? DockerImage.named(image) : null,
                getInt(label, worker, "max-run-time", 0),
                scripts,
                getStringMap(worker, "env"),
                getStringMap(worker, "caches"),
                new LinkedHashSet<>(getStringList(worker, "features", List.of())),
                getStringList(worker, "artifacts", List.of()),
                List.of()
        );
    }

    private List<UpstreamArtifact> parseUpstreamArtifacts(String label, Map<String, Object> worker) {
        Object value = worker.get("upstream-artifacts");
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> entries)) {
            throw new SchemaViolationException(label, "worker.upstream-artifacts", "must be a list");
        }

        List<UpstreamArtifact> artifacts = new ArrayList<>();
        for (Object entry : entries) {
            if (!(entry instanceof Map<?, ?> map) || map.get("task") == null) {
                throw new SchemaViolationException(label, "worker.upstream-artifacts", "entries need a 'task'");
            }
            Map<String, Object> artifact = stringKeys(map);
            artifacts.add(new UpstreamArtifact(
                    getString(artifact, "task", true),
                    getString(artifact, "task-type", false),
                    getStringList(artifact, "paths", List.of())
            ));
        }
        return artifacts;
    }

    private CachePolicy parseCache(String label, Object cache) {
        if (cache == null || "none".equals(cache)) {
            return CachePolicy.none();
        }
        if ("content-hash".equals(cache)) {
            return CachePolicy.contentHash();
        }
        if (cache instanceof Map<?, ?> map && map.get("index-path") != null) {
            return CachePolicy.indexPath(map.get("index-path").toString());
        }
        throw new SchemaViolationException(label, "cache",
                "must be 'none', 'content-hash' or {index-path: ...}, got: " + cache);
    }

    /**
     * {@code override} over {@code base}: nested maps are merged, anything else replaced
     */
    @SuppressWarnings("unchecked")
    static Map<String, Object> merge(Map<String, Object> base, Map<String, Object> override) {
        Map<String, Object> merged = new LinkedHashMap<>(base != null ? base : Map.of());
        if (override == null) {
            return merged;
        }
        override.forEach((key, value) -> {
            Object existing = merged.get(key);
            if (existing instanceof Map && value instanceof Map) {
                merged.put(key, merge((Map<String, Object>) existing, (Map<String, Object>) value));
            } else {
                merged.put(key, value);
            }
        });
        return merged;
    }

    // Helper methods for type-safe extraction

    private String getString(Map<String, Object> map, String key, boolean required) {
        Object value = map.get(key);
        if (value == null) {
            if (required) {
                throw new IllegalArgumentException("Missing required field: " + key);
            }
            return null;
        }
        return value.toString();
    }

    private int getInt(String label, Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString());
        } catch (NumberFormatException e) {
            throw new SchemaViolationException(label, "worker." + key, "must be a number, got: " + value);
        }
    }

    private List<String> getStringList(Map<String, Object> map, String key, List<String> defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof List<?> list) {
            return list.stream().map(Object::toString).collect(Collectors.toList());
        }
        return List.of(value.toString());
    }

    private Map<String, Object> getMap(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof Map<?, ?> nested) {
            return stringKeys(nested);
        }
        if (value != null) {
            throw new IllegalArgumentException("Field '" + key + "' must be a map, got: " + value);
        }
        return Map.of();
    }

    private Map<String, String> getStringMap(Map<String, Object> map, String key) {
        Map<String, String> result = new LinkedHashMap<>();
        getMap(map, key).forEach((k, v) -> result.put(k, v != null ? v.toString() : null));
        return result;
    }

    private static Map<String, Object> stringKeys(Map<?, ?> map) {
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }
}
