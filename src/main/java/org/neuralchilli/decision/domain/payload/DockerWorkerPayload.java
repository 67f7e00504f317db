package org.neuralchilli.decision.domain.payload;

import org.neuralchilli.decision.util.Immutables;
import org.neuralchilli.decision.util.TextFunctions;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Payload for the docker-worker implementation.
 * Scripts are joined, de-indented and interpreted with {@code bash}.
 */
public record DockerWorkerPayload(
        DockerImage image,
        int maxRunTimeMinutes,
        List<String> scripts,
        Map<String, String> env,
        Map<String, String> caches,
        Set<String> features,
        List<String> artifacts,
        List<ArtifactFetch> fetches
) implements WorkerPayload {

    public static final String DEFAULT_IMAGE = "ubuntu:bionic-20180821";
    public static final String CHAIN_OF_TRUST = "chainOfTrust";

    public DockerWorkerPayload {
        if (image == null) {
            image = DockerImage.named(DEFAULT_IMAGE);
        }
        if (maxRunTimeMinutes <= 0) {
            maxRunTimeMinutes = 30;
        }
        scripts = Immutables.list(scripts);
        env = Immutables.map(env);
        caches = Immutables.map(caches);
        features = Immutables.set(features);
        artifacts = Immutables.list(artifacts);
        fetches = Immutables.list(fetches);
    }

    public static DockerWorkerPayload empty() {
        return new DockerWorkerPayload(null, 0, null, null, null, null, null, null);
    }

    @Override
    public WorkerImplementation implementation() {
        return WorkerImplementation.DOCKER_WORKER;
    }

    public DockerWorkerPayload withImage(DockerImage image) {
        return new DockerWorkerPayload(image, maxRunTimeMinutes, scripts, env, caches, features, artifacts, fetches);
    }

    public DockerWorkerPayload withMaxRunTimeMinutes(int minutes) {
        return new DockerWorkerPayload(image, minutes, scripts, env, caches, features, artifacts, fetches);
    }

    public DockerWorkerPayload withScripts(List<String> scripts) {
        return new DockerWorkerPayload(image, maxRunTimeMinutes, scripts, env, caches, features, artifacts, fetches);
    }

    public DockerWorkerPayload withScript(String script) {
        List<String> appended = new ArrayList<>(scripts);
        appended.add(script);
        return withScripts(appended);
    }

    public DockerWorkerPayload withEarlyScript(String script) {
        List<String> prepended = new ArrayList<>();
        prepended.add(script);
        prepended.addAll(scripts);
        return withScripts(prepended);
    }

    public DockerWorkerPayload withEnv(Map<String, String> env) {
        return new DockerWorkerPayload(image, maxRunTimeMinutes, scripts, env, caches, features, artifacts, fetches);
    }

    public DockerWorkerPayload withEnv(String name, String value) {
        Map<String, String> updated = new LinkedHashMap<>(env);
        updated.put(name, value);
        return withEnv(updated);
    }

    public DockerWorkerPayload withFeatures(String... names) {
        Set<String> updated = new LinkedHashSet<>(features);
        updated.addAll(List.of(names));
        return new DockerWorkerPayload(image, maxRunTimeMinutes, scripts, env, caches, updated, artifacts, fetches);
    }

    public DockerWorkerPayload withArtifacts(List<String> artifacts) {
        return new DockerWorkerPayload(image, maxRunTimeMinutes, scripts, env, caches, features, artifacts, fetches);
    }

    public DockerWorkerPayload withFetch(ArtifactFetch fetch) {
        List<ArtifactFetch> updated = new ArrayList<>(fetches);
        updated.add(fetch);
        return new DockerWorkerPayload(image, maxRunTimeMinutes, scripts, env, caches, features, artifacts, updated);
    }

    @Override
    public List<String> violations() {
        List<String> violations = new ArrayList<>();
        if (scripts.isEmpty()) {
            violations.add("payload.scripts: at least one script is required");
        }
        if (maxRunTimeMinutes > 24 * 60) {
            violations.add("payload.max-run-time: must not exceed 1440 minutes, got " + maxRunTimeMinutes);
        }
        for (String artifact : artifacts) {
            if (!artifact.startsWith("/")) {
                violations.add("payload.artifacts: path must be absolute, got " + artifact);
            }
        }
        return violations;
    }

    @Override
    public Set<String> referencedLabels() {
        Set<String> labels = new LinkedHashSet<>();
        if (image instanceof DockerImage.TaskImage taskImage) {
            labels.add(taskImage.label());
        }
        fetches.forEach(fetch -> labels.add(fetch.label()));
        return labels;
    }

    @Override
    public Map<String, Object> render(RenderContext context) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("image", image.render(context));
        payload.put("maxRunTime", maxRunTimeMinutes * 60);

        List<String> allScripts = new ArrayList<>();
        fetches.forEach(fetch -> allScripts.add(fetch.script(context)));
        allScripts.addAll(scripts);
        payload.put("command", List.of(
                "/bin/bash", "--login", "-x", "-e", "-c",
                TextFunctions.deindent(String.join("\n", allScripts))
        ));

        Set<String> effectiveFeatures = new LinkedHashSet<>(features);
        if (!artifacts.isEmpty()) {
            effectiveFeatures.add(CHAIN_OF_TRUST);
        }

        if (!env.isEmpty()) {
            payload.put("env", env);
        }
        if (!caches.isEmpty()) {
            payload.put("cache", caches);
        }
        if (!effectiveFeatures.isEmpty()) {
            Map<String, Object> featureFlags = new LinkedHashMap<>();
            effectiveFeatures.forEach(name -> featureFlags.put(name, true));
            payload.put("features", featureFlags);
        }
        if (!artifacts.isEmpty()) {
            Map<String, Object> published = new LinkedHashMap<>();
            for (String path : artifacts) {
                Map<String, Object> artifact = new LinkedHashMap<>();
                artifact.put("type", "file");
                artifact.put("path", path);
                if (!context.normalized()) {
                    artifact.put("expires", context.artifactsExpireAt());
                }
                published.put("public/" + TextFunctions.urlBasename(path), artifact);
            }
            payload.put("artifacts", published);
        }
        return payload;
    }
}
