package org.neuralchilli.decision.domain.payload;

import org.neuralchilli.decision.util.Immutables;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Payload for the beetmover (publish) implementation.
 */
public record BeetmoverPayload(
        int maxRunTimeSeconds,
        String appName,
        String appVersion,
        String artifactId,
        List<UpstreamArtifact> upstreamArtifacts
) implements WorkerPayload {

    public BeetmoverPayload {
        if (maxRunTimeSeconds <= 0) {
            maxRunTimeSeconds = 10 * 60;
        }
        upstreamArtifacts = Immutables.list(upstreamArtifacts);
    }

    @Override
    public WorkerImplementation implementation() {
        return WorkerImplementation.BEETMOVER;
    }

    public BeetmoverPayload withAppVersion(String appVersion) {
        return new BeetmoverPayload(maxRunTimeSeconds, appName, appVersion, artifactId, upstreamArtifacts);
    }

    @Override
    public List<String> violations() {
        List<String> violations = new ArrayList<>();
        if (appName == null || appName.isBlank()) {
            violations.add("payload.app-name: required");
        }
        if (appVersion == null || appVersion.isBlank()) {
            violations.add("payload.app-version: required");
        }
        if (artifactId == null || artifactId.isBlank()) {
            violations.add("payload.artifact-id: required");
        }
        if (upstreamArtifacts.isEmpty()) {
            violations.add("payload.upstream-artifacts: nothing to publish");
        }
        return violations;
    }

    @Override
    public Set<String> referencedLabels() {
        Set<String> labels = new LinkedHashSet<>();
        upstreamArtifacts.forEach(artifact -> labels.add(artifact.label()));
        return labels;
    }

    @Override
    public Map<String, Object> render(RenderContext context) {
        List<Map<String, Object>> upstream = new ArrayList<>();
        upstreamArtifacts.forEach(artifact -> upstream.add(artifact.render(context)));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("features", Map.of(DockerWorkerPayload.CHAIN_OF_TRUST, true));
        payload.put("maxRunTime", maxRunTimeSeconds);
        payload.put("releaseProperties", Map.of("appName", appName));
        payload.put("upstreamArtifacts", upstream);
        payload.put("version", appVersion);
        payload.put("artifact_id", artifactId);
        return payload;
    }
}
