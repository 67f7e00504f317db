package org.neuralchilli.decision.domain.payload;

import org.neuralchilli.decision.util.Immutables;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Payload for the scriptworker signing implementation.
 */
public record SigningPayload(
        int maxRunTimeSeconds,
        List<String> formats,
        List<UpstreamArtifact> upstreamArtifacts
) implements WorkerPayload {

    public SigningPayload {
        if (maxRunTimeSeconds <= 0) {
            maxRunTimeSeconds = 10 * 60;
        }
        formats = Immutables.list(formats);
        upstreamArtifacts = Immutables.list(upstreamArtifacts);
    }

    @Override
    public WorkerImplementation implementation() {
        return WorkerImplementation.SIGNING;
    }

    @Override
    public List<String> violations() {
        List<String> violations = new ArrayList<>();
        if (formats.isEmpty()) {
            violations.add("payload.formats: at least one signing format is required");
        }
        if (upstreamArtifacts.isEmpty()) {
            violations.add("payload.upstream-artifacts: nothing to sign");
        }
        for (UpstreamArtifact artifact : upstreamArtifacts) {
            if (artifact.paths().isEmpty()) {
                violations.add("payload.upstream-artifacts: no paths listed for " + artifact.label());
            }
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
        for (UpstreamArtifact artifact : upstreamArtifacts) {
            Map<String, Object> rendered = artifact.render(context);
            rendered.put("formats", formats);
            upstream.add(rendered);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("maxRunTime", maxRunTimeSeconds);
        payload.put("upstreamArtifacts", upstream);
        return payload;
    }
}
