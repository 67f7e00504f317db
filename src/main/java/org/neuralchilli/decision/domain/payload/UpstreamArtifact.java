package org.neuralchilli.decision.domain.payload;

import org.neuralchilli.decision.util.Immutables;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Artifacts of an upstream task consumed by a scriptworker task (signing, publishing).
 */
public record UpstreamArtifact(
        String label,
        String taskType,
        List<String> paths
) {
    public UpstreamArtifact {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Upstream artifact label cannot be null or empty");
        }
        if (taskType == null || taskType.isBlank()) {
            taskType = "build";
        }
        paths = Immutables.list(paths);
    }

    Map<String, Object> render(RenderContext context) {
        Map<String, Object> rendered = new LinkedHashMap<>();
        rendered.put("taskId", context.taskIdFor(label));
        rendered.put("taskType", taskType);
        rendered.put("paths", paths);
        return rendered;
    }
}
