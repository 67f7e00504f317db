package org.neuralchilli.decision.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * Task as submitted to the remote queue's {@code createTask}.
 * Empty scopes, routes and extra are left out of the JSON.
 */
public record TaskDefinition(
        String taskGroupId,
        List<String> dependencies,
        String schedulerId,
        String provisionerId,
        String workerType,
        String created,
        String deadline,
        String expires,
        Metadata metadata,
        Map<String, Object> payload,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> scopes,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> routes,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, Object> extra
) {
    public TaskDefinition {
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        scopes = scopes != null ? List.copyOf(scopes) : List.of();
        routes = routes != null ? List.copyOf(routes) : List.of();
        payload = payload != null ? payload : Map.of();
        extra = extra != null ? extra : Map.of();
    }

    public record Metadata(String name, String description, String owner, String source) {
    }
}
