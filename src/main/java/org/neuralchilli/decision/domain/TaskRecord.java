package org.neuralchilli.decision.domain;

import org.neuralchilli.decision.domain.payload.WorkerPayload;
import org.neuralchilli.decision.util.Immutables;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One node of the task graph: a unit of schedulable work.
 * Immutable; every {@code with*} method returns a new record.
 */
public record TaskRecord(
        String label,
        String kind,
        String description,
        String provisionerId,
        String workerType,
        WorkerPayload payload,
        Set<String> dependencies,
        Map<String, Object> attributes,
        List<String> routes,
        List<String> scopes,
        Map<String, Object> extra,
        CachePolicy cache,
        String deadlineIn,
        String expiresIn,
        String indexAndArtifactsExpireIn
) {
    public static final String LABEL_PATTERN = "^[a-z0-9][a-z0-9._-]*$";
    public static final String DEFAULT_PROVISIONER = "aws-provisioner-v1";
    public static final String DEFAULT_WORKER_TYPE = "github-worker";
    public static final String NOTIFY_ROUTE_PREFIX = "notify.";

    public TaskRecord {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Task label cannot be null or empty");
        }

        if (!label.matches(LABEL_PATTERN)) {
            throw new IllegalArgumentException(
                    "Task label must match pattern " + LABEL_PATTERN + ", got: " + label
            );
        }

        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("Task kind cannot be null or empty for task: " + label);
        }

        if (payload == null) {
            throw new IllegalArgumentException("Task payload cannot be null for task: " + label);
        }

        if (dependencies != null && dependencies.contains(label)) {
            throw new IllegalArgumentException("Task cannot depend on itself: " + label);
        }

        // Defaults
        if (description == null) {
            description = "";
        }
        if (provisionerId == null || provisionerId.isBlank()) {
            provisionerId = DEFAULT_PROVISIONER;
        }
        if (workerType == null || workerType.isBlank()) {
            workerType = DEFAULT_WORKER_TYPE;
        }
        if (cache == null) {
            cache = CachePolicy.none();
        }
        if (deadlineIn == null || deadlineIn.isBlank()) {
            deadlineIn = "1 day";
        }
        if (expiresIn == null || expiresIn.isBlank()) {
            expiresIn = "1 year";
        }
        if (indexAndArtifactsExpireIn == null || indexAndArtifactsExpireIn.isBlank()) {
            indexAndArtifactsExpireIn = expiresIn;
        }
        dependencies = Immutables.set(dependencies);
        attributes = Immutables.deepMap(attributes);
        routes = Immutables.list(routes);
        scopes = Immutables.list(scopes);
        extra = Immutables.deepMap(extra);
    }

    /**
     * Attribute value or {@code null}
     */
    public Object attribute(String name) {
        return attributes.get(name);
    }

    public boolean hasAttribute(String name) {
        return attributes.containsKey(name) && attributes.get(name) != null;
    }

    /**
     * Boolean attribute; absent values fall back to {@code defaultValue}
     */
    public boolean booleanAttribute(String name, boolean defaultValue) {
        Object value = attributes.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        return Boolean.parseBoolean(value.toString());
    }

    public String stringAttribute(String name) {
        Object value = attributes.get(name);
        return value != null ? value.toString() : null;
    }

    public boolean hasNotifications() {
        return routes.stream().anyMatch(route -> route.startsWith(NOTIFY_ROUTE_PREFIX))
                || extra.containsKey("notify");
    }

    public TaskRecord withLabel(String label) {
        return toBuilder().label(label).build();
    }

    public TaskRecord withDescription(String description) {
        return toBuilder().description(description).build();
    }

    public TaskRecord withWorkerType(String workerType) {
        return toBuilder().workerType(workerType).build();
    }

    public TaskRecord withPayload(WorkerPayload payload) {
        return toBuilder().payload(payload).build();
    }

    public TaskRecord withDependencies(Collection<String> dependencies) {
        return toBuilder().dependencies(dependencies).build();
    }

    public TaskRecord withAddedDependencies(Collection<String> added) {
        Set<String> merged = new LinkedHashSet<>(dependencies);
        merged.addAll(added);
        return withDependencies(merged);
    }

    public TaskRecord withAttributes(Map<String, Object> attributes) {
        return toBuilder().attributes(attributes).build();
    }

    public TaskRecord withAttribute(String name, Object value) {
        Map<String, Object> updated = new LinkedHashMap<>(attributes);
        updated.put(name, value);
        return withAttributes(updated);
    }

    public TaskRecord withRoutes(List<String> routes) {
        return toBuilder().routes(routes).build();
    }

    public TaskRecord withAddedRoute(String route) {
        List<String> updated = new ArrayList<>(routes);
        updated.add(route);
        return withRoutes(updated);
    }

    public TaskRecord withCache(CachePolicy cache) {
        return toBuilder().cache(cache).build();
    }

    public TaskRecord withExtra(Map<String, Object> extra) {
        return toBuilder().extra(extra).build();
    }

    public Builder toBuilder() {
        return new Builder(label)
                .kind(kind)
                .description(description)
                .provisionerId(provisionerId)
                .workerType(workerType)
                .payload(payload)
                .dependencies(dependencies)
                .attributes(attributes)
                .routes(routes)
                .scopes(scopes)
                .extra(extra)
                .cache(cache)
                .deadlineIn(deadlineIn)
                .expiresIn(expiresIn)
                .indexAndArtifactsExpireIn(indexAndArtifactsExpireIn);
    }

    /**
     * Builder for creating task records fluently
     */
    public static Builder builder(String label) {
        return new Builder(label);
    }

    /**
     * Mutable, single-use builder: setters change it in place and return {@code this}.
     * Do not keep or share a builder after {@link #build()}; start from
     * {@link TaskRecord#toBuilder()} for every variant instead.
     */
    public static class Builder {
        private String label;
        private String kind;
        private String description;
        private String provisionerId;
        private String workerType;
        private WorkerPayload payload;
        private Collection<String> dependencies = List.of();
        private Map<String, Object> attributes = Map.of();
        private List<String> routes = List.of();
        private List<String> scopes = List.of();
        private Map<String, Object> extra = Map.of();
        private CachePolicy cache = CachePolicy.none();
        private String deadlineIn;
        private String expiresIn;
        private String indexAndArtifactsExpireIn;

        public Builder(String label) {
            this.label = label;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder kind(String kind) {
            this.kind = kind;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder provisionerId(String provisionerId) {
            this.provisionerId = provisionerId;
            return this;
        }

        public Builder workerType(String workerType) {
            this.workerType = workerType;
            return this;
        }

        public Builder payload(WorkerPayload payload) {
            this.payload = payload;
            return this;
        }

        public Builder dependencies(Collection<String> dependencies) {
            this.dependencies = dependencies;
            return this;
        }

        public Builder attributes(Map<String, Object> attributes) {
            this.attributes = attributes;
            return this;
        }

        public Builder routes(List<String> routes) {
            this.routes = routes;
            return this;
        }

        public Builder scopes(List<String> scopes) {
            this.scopes = scopes;
            return this;
        }

        public Builder extra(Map<String, Object> extra) {
            this.extra = extra;
            return this;
        }

        public Builder cache(CachePolicy cache) {
            this.cache = cache;
            return this;
        }

        public Builder deadlineIn(String deadlineIn) {
            this.deadlineIn = deadlineIn;
            return this;
        }

        public Builder expiresIn(String expiresIn) {
            this.expiresIn = expiresIn;
            return this;
        }

        public Builder indexAndArtifactsExpireIn(String indexAndArtifactsExpireIn) {
            this.indexAndArtifactsExpireIn = indexAndArtifactsExpireIn;
            return this;
        }

        public TaskRecord build() {
            return new TaskRecord(
                    label, kind, description, provisionerId, workerType, payload,
                    dependencies != null ? new LinkedHashSet<>(dependencies) : null,
                    attributes, routes, scopes, extra, cache,
                    deadlineIn, expiresIn, indexAndArtifactsExpireIn
            );
        }
    }
}
