package org.neuralchilli.decision.domain;

import org.neuralchilli.decision.util.Immutables;

import java.util.List;
import java.util.Map;

/**
 * A kind: one family of task templates, the loader that turns them into records and
 * the transforms applied to those records, in order.
 */
public record KindDefinition(
        String name,
        Loader loader,
        List<String> kindDependencies,
        List<String> transforms,
        Map<String, Object> jobDefaults,
        Map<String, Map<String, Object>> jobs,
        FromDeps fromDeps
) {
    public enum Loader {
        /** One record per entry under {@code jobs}. */
        TEMPLATES,
        /** One record per group of upstream-kind tasks. */
        FROM_DEPS;

        public static Loader fromString(String value) {
            if (value == null || value.isBlank()) {
                return TEMPLATES;
            }
            return switch (value.toLowerCase()) {
                case "templates", "default" -> TEMPLATES;
                case "from-deps" -> FROM_DEPS;
                default -> throw new IllegalArgumentException(
                        "Invalid loader: " + value + ". Valid loaders: templates, from-deps"
                );
            };
        }
    }

    /**
     * Grouping configuration of a from-deps kind.
     *
     * @param kinds           upstream kinds whose tasks are grouped
     * @param groupBy         attribute holding the grouping key
     * @param allGroupsValue  reserved key value replicated into every group
     * @param jobTemplate     template each synthesized task starts from
     */
    public record FromDeps(
            List<String> kinds,
            String groupBy,
            String allGroupsValue,
            Map<String, Object> jobTemplate
    ) {
        public static final String DEFAULT_GROUP_BY = "component";
        public static final String DEFAULT_ALL_GROUPS_VALUE = "all";

        public FromDeps {
            if (kinds == null || kinds.isEmpty()) {
                throw new IllegalArgumentException("from-deps must name at least one upstream kind");
            }
            kinds = List.copyOf(kinds);
            if (groupBy == null || groupBy.isBlank()) {
                groupBy = DEFAULT_GROUP_BY;
            }
            if (allGroupsValue == null || allGroupsValue.isBlank()) {
                allGroupsValue = DEFAULT_ALL_GROUPS_VALUE;
            }
            jobTemplate = Immutables.deepMap(jobTemplate);
        }
    }

    public KindDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Kind name cannot be null or empty");
        }

        if (!name.matches("^[a-z0-9-]+$")) {
            throw new IllegalArgumentException(
                    "Kind name must match pattern ^[a-z0-9-]+$, got: " + name
            );
        }

        if (loader == null) {
            loader = Loader.TEMPLATES;
        }

        if (loader == Loader.FROM_DEPS && fromDeps == null) {
            throw new IllegalArgumentException("Kind '" + name + "' uses the from-deps loader without a from-deps section");
        }

        if (loader == Loader.TEMPLATES && (jobs == null || jobs.isEmpty())) {
            throw new IllegalArgumentException("Kind '" + name + "' must define at least one job");
        }

        kindDependencies = kindDependencies != null ? List.copyOf(kindDependencies) : List.of();
        transforms = transforms != null ? List.copyOf(transforms) : List.of();
        jobDefaults = Immutables.deepMap(jobDefaults);
        jobs = jobs != null ? Immutables.map(jobs) : Map.of();

        if (fromDeps != null && !kindDependencies.containsAll(fromDeps.kinds())) {
            throw new IllegalArgumentException(
                    "Kind '" + name + "' groups kinds " + fromDeps.kinds() +
                            " that are not all listed in kind-dependencies " + kindDependencies
            );
        }
    }
}
