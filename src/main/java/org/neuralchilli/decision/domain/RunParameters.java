package org.neuralchilli.decision.domain;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable description of what triggered a decision run. Computed once at the start
 * of the run and passed read-only through every stage.
 */
public record RunParameters(
        TriggerKind triggerKind,
        String gitUrl,
        String gitRef,
        String gitSha,
        String decisionTaskId,
        String taskOwner,
        String taskSource,
        String triggerTitle,
        int buildLevel,
        TitleOverrides overrides,
        String targetTasksMethod,
        String shippingPhase,
        String version,
        boolean preview
) {
    public static final String TAG_REF_PREFIX = "refs/tags/";
    public static final int TRUSTED_BUILD_LEVEL = 3;

    public RunParameters {
        if (triggerKind == null) {
            throw new IllegalArgumentException("Trigger kind cannot be null");
        }

        if (buildLevel < 1 || buildLevel > TRUSTED_BUILD_LEVEL) {
            throw new IllegalArgumentException(
                    "Build level must be between 1 and " + TRUSTED_BUILD_LEVEL + ", got: " + buildLevel
            );
        }

        if (triggerTitle == null) {
            triggerTitle = "";
        }
        if (overrides == null) {
            overrides = TitleOverrides.none();
        }
        if (targetTasksMethod != null && targetTasksMethod.isBlank()) {
            targetTasksMethod = null;
        }
        if (shippingPhase != null && shippingPhase.isBlank()) {
            shippingPhase = null;
        }
        if (version == null || version.isBlank()) {
            version = releaseTag(gitRef);
        }
    }

    /**
     * Tag pushes and release events
     */
    public boolean isRelease() {
        return triggerKind == TriggerKind.RELEASE || (gitRef != null && gitRef.startsWith(TAG_REF_PREFIX));
    }

    public boolean isTrusted() {
        return buildLevel >= TRUSTED_BUILD_LEVEL;
    }

    /**
     * Parameters as seen by template expressions and written to {@code parameters.yml}
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("trigger", triggerKind.value());
        map.put("git_url", gitUrl);
        map.put("git_ref", gitRef);
        map.put("git_sha", gitSha);
        map.put("decision_task_id", decisionTaskId);
        map.put("owner", taskOwner);
        map.put("source", taskSource);
        map.put("title", triggerTitle);
        map.put("build_level", buildLevel);
        map.put("full_ci", overrides.fullCi());
        map.put("skip_ci", overrides.skipCi());
        map.put("branches", overrides.branches());
        map.put("target_tasks_method", targetTasksMethod);
        map.put("shipping_phase", shippingPhase);
        map.put("version", version);
        map.put("preview", preview);
        map.put("release", isRelease());
        return map;
    }

    private static String releaseTag(String gitRef) {
        if (gitRef == null || !gitRef.startsWith(TAG_REF_PREFIX)) {
            return null;
        }
        String tag = gitRef.substring(TAG_REF_PREFIX.length());
        return tag.startsWith("v") ? tag.substring(1) : tag;
    }

    /**
     * Builder for creating parameters fluently
     */
    public static Builder builder(TriggerKind triggerKind) {
        return new Builder(triggerKind);
    }

    public static class Builder {
        private final TriggerKind triggerKind;
        private String gitUrl;
        private String gitRef;
        private String gitSha;
        private String decisionTaskId;
        private String taskOwner;
        private String taskSource;
        private String triggerTitle = "";
        private int buildLevel = 1;
        private TitleOverrides overrides = TitleOverrides.none();
        private String targetTasksMethod;
        private String shippingPhase;
        private String version;
        private boolean preview;

        public Builder(TriggerKind triggerKind) {
            this.triggerKind = triggerKind;
        }

        public Builder gitUrl(String gitUrl) {
            this.gitUrl = gitUrl;
            return this;
        }

        public Builder gitRef(String gitRef) {
            this.gitRef = gitRef;
            return this;
        }

        public Builder gitSha(String gitSha) {
            this.gitSha = gitSha;
            return this;
        }

        public Builder decisionTaskId(String decisionTaskId) {
            this.decisionTaskId = decisionTaskId;
            return this;
        }

        public Builder taskOwner(String taskOwner) {
            this.taskOwner = taskOwner;
            return this;
        }

        public Builder taskSource(String taskSource) {
            this.taskSource = taskSource;
            return this;
        }

        public Builder triggerTitle(String triggerTitle) {
            this.triggerTitle = triggerTitle;
            return this;
        }

        public Builder buildLevel(int buildLevel) {
            this.buildLevel = buildLevel;
            return this;
        }

        public Builder overrides(TitleOverrides overrides) {
            this.overrides = overrides;
            return this;
        }

        public Builder targetTasksMethod(String targetTasksMethod) {
            this.targetTasksMethod = targetTasksMethod;
            return this;
        }

        public Builder shippingPhase(String shippingPhase) {
            this.shippingPhase = shippingPhase;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder preview(boolean preview) {
            this.preview = preview;
            return this;
        }

        public RunParameters build() {
            return new RunParameters(
                    triggerKind, gitUrl, gitRef, gitSha, decisionTaskId, taskOwner, taskSource,
                    triggerTitle, buildLevel, overrides, targetTasksMethod, shippingPhase, version, preview
            );
        }
    }
}
