package org.neuralchilli.decision.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.List;
import java.util.Optional;

/**
 * Project-level settings of the decision run, under the {@code decision} prefix.
 */
@ConfigMapping(prefix = "decision")
public interface DecisionConfig {

    /**
     * {@code String.format} template applied to task descriptions to build metadata names
     */
    @WithName("task-name-template")
    @WithDefault("%s")
    String taskNameTemplate();

    /**
     * Namespace prepended to every index path
     */
    @WithName("index-prefix")
    @WithDefault("garbage.decision")
    String indexPrefix();

    @WithName("scheduler-id")
    @WithDefault("taskcluster-github")
    String schedulerId();

    @WithName("scopes-for-all-subtasks")
    Optional<List<String>> scopesForAllSubtasks();

    @WithName("routes-for-all-subtasks")
    Optional<List<String>> routesForAllSubtasks();

    /**
     * Worker type used for image builds; tasks keep their own worker type when unset
     */
    @WithName("docker-image-build-worker-type")
    Optional<String> dockerImageBuildWorkerType();

    @WithName("docker-images-expire-in")
    @WithDefault("1 month")
    String dockerImagesExpireIn();

    /**
     * Dependency limit per task, excluding the decision task itself
     */
    @WithName("max-dependencies")
    @WithDefault("99")
    int maxDependencies();

    /**
     * Checkout the decision task runs in; Dockerfiles and source trees are resolved against it
     */
    @WithName("repository-root")
    @WithDefault(".")
    String repositoryRoot();

    /**
     * Directory holding one sub-directory per kind, each with a {@code kind.yml}
     */
    @WithName("kinds-path")
    @WithDefault("taskcluster/kinds")
    String kindsPath();

    /**
     * Where chain-of-trust files are written on release runs
     */
    @WithName("chain-of-trust-dir")
    @WithDefault(".")
    String chainOfTrustDir();

    /**
     * Worker type of synthetic chunk tasks
     */
    @WithName("chunk-worker-type")
    @WithDefault("succeed")
    String chunkWorkerType();
}
