package org.neuralchilli.decision.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.neuralchilli.decision.core.transform.DockerImageTransform;
import org.neuralchilli.decision.core.transform.FetchUpstreamArtifactsTransform;
import org.neuralchilli.decision.core.transform.IndexBySourceTreeTransform;
import org.neuralchilli.decision.core.transform.InterpolateTransform;
import org.neuralchilli.decision.core.transform.RequireBuildLevelTransform;
import org.neuralchilli.decision.core.transform.ResolveKeyedByTransform;
import org.neuralchilli.decision.core.transform.SplitByReleasePhaseTransform;
import org.neuralchilli.decision.core.transform.TransformRegistry;
import org.neuralchilli.decision.core.transform.UseDockerImageTransform;
import org.neuralchilli.decision.core.transform.WithRepoTransform;
import org.neuralchilli.decision.target.TargetTaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Builds the transform and target-task registries once, listing every entry explicitly.
 */
@ApplicationScoped
public class RegistryProducers {

    private static final Logger log = LoggerFactory.getLogger(RegistryProducers.class);

    @Produces
    @Singleton
    public TransformRegistry transformRegistry(
            ResolveKeyedByTransform resolveKeyedBy,
            RequireBuildLevelTransform requireBuildLevel,
            SplitByReleasePhaseTransform splitByReleasePhase,
            DockerImageTransform dockerImage,
            UseDockerImageTransform useDockerImage,
            IndexBySourceTreeTransform indexBySourceTree,
            InterpolateTransform interpolate,
            FetchUpstreamArtifactsTransform fetchUpstreamArtifacts,
            WithRepoTransform withRepo
    ) {
        TransformRegistry registry = TransformRegistry.of(List.of(
                resolveKeyedBy,
                requireBuildLevel,
                splitByReleasePhase,
                dockerImage,
                useDockerImage,
                indexBySourceTree,
                interpolate,
                fetchUpstreamArtifacts,
                withRepo
        ));
        log.info("Registered transforms: {}", registry.names());
        return registry;
    }

    @Produces
    @Singleton
    public TargetTaskRegistry targetTaskRegistry() {
        TargetTaskRegistry registry = TargetTaskRegistry.builtIn();
        log.info("Registered target tasks methods: {}", registry.names());
        return registry;
    }
}
