package org.neuralchilli.decision.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.decision.domain.RunParameters;
import org.neuralchilli.decision.domain.TriggerKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Reads the run parameters the decision task was started with.
 * Each property can be set from the environment ({@code task.for} as {@code TASK_FOR}, ...).
 */
@ApplicationScoped
public class RunParametersFactory {

    private static final Logger log = LoggerFactory.getLogger(RunParametersFactory.class);

    @ConfigProperty(name = "task.for", defaultValue = "github-push")
    String taskFor;

    @ConfigProperty(name = "git.url")
    Optional<String> gitUrl;

    @ConfigProperty(name = "git.ref")
    Optional<String> gitRef;

    @ConfigProperty(name = "git.sha")
    Optional<String> gitSha;

    @ConfigProperty(name = "task.id")
    Optional<String> taskId;

    @ConfigProperty(name = "task.owner")
    Optional<String> taskOwner;

    @ConfigProperty(name = "task.source")
    Optional<String> taskSource;

    @ConfigProperty(name = "trigger.title")
    Optional<String> triggerTitle;

    @ConfigProperty(name = "build.level", defaultValue = "1")
    int buildLevel;

    @ConfigProperty(name = "target.tasks.method")
    Optional<String> targetTasksMethod;

    @ConfigProperty(name = "shipping.phase")
    Optional<String> shippingPhase;

    @ConfigProperty(name = "release.version")
    Optional<String> version;

    @ConfigProperty(name = "preview", defaultValue = "false")
    boolean preview;

    public RunParameters fromConfig() {
        String title = triggerTitle.orElse("");

        RunParameters params = RunParameters.builder(TriggerKind.fromString(taskFor))
                .gitUrl(gitUrl.orElse(null))
                .gitRef(gitRef.orElse(null))
                .gitSha(gitSha.orElse(null))
                .decisionTaskId(taskId.orElse(null))
                .taskOwner(taskOwner.orElse(null))
                .taskSource(taskSource.orElse(null))
                .triggerTitle(title)
                .buildLevel(buildLevel)
                .overrides(TriggerTitleParser.parse(title))
                .targetTasksMethod(targetTasksMethod.orElse(null))
                .shippingPhase(shippingPhase.orElse(null))
                .version(version.orElse(null))
                .preview(preview)
                .build();

        log.info("Run parameters: trigger={}, ref={}, sha={}, build level={}",
                params.triggerKind().value(), params.gitRef(), params.gitSha(), params.buildLevel());
        return params;
    }
}
