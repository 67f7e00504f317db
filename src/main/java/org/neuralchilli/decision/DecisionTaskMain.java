package org.neuralchilli.decision;

import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.inject.Inject;
import org.neuralchilli.decision.domain.RunParameters;
import org.neuralchilli.decision.service.DecisionResult;
import org.neuralchilli.decision.service.DecisionTaskService;
import org.neuralchilli.decision.service.RunParametersFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-mode entry point: reads run parameters from the environment, runs one
 * decision and exits.
 */
@QuarkusMain
public class DecisionTaskMain implements QuarkusApplication {

    private static final Logger log = LoggerFactory.getLogger(DecisionTaskMain.class);

    @Inject
    RunParametersFactory parametersFactory;

    @Inject
    DecisionTaskService decisionTaskService;

    @Override
    public int run(String... args) {
        RunParameters params = parametersFactory.fromConfig();
        try {
            DecisionResult result = decisionTaskService.run(params);
            log.info("Scheduled {} tasks with method '{}' ({} created, {} reused)",
                    result.targetGraph().size(), result.targetTasksMethod(),
                    result.createdCount(), result.reusedCount());
            return 0;
        } catch (RuntimeException e) {
            log.error("Decision task failed: {}", e.getMessage(), e);
            return 1;
        }
    }
}
