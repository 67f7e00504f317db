package org.neuralchilli.decision.target;

import org.neuralchilli.decision.cache.IndexService;
import org.neuralchilli.decision.domain.RunParameters;

/**
 * What target-task methods may consult besides the graph.
 */
public record TargetTaskContext(RunParameters params, IndexService index, String indexPrefix) {
}
