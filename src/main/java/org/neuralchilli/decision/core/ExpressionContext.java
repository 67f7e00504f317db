package org.neuralchilli.decision.core;

import org.neuralchilli.decision.domain.RunParameters;
import org.neuralchilli.decision.domain.TaskRecord;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Variables visible to {@code ${...}} expressions in kind templates.
 */
public record ExpressionContext(
        Map<String, Object> params,
        Map<String, Object> attributes,
        Map<String, Object> task
) {
    public ExpressionContext {
        if (params == null) {
            params = Map.of();
        }
        if (attributes == null) {
            attributes = Map.of();
        }
        if (task == null) {
            task = Map.of();
        }
    }

    /**
     * Create a context with only run parameters
     */
    public static ExpressionContext withParams(RunParameters params) {
        return new ExpressionContext(params.toMap(), Map.of(), Map.of());
    }

    /**
     * Context for one task: {@code params.*}, {@code attributes.*} and
     * {@code task.label}, {@code task.kind}, {@code task.dependencies}
     */
    public static ExpressionContext forTask(RunParameters params, TaskRecord record) {
        Map<String, Object> task = new LinkedHashMap<>();
        task.put("label", record.label());
        task.put("kind", record.kind());
        task.put("description", record.description());
        task.put("dependencies", record.dependencies());
        return new ExpressionContext(params.toMap(), record.attributes(), task);
    }

    public static ExpressionContext empty() {
        return new ExpressionContext(Map.of(), Map.of(), Map.of());
    }
}
