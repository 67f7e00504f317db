package org.neuralchilli.decision.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.decision.domain.RunParameters;
import org.neuralchilli.decision.domain.TaskRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves "keyed-by" values: a single-entry map {@code {by-<key>: {<value>: ..., default: ...}}}
 * picks the alternative matching the run or task's value for {@code <key>}.
 * <p>
 * Keys: {@code trigger}, {@code build-level}, {@code shipping-phase}, or any task attribute.
 * Resolution repeats until a plain value is reached, so alternatives may be keyed again.
 */
@ApplicationScoped
public class KeyedByResolver {

    static final String PREFIX = "by-";
    static final String DEFAULT_KEY = "default";

    /**
     * Resolve every keyed-by value found in a value tree.
     *
     * @param field name used in error messages
     */
    public Object resolve(Object value, String field, TaskRecord task, RunParameters params) {
        Object current = value;
        while (isKeyedBy(current)) {
            current = resolveOnce((Map<?, ?>) current, field, task, params);
        }

        if (current instanceof Map<?, ?> map) {
            Map<String, Object> resolved = new LinkedHashMap<>();
            map.forEach((k, v) -> resolved.put(String.valueOf(k), resolve(v, field + "." + k, task, params)));
            return resolved;
        }
        if (current instanceof List<?> list) {
            List<Object> resolved = new ArrayList<>(list.size());
            for (int i = 0; i < list.size(); i++) {
                resolved.add(resolve(list.get(i), field + "[" + i + "]", task, params));
            }
            return resolved;
        }
        return current;
    }

    public boolean isKeyedBy(Object value) {
        if (!(value instanceof Map<?, ?> map) || map.size() != 1) {
            return false;
        }
        Map.Entry<?, ?> entry = map.entrySet().iterator().next();
        return String.valueOf(entry.getKey()).startsWith(PREFIX) && entry.getValue() instanceof Map;
    }

    private Object resolveOnce(Map<?, ?> keyedBy, String field, TaskRecord task, RunParameters params) {
        Map.Entry<?, ?> entry = keyedBy.entrySet().iterator().next();
        String key = String.valueOf(entry.getKey()).substring(PREFIX.length());
        Map<?, ?> alternatives = (Map<?, ?>) entry.getValue();

        String actual = keyValue(key, task, params);
        for (Map.Entry<?, ?> alternative : alternatives.entrySet()) {
            if (String.valueOf(alternative.getKey()).equals(actual)) {
                return alternative.getValue();
            }
        }
        if (alternatives.containsKey(DEFAULT_KEY)) {
            return alternatives.get(DEFAULT_KEY);
        }
        throw new IllegalArgumentException(
                field + ": no alternative of 'by-" + key + "' matches '" + actual +
                        "' and no default is given (alternatives: " + alternatives.keySet() + ")"
        );
    }

    private String keyValue(String key, TaskRecord task, RunParameters params) {
        switch (key) {
            case "trigger":
                return params.triggerKind().value();
            case "build-level":
                return String.valueOf(params.buildLevel());
            case "shipping-phase":
                if (task.hasAttribute("shipping-phase")) {
                    return task.stringAttribute("shipping-phase");
                }
                return params.shippingPhase();
            default:
                return task.stringAttribute(key);
        }
    }
}
