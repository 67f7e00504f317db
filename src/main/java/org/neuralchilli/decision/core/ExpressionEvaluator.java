package org.neuralchilli.decision.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.jexl3.JexlBuilder;
import org.apache.commons.jexl3.JexlContext;
import org.apache.commons.jexl3.JexlEngine;
import org.apache.commons.jexl3.JexlExpression;
import org.apache.commons.jexl3.MapContext;
import org.apache.commons.jexl3.introspection.JexlPermissions;
import org.neuralchilli.decision.service.ExpressionException;
import org.neuralchilli.decision.util.TextFunctions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates JEXL {@code ${...}} expressions found in kind templates.
 * A string that is exactly one expression evaluates to the raw object; anything
 * else is interpolated into a string.
 */
@ApplicationScoped
public class ExpressionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ExpressionEvaluator.class);

    private final JexlEngine jexl;
    private final TextFunctions textFunctions;

    public ExpressionEvaluator() {
        this.textFunctions = new TextFunctions();
        this.jexl = new JexlBuilder()
                .cache(512)
                .strict(true)
                .silent(false)
                .safe(false)  // Unknown variables are errors, not empty strings
                .namespaces(Map.of("text", textFunctions))
                .permissions(JexlPermissions.UNRESTRICTED)
                .create();
    }

    /**
     * Evaluate to a string. Values without {@code ${} are returned as-is.
     */
    public String evaluate(String expression, ExpressionContext context) {
        Object result = evaluateToObject(expression, context);
        return result != null ? result.toString() : null;
    }

    /**
     * Evaluate to the expression's raw object type.
     */
    public Object evaluateToObject(String expression, ExpressionContext context) {
        if (expression == null || !isExpression(expression)) {
            return expression;
        }

        try {
            if (isSingleExpression(expression)) {
                return evaluateExpression(expression.substring(2, expression.length() - 1), context);
            }
            return interpolateString(expression, context);
        } catch (ExpressionException e) {
            throw e;
        } catch (RuntimeException e) {
            log.debug("Failed to evaluate expression: {}", expression, e);
            throw new ExpressionException(expression, "Failed to evaluate expression", e);
        }
    }

    /**
     * Evaluate every string found in a value tree (maps, lists), leaving other values alone.
     */
    public Object evaluateTree(Object value, ExpressionContext context) {
        if (value instanceof String string) {
            return evaluateToObject(string, context);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> result = new LinkedHashMap<>();
            map.forEach((k, v) -> result.put(String.valueOf(k), evaluateTree(v, context)));
            return result;
        }
        if (value instanceof List<?> list) {
            List<Object> result = new ArrayList<>(list.size());
            list.forEach(item -> result.add(evaluateTree(item, context)));
            return result;
        }
        return value;
    }

    /**
     * Evaluate a map of expressions (typically environment variables)
     */
    public Map<String, String> evaluateMap(Map<String, String> map, ExpressionContext context) {
        if (map == null || map.isEmpty()) {
            return Map.of();
        }
        Map<String, String> result = new LinkedHashMap<>();
        map.forEach((key, value) -> result.put(key, evaluate(value, context)));
        return result;
    }

    public List<String> evaluateList(List<String> values, ExpressionContext context) {
        List<String> result = new ArrayList<>(values.size());
        values.forEach(value -> result.add(evaluate(value, context)));
        return result;
    }

    public boolean isExpression(String value) {
        return value != null && value.contains("${") && value.contains("}");
    }

    private Object evaluateExpression(String source, ExpressionContext context) {
        JexlExpression compiled = jexl.createExpression(source);
        return compiled.evaluate(createJexlContext(context));
    }

    private boolean isSingleExpression(String expression) {
        if (!expression.startsWith("${")) {
            return false;
        }
        return findClosingBrace(expression, 2) == expression.length() - 1;
    }

    private String interpolateString(String template, ExpressionContext context) {
        StringBuilder result = new StringBuilder();
        int pos = 0;

        while (pos < template.length()) {
            int start = template.indexOf("${", pos);
            if (start == -1) {
                result.append(template.substring(pos));
                break;
            }

            result.append(template, pos, start);

            int end = findClosingBrace(template, start + 2);
            if (end == -1) {
                throw new ExpressionException(template, "Unclosed expression");
            }

            Object evaluated = evaluateExpression(template.substring(start + 2, end), context);
            result.append(evaluated != null ? evaluated.toString() : "");

            pos = end + 1;
        }

        return result.toString();
    }

    private int findClosingBrace(String str, int start) {
        int depth = 1;
        for (int i = start; i < str.length(); i++) {
            if (str.charAt(i) == '{') {
                depth++;
            } else if (str.charAt(i) == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private JexlContext createJexlContext(ExpressionContext context) {
        MapContext jexlContext = new MapContext();
        jexlContext.set("params", context.params());
        jexlContext.set("attributes", context.attributes());
        jexlContext.set("task", context.task());
        return jexlContext;
    }
}
