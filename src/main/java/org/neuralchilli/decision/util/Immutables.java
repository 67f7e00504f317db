package org.neuralchilli.decision.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Order-preserving immutable copies.
 * Unlike {@code Map.copyOf} these keep insertion order and tolerate null values,
 * which task attributes rely on.
 */
public final class Immutables {

    private Immutables() {
    }

    public static <T> List<T> list(Collection<? extends T> source) {
        if (source == null || source.isEmpty()) {
            return List.of();
        }
        return Collections.unmodifiableList(new ArrayList<>(source));
    }

    public static <T> Set<T> set(Collection<? extends T> source) {
        if (source == null || source.isEmpty()) {
            return Set.of();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(source));
    }

    public static <V> Map<String, V> map(Map<String, ? extends V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    /**
     * Recursively freeze a free-form value tree (maps, lists, scalars).
     */
    public static Map<String, Object> deepMap(Map<?, ?> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(String.valueOf(k), deepValue(v)));
        return Collections.unmodifiableMap(copy);
    }

    public static Object deepValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return deepMap(map);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object item : collection) {
                copy.add(deepValue(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
