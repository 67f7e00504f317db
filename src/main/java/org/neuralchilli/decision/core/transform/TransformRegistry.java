package org.neuralchilli.decision.core.transform;

import org.neuralchilli.decision.service.KindLoadException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Transforms available to kinds, by name. Built once at startup.
 */
public final class TransformRegistry {

    private final Map<String, Transform> transforms;

    private TransformRegistry(Map<String, Transform> transforms) {
        this.transforms = transforms;
    }

    public static TransformRegistry of(Collection<? extends Transform> transforms) {
        Map<String, Transform> byName = new LinkedHashMap<>();
        for (Transform transform : transforms) {
            if (byName.putIfAbsent(transform.name(), transform) != null) {
                throw new IllegalArgumentException("Duplicate transform name: " + transform.name());
            }
        }
        return new TransformRegistry(Collections.unmodifiableMap(byName));
    }

    public Transform get(String name) {
        Transform transform = transforms.get(name);
        if (transform == null) {
            throw new KindLoadException("Unknown transform '" + name + "'. Known transforms: " + names());
        }
        return transform;
    }

    public Set<String> names() {
        return transforms.keySet();
    }

    /**
     * Pipeline of the named transforms, in the given order
     */
    public TransformPipeline pipeline(List<String> names) {
        TransformPipeline pipeline = TransformPipeline.empty();
        for (String name : names) {
            pipeline = pipeline.then(get(name));
        }
        return pipeline;
    }
}
