package org.neuralchilli.decision.target;

import org.neuralchilli.decision.domain.RunParameters;
import org.neuralchilli.decision.domain.TriggerKind;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Target-task methods by name. Built once at startup.
 */
public final class TargetTaskRegistry {

    private final Map<String, TargetTaskMethod> methods;

    private TargetTaskRegistry(Map<String, TargetTaskMethod> methods) {
        this.methods = methods;
    }

    public static TargetTaskRegistry of(Collection<? extends TargetTaskMethod> methods) {
        Map<String, TargetTaskMethod> byName = new LinkedHashMap<>();
        for (TargetTaskMethod method : methods) {
            if (byName.putIfAbsent(method.name(), method) != null) {
                throw new IllegalArgumentException("Duplicate target task method: " + method.name());
            }
        }
        return new TargetTaskRegistry(Collections.unmodifiableMap(byName));
    }

    /**
     * Registry holding every built-in method
     */
    public static TargetTaskRegistry builtIn() {
        return of(List.of(
                new SkipTargetTasks(),
                new NormalTargetTasks(),
                new FullTargetTasks(),
                new ReleaseTargetTasks(),
                new NightlyTargetTasks(),
                new PromoteTargetTasks(),
                new ShipTargetTasks()
        ));
    }

    public TargetTaskMethod get(String name) {
        TargetTaskMethod method = methods.get(name);
        if (method == null) {
            throw new IllegalArgumentException(
                    "Unknown target tasks method '" + name + "'. Known methods: " + names());
        }
        return method;
    }

    public Set<String> names() {
        return methods.keySet();
    }

    /**
     * Method a run uses: the explicit parameter when given, otherwise derived from the
     * trigger and title overrides.
     */
    public String methodFor(RunParameters params) {
        if (params.targetTasksMethod() != null) {
            return params.targetTasksMethod();
        }
        if (params.overrides().skipCi()) {
            return SkipTargetTasks.NAME;
        }
        if (params.isRelease()) {
            return ReleaseTargetTasks.NAME;
        }

        TriggerKind trigger = params.triggerKind();
        return switch (trigger) {
            case CRON -> NightlyTargetTasks.NAME;
            case ACTION -> TargetAttributes.PHASE_SHIP.equals(params.shippingPhase())
                    ? ShipTargetTasks.NAME
                    : PromoteTargetTasks.NAME;
            case PULL_REQUEST, PUSH -> params.overrides().fullCi() ? FullTargetTasks.NAME : NormalTargetTasks.NAME;
            case RELEASE -> ReleaseTargetTasks.NAME;
        };
    }
}
