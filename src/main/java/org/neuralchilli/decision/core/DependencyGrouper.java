package org.neuralchilli.decision.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.decision.domain.DependencyGroup;
import org.neuralchilli.decision.domain.TaskRecord;
import org.neuralchilli.decision.service.KindLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Fans work out per group of upstream tasks (from-deps loading).
 * <p>
 * Upstream tasks are grouped by the value of one attribute. Tasks carrying the reserved
 * value belong to every group; a group made only of those is never formed. Upstream
 * tasks without the attribute are not grouped at all.
 */
@ApplicationScoped
public class DependencyGrouper {

    private static final Logger log = LoggerFactory.getLogger(DependencyGrouper.class);

    /**
     * Groups in first-seen key order, members in upstream order.
     */
    public List<DependencyGroup> group(List<TaskRecord> upstream, String groupBy, String allGroupsValue) {
        List<TaskRecord> everyGroup = new ArrayList<>();
        Map<String, List<TaskRecord>> byKey = new LinkedHashMap<>();

        for (TaskRecord task : upstream) {
            String key = task.stringAttribute(groupBy);
            if (key == null) {
                log.debug("Task {} has no '{}' attribute, not grouped", task.label(), groupBy);
                continue;
            }
            if (key.equals(allGroupsValue)) {
                everyGroup.add(task);
            } else {
                byKey.computeIfAbsent(key, k -> new ArrayList<>()).add(task);
            }
        }

        List<DependencyGroup> groups = new ArrayList<>();
        byKey.forEach((key, keyed) -> {
            List<TaskRecord> members = new ArrayList<>();
            for (TaskRecord task : upstream) {
                if (keyed.contains(task) || everyGroup.contains(task)) {
                    members.add(task);
                }
            }
            groups.add(new DependencyGroup(key, members));
        });

        log.debug("Grouped {} upstream tasks by '{}' into {} groups ({} shared)",
                upstream.size(), groupBy, groups.size(), everyGroup.size());
        return groups;
    }

    /**
     * One downstream task per group: the template relabelled {@code <kind>-<key>},
     * tagged with the group key and depending on exactly the group's labels.
     *
     * @throws KindLoadException when two group keys map to the same label
     */
    public List<TaskRecord> downstreamTasks(TaskRecord template, List<DependencyGroup> groups, String groupBy) {
        List<TaskRecord> tasks = new ArrayList<>(groups.size());
        Map<String, String> keysByLabel = new HashMap<>();
        for (DependencyGroup group : groups) {
            String label = template.kind() + "-" + labelPart(group.key());
            String previous = keysByLabel.putIfAbsent(label, group.key());
            if (previous != null) {
                throw new KindLoadException("Kind " + template.kind() + ": group keys '" + previous +
                        "' and '" + group.key() + "' both map to task label " + label);
            }
            tasks.add(template.toBuilder()
                    .label(label)
                    .attributes(withAttribute(template.attributes(), groupBy, group.key()))
                    .dependencies(group.labels())
                    .build());
        }
        return tasks;
    }

    static String labelPart(String key) {
        String part = key.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9._-]+", "-");
        return part.replaceAll("^-+", "");
    }

    private static Map<String, Object> withAttribute(Map<String, Object> attributes, String name, Object value) {
        Map<String, Object> updated = new LinkedHashMap<>(attributes);
        updated.put(name, value);
        return updated;
    }
}
