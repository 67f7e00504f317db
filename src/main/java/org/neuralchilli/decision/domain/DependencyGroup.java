package org.neuralchilli.decision.domain;

import java.util.List;

/**
 * Upstream tasks sharing one grouping key, plus the tasks that apply to every group.
 */
public record DependencyGroup(String key, List<TaskRecord> members) {

    public DependencyGroup {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Group key cannot be null or empty");
        }
        members = members != null ? List.copyOf(members) : List.of();
    }

    public List<String> labels() {
        return members.stream().map(TaskRecord::label).toList();
    }
}
