package com.bko.planner.graph;

import java.util.Set;

public record TaskNode(String id, TaskType type, Set<String> dependencies) {

    public TaskNode {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Task id is required.");
        }
        if (type == null) {
            throw new IllegalArgumentException("Task " + id + " has no type.");
        }
        dependencies = dependencies == null ? Set.of() : Set.copyOf(dependencies);
    }

    /**
     * Lane prefix of a multi-lane node id ({@code process_auditor:event_summary}), or {@code null}
     * for single-lane ids.
     */
    public String lane() {
        int separator = id.indexOf(':');
        return separator > 0 ? id.substring(0, separator) : null;
    }
}
