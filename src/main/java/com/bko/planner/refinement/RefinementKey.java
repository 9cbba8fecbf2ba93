package com.bko.planner.refinement;

import com.bko.planner.graph.TaskType;
import com.bko.planner.plan.PlanIdGenerator;

/**
 * The prompt artifact a refinement run tunes: one task type for one concern.
 */
public record RefinementKey(String concernId, TaskType taskType) {

    public RefinementKey {
        if (concernId == null || concernId.isBlank()) {
            throw new IllegalArgumentException("Concern id is required.");
        }
        if (taskType == null) {
            throw new IllegalArgumentException("Task type is required.");
        }
    }

    public String slug() {
        return PlanIdGenerator.slug(concernId) + "_" + taskType.key();
    }
}
