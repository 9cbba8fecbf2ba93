package com.bko.planner.execution;

import com.bko.planner.graph.TaskType;
import com.bko.planner.resolver.ResolvedContext;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.Map;

/**
 * Inputs shared by every task of one execution run.
 *
 * @param executionId     run identifier used in logs
 * @param concernId       concern being planned
 * @param resolved        classification of the concern
 * @param narrative       primary case narrative; required by narrative-driven task types
 * @param timeout         bound on each generation call
 * @param promptOverrides task prompt bodies replacing the built-in ones for this run only
 */
public record ExecutionContext(
        String executionId,
        String concernId,
        ResolvedContext resolved,
        @Nullable String narrative,
        Duration timeout,
        Map<TaskType, String> promptOverrides
) {

    public ExecutionContext {
        promptOverrides = promptOverrides == null ? Map.of() : Map.copyOf(promptOverrides);
    }

    public boolean hasNarrative() {
        return narrative != null && !narrative.isBlank();
    }
}
