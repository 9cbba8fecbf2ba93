package com.bko.planner.refinement;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RefinementHistoryEntry(
        int iteration,
        double score,
        double delta,
        RefinementOutcome outcome,
        String changeDescription
) {
}
