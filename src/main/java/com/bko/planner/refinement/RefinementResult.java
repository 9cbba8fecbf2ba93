package com.bko.planner.refinement;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RefinementResult(
        String concernId,
        String taskType,
        String batchId,
        String batchVersion,
        StopReason stopReason,
        int iterations,
        double bestScore,
        String bestArtifact,
        List<RefinementHistoryEntry> history
) {

    public RefinementResult {
        history = List.copyOf(history);
    }
}
