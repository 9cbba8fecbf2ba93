package com.bko.planner.api;

import com.bko.planner.refinement.EvaluationBatch;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RefineRequest(
        @NotBlank String concernId,
        @NotBlank String taskType,
        @NotNull EvaluationBatch batch
) {
}
