package com.bko.planner.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GeneratePlanRequest(
        @NotBlank String concernId,
        String domain,
        String narrative,
        List<String> riskFactors,
        Boolean researchMode,
        Boolean strict,
        String planningInputId
) {
}
