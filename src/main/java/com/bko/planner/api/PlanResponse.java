package com.bko.planner.api;

import com.bko.planner.plan.ClinicalPlan;
import com.bko.planner.plan.PlanGenerationResult;
import com.bko.planner.quality.QualityVerdict;
import com.bko.planner.validation.ValidationResult;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PlanResponse(
        String requestId,
        Instant createdAt,
        String planId,
        boolean templateFallback,
        List<String> executionOrder,
        List<String> warnings,
        ClinicalPlan plan,
        QualityVerdict quality,
        ValidationResult validation
) {

    public static PlanResponse from(PlanGenerationResult result) {
        return new PlanResponse(
                UUID.randomUUID().toString(),
                Instant.now(),
                result.plan().planId(),
                result.templateFallback(),
                result.executionOrder(),
                result.warnings(),
                result.plan(),
                result.verdict(),
                result.validation()
        );
    }
}
