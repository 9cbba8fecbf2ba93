package com.bko.planner.plan;

import com.bko.planner.quality.QualityVerdict;
import com.bko.planner.validation.ValidationResult;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Outcome of one generation request. {@code templateFallback} marks plans built from placeholder
 * data after the generation call failed.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PlanGenerationResult(
        ClinicalPlan plan,
        QualityVerdict verdict,
        ValidationResult validation,
        List<String> executionOrder,
        boolean templateFallback,
        List<String> warnings
) {

    public PlanGenerationResult {
        executionOrder = List.copyOf(executionOrder);
        warnings = List.copyOf(warnings);
    }
}
