package com.bko.planner.api;

import com.bko.planner.plan.PlanReviewService;
import com.bko.planner.quality.QualityVerdict;
import com.bko.planner.validation.ValidationResult;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AssessmentResponse(
        String planId,
        String documentVersion,
        QualityVerdict quality,
        ValidationResult validation
) {

    public static AssessmentResponse from(PlanReviewService.Review review) {
        return new AssessmentResponse(review.planId(), review.version().name(), review.verdict(), review.validation());
    }
}
