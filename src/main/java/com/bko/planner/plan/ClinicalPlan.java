package com.bko.planner.plan;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

/**
 * Canonical plan document. Every supported document version is converted to this shape once, at
 * the boundary, by {@link PlanDocumentReader}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClinicalPlan(
        @NotNull @Valid PlanMetadata planMetadata,
        @NotNull @Valid ClinicalConfig clinicalConfig,
        Provenance provenance,
        Rationale rationale,
        QualitySummary quality
) {

    public static final String HAC_CONCERN_TYPE = "HAC";

    public boolean researchMode() {
        return planMetadata != null && planMetadata.researchMode();
    }

    /**
     * Hospital-acquired-condition plans are scored on signal count; other plans on question count.
     */
    public boolean hacCategory() {
        if (planMetadata != null && planMetadata.concern() != null
                && HAC_CONCERN_TYPE.equalsIgnoreCase(planMetadata.concern().concernType())) {
            return true;
        }
        return clinicalConfig != null && clinicalConfig.domain() != null
                && HAC_CONCERN_TYPE.equalsIgnoreCase(clinicalConfig.domain().name());
    }

    public String planId() {
        return planMetadata == null ? null : planMetadata.planId();
    }

    /**
     * Copy carrying the producer's quality block; plans that are not deployment ready are flagged
     * for review.
     */
    public ClinicalPlan withQuality(QualitySummary summary) {
        boolean requiresReview = !Boolean.TRUE.equals(summary.deploymentReady());
        PlanMetadata metadata = new PlanMetadata(planMetadata.planId(), planMetadata.planningInputId(),
                planMetadata.version(), planMetadata.createdAt(), planMetadata.concern(), planMetadata.workflow(),
                new PlanMetadata.Status(requiresReview, requiresReview ? "needs_review" : "ready"),
                planMetadata.confidence());
        return new ClinicalPlan(metadata, clinicalConfig, provenance, rationale, summary);
    }
}
