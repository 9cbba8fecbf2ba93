package com.bko.planner.plan;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlanMetadata(
        String planId,
        String planningInputId,
        String version,
        String createdAt,
        @NotNull @Valid Concern concern,
        Workflow workflow,
        Status status,
        Double confidence
) {

    public static final String RESEARCH_WORKFLOW = "research_plan_implement";

    public boolean researchMode() {
        return workflow != null && RESEARCH_WORKFLOW.equals(workflow.mode());
    }

    public boolean reviewRequired() {
        return status != null && Boolean.TRUE.equals(status.requiresReview());
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Concern(String concernId, String concernType, String domain, String archetype) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Workflow(String mode) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Status(Boolean requiresReview, String state) {
    }
}
