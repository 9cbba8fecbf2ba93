package com.bko.planner.refinement;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Versioned, immutable set of evaluation cases. Refinement scores every prompt variant against the
 * same batch.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record EvaluationBatch(String batchId, String version, List<EvaluationCase> cases) {

    public EvaluationBatch {
        if (batchId == null || batchId.isBlank()) {
            throw new IllegalArgumentException("Evaluation batch id is required.");
        }
        cases = cases == null ? List.of() : List.copyOf(cases);
    }
}
