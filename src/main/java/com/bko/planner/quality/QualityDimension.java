package com.bko.planner.quality;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QualityDimension(String name, double score, String rationale, Map<String, Object> details) {

    public static final String CLINICAL_ACCURACY = "clinical_accuracy";
    public static final String DATA_FEASIBILITY = "data_feasibility";
    public static final String PARSIMONY = "parsimony";
    public static final String COMPLETENESS = "completeness";
    public static final String RESEARCH_COVERAGE = "research_coverage";
    public static final String SPEC_COMPLIANCE = "spec_compliance";
    public static final String IMPLEMENTATION_READINESS = "implementation_readiness";

    public QualityDimension {
        score = clamp(score);
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static QualityDimension of(String name, double score, String rationale) {
        return new QualityDimension(name, score, rationale, Map.of());
    }

    static double clamp(double score) {
        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }
}
