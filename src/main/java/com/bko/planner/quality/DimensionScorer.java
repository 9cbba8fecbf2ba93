package com.bko.planner.quality;

import com.bko.planner.plan.ClinicalPlan;

/**
 * Computes one quality dimension from plan content alone. Scorers never read each other's results.
 */
public interface DimensionScorer {

    String dimension();

    default boolean appliesTo(AssessmentMode mode) {
        return true;
    }

    QualityDimension score(ClinicalPlan plan, AssessmentMode mode);
}
