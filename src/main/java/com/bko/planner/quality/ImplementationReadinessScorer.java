package com.bko.planner.quality;

import com.bko.planner.plan.ClinicalPlan;
import org.springframework.stereotype.Component;

@Component
public class ImplementationReadinessScorer implements DimensionScorer {

    @Override
    public String dimension() {
        return QualityDimension.IMPLEMENTATION_READINESS;
    }

    @Override
    public boolean appliesTo(AssessmentMode mode) {
        return mode == AssessmentMode.RESEARCH;
    }

    @Override
    public QualityDimension score(ClinicalPlan plan, AssessmentMode mode) {
        if (plan.provenance() != null) {
            return QualityDimension.of(dimension(), 0.95, "Research-grounded plan with provenance");
        }
        return QualityDimension.of(dimension(), 0.70, "No research provenance");
    }
}
