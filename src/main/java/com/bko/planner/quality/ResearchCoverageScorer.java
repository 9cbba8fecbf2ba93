package com.bko.planner.quality;

import com.bko.planner.plan.ClinicalPlan;
import com.bko.planner.plan.Provenance;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class ResearchCoverageScorer implements DimensionScorer {

    static final int EXPECTED_HAC_SOURCES = 3;
    static final int EXPECTED_SOURCES = 2;

    @Override
    public String dimension() {
        return QualityDimension.RESEARCH_COVERAGE;
    }

    @Override
    public boolean appliesTo(AssessmentMode mode) {
        return mode == AssessmentMode.RESEARCH;
    }

    @Override
    public QualityDimension score(ClinicalPlan plan, AssessmentMode mode) {
        if (plan.provenance() == null) {
            return QualityDimension.of(dimension(), 0.0, "No research provenance");
        }
        long successful = plan.provenance().sourceList().stream().filter(Provenance.Source::successful).count();
        int expected = plan.hacCategory() ? EXPECTED_HAC_SOURCES : EXPECTED_SOURCES;
        return new QualityDimension(dimension(), (double) successful / expected,
                successful + " of " + expected + " expected sources retrieved",
                Map.of("successful_sources", successful, "expected_sources", expected));
    }
}
