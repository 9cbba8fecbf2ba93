package com.bko.planner.quality;

import com.bko.planner.config.PlannerProperties;
import com.bko.planner.plan.ClinicalPlan;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Banded score on plan size: signal count for hospital-acquired-condition plans, metric question
 * count otherwise.
 */
@Component
@RequiredArgsConstructor
public class ParsimonyScorer implements DimensionScorer {

    static final double IN_TARGET = 1.0;
    static final double NEAR_TARGET = 0.85;
    static final double WIDE = 0.70;
    static final double OUTSIDE = 0.50;

    private final PlannerProperties properties;

    @Override
    public String dimension() {
        return QualityDimension.PARSIMONY;
    }

    @Override
    public QualityDimension score(ClinicalPlan plan, AssessmentMode mode) {
        boolean hac = plan.hacCategory();
        int count = plan.clinicalConfig() == null
                ? 0
                : hac ? plan.clinicalConfig().allSignals().size() : plan.clinicalConfig().metricQuestions().size();
        PlannerProperties.ParsimonyBands bands = hac
                ? properties.getQuality().getSignalBands()
                : properties.getQuality().getQuestionBands();
        double score = band(count, bands);
        String unit = hac ? "signals" : "questions";
        return new QualityDimension(dimension(), score,
                count + " " + unit + " against target " + bands.getTarget().getMin() + "-" + bands.getTarget().getMax(),
                Map.of("count", count, "unit", unit));
    }

    static double band(int count, PlannerProperties.ParsimonyBands bands) {
        if (bands.getTarget().contains(count)) {
            return IN_TARGET;
        }
        if (bands.getNear().contains(count)) {
            return NEAR_TARGET;
        }
        if (bands.getWide().contains(count)) {
            return WIDE;
        }
        return OUTSIDE;
    }
}
