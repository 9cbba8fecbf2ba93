package com.bko.planner.quality;

import com.bko.planner.plan.ClinicalConfig;
import com.bko.planner.plan.ClinicalPlan;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Traceability of generated elements: the share of signals and criteria carrying a source.
 */
@Component
public class SpecComplianceScorer implements DimensionScorer {

    static final double NO_PROVENANCE_SCORE = 0.70;

    @Override
    public String dimension() {
        return QualityDimension.SPEC_COMPLIANCE;
    }

    @Override
    public boolean appliesTo(AssessmentMode mode) {
        return mode == AssessmentMode.RESEARCH;
    }

    @Override
    public QualityDimension score(ClinicalPlan plan, AssessmentMode mode) {
        if (plan.provenance() == null) {
            return QualityDimension.of(dimension(), NO_PROVENANCE_SCORE, "No provenance tracking");
        }
        List<ClinicalConfig.Signal> signals = plan.clinicalConfig() == null ? List.of() : plan.clinicalConfig().allSignals();
        List<ClinicalConfig.CriteriaRule> rules = plan.clinicalConfig() == null ? List.of() : plan.clinicalConfig().criteriaRules();
        int total = signals.size() + rules.size();
        if (total == 0) {
            return QualityDimension.of(dimension(), 0.0, "No signals or criteria to trace");
        }
        long sourced = signals.stream().filter(signal -> hasText(signal.provenance())).count()
                + rules.stream().filter(rule -> hasText(rule.provenance())).count();
        return new QualityDimension(dimension(), (double) sourced / total,
                sourced + " of " + total + " elements have source attribution",
                Map.of("sourced_elements", sourced, "total_elements", total));
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
