package com.bko.planner.quality;

import com.bko.planner.plan.ClinicalConfig;
import com.bko.planner.plan.ClinicalPlan;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Share of signals whose trigger expression points at structured data.
 */
@Component
public class DataFeasibilityScorer implements DimensionScorer {

    static final List<String> STRUCTURED_MARKERS = List.of(".", "code", "result", "status", "value");

    @Override
    public String dimension() {
        return QualityDimension.DATA_FEASIBILITY;
    }

    @Override
    public QualityDimension score(ClinicalPlan plan, AssessmentMode mode) {
        List<ClinicalConfig.Signal> signals = plan.clinicalConfig() == null ? List.of() : plan.clinicalConfig().allSignals();
        if (signals.isEmpty()) {
            return new QualityDimension(dimension(), 0.0, "No signals defined", Map.of("signal_count", 0));
        }
        long extractable = signals.stream().filter(signal -> structured(signal.triggerExpr())).count();
        double score = (double) extractable / signals.size();
        return new QualityDimension(dimension(), score,
                extractable + " of " + signals.size() + " signals map to structured data",
                Map.of("signal_count", signals.size(), "structured_count", extractable,
                        "manual_count", signals.size() - extractable));
    }

    static boolean structured(String triggerExpr) {
        if (triggerExpr == null) {
            return false;
        }
        String lower = triggerExpr.toLowerCase(Locale.ROOT);
        return STRUCTURED_MARKERS.stream().anyMatch(lower::contains);
    }
}
