package com.bko.planner.quality;

import com.bko.planner.config.PlannerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class GateEvaluator {

    private final PlannerProperties properties;

    /**
     * Evaluates every configured gate for the mode. A gate whose dimension was not computed
     * counts as failed.
     */
    public List<QualityGate> evaluate(Map<String, QualityDimension> dimensions, double overallScore, AssessmentMode mode) {
        PlannerProperties.GateConfig config = properties.getQuality().getGates();
        List<QualityGate> gates = new ArrayList<>();
        gates.add(gate(QualityDimension.CLINICAL_ACCURACY, config.getClinicalAccuracy(), dimensions));
        gates.add(gate(QualityDimension.DATA_FEASIBILITY, config.getDataFeasibility(), dimensions));
        gates.add(gate(QualityDimension.PARSIMONY, config.getParsimony(), dimensions));
        double overallMinimum = mode == AssessmentMode.RESEARCH ? config.getOverallResearch() : config.getOverallFast();
        gates.add(QualityGate.evaluate(QualityGate.OVERALL, overallMinimum, overallScore));
        if (mode == AssessmentMode.RESEARCH) {
            gates.add(gate(QualityDimension.RESEARCH_COVERAGE, config.getResearchCoverage(), dimensions));
            gates.add(gate(QualityDimension.SPEC_COMPLIANCE, config.getSpecCompliance(), dimensions));
        }
        return gates;
    }

    private static QualityGate gate(String dimension, double minimum, Map<String, QualityDimension> dimensions) {
        QualityDimension value = dimensions.get(dimension);
        return QualityGate.evaluate(dimension, minimum, value == null ? 0.0 : value.score());
    }
}
