package com.bko.planner.quality;

import com.bko.planner.config.PlannerProperties;
import com.bko.planner.execution.PlannerMetricsService;
import com.bko.planner.plan.ClinicalPlan;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class QualityAssessmentService {

    private final List<DimensionScorer> scorers;
    private final GateEvaluator gateEvaluator;
    private final PlannerProperties properties;
    private final PlannerMetricsService metricsService;

    /**
     * Scores a plan on every dimension that applies to its mode, aggregates the weighted overall
     * score and evaluates the deployment gates. Depends only on the plan's content.
     */
    public QualityVerdict assess(ClinicalPlan plan) {
        AssessmentMode mode = AssessmentMode.of(plan);
        Map<String, QualityDimension> dimensions = new LinkedHashMap<>();
        for (DimensionScorer scorer : scorers) {
            if (scorer.appliesTo(mode)) {
                dimensions.put(scorer.dimension(), scorer.score(plan, mode));
            }
        }
        double overall = aggregate(dimensions, weightsFor(mode));
        List<QualityGate> gates = gateEvaluator.evaluate(dimensions, overall, mode);
        QualityVerdict verdict = QualityVerdict.of(overall, mode, dimensions, gates, recommendations(dimensions));
        if (!verdict.deploymentReady()) {
            log.info("Plan {} is not deployment ready: {}.", plan.planId(), verdict.flaggedAreas());
        }
        metricsService.recordPlanAssessed(plan.planId(), overall, verdict.deploymentReady());
        return verdict;
    }

    Map<String, Double> weightsFor(AssessmentMode mode) {
        return mode == AssessmentMode.RESEARCH
                ? properties.getQuality().getResearchWeights()
                : properties.getQuality().getFastWeights();
    }

    static double aggregate(Map<String, QualityDimension> dimensions, Map<String, Double> weights) {
        double overall = 0.0;
        for (Map.Entry<String, Double> weight : weights.entrySet()) {
            QualityDimension dimension = dimensions.get(weight.getKey());
            if (dimension == null) {
                log.warn("Weighted dimension {} was not computed; it contributes 0.", weight.getKey());
                continue;
            }
            overall += weight.getValue() * dimension.score();
        }
        return Math.max(0.0, Math.min(1.0, overall));
    }

    List<String> recommendations(Map<String, QualityDimension> dimensions) {
        List<String> recommendations = new ArrayList<>();
        if (below(dimensions, QualityDimension.CLINICAL_ACCURACY, properties.getQuality().getGates().getClinicalAccuracy())) {
            recommendations.add("Strengthen clinical terminology and cite sources for review criteria");
        }
        if (below(dimensions, QualityDimension.DATA_FEASIBILITY, 0.80)) {
            recommendations.add("Review signals requiring manual extraction - consider FHIR mapping improvements");
        }
        if (below(dimensions, QualityDimension.PARSIMONY, 0.85)) {
            recommendations.add("Consider reducing signal/question count to focus on 20/80 principle");
        }
        if (below(dimensions, QualityDimension.SPEC_COMPLIANCE, 0.95)) {
            recommendations.add("Add source attribution to remaining signals and criteria for full traceability");
        }
        QualityDimension completeness = dimensions.get(QualityDimension.COMPLETENESS);
        if (completeness != null && completeness.score() < 1.0) {
            recommendations.add("Complete missing fields: " + summarizeMissing(completeness));
        }
        return recommendations;
    }

    private static boolean below(Map<String, QualityDimension> dimensions, String name, double threshold) {
        QualityDimension dimension = dimensions.get(name);
        return dimension != null && dimension.score() < threshold;
    }

    private static String summarizeMissing(QualityDimension completeness) {
        Object value = completeness.details().get("missing_fields");
        if (!(value instanceof List<?> list) || list.isEmpty()) {
            return completeness.rationale();
        }
        List<String> missing = list.stream().map(String::valueOf).toList();
        String head = String.join(", ", missing.subList(0, Math.min(3, missing.size())));
        return missing.size() > 3 ? head + "..." : head;
    }
}
