package com.bko.planner.quality;

import com.bko.planner.plan.QualitySummary;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Scored assessment of one plan. {@code deploymentReady} holds exactly when every gate passed.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QualityVerdict(
        double overallScore,
        Grade grade,
        AssessmentMode mode,
        Map<String, QualityDimension> dimensions,
        List<QualityGate> gates,
        boolean deploymentReady,
        List<String> flaggedAreas,
        List<String> recommendations
) {

    public QualityVerdict {
        dimensions = Collections.unmodifiableMap(new LinkedHashMap<>(dimensions));
        gates = List.copyOf(gates);
        flaggedAreas = List.copyOf(flaggedAreas);
        recommendations = List.copyOf(recommendations);
    }

    public static QualityVerdict of(double overallScore,
                                    AssessmentMode mode,
                                    Map<String, QualityDimension> dimensions,
                                    List<QualityGate> gates,
                                    List<String> recommendations) {
        boolean ready = gates.stream().allMatch(QualityGate::passed);
        List<String> flagged = gates.stream()
                .filter(gate -> !gate.passed())
                .map(QualityGate::flaggedArea)
                .toList();
        return new QualityVerdict(overallScore, Grade.fromScore(overallScore), mode, dimensions, gates, ready,
                flagged, recommendations);
    }

    public Optional<QualityDimension> dimension(String name) {
        return Optional.ofNullable(dimensions.get(name));
    }

    public Optional<QualityGate> gate(String name) {
        return gates.stream().filter(gate -> gate.name().equals(name)).findFirst();
    }

    public QualitySummary toSummary() {
        return new QualitySummary(overallScore, grade.name(), deploymentReady);
    }
}
