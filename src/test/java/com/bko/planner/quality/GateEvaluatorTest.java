package com.bko.planner.quality;

import com.bko.planner.config.PlannerProperties;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GateEvaluatorTest {

    private final GateEvaluator evaluator = new GateEvaluator(new PlannerProperties());

    @Test
    void testFastModeGates() {
        Map<String, QualityDimension> dimensions = Map.of(
                QualityDimension.CLINICAL_ACCURACY, QualityDimension.of(QualityDimension.CLINICAL_ACCURACY, 0.90, ""),
                QualityDimension.DATA_FEASIBILITY, QualityDimension.of(QualityDimension.DATA_FEASIBILITY, 0.60, ""),
                QualityDimension.PARSIMONY, QualityDimension.of(QualityDimension.PARSIMONY, 1.0, ""));

        List<QualityGate> gates = evaluator.evaluate(dimensions, 0.80, AssessmentMode.FAST);

        assertEquals(List.of("clinical_accuracy", "data_feasibility", "parsimony", "overall"),
                gates.stream().map(QualityGate::name).toList());
        assertFalse(gates.get(1).passed());
        assertTrue(gates.get(3).passed());
        assertEquals(0.75, gates.get(3).minimum());
    }

    @Test
    void testResearchModeAddsGatesAndRaisesOverall() {
        List<QualityGate> gates = evaluator.evaluate(Map.of(), 0.80, AssessmentMode.RESEARCH);

        assertEquals(6, gates.size());
        assertEquals(0.85, gates.get(3).minimum());
        assertFalse(gates.get(3).passed());
    }

    @Test
    void testMissingDimensionFailsItsGate() {
        QualityGate parsimony = evaluator.evaluate(Map.of(), 1.0, AssessmentMode.FAST).get(2);

        assertFalse(parsimony.passed());
        assertEquals(0.0, parsimony.actual());
    }

    @Test
    void testVerdictReadyOnlyWhenAllGatesPass() {
        List<QualityGate> gates = List.of(QualityGate.evaluate("overall", 0.75, 0.95),
                QualityGate.evaluate("data_feasibility", 0.70, 0.69));

        QualityVerdict verdict = QualityVerdict.of(0.95, AssessmentMode.FAST, Map.of(), gates, List.of());

        assertFalse(verdict.deploymentReady());
        assertEquals(Grade.A, verdict.grade());
        assertEquals(List.of("data feasibility below minimum threshold"), verdict.flaggedAreas());
    }

    @Test
    void testGradeBoundaries() {
        assertEquals(Grade.A, Grade.fromScore(0.90));
        assertEquals(Grade.B, Grade.fromScore(0.89));
        assertEquals(Grade.C, Grade.fromScore(0.70));
        assertEquals(Grade.D, Grade.fromScore(0.6999));
    }
}
