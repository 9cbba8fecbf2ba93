package com.bko.planner.quality;

import com.bko.planner.config.PlannerProperties;
import com.bko.planner.execution.PlannerMetricsService;
import com.bko.planner.plan.ClinicalConfig;
import com.bko.planner.plan.ClinicalPlan;
import com.bko.planner.plan.PlanFixtures;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QualityAssessmentServiceTest {

    private QualityAssessmentService service;

    @BeforeEach
    void setUp() {
        PlannerProperties properties = new PlannerProperties();
        List<DimensionScorer> scorers = List.of(
                new ClinicalAccuracyScorer(),
                new DataFeasibilityScorer(),
                new ParsimonyScorer(properties),
                new CompletenessScorer(new ObjectMapper()),
                new ResearchCoverageScorer(),
                new SpecComplianceScorer(),
                new ImplementationReadinessScorer());
        service = new QualityAssessmentService(scorers, new GateEvaluator(properties), properties,
                new PlannerMetricsService());
    }

    @Test
    void testDeploymentReadyFastPlan() {
        QualityVerdict verdict = service.assess(PlanFixtures.hacPlan(18, PlanFixtures.CLINICAL_SYSTEM_PROMPT));

        assertEquals(AssessmentMode.FAST, verdict.mode());
        assertEquals(4, verdict.dimensions().size());
        assertEquals(0.9475, verdict.overallScore(), 1e-9);
        assertEquals(Grade.A, verdict.grade());
        assertTrue(verdict.deploymentReady());
        assertTrue(verdict.flaggedAreas().isEmpty());
    }

    @Test
    void testSingleFailedGateBlocksDeployment() {
        QualityVerdict verdict = service.assess(PlanFixtures.hacPlan(18, PlanFixtures.PLAIN_SYSTEM_PROMPT));

        assertEquals(0.9125, verdict.overallScore(), 1e-9);
        assertTrue(verdict.gate(QualityGate.OVERALL).orElseThrow().passed());
        assertFalse(verdict.deploymentReady());
        assertEquals(List.of("clinical accuracy below minimum threshold"), verdict.flaggedAreas());
        assertTrue(verdict.recommendations().contains(
                "Strengthen clinical terminology and cite sources for review criteria"));
    }

    @Test
    void testResearchPlan() {
        QualityVerdict verdict = service.assess(PlanFixtures.researchPlan(18));

        assertEquals(AssessmentMode.RESEARCH, verdict.mode());
        assertEquals(7, verdict.dimensions().size());
        assertEquals(6, verdict.gates().size());
        assertEquals(1.0, verdict.overallScore(), 1e-9);
        assertEquals(0.95, verdict.dimension(QualityDimension.IMPLEMENTATION_READINESS).orElseThrow().score());
        assertTrue(verdict.deploymentReady());
    }

    @Test
    void testIncompletePlanGetsRecommendation() {
        ClinicalPlan plan = PlanFixtures.hacPlan(18, PlanFixtures.CLINICAL_SYSTEM_PROMPT);
        ClinicalPlan withoutSurveillance = PlanFixtures.plan(plan.planMetadata(),
                new ClinicalConfig(plan.clinicalConfig().configMetadata(),
                        plan.clinicalConfig().domain(), null, plan.clinicalConfig().signals(),
                        plan.clinicalConfig().timeline(), plan.clinicalConfig().prompts(),
                        plan.clinicalConfig().criteria(), null, null),
                null, plan.rationale());

        QualityVerdict verdict = service.assess(withoutSurveillance);

        assertEquals(8.0 / 9.0, verdict.dimension(QualityDimension.COMPLETENESS).orElseThrow().score(), 1e-9);
        assertTrue(verdict.recommendations().contains("Complete missing fields: clinical_config.surveillance"));
    }

    @Test
    void testAssessmentIsDeterministic() {
        ClinicalPlan plan = PlanFixtures.hacPlan(35, PlanFixtures.CLINICAL_SYSTEM_PROMPT);

        assertEquals(service.assess(plan), service.assess(plan));
    }

    @Test
    void testAggregateSkipsMissingDimensions() {
        Map<String, QualityDimension> dimensions = Map.of(
                QualityDimension.PARSIMONY, QualityDimension.of(QualityDimension.PARSIMONY, 1.0, ""));

        assertEquals(0.20, QualityAssessmentService.aggregate(dimensions,
                new PlannerProperties().getQuality().getFastWeights()), 1e-9);
    }
}
