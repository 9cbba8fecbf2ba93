package com.bko.planner.refinement;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SafeScorerTest {

    private final SafeScorer scorer = new SafeScorer();
    private EvaluationBatch batch;
    private EvaluationCase firstCase;

    @BeforeEach
    void setUp() {
        batch = RefinementFixtures.clabsiBatch();
        firstCase = batch.cases().get(0);
    }

    @Test
    void testBatchFixtureBinds() {
        assertEquals("clabsi_golden", batch.batchId());
        assertEquals(2, batch.cases().size());
        assertEquals(List.of("positive_blood_culture", "central_line_days"), firstCase.mustFindSignals());
        assertEquals(List.of("negligence", "blame"), firstCase.forbiddenTerms());
    }

    @Test
    void testPerfectCase() {
        CaseOutput output = new CaseOutput("clabsi_001", List.of("Positive Blood Culture", "central-line-days"),
                "Fever with positive blood culture on line day 5.", List.of("Was the dressing change documented?"));

        CaseScore score = scorer.score(firstCase, output, false);

        assertEquals(1.0, score.composite(), 1e-9);
        assertEquals(SafeLabel.PASS, score.label());
        assertTrue(score.missedSignals().isEmpty());
    }

    @Test
    void testPartialCaseNeedsReview() {
        CaseOutput output = new CaseOutput("clabsi_001", List.of("positive_blood_culture"), "Fever noted.",
                List.of("Who is to blame for the missed dressing change?"));

        CaseScore score = scorer.score(firstCase, output, false);

        assertEquals(0.5, score.cr(), 1e-9);
        assertEquals(0.5, score.ah(), 1e-9);
        assertEquals(0.5, score.ac(), 1e-9);
        assertEquals(SafeLabel.REVIEW, score.label());
        assertEquals(List.of("central_line_days"), score.missedSignals());
        assertEquals(List.of("blood culture"), score.missedPhrases());
        assertEquals(List.of("blame"), score.violations());
    }

    @Test
    void testStrictScoringFailsAnyViolation() {
        CaseOutput output = new CaseOutput("clabsi_001", List.of("positive_blood_culture", "central_line_days"),
                "Fever and blood culture positive.", List.of("Is anyone to BLAME?"));

        CaseScore score = scorer.score(firstCase, output, true);

        assertEquals(0.0, score.ah());
        assertEquals(SafeLabel.FAIL, score.label());
    }

    @Test
    void testSignalFoundInSummary() {
        CaseOutput output = new CaseOutput("clabsi_001", List.of("positive_blood_culture"),
                "Fever, blood culture positive; central_line_days = 5.", List.of());

        assertEquals(1.0, scorer.score(firstCase, output, false).cr(), 1e-9);
    }

    @Test
    void testMissingOutputScoresAsEmpty() {
        CaseOutput perfect = new CaseOutput("clabsi_001", List.of("positive_blood_culture", "central_line_days"),
                "Fever and blood culture positive.", List.of());

        BatchScore score = scorer.scoreBatch(batch, Map.of("clabsi_001", perfect), false);

        CaseScore second = score.cases().get(1);
        assertEquals(0.0, second.cr());
        assertEquals(1.0, second.ah());
        assertEquals(SafeLabel.FAIL, second.label());
        assertEquals((1.0 + 1.0 / 3.0) / 2.0, score.score(), 1e-9);
        assertTrue(score.failureEvidence().contains("- positive_blood_culture (1 cases)"));
        assertTrue(score.failureEvidence().contains("- urine culture (1 cases)"));
    }

    @Test
    void testSignalSynonyms() {
        assertTrue(SafeScorer.signalMatches("surgical_site_infection", "SSI"));
        assertTrue(SafeScorer.signalMatches("antibiotic_timing", "cefazolin_given_late"));
        assertFalse(SafeScorer.signalMatches("positive_blood_culture", "urine_culture"));
        assertFalse(SafeScorer.signalMatches("", "ssi"));
    }

    @Test
    void testNormalizeId() {
        assertEquals("surgicalsiteinf", SafeScorer.normalizeId("Surgical Site Infection Prevention Bundle"));
    }

    @Test
    void testLabelThresholds() {
        assertEquals(SafeLabel.PASS, SafeScorer.label(0.8, 1.0, 0.8));
        assertEquals(SafeLabel.REVIEW, SafeScorer.label(0.8, 0.99, 0.8));
        assertEquals(SafeLabel.FAIL, SafeScorer.label(0.49, 1.0, 1.0));
    }

    @Test
    void testNoFailuresEvidence() {
        assertEquals("No failures recorded.", new BatchScore("b", 1.0, List.of()).failureEvidence());
    }
}
