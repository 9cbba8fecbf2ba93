package com.bko.planner.plan;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Hand-built plans for scoring and validation tests.
 */
public final class PlanFixtures {

    public static final String CLINICAL_SYSTEM_PROMPT =
            "You support clinical surveillance teams during patient chart review.";
    public static final String PLAIN_SYSTEM_PROMPT = "Be brief.";

    private PlanFixtures() {
    }

    /**
     * Fast-mode CLABSI plan with the given number of structured signals.
     */
    public static ClinicalPlan hacPlan(int signalCount, String systemPrompt) {
        return plan(metadata("fast", "HAC"), config("HAC", signals(signalCount, null), systemPrompt, null, null),
                null, rationale());
    }

    /**
     * Research-mode CLABSI plan where every signal and rule is sourced and three sources succeeded.
     */
    public static ClinicalPlan researchPlan(int signalCount) {
        Provenance provenance = new Provenance(List.of(
                new Provenance.Source("CDC NHSN", "success", "https://www.cdc.gov/nhsn"),
                new Provenance.Source("AHRQ", "success", null),
                new Provenance.Source("SPS", "success", null)), List.of("NHSN CLABSI checklist"));
        return plan(metadata(PlanMetadata.RESEARCH_WORKFLOW, "HAC"),
                config("HAC", signals(signalCount, "CDC NHSN"), CLINICAL_SYSTEM_PROMPT, "CDC NHSN", null),
                provenance, rationale());
    }

    /**
     * Specialty plan scored on metric questions instead of signals.
     */
    public static ClinicalPlan metricPlan(int questionCount) {
        List<ClinicalConfig.MetricQuestion> questions = new ArrayList<>();
        for (int i = 1; i <= questionCount; i++) {
            questions.add(new ClinicalConfig.MetricQuestion("q" + i, "Was the criteria met for patient " + i + "?"));
        }
        return plan(metadata("fast", "USNWR"),
                config("Cardiology", signals(4, null), CLINICAL_SYSTEM_PROMPT, null, questions), null, rationale());
    }

    public static ClinicalPlan plan(PlanMetadata metadata, ClinicalConfig config, Provenance provenance,
                                    Rationale rationale) {
        return new ClinicalPlan(metadata, config, provenance, rationale, null);
    }

    public static PlanMetadata metadata(String workflow, String concernType) {
        return new PlanMetadata("plan_clabsi_test", "input_plan_clabsi_test", "9.1", "2026-01-05T10:00:00Z",
                new PlanMetadata.Concern("CLABSI", concernType, "HAC", "Preventability_Detective"),
                new PlanMetadata.Workflow(workflow), new PlanMetadata.Status(true, "draft"), null);
    }

    public static ClinicalConfig config(String domain, List<ClinicalConfig.Signal> signals, String systemPrompt,
                                        String ruleProvenance, List<ClinicalConfig.MetricQuestion> questions) {
        return new ClinicalConfig(
                new ClinicalConfig.ConfigMetadata("cfg_clabsi", "CLABSI surveillance", "9.1"),
                new ClinicalConfig.DomainInfo(domain, "Preventability_Detective", List.of("Preventability_Detective")),
                new ClinicalConfig.Surveillance("Detect preventable CLABSI", "Adult inpatients with central lines", 30),
                new ClinicalConfig.Signals(List.of(new ClinicalConfig.SignalGroup("safety_signals", "Safety Signals", signals))),
                new ClinicalConfig.Timeline(List.of(new ClinicalConfig.Phase("line_placement", "Line Placement", null))),
                new ClinicalConfig.Prompts(systemPrompt, Map.of("event_summary", "Summarize the course.")),
                new ClinicalConfig.Criteria(List.of(
                        new ClinicalConfig.CriteriaRule("nhsn_lcbi_1", "Recognized pathogen in blood culture", ruleProvenance))),
                questions == null ? null : new ClinicalConfig.Questions(questions),
                null);
    }

    public static List<ClinicalConfig.Signal> signals(int count, String provenance) {
        List<ClinicalConfig.Signal> signals = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            signals.add(new ClinicalConfig.Signal("signal_" + i, "Signal " + i, "lab.result == 'positive'", provenance));
        }
        return signals;
    }

    public static Rationale rationale() {
        return new Rationale("Central line days and positive blood cultures drive the review; device removal timing "
                + "and alternate infection sources are captured to separate preventable events.",
                List.of("Signals limited to structured lab and device data"));
    }
}
