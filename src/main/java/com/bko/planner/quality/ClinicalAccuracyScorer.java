package com.bko.planner.quality;

import com.bko.planner.plan.ClinicalConfig;
import com.bko.planner.plan.ClinicalPlan;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
public class ClinicalAccuracyScorer implements DimensionScorer {

    static final double FAST_BASELINE = 0.85;
    static final double RESEARCH_BASELINE = 0.90;
    static final double SOURCED_CRITERIA_BONUS = 0.05;
    static final double CLINICAL_TOOLS_BONUS = 0.05;
    static final double TERMINOLOGY_PENALTY = 0.10;
    static final int MIN_DISTINCT_TERMS = 3;

    static final List<String> CLINICAL_TERMS = List.of(
            "patient", "clinical", "diagnosis", "symptom", "treatment", "infection", "procedure", "medical",
            "hospital", "care", "assessment", "review", "criteria", "indication", "surveillance");

    @Override
    public String dimension() {
        return QualityDimension.CLINICAL_ACCURACY;
    }

    @Override
    public QualityDimension score(ClinicalPlan plan, AssessmentMode mode) {
        boolean research = mode == AssessmentMode.RESEARCH;
        double score = research ? RESEARCH_BASELINE : FAST_BASELINE;
        StringBuilder rationale = new StringBuilder(research ? "Research baseline" : "Fast baseline");

        List<ClinicalConfig.CriteriaRule> rules = plan.clinicalConfig() == null
                ? List.of()
                : plan.clinicalConfig().criteriaRules();
        boolean allSourced = !rules.isEmpty() && rules.stream().allMatch(rule -> hasText(rule.provenance()));
        if (research && plan.provenance() != null && allSourced) {
            score += SOURCED_CRITERIA_BONUS;
            rationale.append("; all criteria sourced");
        }
        if (plan.provenance() != null && !plan.provenance().toolList().isEmpty()) {
            score += CLINICAL_TOOLS_BONUS;
            rationale.append("; clinical tools integrated");
        }

        long distinctTerms = countDistinctTerms(promptText(plan));
        if (distinctTerms < MIN_DISTINCT_TERMS) {
            score -= TERMINOLOGY_PENALTY;
            rationale.append("; limited clinical terminology (").append(distinctTerms).append(" terms)");
        }
        return new QualityDimension(dimension(), score, rationale.toString(),
                Map.of("distinct_terms", distinctTerms, "all_criteria_sourced", allSourced));
    }

    static long countDistinctTerms(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        return CLINICAL_TERMS.stream().filter(lower::contains).count();
    }

    private static String promptText(ClinicalPlan plan) {
        if (plan.clinicalConfig() == null || plan.clinicalConfig().prompts() == null) {
            return "";
        }
        ClinicalConfig.Prompts prompts = plan.clinicalConfig().prompts();
        StringBuilder text = new StringBuilder();
        if (prompts.systemPrompt() != null) {
            text.append(prompts.systemPrompt()).append(' ');
        }
        if (prompts.taskPrompts() != null) {
            prompts.taskPrompts().values().forEach(value -> text.append(value).append(' '));
        }
        return text.toString();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
