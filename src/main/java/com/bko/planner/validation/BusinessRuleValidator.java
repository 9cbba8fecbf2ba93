package com.bko.planner.validation;

import com.bko.planner.plan.ClinicalConfig;
import com.bko.planner.plan.ClinicalPlan;
import com.bko.planner.plan.PlanDocument;
import com.bko.planner.plan.PlanMetadata;
import com.bko.planner.plan.PlanVersion;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Cross-field and range rules that a structural schema cannot express.
 */
@Component
public class BusinessRuleValidator {

    static final int MIN_SUMMARY_LENGTH = 100;
    static final double REVIEW_SCORE_THRESHOLD = 0.7;

    public record Report(List<ValidationIssue> errors, List<ValidationIssue> warnings) {
    }

    public Report validate(PlanDocument document) {
        List<ValidationIssue> errors = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();
        ClinicalPlan plan = document.plan();

        PlanMetadata metadata = plan.planMetadata();
        if (metadata == null || !StringUtils.hasText(metadata.planId())) {
            errors.add(ValidationIssue.rule("plan_metadata.plan_id", "plan_id is required"));
        }
        if (metadata == null || !StringUtils.hasText(metadata.planningInputId())) {
            errors.add(ValidationIssue.rule("plan_metadata.planning_input_id", "planning_input_id is required"));
        }

        checkConfig(plan.clinicalConfig(), errors);

        if (document.version() == PlanVersion.V1) {
            checkLegacy(plan, errors, warnings);
        } else {
            checkScored(plan, errors, warnings);
        }
        return new Report(errors, warnings);
    }

    private void checkConfig(ClinicalConfig config, List<ValidationIssue> errors) {
        if (config == null) {
            return;
        }
        List<ClinicalConfig.SignalGroup> groups = config.signals() == null || config.signals().signalGroups() == null
                ? List.of()
                : config.signals().signalGroups();
        if (groups.isEmpty()) {
            errors.add(ValidationIssue.rule("clinical_config.signals.signal_groups", "At least one signal group is required"));
        }
        for (ClinicalConfig.SignalGroup group : groups) {
            if (group.signals() == null || group.signals().isEmpty()) {
                errors.add(ValidationIssue.rule("clinical_config.signals.signal_groups",
                        "Signal group " + group.groupId() + " must contain at least one signal"));
            }
        }
        if (config.timeline() == null || config.timeline().phases() == null || config.timeline().phases().isEmpty()) {
            errors.add(ValidationIssue.rule("clinical_config.timeline.phases", "At least one timeline phase is required"));
        }
        if (config.criteriaRules().isEmpty()) {
            errors.add(ValidationIssue.rule("clinical_config.criteria.rules", "At least one criteria rule is required"));
        }
    }

    private void checkLegacy(ClinicalPlan plan, List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        Double confidence = plan.planMetadata() == null ? null : plan.planMetadata().confidence();
        if (confidence != null && (confidence < 0.0 || confidence > 1.0)) {
            errors.add(ValidationIssue.rule("plan_metadata.confidence", "confidence must be between 0 and 1"));
        }
        if (plan.rationale() == null || plan.rationale().keyDecisions() == null || plan.rationale().keyDecisions().isEmpty()) {
            warnings.add(ValidationIssue.rule("rationale.key_decisions", "No key decisions documented"));
        }
        checkSummary(plan, warnings);
    }

    private void checkScored(ClinicalPlan plan, List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        Double score = plan.quality() == null ? null : plan.quality().overallScore();
        if (score != null) {
            if (score < 0.0 || score > 1.0) {
                errors.add(ValidationIssue.rule("quality.overall_score", "quality score must be between 0 and 1"));
            } else if (score < REVIEW_SCORE_THRESHOLD && !flaggedForReview(plan)) {
                warnings.add(ValidationIssue.rule("plan_metadata.status.requires_review",
                        "Quality score below " + REVIEW_SCORE_THRESHOLD + " but plan is not flagged for review"));
            }
        }
        if (plan.researchMode() && (plan.provenance() == null || plan.provenance().sourceList().isEmpty())) {
            warnings.add(ValidationIssue.rule("provenance.sources", "Research mode plan has no provenance sources"));
        }
        checkSummary(plan, warnings);
    }

    private static boolean flaggedForReview(ClinicalPlan plan) {
        return plan.planMetadata() != null && plan.planMetadata().reviewRequired();
    }

    private void checkSummary(ClinicalPlan plan, List<ValidationIssue> warnings) {
        String summary = plan.rationale() == null ? null : plan.rationale().summary();
        if (summary != null && summary.length() < MIN_SUMMARY_LENGTH) {
            warnings.add(ValidationIssue.rule("rationale.summary",
                    "Rationale summary is shorter than " + MIN_SUMMARY_LENGTH + " characters"));
        }
    }
}
