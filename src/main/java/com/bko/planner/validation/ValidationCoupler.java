package com.bko.planner.validation;

import com.bko.planner.config.PlannerProperties;
import com.bko.planner.plan.PlanDocument;
import com.bko.planner.quality.QualityVerdict;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Merges structural validation with the quality verdict. A structurally clean plan is still
 * invalid when its quality score is under the threshold.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ValidationCoupler {

    private final PlanSchemaValidator schemaValidator;
    private final BusinessRuleValidator businessRuleValidator;
    private final PlannerProperties properties;

    public ValidationResult validate(PlanDocument document, QualityVerdict verdict) {
        List<ValidationIssue> schemaErrors = schemaValidator.validate(document.plan());
        BusinessRuleValidator.Report rules = businessRuleValidator.validate(document);

        List<ValidationIssue> errors = new ArrayList<>(rules.errors());
        errors.addAll(schemaErrors);
        List<ValidationIssue> warnings = new ArrayList<>(rules.warnings());

        double threshold = properties.getValidation().getQualityThreshold();
        boolean qualityMet = verdict.overallScore() >= threshold;
        if (!qualityMet) {
            errors.add(ValidationIssue.quality(shortfallMessage(verdict, threshold)));
        }
        if (!verdict.deploymentReady() && qualityMet) {
            verdict.flaggedAreas().forEach(area -> warnings.add(ValidationIssue.quality(area)));
        }
        boolean schemaValid = schemaErrors.isEmpty();
        boolean rulesValid = rules.errors().isEmpty();
        boolean valid = schemaValid && rulesValid && qualityMet;
        if (!valid) {
            log.info("Plan {} failed validation with {} errors.", document.plan().planId(), errors.size());
        }
        return new ValidationResult(valid, errors, warnings, schemaValid, rulesValid, qualityMet);
    }

    static String shortfallMessage(QualityVerdict verdict, double threshold) {
        String message = String.format(Locale.ROOT, "Quality score %.2f is below the required threshold %.2f (grade %s)",
                verdict.overallScore(), threshold, verdict.grade());
        if (verdict.flaggedAreas().isEmpty()) {
            return message;
        }
        return message + ". Flagged areas: " + String.join(", ", verdict.flaggedAreas());
    }
}
