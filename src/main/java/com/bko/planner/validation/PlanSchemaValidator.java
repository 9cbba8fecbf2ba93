package com.bko.planner.validation;

import com.bko.planner.plan.ClinicalPlan;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Structural validation of the canonical plan through Bean Validation constraints.
 */
@Component
@RequiredArgsConstructor
public class PlanSchemaValidator {

    private final Validator validator;

    public List<ValidationIssue> validate(ClinicalPlan plan) {
        return validator.validate(plan).stream()
                .sorted(Comparator.comparing((ConstraintViolation<ClinicalPlan> violation) -> violation.getPropertyPath().toString()))
                .map(violation -> ValidationIssue.schema(violation.getPropertyPath().toString(),
                        "Schema error at " + violation.getPropertyPath() + ": " + violation.getMessage()))
                .toList();
    }
}
