package com.bko.planner.validation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Combined structural and quality verdict. {@code valid} requires a clean schema, clean business
 * rules and a quality score at or above the configured threshold.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ValidationResult(
        @JsonProperty("is_valid") boolean valid,
        List<ValidationIssue> errors,
        List<ValidationIssue> warnings,
        boolean schemaValid,
        boolean businessRulesValid,
        boolean qualityThresholdMet
) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public List<String> errorMessages() {
        return errors.stream().map(ValidationIssue::message).toList();
    }
}
