package com.bko.planner.execution;

import java.util.List;

public record TaskValidation(boolean passed, List<String> errors, List<String> warnings) {

    public TaskValidation {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static TaskValidation of(List<String> errors, List<String> warnings) {
        return new TaskValidation(errors.isEmpty(), errors, warnings);
    }
}
