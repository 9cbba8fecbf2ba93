package com.bko.planner.execution;

import com.bko.planner.graph.TaskType;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural checks on a task payload. Errors are fatal to the run; warnings are carried on the output.
 */
@Component
public class TaskOutputValidator {

    public TaskValidation validate(TaskType type, JsonNode payload) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (payload == null || !payload.isObject()) {
            errors.add("payload is not a JSON object");
            return TaskValidation.of(errors, warnings);
        }
        switch (type) {
            case SIGNAL_ENRICHMENT -> checkSignalGroups(payload, "signal_groups", errors, warnings);
            case EVENT_SUMMARY -> {
                requireText(payload, "event_summary", errors);
                if (payload.path("timeline_complete").isBoolean() && !payload.path("timeline_complete").asBoolean()) {
                    warnings.add("event timeline is incomplete");
                }
            }
            case SUMMARY_20_80 -> requireText(payload, "result", errors);
            case FOLLOWUP_QUESTIONS -> requireArray(payload, "followup_questions", errors, warnings);
            case CLINICAL_REVIEW_PLAN -> requireArray(payload, "clinical_tools", errors, warnings);
            case MULTI_ARCHETYPE_SYNTHESIS -> checkSignalGroups(payload, "merged_signal_groups", errors, warnings);
        }
        return TaskValidation.of(errors, warnings);
    }

    private void checkSignalGroups(JsonNode payload, String field, List<String> errors, List<String> warnings) {
        if (!requireArray(payload, field, errors, warnings)) {
            return;
        }
        JsonNode groups = payload.get(field);
        for (int i = 0; i < groups.size(); i++) {
            JsonNode group = groups.get(i);
            if (!group.path("signals").isArray()) {
                errors.add(field + "[" + i + "] is missing signals array");
            } else if (group.path("signals").isEmpty()) {
                warnings.add(field + "[" + i + "] has no signals");
            }
            if (!group.hasNonNull("group_id")) {
                warnings.add(field + "[" + i + "] has no group_id");
            }
        }
    }

    private boolean requireArray(JsonNode payload, String field, List<String> errors, List<String> warnings) {
        JsonNode node = payload.get(field);
        if (node == null || !node.isArray()) {
            errors.add("missing " + field + " array");
            return false;
        }
        if (node.isEmpty()) {
            warnings.add(field + " is empty");
        }
        return true;
    }

    private void requireText(JsonNode payload, String field, List<String> errors) {
        JsonNode node = payload.get(field);
        if (node == null || !node.isTextual()) {
            errors.add("missing " + field + " string");
        } else if (node.asText().isBlank()) {
            errors.add(field + " is blank");
        }
    }
}
