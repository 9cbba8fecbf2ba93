package com.bko.planner.execution;

import com.bko.planner.graph.TaskType;
import com.fasterxml.jackson.databind.JsonNode;

public record TaskOutput(String taskId, TaskType type, JsonNode payload, TaskValidation validation) {
}
