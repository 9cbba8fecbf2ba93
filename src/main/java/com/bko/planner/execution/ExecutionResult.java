package com.bko.planner.execution;

import com.bko.planner.graph.TaskType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outputs of one run keyed by task id, in execution order.
 */
public record ExecutionResult(String executionId, List<String> executionOrder, Map<String, TaskOutput> outputs) {

    public ExecutionResult {
        executionOrder = List.copyOf(executionOrder);
        outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    }

    public List<TaskOutput> outputsOfType(TaskType type) {
        return outputs.values().stream().filter(output -> output.type() == type).toList();
    }
}
