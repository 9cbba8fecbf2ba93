package com.bko.planner.execution;

import com.bko.planner.graph.TaskType;

/**
 * A narrative-driven task was scheduled without a case narrative. This points at upstream
 * assembly, not at the model.
 */
public class MissingTaskInputException extends TaskExecutionException {

    public MissingTaskInputException(String taskId, TaskType type) {
        super(taskId, "Task " + taskId + " (" + type.key() + ") requires the case narrative but it is empty");
    }
}
