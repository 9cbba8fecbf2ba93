package com.bko.planner.execution;

import com.bko.planner.graph.TaskType;

public class TaskValidationException extends TaskExecutionException {

    private final TaskType taskType;
    private final String failedCheck;

    public TaskValidationException(String taskId, TaskType taskType, String failedCheck) {
        super(taskId, "Task " + taskId + " validation failed: " + failedCheck);
        this.taskType = taskType;
        this.failedCheck = failedCheck;
    }

    public TaskType getTaskType() {
        return taskType;
    }

    public String getFailedCheck() {
        return failedCheck;
    }
}
