package com.bko.planner.execution;

/**
 * Fatal failure of a task execution run. Never retried within the run.
 */
public class TaskExecutionException extends RuntimeException {

    private final String taskId;

    public TaskExecutionException(String taskId, String message) {
        super(message);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
