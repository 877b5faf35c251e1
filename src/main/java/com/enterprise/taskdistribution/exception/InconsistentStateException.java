package com.enterprise.taskdistribution.exception;

/**
 * Exception thrown when scheduler bookkeeping contradicts itself.
 * Never expected under correct locking; treat as fatal.
 */
public class InconsistentStateException extends IllegalStateException {

    private final String taskId;

    public InconsistentStateException(String taskId, String message) {
        super("Inconsistent state for task " + taskId + ": " + message);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
