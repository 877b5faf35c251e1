package com.enterprise.taskdistribution.core;

import com.enterprise.taskdistribution.exception.ValidationException;

/**
 * Validates tasks before they touch scheduler or planner state
 */
public final class TaskValidator {

    public static final int HIGHEST_PRIORITY = 1;
    public static final int LOWEST_PRIORITY = 5;

    private TaskValidator() {
    }

    /**
     * Throws {@link ValidationException} describing the first invalid field
     */
    public static void validate(Task task) {
        if (task == null) {
            throw new ValidationException("task", "Task is required");
        }
        if (task.getId() == null || task.getId().trim().isEmpty()) {
            throw new ValidationException("taskId", "Task id must be a non-empty string");
        }
        if (task.getRequiredCapabilities() == null || task.getRequiredCapabilities().isEmpty()) {
            throw new ValidationException("requiredCapabilities",
                "Task " + task.getId() + " must require at least one capability");
        }
        if (task.getRequiredCapabilities().contains(null)) {
            throw new ValidationException("requiredCapabilities",
                "Task " + task.getId() + " lists a null capability");
        }
        if (task.getPriority() < HIGHEST_PRIORITY || task.getPriority() > LOWEST_PRIORITY) {
            throw new ValidationException("priority",
                "Priority must be between " + HIGHEST_PRIORITY + " and " + LOWEST_PRIORITY
                    + " but was " + task.getPriority());
        }
        if (task.getTimeout() != null && task.getTimeout().isNegative()) {
            throw new ValidationException("timeout", "Timeout cannot be negative");
        }
        if (task.getRetryCount() < 0) {
            throw new ValidationException("retryCount", "Retry count cannot be negative");
        }
        if (task.getMaxRetries() < 0) {
            throw new ValidationException("maxRetries", "Maximum retries cannot be negative");
        }
    }
}
