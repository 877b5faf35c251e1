package com.enterprise.taskdistribution.exception;

/**
 * Base exception for collaborator failures inside the task distribution core
 */
public class TaskDistributionException extends Exception {

    public TaskDistributionException(String message) {
        super(message);
    }

    public TaskDistributionException(String message, Throwable cause) {
        super(message, cause);
    }
}
