package com.enterprise.taskdistribution.core;

/**
 * Progress of a subtask within its decomposition chain
 */
public enum TaskStatus {
    PENDING,        // Waiting for dependencies or for an agent
    IN_PROGRESS,    // Assigned to an agent
    COMPLETED       // Finished; dependents may now run
}
