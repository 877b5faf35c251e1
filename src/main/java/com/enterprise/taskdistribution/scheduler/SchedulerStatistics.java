package com.enterprise.taskdistribution.scheduler;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time statistics about a task scheduler
 */
public interface SchedulerStatistics {

    /**
     * Total number of tasks submitted through assignTask
     */
    long getTotalTasksSubmitted();

    /**
     * Total number of assignments made, including backlog drains
     */
    long getTotalAssignments();

    /**
     * Total number of assignments completed
     */
    long getTotalTasksCompleted();

    /**
     * Total number of assignments that timed out
     */
    long getTotalTimeouts();

    /**
     * Number of assignments currently active
     */
    int getActiveAssignments();

    /**
     * Number of tasks waiting on the backlog
     */
    int getBacklogSize();

    /**
     * Number of permanently failed tasks
     */
    int getFailedTasks();

    /**
     * Active assignment count per agent with at least one
     */
    Map<String, Integer> getActiveAssignmentsByAgent();

    /**
     * When the scheduler was created
     */
    Instant getStartedAt();
}
