package com.enterprise.taskdistribution.core;

import com.enterprise.taskdistribution.exception.InconsistentStateException;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Record binding a task to the agent responsible for it.
 * <p>
 * Completion and failure are terminal and mutually exclusive; each record is
 * stamped at most once. Mutated only under the owning scheduler's lock.
 */
public class TaskAssignment {

    private volatile Task task;
    private final String agentId;
    private final Instant assignedAt;
    private final double capabilityMatchScore;
    private final double finalScore;

    private volatile Instant completedAt;
    private volatile Instant failedAt;
    private volatile String failureReason;

    public TaskAssignment(Task task, String agentId, Instant assignedAt,
                          double capabilityMatchScore, double finalScore) {
        this.task = task;
        this.agentId = agentId;
        this.assignedAt = assignedAt;
        this.capabilityMatchScore = capabilityMatchScore;
        this.finalScore = finalScore;
    }

    public Task getTask() { return task; }

    public String getTaskId() { return task.getId(); }

    public String getAgentId() { return agentId; }

    public Instant getAssignedAt() { return assignedAt; }

    /**
     * Weighted capability fit of the agent for this task, in [0, 1]
     */
    public double getCapabilityMatchScore() { return capabilityMatchScore; }

    /**
     * Combined score the agent won the assignment with
     */
    public double getFinalScore() { return finalScore; }

    public Instant getCompletedAt() { return completedAt; }

    public Instant getFailedAt() { return failedAt; }

    public String getFailureReason() { return failureReason; }

    public boolean isActive() {
        return completedAt == null && failedAt == null;
    }

    public boolean isCompleted() {
        return completedAt != null;
    }

    public boolean isFailed() {
        return failedAt != null;
    }

    /**
     * Time at which the holder of this assignment is considered to have timed out,
     * or null if the task never times out
     */
    public Instant getTimeoutAt() {
        return task.getTimeout() != null ? assignedAt.plus(task.getTimeout()) : null;
    }

    public void markCompleted(Instant at, Map<String, Object> result) {
        ensureActive();
        if (result != null && !result.isEmpty()) {
            Map<String, Object> metadata = new HashMap<>(task.getMetadata());
            metadata.put("result", result);
            this.task = task.withMetadata(metadata);
        }
        this.completedAt = at;
    }

    public void markFailed(Instant at, String reason) {
        ensureActive();
        this.failedAt = at;
        this.failureReason = reason;
    }

    private void ensureActive() {
        if (!isActive()) {
            throw new InconsistentStateException(task.getId(),
                "assignment to " + agentId + " already " + (isCompleted() ? "completed" : "failed"));
        }
    }

    @Override
    public String toString() {
        return "TaskAssignment{" +
                "taskId='" + task.getId() + '\'' +
                ", agentId='" + agentId + '\'' +
                ", assignedAt=" + assignedAt +
                ", capabilityMatchScore=" + capabilityMatchScore +
                ", completedAt=" + completedAt +
                ", failedAt=" + failedAt +
                ", failureReason='" + failureReason + '\'' +
                '}';
    }
}
