package com.enterprise.taskdistribution.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A task produced by decomposing a parent task. Carries its position in the
 * chain, the subtasks it depends on and its estimated complexity.
 * <p>
 * Status and assigned agent are mutated by the owning planner under its lock;
 * everything else is immutable.
 */
public class SubTask implements Task {

    private final Task task;
    private final String parentTaskId;
    private final List<String> dependencies;
    private final int stepNumber;
    private final double estimatedComplexity;

    private volatile TaskStatus status;
    private volatile String assignedAgent;

    public SubTask(Task task, String parentTaskId, List<String> dependencies,
                   int stepNumber, double estimatedComplexity) {
        this(task, parentTaskId, dependencies, stepNumber, estimatedComplexity, TaskStatus.PENDING, null);
    }

    private SubTask(Task task, String parentTaskId, List<String> dependencies, int stepNumber,
                    double estimatedComplexity, TaskStatus status, String assignedAgent) {
        this.task = task;
        this.parentTaskId = parentTaskId;
        this.dependencies = dependencies != null ? List.copyOf(dependencies) : Collections.emptyList();
        this.stepNumber = stepNumber;
        this.estimatedComplexity = estimatedComplexity;
        this.status = status;
        this.assignedAgent = assignedAgent;
    }

    @Override
    public String getId() { return task.getId(); }

    @Override
    public List<Capability> getRequiredCapabilities() { return task.getRequiredCapabilities(); }

    @Override
    public int getPriority() { return task.getPriority(); }

    @Override
    public Instant getDeadline() { return task.getDeadline(); }

    @Override
    public Duration getTimeout() { return task.getTimeout(); }

    @Override
    public int getRetryCount() { return task.getRetryCount(); }

    @Override
    public int getMaxRetries() { return task.getMaxRetries(); }

    @Override
    public Map<String, Object> getMetadata() { return task.getMetadata(); }

    @Override
    public Instant getCreatedAt() { return task.getCreatedAt(); }

    public String getParentTaskId() { return parentTaskId; }

    public List<String> getDependencies() { return dependencies; }

    public int getStepNumber() { return stepNumber; }

    public double getEstimatedComplexity() { return estimatedComplexity; }

    public TaskStatus getStatus() { return status; }

    public String getAssignedAgent() { return assignedAgent; }

    public String getDescription() {
        Object description = task.getMetadata().get("description");
        return description != null ? description.toString() : "";
    }

    public void setStatus(TaskStatus status) {
        this.status = status;
    }

    public void setAssignedAgent(String assignedAgent) {
        this.assignedAgent = assignedAgent;
    }

    @Override
    public Task withRetryCount(int retryCount) {
        return copyOf(task.withRetryCount(retryCount));
    }

    @Override
    public Task withPriority(int priority) {
        return copyOf(task.withPriority(priority));
    }

    @Override
    public Task withMetadata(Map<String, Object> metadata) {
        return copyOf(task.withMetadata(metadata));
    }

    private SubTask copyOf(Task updated) {
        return new SubTask(updated, parentTaskId, dependencies, stepNumber,
                           estimatedComplexity, status, assignedAgent);
    }

    @Override
    public String toString() {
        return "SubTask{" +
                "id='" + getId() + '\'' +
                ", parentTaskId='" + parentTaskId + '\'' +
                ", stepNumber=" + stepNumber +
                ", status=" + status +
                ", dependencies=" + dependencies +
                '}';
    }
}
