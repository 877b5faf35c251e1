package com.enterprise.taskdistribution.core;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A unit of work to be assigned to a capable agent.
 * Tasks are immutable; retries and escalation produce modified copies.
 */
public interface Task {

    /**
     * Unique identifier for this task
     */
    String getId();

    /**
     * Capabilities an agent must hold, most important first
     */
    List<Capability> getRequiredCapabilities();

    /**
     * Priority level, 1 (highest) to 5 (lowest)
     */
    int getPriority();

    /**
     * Latest acceptable assignment time (null for no deadline)
     */
    Instant getDeadline();

    /**
     * How long an agent may hold the task before it times out (null for never)
     */
    Duration getTimeout();

    /**
     * Current retry count
     */
    int getRetryCount();

    /**
     * Maximum number of retry attempts
     */
    int getMaxRetries();

    /**
     * Additional metadata for the task
     */
    Map<String, Object> getMetadata();

    /**
     * When this task was created
     */
    Instant getCreatedAt();

    /**
     * Creates a new task with updated retry count
     */
    Task withRetryCount(int retryCount);

    /**
     * Creates a new task with updated priority
     */
    Task withPriority(int priority);

    /**
     * Creates a new task with replaced metadata
     */
    Task withMetadata(Map<String, Object> metadata);

    default boolean hasRetriesLeft() {
        return getRetryCount() < getMaxRetries();
    }
}
