package com.enterprise.taskdistribution.core;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Default implementation of the Task interface
 */
public class TaskImpl implements Task {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofHours(1);
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final int DEFAULT_PRIORITY = 3;

    private final String id;
    private final List<Capability> requiredCapabilities;
    private final int priority;
    private final Instant deadline;
    private final Duration timeout;
    private final int retryCount;
    private final int maxRetries;
    private final Map<String, Object> metadata;
    private final Instant createdAt;

    public TaskImpl(String id,
                    Collection<Capability> requiredCapabilities,
                    int priority,
                    Instant deadline,
                    Duration timeout,
                    int retryCount,
                    int maxRetries,
                    Map<String, Object> metadata,
                    Instant createdAt) {
        this.id = id;
        this.requiredCapabilities = requiredCapabilities != null
            ? Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(requiredCapabilities)))
            : Collections.emptyList();
        this.priority = priority;
        this.deadline = deadline;
        this.timeout = timeout;
        this.retryCount = retryCount;
        this.maxRetries = maxRetries;
        this.metadata = metadata != null
            ? Collections.unmodifiableMap(new HashMap<>(metadata))
            : Collections.emptyMap();
        this.createdAt = createdAt != null ? createdAt : Instant.now();
    }

    @Override
    public String getId() { return id; }

    @Override
    public List<Capability> getRequiredCapabilities() { return requiredCapabilities; }

    @Override
    public int getPriority() { return priority; }

    @Override
    public Instant getDeadline() { return deadline; }

    @Override
    public Duration getTimeout() { return timeout; }

    @Override
    public int getRetryCount() { return retryCount; }

    @Override
    public int getMaxRetries() { return maxRetries; }

    @Override
    public Map<String, Object> getMetadata() { return metadata; }

    @Override
    public Instant getCreatedAt() { return createdAt; }

    @Override
    public Task withRetryCount(int retryCount) {
        return new TaskImpl(id, requiredCapabilities, priority, deadline, timeout,
                            retryCount, maxRetries, metadata, createdAt);
    }

    @Override
    public Task withPriority(int priority) {
        return new TaskImpl(id, requiredCapabilities, priority, deadline, timeout,
                            retryCount, maxRetries, metadata, createdAt);
    }

    @Override
    public Task withMetadata(Map<String, Object> metadata) {
        return new TaskImpl(id, requiredCapabilities, priority, deadline, timeout,
                            retryCount, maxRetries, metadata, createdAt);
    }

    @Override
    public String toString() {
        return "Task{" +
                "id='" + id + '\'' +
                ", requiredCapabilities=" + requiredCapabilities +
                ", priority=" + priority +
                ", retryCount=" + retryCount + "/" + maxRetries +
                '}';
    }

    /**
     * Builder for creating Task instances
     */
    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private List<Capability> requiredCapabilities = new ArrayList<>();
        private int priority = DEFAULT_PRIORITY;
        private Instant deadline;
        private Duration timeout = DEFAULT_TIMEOUT;
        private int retryCount = 0;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Map<String, Object> metadata;
        private Instant createdAt = Instant.now();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder requiredCapabilities(Collection<Capability> capabilities) {
            this.requiredCapabilities = new ArrayList<>(capabilities);
            return this;
        }

        public Builder requiredCapabilities(Capability... capabilities) {
            this.requiredCapabilities = new ArrayList<>(List.of(capabilities));
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder deadline(Instant deadline) {
            this.deadline = deadline;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Task build() {
            return new TaskImpl(id, requiredCapabilities, priority, deadline, timeout,
                                retryCount, maxRetries, metadata, createdAt);
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}
