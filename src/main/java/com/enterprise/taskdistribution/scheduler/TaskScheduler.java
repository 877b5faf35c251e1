package com.enterprise.taskdistribution.scheduler;

import com.enterprise.taskdistribution.core.Capability;
import com.enterprise.taskdistribution.core.Task;
import com.enterprise.taskdistribution.core.TaskAssignment;
import com.enterprise.taskdistribution.core.TaskValidator;
import com.enterprise.taskdistribution.exception.PersistenceException;
import com.enterprise.taskdistribution.exception.ValidationException;
import com.enterprise.taskdistribution.memory.MemoryStore;
import com.enterprise.taskdistribution.monitoring.SchedulerMetrics;
import com.enterprise.taskdistribution.registry.CapabilityRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Assigns tasks to capable agents and tracks them until they complete or fail.
 * <p>
 * Every candidate agent is scored on capability fit, current load, task
 * priority and deadline urgency; the best score wins and equal scores resolve
 * to the lowest agent id. Tasks no agent can take wait on a priority backlog
 * that is drained whenever an agent completes work. Failed and timed-out
 * tasks are retried at a raised priority until their retries are exhausted.
 * <p>
 * All state is guarded by a single lock. Metrics, memory store writes and
 * listener callbacks run after the lock is released.
 */
public class TaskScheduler {

    private static final Logger logger = LoggerFactory.getLogger(TaskScheduler.class);

    public static final int DEFAULT_MAX_TASKS_PER_AGENT = 3;
    public static final Duration DEFAULT_HEARTBEAT_TIMEOUT = Duration.ofMinutes(5);

    static final String REASON_TIMED_OUT = "Task timed out";
    static final String REASON_DEADLINE_ELAPSED = "Deadline elapsed";

    private final CapabilityRegistry registry;
    private final int maxTasksPerAgent;
    private final Duration heartbeatTimeout;
    private final ScoringPolicy scoringPolicy;
    private final SchedulerMetrics metrics;
    private final MemoryStore memoryStore;
    private final Clock clock;
    private final List<AssignmentListener> listeners = new CopyOnWriteArrayList<>();

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Map<String, TaskAssignment>> activeTasks = new HashMap<>();
    private final Map<String, List<TaskAssignment>> taskHistory = new HashMap<>();
    private final TaskBacklog backlog = new TaskBacklog();
    private final Map<String, TaskAssignment> failedTasks = new LinkedHashMap<>();
    private final Map<String, Instant> agentHealth = new HashMap<>();

    private final Instant startedAt;
    private long totalTasksSubmitted;
    private long totalAssignments;
    private long totalTasksCompleted;
    private long totalTimeouts;

    private TaskScheduler(Builder builder) {
        this.registry = Objects.requireNonNull(builder.registry, "Capability registry is required");
        this.maxTasksPerAgent = builder.maxTasksPerAgent;
        this.heartbeatTimeout = builder.heartbeatTimeout;
        this.scoringPolicy = builder.scoringPolicy;
        this.metrics = builder.metrics != null ? builder.metrics : SchedulerMetrics.noop();
        this.memoryStore = builder.memoryStore;
        this.clock = builder.clock;
        this.listeners.addAll(builder.listeners);
        this.startedAt = clock.instant();

        logger.info("TaskScheduler initialized (maxTasksPerAgent: {}, heartbeatTimeout: {})",
                    maxTasksPerAgent, heartbeatTimeout);
    }

    public static Builder builder(CapabilityRegistry registry) {
        return new Builder(registry);
    }

    public void addListener(AssignmentListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
    }

    public void removeListener(AssignmentListener listener) {
        listeners.remove(listener);
    }

    /**
     * Assigns a task to the best available agent.
     * <p>
     * Runs the timeout sweep first. If no agent qualifies the task is put on the
     * backlog; if its deadline has already elapsed it is dropped. Submitting a
     * permanently failed task clears its failure record.
     *
     * @param task The task to assign
     * @return The chosen agent id, or empty if the task was queued or dropped
     * @throws ValidationException if the task is malformed or already assigned
     */
    public Optional<String> assignTask(Task task) {
        TaskValidator.validate(task);

        List<Runnable> deferred = new ArrayList<>();
        Optional<String> agentId;
        lock.lock();
        try {
            if (findActive(task.getId()) != null) {
                throw new ValidationException("taskId", "Task " + task.getId() + " is already assigned");
            }
            backlog.remove(task.getId());
            if (failedTasks.remove(task.getId()) != null) {
                logger.info("Task {} re-submitted, clearing its failure record", task.getId());
            }
            totalTasksSubmitted++;
            deferred.add(() -> metrics.recordTaskSubmitted(task));

            Instant now = clock.instant();
            sweepTimeouts(now, deferred);

            if (task.getDeadline() != null && task.getDeadline().isBefore(now)) {
                logger.warn("Task {} deadline {} has already elapsed, not assigning", task.getId(), task.getDeadline());
                agentId = Optional.empty();
            } else {
                Optional<TaskAssignment> assignment = tryAssign(task, now, deferred);
                if (assignment.isPresent()) {
                    agentId = Optional.of(assignment.get().getAgentId());
                } else {
                    backlog.push(task);
                    deferred.add(() -> metrics.recordTaskQueued(task));
                    logger.warn("No suitable agent for task {} (priority {}), queued with {} tasks waiting",
                                task.getId(), task.getPriority(), backlog.size());
                    agentId = Optional.empty();
                }
            }
            captureState(deferred);
        } finally {
            lock.unlock();
        }

        runDeferred(deferred);
        return agentId;
    }

    /**
     * Fails every assignment held past its timeout and retries it where allowed.
     *
     * @return Number of assignments that timed out
     */
    public int checkTaskTimeouts() {
        List<Runnable> deferred = new ArrayList<>();
        int timedOut;
        lock.lock();
        try {
            timedOut = sweepTimeouts(clock.instant(), deferred);
            captureState(deferred);
        } finally {
            lock.unlock();
        }

        runDeferred(deferred);
        return timedOut;
    }

    /**
     * Fails an active assignment.
     * <p>
     * When {@code retry} is set and the task has retries left, a copy with an
     * incremented retry count and a priority raised by one is put on the backlog.
     * Otherwise the task is failed permanently.
     *
     * @return false if the agent holds no such assignment
     */
    public boolean failTask(String agentId, String taskId, String reason, boolean retry) {
        List<Runnable> deferred = new ArrayList<>();
        boolean failed;
        lock.lock();
        try {
            failed = handleFailure(agentId, taskId, reason, retry, clock.instant(), deferred);
            captureState(deferred);
        } finally {
            lock.unlock();
        }

        runDeferred(deferred);
        return failed;
    }

    /**
     * Completes an active assignment and hands freed capacity to the backlog.
     *
     * @param result Optional result, merged into the task metadata under {@code result}
     * @return false if the agent holds no such assignment
     */
    public boolean completeTask(String agentId, String taskId, Map<String, Object> result) {
        List<Runnable> deferred = new ArrayList<>();
        lock.lock();
        try {
            TaskAssignment assignment = removeActive(agentId, taskId);
            if (assignment == null) {
                logger.warn("Agent {} reported completion of task {} it does not hold", agentId, taskId);
                return false;
            }

            Instant now = clock.instant();
            assignment.markCompleted(now, result);
            totalTasksCompleted++;
            Duration heldFor = Duration.between(assignment.getAssignedAt(), now);
            deferred.add(() -> metrics.recordTaskCompleted(assignment.getTask(), heldFor));
            logger.info("Task {} completed by agent {} after {}ms", taskId, agentId, heldFor.toMillis());

            drainBacklog(now, deferred);
            captureState(deferred);
        } finally {
            lock.unlock();
        }

        runDeferred(deferred);
        return true;
    }

    public boolean completeTask(String agentId, String taskId) {
        return completeTask(agentId, taskId, null);
    }

    /**
     * Assigns backlog tasks in priority order until one cannot be placed.
     *
     * @return Number of tasks assigned
     */
    public int processBacklog() {
        List<Runnable> deferred = new ArrayList<>();
        int assigned;
        lock.lock();
        try {
            assigned = drainBacklog(clock.instant(), deferred);
            captureState(deferred);
        } finally {
            lock.unlock();
        }

        runDeferred(deferred);
        return assigned;
    }

    /**
     * Re-submits permanently failed tasks that still have retries left.
     * Tasks whose deadline has elapsed stay failed.
     * <p>
     * Each record leaves the failed set only as its task is re-submitted. A
     * record whose task was re-submitted by someone else in the meantime is
     * skipped, and a rejected re-submission keeps the task failed unless it is
     * already active.
     *
     * @return Number of tasks re-submitted
     */
    public int retryFailedTasks() {
        List<TaskAssignment> candidates = new ArrayList<>();
        lock.lock();
        try {
            Instant now = clock.instant();
            for (TaskAssignment assignment : failedTasks.values()) {
                Task task = assignment.getTask();
                boolean expired = task.getDeadline() != null && task.getDeadline().isBefore(now);
                if (task.hasRetriesLeft() && !expired) {
                    candidates.add(assignment);
                }
            }
        } finally {
            lock.unlock();
        }

        int resubmitted = 0;
        for (TaskAssignment assignment : candidates) {
            Task task = assignment.getTask();
            lock.lock();
            try {
                if (!failedTasks.remove(task.getId(), assignment)) {
                    logger.debug("Failed task {} was re-submitted elsewhere, skipping", task.getId());
                    continue;
                }
            } finally {
                lock.unlock();
            }

            logger.info("Re-submitting failed task {} (attempt {}/{})",
                        task.getId(), task.getRetryCount(), task.getMaxRetries());
            try {
                assignTask(task);
                resubmitted++;
            } catch (ValidationException e) {
                restoreFailed(assignment);
                logger.warn("Could not re-submit failed task {}: {}", task.getId(), e.getMessage());
            }
        }
        return resubmitted;
    }

    /**
     * Records a heartbeat for an agent
     */
    public void updateAgentHealth(String agentId) {
        if (agentId == null || agentId.trim().isEmpty()) {
            throw new ValidationException("agentId", "Agent ID cannot be null or empty");
        }
        lock.lock();
        try {
            agentHealth.put(agentId.trim(), clock.instant());
        } finally {
            lock.unlock();
        }
        logger.debug("Heartbeat from agent {}", agentId);
    }

    public boolean isAgentHealthy(String agentId) {
        lock.lock();
        try {
            return isHealthy(agentId, clock.instant());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Active assignments held by an agent
     */
    public List<TaskAssignment> getAgentTasks(String agentId) {
        lock.lock();
        try {
            Map<String, TaskAssignment> held = activeTasks.get(agentId);
            return held == null ? Collections.emptyList() : List.copyOf(held.values());
        } finally {
            lock.unlock();
        }
    }

    /**
     * The agent currently holding a task
     */
    public Optional<String> getTaskAgent(String taskId) {
        lock.lock();
        try {
            TaskAssignment assignment = findActive(taskId);
            return assignment == null ? Optional.empty() : Optional.of(assignment.getAgentId());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Every assignment made for a task, oldest first
     */
    public List<TaskAssignment> getTaskHistory(String taskId) {
        lock.lock();
        try {
            List<TaskAssignment> history = taskHistory.get(taskId);
            return history == null ? Collections.emptyList() : List.copyOf(history);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Backlog tasks in the order they would be assigned
     */
    public List<Task> getQueuedTasks() {
        lock.lock();
        try {
            return backlog.snapshot();
        } finally {
            lock.unlock();
        }
    }

    public boolean isQueued(String taskId) {
        lock.lock();
        try {
            return backlog.contains(taskId);
        } finally {
            lock.unlock();
        }
    }

    public boolean isFailed(String taskId) {
        lock.lock();
        try {
            return failedTasks.containsKey(taskId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Permanently failed tasks by task id
     */
    public Map<String, TaskAssignment> getFailedTasks() {
        lock.lock();
        try {
            return Collections.unmodifiableMap(new LinkedHashMap<>(failedTasks));
        } finally {
            lock.unlock();
        }
    }

    public int getActiveAssignmentCount() {
        lock.lock();
        try {
            return countActive();
        } finally {
            lock.unlock();
        }
    }

    public SchedulerStatistics getStatistics() {
        lock.lock();
        try {
            long submitted = totalTasksSubmitted;
            long assignments = totalAssignments;
            long completed = totalTasksCompleted;
            long timeouts = totalTimeouts;
            int active = countActive();
            int backlogSize = backlog.size();
            int failed = failedTasks.size();
            Map<String, Integer> byAgent = new LinkedHashMap<>();
            activeTasks.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(entry -> byAgent.put(entry.getKey(), entry.getValue().size()));

            return new SchedulerStatistics() {
                @Override
                public long getTotalTasksSubmitted() {
                    return submitted;
                }

                @Override
                public long getTotalAssignments() {
                    return assignments;
                }

                @Override
                public long getTotalTasksCompleted() {
                    return completed;
                }

                @Override
                public long getTotalTimeouts() {
                    return timeouts;
                }

                @Override
                public int getActiveAssignments() {
                    return active;
                }

                @Override
                public int getBacklogSize() {
                    return backlogSize;
                }

                @Override
                public int getFailedTasks() {
                    return failed;
                }

                @Override
                public Map<String, Integer> getActiveAssignmentsByAgent() {
                    return Collections.unmodifiableMap(byAgent);
                }

                @Override
                public Instant getStartedAt() {
                    return startedAt;
                }
            };
        } finally {
            lock.unlock();
        }
    }

    private void restoreFailed(TaskAssignment assignment) {
        lock.lock();
        try {
            if (findActive(assignment.getTaskId()) == null && !backlog.contains(assignment.getTaskId())) {
                failedTasks.putIfAbsent(assignment.getTaskId(), assignment);
            }
        } finally {
            lock.unlock();
        }
    }

    public int getMaxTasksPerAgent() {
        return maxTasksPerAgent;
    }

    public CapabilityRegistry getRegistry() {
        return registry;
    }

    // The helpers below must be called with the lock held

    private Optional<TaskAssignment> tryAssign(Task task, Instant now, List<Runnable> deferred) {
        Map<String, Map<Capability, Double>> matrix = registry.getCapabilityMatrix();
        double priorityFactor = scoringPolicy.priorityFactor(task.getPriority());
        double deadlineFactor = scoringPolicy.deadlineFactor(task.getDeadline(), now);

        String bestAgent = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        double bestCapabilityScore = 0.0;

        // Matrix iterates in ascending agent id order; strict comparison keeps the lowest id on ties
        for (Map.Entry<String, Map<Capability, Double>> entry : matrix.entrySet()) {
            String agentId = entry.getKey();
            if (!isHealthy(agentId, now)) {
                continue;
            }
            Map<String, TaskAssignment> held = activeTasks.getOrDefault(agentId, Collections.emptyMap());
            if (held.size() >= maxTasksPerAgent) {
                continue;
            }
            OptionalDouble capabilityScore = scoringPolicy.capabilityScore(task.getRequiredCapabilities(), entry.getValue());
            if (capabilityScore.isEmpty()) {
                continue;
            }

            List<Integer> heldPriorities = held.values().stream()
                .map(assignment -> assignment.getTask().getPriority())
                .collect(Collectors.toList());
            double loadFactor = scoringPolicy.loadFactor(heldPriorities, maxTasksPerAgent);
            double score = scoringPolicy.finalScore(capabilityScore.getAsDouble(), loadFactor,
                                                    priorityFactor, deadlineFactor);

            logger.debug("Agent {} scored {} for task {} (capability {}, load {}, priority {}, deadline {})",
                         agentId, score, task.getId(), capabilityScore.getAsDouble(),
                         loadFactor, priorityFactor, deadlineFactor);

            if (score > bestScore) {
                bestAgent = agentId;
                bestScore = score;
                bestCapabilityScore = capabilityScore.getAsDouble();
            }
        }

        if (bestAgent == null) {
            return Optional.empty();
        }

        TaskAssignment assignment = new TaskAssignment(task, bestAgent, now, bestCapabilityScore, bestScore);
        activeTasks.computeIfAbsent(bestAgent, id -> new LinkedHashMap<>()).put(task.getId(), assignment);
        taskHistory.computeIfAbsent(task.getId(), id -> new ArrayList<>()).add(assignment);
        totalAssignments++;

        String agentId = bestAgent;
        deferred.add(() -> metrics.recordTaskAssigned(task, agentId));
        deferred.add(() -> notifyListeners(listener -> listener.onTaskAssigned(assignment)));
        logger.info("Assigned task {} to agent {} with score {}", task.getId(), bestAgent, bestScore);
        return Optional.of(assignment);
    }

    private int sweepTimeouts(Instant now, List<Runnable> deferred) {
        List<TaskAssignment> expired = new ArrayList<>();
        for (Map<String, TaskAssignment> held : activeTasks.values()) {
            for (TaskAssignment assignment : held.values()) {
                Instant timeoutAt = assignment.getTimeoutAt();
                if (timeoutAt != null && !now.isBefore(timeoutAt)) {
                    expired.add(assignment);
                }
            }
        }

        for (TaskAssignment assignment : expired) {
            logger.warn("Task {} timed out on agent {} (assigned at {})",
                        assignment.getTaskId(), assignment.getAgentId(), assignment.getAssignedAt());
            totalTimeouts++;
            Task task = assignment.getTask();
            deferred.add(() -> metrics.recordTaskTimedOut(task));
            handleFailure(assignment.getAgentId(), assignment.getTaskId(), REASON_TIMED_OUT, true, now, deferred);
        }
        return expired.size();
    }

    private boolean handleFailure(String agentId, String taskId, String reason, boolean retry,
                                  Instant now, List<Runnable> deferred) {
        TaskAssignment assignment = removeActive(agentId, taskId);
        if (assignment == null) {
            logger.warn("Agent {} reported failure of task {} it does not hold", agentId, taskId);
            return false;
        }
        assignment.markFailed(now, reason);

        Task task = assignment.getTask();
        if (retry && task.hasRetriesLeft()) {
            Task retryTask = task.withRetryCount(task.getRetryCount() + 1)
                .withPriority(Math.max(TaskValidator.HIGHEST_PRIORITY, task.getPriority() - 1));
            backlog.push(retryTask);

            logger.warn("Task {} failed on agent {} ({}), requeued as attempt {}/{} at priority {}",
                        taskId, agentId, reason, retryTask.getRetryCount(), retryTask.getMaxRetries(),
                        retryTask.getPriority());
            deferred.add(() -> metrics.recordTaskRetried(retryTask));
            deferred.add(() -> notifyListeners(listener -> listener.onTaskRequeued(retryTask, reason)));
        } else {
            failPermanently(assignment, deferred);
        }
        return true;
    }

    private int drainBacklog(Instant now, List<Runnable> deferred) {
        int assigned = 0;
        while (!backlog.isEmpty()) {
            TaskBacklog.Entry entry = backlog.poll();
            Task task = entry.getTask();

            if (task.getDeadline() != null && task.getDeadline().isBefore(now)) {
                TaskAssignment expired = new TaskAssignment(task, null, now, 0.0, 0.0);
                expired.markFailed(now, REASON_DEADLINE_ELAPSED);
                deferred.add(() -> metrics.recordTaskExpired(task));
                failPermanently(expired, deferred);
                continue;
            }

            if (tryAssign(task, now, deferred).isPresent()) {
                assigned++;
            } else {
                backlog.pushBack(entry);
                break;
            }
        }

        if (assigned > 0) {
            logger.info("Assigned {} tasks from backlog, {} still waiting", assigned, backlog.size());
        }
        return assigned;
    }

    private void failPermanently(TaskAssignment assignment, List<Runnable> deferred) {
        failedTasks.put(assignment.getTaskId(), assignment);
        logger.warn("Task {} failed permanently after {} retries: {}",
                    assignment.getTaskId(), assignment.getTask().getRetryCount(), assignment.getFailureReason());

        Map<String, Object> record = failureRecord(assignment);
        deferred.add(() -> metrics.recordTaskFailed(assignment.getTask(), assignment.getFailureReason()));
        deferred.add(() -> storeFailureRecord(assignment.getTaskId(), record));
        deferred.add(() -> notifyListeners(listener -> listener.onTaskFailed(assignment)));
    }

    private TaskAssignment removeActive(String agentId, String taskId) {
        Map<String, TaskAssignment> held = activeTasks.get(agentId);
        if (held == null) {
            return null;
        }
        TaskAssignment assignment = held.remove(taskId);
        if (held.isEmpty()) {
            activeTasks.remove(agentId);
        }
        return assignment;
    }

    private TaskAssignment findActive(String taskId) {
        for (Map<String, TaskAssignment> held : activeTasks.values()) {
            TaskAssignment assignment = held.get(taskId);
            if (assignment != null) {
                return assignment;
            }
        }
        return null;
    }

    private boolean isHealthy(String agentId, Instant now) {
        Instant lastHeartbeat = agentHealth.get(agentId);
        return lastHeartbeat != null && !lastHeartbeat.plus(heartbeatTimeout).isBefore(now);
    }

    private int countActive() {
        return activeTasks.values().stream().mapToInt(Map::size).sum();
    }

    private void captureState(List<Runnable> deferred) {
        int backlogSize = backlog.size();
        int active = countActive();
        int failed = failedTasks.size();
        deferred.add(() -> metrics.updateState(backlogSize, active, failed));
    }

    private static Map<String, Object> failureRecord(TaskAssignment assignment) {
        Task task = assignment.getTask();
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("task_id", task.getId());
        if (assignment.getAgentId() != null) {
            record.put("agent_id", assignment.getAgentId());
        }
        record.put("reason", assignment.getFailureReason());
        record.put("failed_at", assignment.getFailedAt().toString());
        record.put("retry_count", task.getRetryCount());
        record.put("max_retries", task.getMaxRetries());
        record.put("priority", task.getPriority());
        record.put("required_capabilities", task.getRequiredCapabilities().stream()
            .map(Capability::getValue)
            .collect(Collectors.toList()));
        return record;
    }

    // Deferred actions, run without the lock

    private void storeFailureRecord(String taskId, Map<String, Object> record) {
        if (memoryStore == null) {
            return;
        }
        try {
            memoryStore.store(taskId, MemoryStore.KIND_TASK_FAILURE, record);
        } catch (PersistenceException e) {
            logger.error("Failed to store failure record for task {}", taskId, e);
        }
    }

    private void notifyListeners(Consumer<AssignmentListener> callback) {
        for (AssignmentListener listener : listeners) {
            try {
                callback.accept(listener);
            } catch (RuntimeException e) {
                logger.error("Error in assignment listener {}", listener, e);
            }
        }
    }

    private void runDeferred(List<Runnable> deferred) {
        for (Runnable action : deferred) {
            try {
                action.run();
            } catch (RuntimeException e) {
                logger.error("Error in scheduler callback", e);
            }
        }
    }

    /**
     * Builder for creating task schedulers
     */
    public static class Builder {
        private final CapabilityRegistry registry;
        private int maxTasksPerAgent = DEFAULT_MAX_TASKS_PER_AGENT;
        private Duration heartbeatTimeout = DEFAULT_HEARTBEAT_TIMEOUT;
        private ScoringPolicy scoringPolicy = ScoringPolicy.standard();
        private SchedulerMetrics metrics;
        private MemoryStore memoryStore;
        private Clock clock = Clock.systemUTC();
        private final List<AssignmentListener> listeners = new ArrayList<>();

        private Builder(CapabilityRegistry registry) {
            this.registry = registry;
        }

        public Builder maxTasksPerAgent(int maxTasksPerAgent) {
            if (maxTasksPerAgent < 1) {
                throw new IllegalArgumentException("Max tasks per agent must be at least 1");
            }
            this.maxTasksPerAgent = maxTasksPerAgent;
            return this;
        }

        public Builder heartbeatTimeout(Duration heartbeatTimeout) {
            this.heartbeatTimeout = Objects.requireNonNull(heartbeatTimeout, "Heartbeat timeout cannot be null");
            return this;
        }

        public Builder scoringPolicy(ScoringPolicy scoringPolicy) {
            this.scoringPolicy = Objects.requireNonNull(scoringPolicy, "Scoring policy cannot be null");
            return this;
        }

        public Builder metrics(SchedulerMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder memoryStore(MemoryStore memoryStore) {
            this.memoryStore = memoryStore;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
            return this;
        }

        public Builder listener(AssignmentListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
            return this;
        }

        public TaskScheduler build() {
            return new TaskScheduler(this);
        }
    }
}
