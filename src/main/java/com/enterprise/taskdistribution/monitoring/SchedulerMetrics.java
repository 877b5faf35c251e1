package com.enterprise.taskdistribution.monitoring;

import com.enterprise.taskdistribution.core.Capability;
import com.enterprise.taskdistribution.core.Task;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Collects and exposes metrics for the task scheduler
 */
public class SchedulerMetrics {

    private static final Logger logger = LoggerFactory.getLogger(SchedulerMetrics.class);

    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<String, Counter> capabilityCounters = new ConcurrentHashMap<>();

    private final Counter tasksSubmitted;
    private final Counter tasksAssigned;
    private final Counter tasksQueued;
    private final Counter tasksCompleted;
    private final Counter tasksFailed;
    private final Counter tasksRetried;
    private final Counter tasksTimedOut;
    private final Counter tasksExpired;

    private final Timer assignmentDuration;

    private final AtomicLong backlogSize = new AtomicLong(0);
    private final AtomicLong activeAssignments = new AtomicLong(0);
    private final AtomicLong failedTasks = new AtomicLong(0);

    public SchedulerMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.tasksSubmitted = Counter.builder("taskdistribution.tasks.submitted")
            .description("Total number of tasks submitted for assignment")
            .register(meterRegistry);

        this.tasksAssigned = Counter.builder("taskdistribution.tasks.assigned")
            .description("Total number of tasks assigned to an agent")
            .register(meterRegistry);

        this.tasksQueued = Counter.builder("taskdistribution.tasks.queued")
            .description("Total number of tasks placed on the backlog")
            .register(meterRegistry);

        this.tasksCompleted = Counter.builder("taskdistribution.tasks.completed")
            .description("Total number of assignments completed")
            .register(meterRegistry);

        this.tasksFailed = Counter.builder("taskdistribution.tasks.failed")
            .description("Total number of tasks that failed permanently")
            .register(meterRegistry);

        this.tasksRetried = Counter.builder("taskdistribution.tasks.retried")
            .description("Total number of task retries")
            .register(meterRegistry);

        this.tasksTimedOut = Counter.builder("taskdistribution.tasks.timedout")
            .description("Total number of assignments that timed out")
            .register(meterRegistry);

        this.tasksExpired = Counter.builder("taskdistribution.tasks.expired")
            .description("Total number of tasks dropped because their deadline elapsed")
            .register(meterRegistry);

        this.assignmentDuration = Timer.builder("taskdistribution.assignment.duration")
            .description("Time from assignment to completion")
            .register(meterRegistry);

        Gauge.builder("taskdistribution.backlog.size", backlogSize, AtomicLong::get)
            .description("Current backlog size")
            .register(meterRegistry);

        Gauge.builder("taskdistribution.assignments.active", activeAssignments, AtomicLong::get)
            .description("Number of active assignments")
            .register(meterRegistry);

        Gauge.builder("taskdistribution.tasks.failed.current", failedTasks, AtomicLong::get)
            .description("Number of permanently failed tasks held by the scheduler")
            .register(meterRegistry);

        logger.info("SchedulerMetrics initialized");
    }

    /**
     * Metrics bound to a private in-memory registry
     */
    public static SchedulerMetrics noop() {
        return new SchedulerMetrics(new SimpleMeterRegistry());
    }

    public void recordTaskSubmitted(Task task) {
        tasksSubmitted.increment();
        logger.debug("Recorded task submission: {}", task.getId());
    }

    public void recordTaskAssigned(Task task, String agentId) {
        tasksAssigned.increment();
        for (Capability capability : task.getRequiredCapabilities()) {
            getCapabilityCounter(capability, "assigned").increment();
        }
        logger.debug("Recorded assignment of {} to {}", task.getId(), agentId);
    }

    public void recordTaskQueued(Task task) {
        tasksQueued.increment();
        for (Capability capability : task.getRequiredCapabilities()) {
            getCapabilityCounter(capability, "queued").increment();
        }
    }

    public void recordTaskCompleted(Task task, Duration heldFor) {
        tasksCompleted.increment();
        assignmentDuration.record(heldFor.toMillis(), TimeUnit.MILLISECONDS);
        logger.debug("Recorded completion of {} after {}ms", task.getId(), heldFor.toMillis());
    }

    public void recordTaskFailed(Task task, String reason) {
        tasksFailed.increment();
        logger.debug("Recorded permanent failure of {}: {}", task.getId(), reason);
    }

    public void recordTaskRetried(Task task) {
        tasksRetried.increment();
        logger.debug("Recorded retry of {} (attempt {})", task.getId(), task.getRetryCount());
    }

    public void recordTaskTimedOut(Task task) {
        tasksTimedOut.increment();
    }

    public void recordTaskExpired(Task task) {
        tasksExpired.increment();
    }

    /**
     * Update the state gauges in one go
     */
    public void updateState(int backlog, int active, int failed) {
        backlogSize.set(backlog);
        activeAssignments.set(active);
        failedTasks.set(failed);
    }

    private Counter getCapabilityCounter(Capability capability, String outcome) {
        String key = capability.getValue() + "." + outcome;
        return capabilityCounters.computeIfAbsent(key, k ->
            Counter.builder("taskdistribution.capability")
                .tag("capability", capability.getValue())
                .tag("outcome", outcome)
                .description("Task count by required capability and outcome")
                .register(meterRegistry)
        );
    }

    /**
     * Get all metrics as a map
     */
    public Map<String, Object> getMetrics() {
        Map<String, Object> metrics = new ConcurrentHashMap<>();

        metrics.put("tasks.submitted", tasksSubmitted.count());
        metrics.put("tasks.assigned", tasksAssigned.count());
        metrics.put("tasks.queued", tasksQueued.count());
        metrics.put("tasks.completed", tasksCompleted.count());
        metrics.put("tasks.failed", tasksFailed.count());
        metrics.put("tasks.retried", tasksRetried.count());
        metrics.put("tasks.timedout", tasksTimedOut.count());
        metrics.put("tasks.expired", tasksExpired.count());

        metrics.put("assignment.duration.mean", assignmentDuration.mean(TimeUnit.MILLISECONDS));
        metrics.put("assignment.duration.max", assignmentDuration.max(TimeUnit.MILLISECONDS));

        metrics.put("backlog.size", backlogSize.get());
        metrics.put("assignments.active", activeAssignments.get());
        metrics.put("tasks.failed.current", failedTasks.get());

        return metrics;
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }
}
