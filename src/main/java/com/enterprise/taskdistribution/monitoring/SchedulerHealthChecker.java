package com.enterprise.taskdistribution.monitoring;

import com.enterprise.taskdistribution.registry.CapabilityRegistry;
import com.enterprise.taskdistribution.scheduler.SchedulerStatistics;
import com.enterprise.taskdistribution.scheduler.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Health checker for the task scheduler and its agent pool
 */
public class SchedulerHealthChecker {

    private static final Logger logger = LoggerFactory.getLogger(SchedulerHealthChecker.class);

    private final TaskScheduler scheduler;
    private final CapabilityRegistry registry;
    private final int maxBacklogSize;
    private final double minHealthyAgentRatio;

    public SchedulerHealthChecker(TaskScheduler scheduler, CapabilityRegistry registry,
                                  int maxBacklogSize, double minHealthyAgentRatio) {
        this.scheduler = scheduler;
        this.registry = registry;
        this.maxBacklogSize = maxBacklogSize;
        this.minHealthyAgentRatio = minHealthyAgentRatio;
    }

    /**
     * Perform a comprehensive health check
     */
    public CompletableFuture<HealthStatus> performHealthCheck() {
        return CompletableFuture.supplyAsync(this::checkNow);
    }

    /**
     * Perform the health check on the calling thread
     */
    public HealthStatus checkNow() {
        HealthStatus.Builder builder = HealthStatus.builder();

        checkAgentPool(builder);
        checkBacklog(builder);
        checkSystemResources(builder);

        HealthStatus status = builder.build();
        if (!status.isHealthy()) {
            logger.warn("Health check failed: {}", status.getFailedChecks());
        }
        return status;
    }

    private void checkAgentPool(HealthStatus.Builder builder) {
        try {
            List<String> agentIds = registry.getAgentIds();
            builder.addCheck("agents.registered", !agentIds.isEmpty(),
                String.format("Registered agents: %d", agentIds.size()));

            if (!agentIds.isEmpty()) {
                long healthy = agentIds.stream().filter(scheduler::isAgentHealthy).count();
                double ratio = (double) healthy / agentIds.size();
                builder.addCheck("agents.healthy_ratio", ratio >= minHealthyAgentRatio,
                    String.format("Healthy agents: %d/%d (%.0f%%)", healthy, agentIds.size(), ratio * 100));
            }

        } catch (RuntimeException e) {
            builder.addCheck("agents.status", false, "Error checking agent pool: " + e.getMessage());
        }
    }

    private void checkBacklog(HealthStatus.Builder builder) {
        try {
            SchedulerStatistics stats = scheduler.getStatistics();
            int backlogSize = stats.getBacklogSize();
            boolean backlogHealthy = backlogSize < maxBacklogSize;
            builder.addCheck("backlog.size", backlogHealthy,
                String.format("Backlog size: %d (threshold %d)", backlogSize, maxBacklogSize));

            builder.addCheck("assignments.active", true,
                String.format("Active assignments: %d, failed tasks: %d",
                    stats.getActiveAssignments(), stats.getFailedTasks()));

        } catch (RuntimeException e) {
            builder.addCheck("backlog.status", false, "Error checking backlog: " + e.getMessage());
        }
    }

    private void checkSystemResources(HealthStatus.Builder builder) {
        Runtime runtime = Runtime.getRuntime();
        long totalMemory = runtime.totalMemory();
        long usedMemory = totalMemory - runtime.freeMemory();
        double memoryUsagePercent = (double) usedMemory / totalMemory * 100;

        boolean memoryHealthy = memoryUsagePercent < 90;
        builder.addCheck("system.memory", memoryHealthy,
            String.format("Memory usage: %.2f%% (%d/%d MB)",
                memoryUsagePercent, usedMemory / 1024 / 1024, totalMemory / 1024 / 1024));
    }

    /**
     * Health status result
     */
    public static class HealthStatus {
        private final boolean healthy;
        private final Map<String, CheckResult> checks;
        private final Instant timestamp;

        private HealthStatus(boolean healthy, Map<String, CheckResult> checks, Instant timestamp) {
            this.healthy = healthy;
            this.checks = checks;
            this.timestamp = timestamp;
        }

        public boolean isHealthy() { return healthy; }
        public Map<String, CheckResult> getChecks() { return checks; }
        public Instant getTimestamp() { return timestamp; }

        public CheckResult getCheck(String name) {
            return checks.get(name);
        }

        public List<String> getFailedChecks() {
            return checks.entrySet().stream()
                .filter(entry -> !entry.getValue().isPassed())
                .map(entry -> entry.getKey() + ": " + entry.getValue().getMessage())
                .sorted()
                .collect(java.util.stream.Collectors.toList());
        }

        public static class CheckResult {
            private final boolean passed;
            private final String message;

            public CheckResult(boolean passed, String message) {
                this.passed = passed;
                this.message = message;
            }

            public boolean isPassed() { return passed; }
            public String getMessage() { return message; }
        }

        public static class Builder {
            private final Map<String, CheckResult> checks = new ConcurrentHashMap<>();

            public Builder addCheck(String name, boolean passed, String message) {
                checks.put(name, new CheckResult(passed, message));
                return this;
            }

            public HealthStatus build() {
                boolean healthy = checks.values().stream().allMatch(CheckResult::isPassed);
                return new HealthStatus(healthy, checks, Instant.now());
            }
        }

        public static Builder builder() {
            return new Builder();
        }
    }
}
