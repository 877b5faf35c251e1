package com.enterprise.taskdistribution;

import com.enterprise.taskdistribution.config.TaskDistributionConfig;
import com.enterprise.taskdistribution.core.AgentCapability;
import com.enterprise.taskdistribution.core.SubTask;
import com.enterprise.taskdistribution.core.Task;
import com.enterprise.taskdistribution.core.TaskImpl;
import com.enterprise.taskdistribution.core.TaskStatus;
import com.enterprise.taskdistribution.memory.MemoryStore;
import com.enterprise.taskdistribution.monitoring.SchedulerHealthChecker;
import com.enterprise.taskdistribution.monitoring.SchedulerMetrics;
import com.enterprise.taskdistribution.planning.TaskDecomposer;
import com.enterprise.taskdistribution.registry.CapabilityRegistry;
import com.enterprise.taskdistribution.registry.CapabilityStore;
import com.enterprise.taskdistribution.scheduler.MaintenanceScheduler;
import com.enterprise.taskdistribution.scheduler.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Facade over the registry, scheduler and decomposer.
 * <p>
 * Agent runtimes call {@link #heartbeat}, {@link #reportCompletion} and
 * {@link #reportFailure}; producers call {@link #submitTask} and
 * {@link #submitCompositeTask}. Completing a subtask through this facade
 * unblocks the subtasks that depend on it.
 */
public class TaskDistributionEngine {

    private static final Logger logger = LoggerFactory.getLogger(TaskDistributionEngine.class);

    private final CapabilityRegistry registry;
    private final TaskScheduler scheduler;
    private final TaskDecomposer decomposer;
    private final MaintenanceScheduler maintenance;
    private final SchedulerMetrics metrics;
    private final SchedulerHealthChecker healthChecker;
    private final MemoryStore memoryStore;
    private final CapabilityStore capabilityStore;
    private final TaskDistributionConfig config;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public TaskDistributionEngine(CapabilityRegistry registry, TaskScheduler scheduler, TaskDecomposer decomposer,
                                  MaintenanceScheduler maintenance, SchedulerMetrics metrics,
                                  SchedulerHealthChecker healthChecker, MemoryStore memoryStore,
                                  CapabilityStore capabilityStore, TaskDistributionConfig config) {
        this.registry = registry;
        this.scheduler = scheduler;
        this.decomposer = decomposer;
        this.maintenance = maintenance;
        this.metrics = metrics;
        this.healthChecker = healthChecker;
        this.memoryStore = memoryStore;
        this.capabilityStore = capabilityStore;
        this.config = config;
    }

    /**
     * Start periodic maintenance, if enabled
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            logger.info("Starting TaskDistributionEngine...");
            if (config.getMaintenanceConfig().isEnabled()) {
                maintenance.start();
            }
            logger.info("TaskDistributionEngine started successfully");
        }
    }

    /**
     * Stop maintenance and close the backing stores
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            logger.info("Stopping TaskDistributionEngine...");
            maintenance.stop();
        }
        if (memoryStore != null) {
            memoryStore.close();
        }
        if (capabilityStore != null) {
            capabilityStore.close();
        }
        logger.info("TaskDistributionEngine stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Registers an agent and records its first heartbeat
     */
    public void registerAgent(String agentId, List<AgentCapability> capabilities) {
        registry.registerAgent(agentId, capabilities);
        scheduler.updateAgentHealth(agentId);
    }

    public void heartbeat(String agentId) {
        scheduler.updateAgentHealth(agentId);
    }

    /**
     * A task builder preset with the configured timeout and retry defaults
     */
    public TaskImpl.Builder taskBuilder() {
        TaskDistributionConfig.SchedulingConfig scheduling = config.getSchedulingConfig();
        return TaskImpl.builder()
            .timeout(scheduling.getDefaultTaskTimeout())
            .maxRetries(scheduling.getDefaultMaxRetries());
    }

    /**
     * Assigns a single task
     *
     * @return The chosen agent, or empty if the task was queued or dropped
     */
    public Optional<String> submitTask(Task task) {
        return scheduler.assignTask(task);
    }

    /**
     * Decomposes a task and assigns the subtasks that are ready
     *
     * @return The subtasks in step order
     */
    public List<SubTask> submitCompositeTask(Task task) {
        List<SubTask> subtasks = decomposer.decomposeTask(task);
        List<String> assigned = decomposer.assignSubtasks(subtasks);
        logger.info("Composite task {} submitted: {} subtasks, {} assigned immediately",
                    task.getId(), subtasks.size(), assigned.size());
        return subtasks;
    }

    /**
     * Completes an assignment. Completing a subtask releases its dependents.
     *
     * @return false if the agent holds no such assignment
     */
    public boolean reportCompletion(String agentId, String taskId, Map<String, Object> result) {
        boolean completed = scheduler.completeTask(agentId, taskId, result);
        if (completed && decomposer.isSubtask(taskId)) {
            decomposer.updateSubtaskStatus(taskId, TaskStatus.COMPLETED);
        }
        return completed;
    }

    /**
     * Fails an assignment, retrying it where allowed
     *
     * @return false if the agent holds no such assignment
     */
    public boolean reportFailure(String agentId, String taskId, String reason, boolean retry) {
        return scheduler.failTask(agentId, taskId, reason, retry);
    }

    /**
     * Run one maintenance pass now
     */
    public MaintenanceScheduler.MaintenanceRun runMaintenance() {
        return maintenance.runOnce();
    }

    public SchedulerHealthChecker.HealthStatus checkHealth() {
        return healthChecker.checkNow();
    }

    public CapabilityRegistry getRegistry() { return registry; }
    public TaskScheduler getScheduler() { return scheduler; }
    public TaskDecomposer getDecomposer() { return decomposer; }
    public SchedulerMetrics getMetrics() { return metrics; }
    public MemoryStore getMemoryStore() { return memoryStore; }
    public TaskDistributionConfig getConfig() { return config; }
}
