package com.enterprise.taskdistribution;

import com.enterprise.taskdistribution.config.ConfigValidator;
import com.enterprise.taskdistribution.config.TaskDistributionConfig;
import com.enterprise.taskdistribution.memory.MapDBMemoryStore;
import com.enterprise.taskdistribution.memory.MemoryStore;
import com.enterprise.taskdistribution.monitoring.SchedulerHealthChecker;
import com.enterprise.taskdistribution.monitoring.SchedulerMetrics;
import com.enterprise.taskdistribution.planning.TaskDecomposer;
import com.enterprise.taskdistribution.registry.CapabilityRegistry;
import com.enterprise.taskdistribution.registry.CapabilityStore;
import com.enterprise.taskdistribution.registry.MapDBCapabilityStore;
import com.enterprise.taskdistribution.scheduler.MaintenanceScheduler;
import com.enterprise.taskdistribution.scheduler.TaskScheduler;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Factory for creating and wiring the task distribution engine
 */
public class TaskDistributionFactory {

    private static final Logger logger = LoggerFactory.getLogger(TaskDistributionFactory.class);

    /**
     * Create an engine with default configuration
     */
    public static TaskDistributionEngine createDefault() {
        return create(TaskDistributionConfig.builder().build());
    }

    /**
     * Create an engine with custom configuration
     */
    public static TaskDistributionEngine create(TaskDistributionConfig config) {
        return create(config, new SimpleMeterRegistry(), Clock.systemUTC());
    }

    /**
     * Create an engine reporting to the given meter registry and reading time from the given clock
     */
    public static TaskDistributionEngine create(TaskDistributionConfig config, MeterRegistry meterRegistry, Clock clock) {
        ConfigValidator validator = new ConfigValidator();
        List<ConfigValidator.ValidationError> errors = validator.validate(config);

        if (!errors.isEmpty()) {
            StringBuilder errorMsg = new StringBuilder("Configuration validation failed:\n");
            errors.forEach(error -> errorMsg.append("  - ").append(error).append("\n"));
            throw new IllegalArgumentException(errorMsg.toString());
        }

        logger.info("Creating TaskDistributionEngine");

        CapabilityStore capabilityStore = createCapabilityStore(config.getRegistryConfig());
        MemoryStore memoryStore = createMemoryStore(config.getMemoryStoreConfig(), clock);
        try {
            CapabilityRegistry registry = new CapabilityRegistry(capabilityStore);

            SchedulerMetrics metrics = config.getMonitoringConfig().isEnableMetrics()
                ? new SchedulerMetrics(meterRegistry)
                : SchedulerMetrics.noop();

            TaskDistributionConfig.SchedulingConfig scheduling = config.getSchedulingConfig();
            TaskScheduler scheduler = TaskScheduler.builder(registry)
                .maxTasksPerAgent(scheduling.getMaxTasksPerAgent())
                .heartbeatTimeout(scheduling.getHeartbeatTimeout())
                .scoringPolicy(config.getScoringConfig().toScoringPolicy())
                .metrics(metrics)
                .memoryStore(memoryStore)
                .clock(clock)
                .build();

            TaskDecomposer decomposer = new TaskDecomposer(scheduler, memoryStore, clock);

            MaintenanceScheduler maintenance = config.getMaintenanceConfig().isEnabled()
                ? new MaintenanceScheduler(scheduler, memoryStore, config.getMaintenanceConfig().getCronPattern())
                : new MaintenanceScheduler(scheduler, memoryStore);

            TaskDistributionConfig.MonitoringConfig monitoring = config.getMonitoringConfig();
            SchedulerHealthChecker healthChecker = new SchedulerHealthChecker(
                scheduler, registry, monitoring.getMaxBacklogSize(), monitoring.getMinHealthyAgentRatio());

            logger.info("TaskDistributionEngine created successfully");
            return new TaskDistributionEngine(registry, scheduler, decomposer, maintenance, metrics,
                                              healthChecker, memoryStore, capabilityStore, config);

        } catch (RuntimeException e) {
            logger.error("Failed to create TaskDistributionEngine", e);
            if (memoryStore != null) {
                memoryStore.close();
            }
            if (capabilityStore != null) {
                capabilityStore.close();
            }
            throw e;
        }
    }

    private static CapabilityStore createCapabilityStore(TaskDistributionConfig.RegistryConfig config) {
        if (!config.isPersistenceEnabled()) {
            return null;
        }
        return new MapDBCapabilityStore(config.getDbPath());
    }

    private static MemoryStore createMemoryStore(TaskDistributionConfig.MemoryStoreConfig config, Clock clock) {
        if (!config.isEnabled()) {
            return null;
        }
        return new MapDBMemoryStore(
            config.getDbPath(),
            config.isEnableRetentionPolicy(),
            config.getRetentionDays(),
            clock
        );
    }
}
