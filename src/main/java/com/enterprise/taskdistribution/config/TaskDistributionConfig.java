package com.enterprise.taskdistribution.config;

import com.enterprise.taskdistribution.scheduler.MaintenanceScheduler;
import com.enterprise.taskdistribution.scheduler.ScoringPolicy;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Configuration for the task distribution engine
 */
public class TaskDistributionConfig {

    private final SchedulingConfig schedulingConfig;
    private final ScoringConfig scoringConfig;
    private final RegistryConfig registryConfig;
    private final MemoryStoreConfig memoryStoreConfig;
    private final MonitoringConfig monitoringConfig;
    private final MaintenanceConfig maintenanceConfig;
    private final Map<String, Object> customProperties;

    public TaskDistributionConfig(SchedulingConfig schedulingConfig, ScoringConfig scoringConfig,
                                  RegistryConfig registryConfig, MemoryStoreConfig memoryStoreConfig,
                                  MonitoringConfig monitoringConfig, MaintenanceConfig maintenanceConfig,
                                  Map<String, Object> customProperties) {
        this.schedulingConfig = schedulingConfig;
        this.scoringConfig = scoringConfig;
        this.registryConfig = registryConfig;
        this.memoryStoreConfig = memoryStoreConfig;
        this.monitoringConfig = monitoringConfig;
        this.maintenanceConfig = maintenanceConfig;
        this.customProperties = customProperties;
    }

    public SchedulingConfig getSchedulingConfig() { return schedulingConfig; }
    public ScoringConfig getScoringConfig() { return scoringConfig; }
    public RegistryConfig getRegistryConfig() { return registryConfig; }
    public MemoryStoreConfig getMemoryStoreConfig() { return memoryStoreConfig; }
    public MonitoringConfig getMonitoringConfig() { return monitoringConfig; }
    public MaintenanceConfig getMaintenanceConfig() { return maintenanceConfig; }
    public Map<String, Object> getCustomProperties() { return customProperties; }

    /**
     * Scheduling configuration
     */
    public static class SchedulingConfig {
        private final int maxTasksPerAgent;
        private final Duration heartbeatTimeout;
        private final Duration defaultTaskTimeout;
        private final int defaultMaxRetries;

        public SchedulingConfig(int maxTasksPerAgent, Duration heartbeatTimeout,
                                Duration defaultTaskTimeout, int defaultMaxRetries) {
            this.maxTasksPerAgent = maxTasksPerAgent;
            this.heartbeatTimeout = heartbeatTimeout;
            this.defaultTaskTimeout = defaultTaskTimeout;
            this.defaultMaxRetries = defaultMaxRetries;
        }

        public int getMaxTasksPerAgent() { return maxTasksPerAgent; }
        public Duration getHeartbeatTimeout() { return heartbeatTimeout; }
        public Duration getDefaultTaskTimeout() { return defaultTaskTimeout; }
        public int getDefaultMaxRetries() { return defaultMaxRetries; }
    }

    /**
     * Agent scoring configuration
     */
    public static class ScoringConfig {
        private final double capabilityWeight;
        private final double loadWeight;
        private final double priorityWeight;
        private final double deadlineWeight;
        private final double maxDeadlineFactor;
        private final Duration deadlineHorizon;

        public ScoringConfig(double capabilityWeight, double loadWeight, double priorityWeight,
                             double deadlineWeight, double maxDeadlineFactor, Duration deadlineHorizon) {
            this.capabilityWeight = capabilityWeight;
            this.loadWeight = loadWeight;
            this.priorityWeight = priorityWeight;
            this.deadlineWeight = deadlineWeight;
            this.maxDeadlineFactor = maxDeadlineFactor;
            this.deadlineHorizon = deadlineHorizon;
        }

        public double getCapabilityWeight() { return capabilityWeight; }
        public double getLoadWeight() { return loadWeight; }
        public double getPriorityWeight() { return priorityWeight; }
        public double getDeadlineWeight() { return deadlineWeight; }
        public double getMaxDeadlineFactor() { return maxDeadlineFactor; }
        public Duration getDeadlineHorizon() { return deadlineHorizon; }

        public ScoringPolicy toScoringPolicy() {
            return ScoringPolicy.builder()
                .capabilityWeight(capabilityWeight)
                .loadWeight(loadWeight)
                .priorityWeight(priorityWeight)
                .deadlineWeight(deadlineWeight)
                .maxDeadlineFactor(maxDeadlineFactor)
                .deadlineHorizon(deadlineHorizon)
                .build();
        }
    }

    /**
     * Capability registry configuration
     */
    public static class RegistryConfig {
        private final boolean persistenceEnabled;
        private final String dbPath;

        public RegistryConfig(boolean persistenceEnabled, String dbPath) {
            this.persistenceEnabled = persistenceEnabled;
            this.dbPath = dbPath;
        }

        public boolean isPersistenceEnabled() { return persistenceEnabled; }
        public String getDbPath() { return dbPath; }
    }

    /**
     * Memory store configuration
     */
    public static class MemoryStoreConfig {
        private final boolean enabled;
        private final String dbPath;
        private final boolean enableRetentionPolicy;
        private final long retentionDays;

        public MemoryStoreConfig(boolean enabled, String dbPath,
                                 boolean enableRetentionPolicy, long retentionDays) {
            this.enabled = enabled;
            this.dbPath = dbPath;
            this.enableRetentionPolicy = enableRetentionPolicy;
            this.retentionDays = retentionDays;
        }

        public boolean isEnabled() { return enabled; }
        public String getDbPath() { return dbPath; }
        public boolean isEnableRetentionPolicy() { return enableRetentionPolicy; }
        public long getRetentionDays() { return retentionDays; }
    }

    /**
     * Monitoring configuration
     */
    public static class MonitoringConfig {
        private final boolean enableMetrics;
        private final boolean enableHealthChecks;
        private final int maxBacklogSize;
        private final double minHealthyAgentRatio;

        public MonitoringConfig(boolean enableMetrics, boolean enableHealthChecks,
                                int maxBacklogSize, double minHealthyAgentRatio) {
            this.enableMetrics = enableMetrics;
            this.enableHealthChecks = enableHealthChecks;
            this.maxBacklogSize = maxBacklogSize;
            this.minHealthyAgentRatio = minHealthyAgentRatio;
        }

        public boolean isEnableMetrics() { return enableMetrics; }
        public boolean isEnableHealthChecks() { return enableHealthChecks; }
        public int getMaxBacklogSize() { return maxBacklogSize; }
        public double getMinHealthyAgentRatio() { return minHealthyAgentRatio; }
    }

    /**
     * Periodic maintenance configuration
     */
    public static class MaintenanceConfig {
        private final boolean enabled;
        private final String cronPattern;

        public MaintenanceConfig(boolean enabled, String cronPattern) {
            this.enabled = enabled;
            this.cronPattern = cronPattern;
        }

        public boolean isEnabled() { return enabled; }
        public String getCronPattern() { return cronPattern; }
    }

    /**
     * Builder for creating configurations
     */
    public static class Builder {
        private SchedulingConfig schedulingConfig = Defaults.defaultSchedulingConfig();
        private ScoringConfig scoringConfig = Defaults.defaultScoringConfig();
        private RegistryConfig registryConfig = Defaults.defaultRegistryConfig();
        private MemoryStoreConfig memoryStoreConfig = Defaults.defaultMemoryStoreConfig();
        private MonitoringConfig monitoringConfig = Defaults.defaultMonitoringConfig();
        private MaintenanceConfig maintenanceConfig = Defaults.defaultMaintenanceConfig();
        private Map<String, Object> customProperties = new HashMap<>();

        public Builder schedulingConfig(SchedulingConfig schedulingConfig) {
            this.schedulingConfig = schedulingConfig;
            return this;
        }

        public Builder scoringConfig(ScoringConfig scoringConfig) {
            this.scoringConfig = scoringConfig;
            return this;
        }

        public Builder registryConfig(RegistryConfig registryConfig) {
            this.registryConfig = registryConfig;
            return this;
        }

        public Builder memoryStoreConfig(MemoryStoreConfig memoryStoreConfig) {
            this.memoryStoreConfig = memoryStoreConfig;
            return this;
        }

        public Builder monitoringConfig(MonitoringConfig monitoringConfig) {
            this.monitoringConfig = monitoringConfig;
            return this;
        }

        public Builder maintenanceConfig(MaintenanceConfig maintenanceConfig) {
            this.maintenanceConfig = maintenanceConfig;
            return this;
        }

        public Builder customProperty(String key, Object value) {
            this.customProperties.put(key, value);
            return this;
        }

        public Builder customProperties(Map<String, Object> properties) {
            this.customProperties.putAll(properties);
            return this;
        }

        public TaskDistributionConfig build() {
            return new TaskDistributionConfig(schedulingConfig, scoringConfig, registryConfig,
                                              memoryStoreConfig, monitoringConfig, maintenanceConfig,
                                              customProperties);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Default configurations
     */
    public static class Defaults {
        public static SchedulingConfig defaultSchedulingConfig() {
            return new SchedulingConfig(
                3, Duration.ofMinutes(5), Duration.ofHours(1), 3
            );
        }

        public static ScoringConfig defaultScoringConfig() {
            return new ScoringConfig(
                ScoringPolicy.DEFAULT_CAPABILITY_WEIGHT,
                ScoringPolicy.DEFAULT_LOAD_WEIGHT,
                ScoringPolicy.DEFAULT_PRIORITY_WEIGHT,
                ScoringPolicy.DEFAULT_DEADLINE_WEIGHT,
                ScoringPolicy.DEFAULT_MAX_DEADLINE_FACTOR,
                ScoringPolicy.DEFAULT_DEADLINE_HORIZON
            );
        }

        public static RegistryConfig defaultRegistryConfig() {
            return new RegistryConfig(true, tempDbPath("capabilities-"));
        }

        public static MemoryStoreConfig defaultMemoryStoreConfig() {
            return new MemoryStoreConfig(true, tempDbPath("memory-"), true, 30);
        }

        public static MonitoringConfig defaultMonitoringConfig() {
            return new MonitoringConfig(true, true, 10000, 0.5);
        }

        public static MaintenanceConfig defaultMaintenanceConfig() {
            return new MaintenanceConfig(true, MaintenanceScheduler.DEFAULT_PATTERN);
        }

        private static String tempDbPath(String prefix) {
            String tmpDir = System.getProperty("java.io.tmpdir");
            String uniqueName = UUID.randomUUID().toString();
            return tmpDir.endsWith("/") ? (tmpDir + prefix + uniqueName + ".db")
                                        : (tmpDir + "/" + prefix + uniqueName + ".db");
        }
    }
}
