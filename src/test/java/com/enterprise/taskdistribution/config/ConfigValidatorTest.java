package com.enterprise.taskdistribution.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ConfigValidatorTest {

    private ConfigValidator validator;

    @BeforeEach
    void setUp() {
        validator = new ConfigValidator();
    }

    private List<String> invalidFields(TaskDistributionConfig config) {
        return validator.validate(config).stream()
            .map(ConfigValidator.ValidationError::getField)
            .collect(Collectors.toList());
    }

    @Test
    void testDefaultConfigIsValid() {
        assertTrue(validator.validate(TaskDistributionConfig.builder().build()).isEmpty());
    }

    @Test
    void testDefaults() {
        TaskDistributionConfig config = TaskDistributionConfig.builder().build();

        assertEquals(3, config.getSchedulingConfig().getMaxTasksPerAgent());
        assertEquals(Duration.ofMinutes(5), config.getSchedulingConfig().getHeartbeatTimeout());
        assertEquals(0.35, config.getScoringConfig().getCapabilityWeight(), 1e-9);
        assertEquals(2.0, config.getScoringConfig().getMaxDeadlineFactor(), 1e-9);
        assertEquals(30, config.getMemoryStoreConfig().getRetentionDays());
        assertEquals("* * * * *", config.getMaintenanceConfig().getCronPattern());
    }

    @Test
    void testInvalidScheduling() {
        TaskDistributionConfig config = TaskDistributionConfig.builder()
            .schedulingConfig(new TaskDistributionConfig.SchedulingConfig(0, Duration.ZERO, Duration.ofSeconds(-1), -1))
            .build();

        assertEquals(List.of("scheduling.maxTasksPerAgent", "scheduling.heartbeatTimeout",
                             "scheduling.defaultTaskTimeout", "scheduling.defaultMaxRetries"),
                     invalidFields(config));
    }

    @Test
    void testInvalidScoring() {
        TaskDistributionConfig config = TaskDistributionConfig.builder()
            .scoringConfig(new TaskDistributionConfig.ScoringConfig(-0.5, 0.0, 0.0, 0.0, 0.5, Duration.ZERO))
            .build();

        assertEquals(List.of("scoring.capabilityWeight", "scoring.weights",
                             "scoring.maxDeadlineFactor", "scoring.deadlineHorizon"),
                     invalidFields(config));
    }

    @Test
    void testStoresRequirePathsWhenEnabled() {
        TaskDistributionConfig config = TaskDistributionConfig.builder()
            .registryConfig(new TaskDistributionConfig.RegistryConfig(true, " "))
            .memoryStoreConfig(new TaskDistributionConfig.MemoryStoreConfig(true, null, true, 0))
            .build();

        assertEquals(List.of("registry.dbPath", "memoryStore.dbPath", "memoryStore.retentionDays"),
                     invalidFields(config));
    }

    @Test
    void testDisabledStoresNeedNoPaths() {
        TaskDistributionConfig config = TaskDistributionConfig.builder()
            .registryConfig(new TaskDistributionConfig.RegistryConfig(false, null))
            .memoryStoreConfig(new TaskDistributionConfig.MemoryStoreConfig(false, null, true, 0))
            .build();

        assertTrue(invalidFields(config).isEmpty());
    }

    @Test
    void testInvalidMonitoringAndMaintenance() {
        TaskDistributionConfig config = TaskDistributionConfig.builder()
            .monitoringConfig(new TaskDistributionConfig.MonitoringConfig(true, true, 0, 1.5))
            .maintenanceConfig(new TaskDistributionConfig.MaintenanceConfig(true, "not a cron"))
            .build();

        assertEquals(List.of("monitoring.maxBacklogSize", "monitoring.minHealthyAgentRatio",
                             "maintenance.cronPattern"),
                     invalidFields(config));
    }

    @Test
    void testDisabledMaintenanceSkipsPatternCheck() {
        TaskDistributionConfig config = TaskDistributionConfig.builder()
            .maintenanceConfig(new TaskDistributionConfig.MaintenanceConfig(false, "not a cron"))
            .build();

        assertTrue(invalidFields(config).isEmpty());
    }

    @Test
    void testScoringConfigBuildsPolicy() {
        TaskDistributionConfig.ScoringConfig scoring = new TaskDistributionConfig.ScoringConfig(
            0.5, 0.2, 0.2, 0.1, 3.0, Duration.ofHours(12));

        assertEquals(0.5, scoring.toScoringPolicy().getCapabilityWeight(), 1e-9);
        assertEquals(3.0, scoring.toScoringPolicy().getMaxDeadlineFactor(), 1e-9);
        assertEquals(Duration.ofHours(12), scoring.toScoringPolicy().getDeadlineHorizon());
    }
}
