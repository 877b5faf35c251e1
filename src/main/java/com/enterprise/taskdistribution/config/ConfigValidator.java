package com.enterprise.taskdistribution.config;

import it.sauronsoftware.cron4j.SchedulingPattern;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates task distribution configuration
 */
public class ConfigValidator {

    /**
     * Validate the configuration and return any validation errors
     */
    public List<ValidationError> validate(TaskDistributionConfig config) {
        List<ValidationError> errors = new ArrayList<>();

        validateSchedulingConfig(config.getSchedulingConfig(), errors);
        validateScoringConfig(config.getScoringConfig(), errors);
        validateRegistryConfig(config.getRegistryConfig(), errors);
        validateMemoryStoreConfig(config.getMemoryStoreConfig(), errors);
        validateMonitoringConfig(config.getMonitoringConfig(), errors);
        validateMaintenanceConfig(config.getMaintenanceConfig(), errors);

        return errors;
    }

    private void validateSchedulingConfig(TaskDistributionConfig.SchedulingConfig config, List<ValidationError> errors) {
        if (config.getMaxTasksPerAgent() <= 0) {
            errors.add(new ValidationError("scheduling.maxTasksPerAgent",
                "Max tasks per agent must be greater than 0"));
        }

        if (config.getHeartbeatTimeout() == null || config.getHeartbeatTimeout().isNegative()
                || config.getHeartbeatTimeout().isZero()) {
            errors.add(new ValidationError("scheduling.heartbeatTimeout",
                "Heartbeat timeout must be positive"));
        }

        if (config.getDefaultTaskTimeout() != null && config.getDefaultTaskTimeout().isNegative()) {
            errors.add(new ValidationError("scheduling.defaultTaskTimeout",
                "Default task timeout cannot be negative"));
        }

        if (config.getDefaultMaxRetries() < 0) {
            errors.add(new ValidationError("scheduling.defaultMaxRetries",
                "Default maximum retries cannot be negative"));
        }
    }

    private void validateScoringConfig(TaskDistributionConfig.ScoringConfig config, List<ValidationError> errors) {
        double[] weights = {
            config.getCapabilityWeight(), config.getLoadWeight(),
            config.getPriorityWeight(), config.getDeadlineWeight()
        };
        String[] names = {"capabilityWeight", "loadWeight", "priorityWeight", "deadlineWeight"};
        double total = 0.0;
        for (int i = 0; i < weights.length; i++) {
            if (weights[i] < 0 || Double.isNaN(weights[i])) {
                errors.add(new ValidationError("scoring." + names[i], "Weight cannot be negative"));
            }
            total += weights[i];
        }

        if (total <= 0) {
            errors.add(new ValidationError("scoring.weights",
                "At least one scoring weight must be greater than 0"));
        }

        if (config.getMaxDeadlineFactor() < 1.0) {
            errors.add(new ValidationError("scoring.maxDeadlineFactor",
                "Maximum deadline factor must be at least 1.0"));
        }

        if (config.getDeadlineHorizon() == null || config.getDeadlineHorizon().getSeconds() <= 0) {
            errors.add(new ValidationError("scoring.deadlineHorizon",
                "Deadline horizon must be at least one second"));
        }
    }

    private void validateRegistryConfig(TaskDistributionConfig.RegistryConfig config, List<ValidationError> errors) {
        if (config.isPersistenceEnabled() && (config.getDbPath() == null || config.getDbPath().trim().isEmpty())) {
            errors.add(new ValidationError("registry.dbPath",
                "Database path is required when persistence is enabled"));
        }
    }

    private void validateMemoryStoreConfig(TaskDistributionConfig.MemoryStoreConfig config, List<ValidationError> errors) {
        if (!config.isEnabled()) {
            return;
        }

        if (config.getDbPath() == null || config.getDbPath().trim().isEmpty()) {
            errors.add(new ValidationError("memoryStore.dbPath",
                "Database path is required"));
        }

        if (config.isEnableRetentionPolicy() && config.getRetentionDays() <= 0) {
            errors.add(new ValidationError("memoryStore.retentionDays",
                "Retention days must be greater than 0"));
        }
    }

    private void validateMonitoringConfig(TaskDistributionConfig.MonitoringConfig config, List<ValidationError> errors) {
        if (config.getMaxBacklogSize() <= 0) {
            errors.add(new ValidationError("monitoring.maxBacklogSize",
                "Maximum backlog size must be greater than 0"));
        }

        if (config.getMinHealthyAgentRatio() < 0.0 || config.getMinHealthyAgentRatio() > 1.0) {
            errors.add(new ValidationError("monitoring.minHealthyAgentRatio",
                "Minimum healthy agent ratio must be between 0.0 and 1.0"));
        }
    }

    private void validateMaintenanceConfig(TaskDistributionConfig.MaintenanceConfig config, List<ValidationError> errors) {
        if (config.isEnabled()
                && (config.getCronPattern() == null || !SchedulingPattern.validate(config.getCronPattern()))) {
            errors.add(new ValidationError("maintenance.cronPattern",
                "Invalid cron expression: " + config.getCronPattern()));
        }
    }

    /**
     * Validation error
     */
    public static class ValidationError {
        private final String field;
        private final String message;

        public ValidationError(String field, String message) {
            this.field = field;
            this.message = message;
        }

        public String getField() { return field; }
        public String getMessage() { return message; }

        @Override
        public String toString() {
            return String.format("%s: %s", field, message);
        }
    }
}
