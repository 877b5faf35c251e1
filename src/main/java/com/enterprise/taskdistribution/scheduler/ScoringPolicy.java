package com.enterprise.taskdistribution.scheduler;

import com.enterprise.taskdistribution.core.Capability;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Weighted scoring used to rank candidate agents for a task.
 * <p>
 * The final score combines capability fit, current load, task priority and
 * deadline urgency. Capability weights grow towards the front of the required
 * list so the first-listed capability matters most.
 */
public class ScoringPolicy {

    public static final double DEFAULT_CAPABILITY_WEIGHT = 0.35;
    public static final double DEFAULT_LOAD_WEIGHT = 0.25;
    public static final double DEFAULT_PRIORITY_WEIGHT = 0.25;
    public static final double DEFAULT_DEADLINE_WEIGHT = 0.15;
    public static final double DEFAULT_MAX_DEADLINE_FACTOR = 2.0;
    public static final Duration DEFAULT_DEADLINE_HORIZON = Duration.ofHours(24);

    private static final double CAPABILITY_RANK_STEP = 0.2;

    private final double capabilityWeight;
    private final double loadWeight;
    private final double priorityWeight;
    private final double deadlineWeight;
    private final double maxDeadlineFactor;
    private final Duration deadlineHorizon;

    public ScoringPolicy(double capabilityWeight, double loadWeight, double priorityWeight,
                         double deadlineWeight, double maxDeadlineFactor, Duration deadlineHorizon) {
        this.capabilityWeight = capabilityWeight;
        this.loadWeight = loadWeight;
        this.priorityWeight = priorityWeight;
        this.deadlineWeight = deadlineWeight;
        this.maxDeadlineFactor = maxDeadlineFactor;
        this.deadlineHorizon = deadlineHorizon;
    }

    /**
     * Weighted mean of the agent's strengths over the required capabilities.
     *
     * @param required Required capabilities, most important first
     * @param strengths The agent's strength per capability
     * @return The score in [0, 1], or empty if the agent lacks any required capability
     */
    public OptionalDouble capabilityScore(List<Capability> required, Map<Capability, Double> strengths) {
        double weightedSum = 0.0;
        double totalWeight = 0.0;
        int count = required.size();
        for (int i = 0; i < count; i++) {
            Double strength = strengths.get(required.get(i));
            if (strength == null) {
                return OptionalDouble.empty();
            }
            double weight = 1.0 + CAPABILITY_RANK_STEP * (count - 1 - i);
            weightedSum += strength * weight;
            totalWeight += weight;
        }
        return totalWeight > 0 ? OptionalDouble.of(weightedSum / totalWeight) : OptionalDouble.empty();
    }

    /**
     * Remaining capacity of an agent, weighting each held task by its priority
     *
     * @param activePriorities Priorities of the agent's active assignments
     */
    public double loadFactor(Collection<Integer> activePriorities, int maxTasksPerAgent) {
        double load = 0.0;
        for (int priority : activePriorities) {
            load += priorityFactor(priority);
        }
        return 1.0 - load / maxTasksPerAgent;
    }

    public double priorityFactor(int priority) {
        return (6 - priority) / 5.0;
    }

    /**
     * Urgency of a deadline: 1.0 at the horizon, growing as it approaches, capped.
     * No deadline scores 1.0.
     */
    public double deadlineFactor(Instant deadline, Instant now) {
        if (deadline == null) {
            return 1.0;
        }
        long secondsLeft = Math.max(1L, Duration.between(now, deadline).getSeconds());
        return Math.min(maxDeadlineFactor, (double) deadlineHorizon.getSeconds() / secondsLeft);
    }

    public double finalScore(double capabilityScore, double loadFactor,
                             double priorityFactor, double deadlineFactor) {
        return capabilityWeight * capabilityScore
            + loadWeight * loadFactor
            + priorityWeight * priorityFactor
            + deadlineWeight * deadlineFactor;
    }

    public double getCapabilityWeight() { return capabilityWeight; }

    public double getLoadWeight() { return loadWeight; }

    public double getPriorityWeight() { return priorityWeight; }

    public double getDeadlineWeight() { return deadlineWeight; }

    public double getMaxDeadlineFactor() { return maxDeadlineFactor; }

    public Duration getDeadlineHorizon() { return deadlineHorizon; }

    /**
     * The standard weighting: 0.35 capability, 0.25 load, 0.25 priority, 0.15 deadline
     */
    public static ScoringPolicy standard() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for creating scoring policies
     */
    public static class Builder {
        private double capabilityWeight = DEFAULT_CAPABILITY_WEIGHT;
        private double loadWeight = DEFAULT_LOAD_WEIGHT;
        private double priorityWeight = DEFAULT_PRIORITY_WEIGHT;
        private double deadlineWeight = DEFAULT_DEADLINE_WEIGHT;
        private double maxDeadlineFactor = DEFAULT_MAX_DEADLINE_FACTOR;
        private Duration deadlineHorizon = DEFAULT_DEADLINE_HORIZON;

        public Builder capabilityWeight(double capabilityWeight) {
            this.capabilityWeight = capabilityWeight;
            return this;
        }

        public Builder loadWeight(double loadWeight) {
            this.loadWeight = loadWeight;
            return this;
        }

        public Builder priorityWeight(double priorityWeight) {
            this.priorityWeight = priorityWeight;
            return this;
        }

        public Builder deadlineWeight(double deadlineWeight) {
            this.deadlineWeight = deadlineWeight;
            return this;
        }

        public Builder maxDeadlineFactor(double maxDeadlineFactor) {
            this.maxDeadlineFactor = maxDeadlineFactor;
            return this;
        }

        public Builder deadlineHorizon(Duration deadlineHorizon) {
            this.deadlineHorizon = deadlineHorizon;
            return this;
        }

        public ScoringPolicy build() {
            return new ScoringPolicy(capabilityWeight, loadWeight, priorityWeight,
                                     deadlineWeight, maxDeadlineFactor, deadlineHorizon);
        }
    }
}
