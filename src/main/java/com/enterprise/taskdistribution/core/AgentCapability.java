package com.enterprise.taskdistribution.core;

import com.enterprise.taskdistribution.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single capability held by an agent, with its strength in [0, 1].
 * Instances are immutable and validated on construction.
 */
public class AgentCapability {

    private final Capability capability;
    private final double strength;
    private final Instant lastUpdated;
    private final Map<String, Object> metadata;

    @JsonCreator
    public AgentCapability(@JsonProperty("capability") Capability capability,
                           @JsonProperty("strength") double strength,
                           @JsonProperty("lastUpdated") Instant lastUpdated,
                           @JsonProperty("metadata") Map<String, Object> metadata) {
        if (capability == null) {
            throw new ValidationException("capability", "Capability is required");
        }
        if (Double.isNaN(strength) || strength < 0.0 || strength > 1.0) {
            throw new ValidationException("strength",
                "Strength must be between 0.0 and 1.0 but was " + strength);
        }
        this.capability = capability;
        this.strength = strength;
        this.lastUpdated = lastUpdated != null ? lastUpdated : Instant.now();
        this.metadata = metadata != null
            ? Collections.unmodifiableMap(new HashMap<>(metadata))
            : Collections.emptyMap();
    }

    public AgentCapability(Capability capability, double strength) {
        this(capability, strength, Instant.now(), null);
    }

    public static AgentCapability of(Capability capability, double strength) {
        return new AgentCapability(capability, strength);
    }

    public Capability getCapability() { return capability; }

    public double getStrength() { return strength; }

    public Instant getLastUpdated() { return lastUpdated; }

    public Map<String, Object> getMetadata() { return metadata; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AgentCapability that = (AgentCapability) o;
        return Double.compare(that.strength, strength) == 0
            && capability == that.capability
            && Objects.equals(metadata, that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(capability, strength, metadata);
    }

    @Override
    public String toString() {
        return "AgentCapability{" +
                "capability=" + capability +
                ", strength=" + strength +
                ", lastUpdated=" + lastUpdated +
                '}';
    }
}
