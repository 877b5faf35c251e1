package com.enterprise.taskdistribution.registry;

import com.enterprise.taskdistribution.core.AgentCapability;
import com.enterprise.taskdistribution.core.Capability;
import com.enterprise.taskdistribution.core.CapabilityCategory;
import com.enterprise.taskdistribution.exception.PersistenceException;
import com.enterprise.taskdistribution.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * Thread-safe registry of agent capability profiles.
 * <p>
 * Profiles are kept in ascending agent id order, so every query that returns
 * several agents lists them by id. When a {@link CapabilityStore} is supplied
 * the registry loads previously saved profiles on construction and saves a
 * snapshot after each mutation. Snapshots are numbered under the write lock
 * and a snapshot older than the last one saved is never written. Store
 * failures are logged and never fail the calling operation.
 */
public class CapabilityRegistry {

    private static final Logger logger = LoggerFactory.getLogger(CapabilityRegistry.class);

    private final TreeMap<String, List<AgentCapability>> profiles = new TreeMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final CapabilityStore store;

    private final ReentrantLock persistLock = new ReentrantLock();
    private long version;
    private long persistedVersion;

    public CapabilityRegistry() {
        this(null);
    }

    public CapabilityRegistry(CapabilityStore store) {
        this.store = store;
        loadProfiles();
    }

    /**
     * Registers an agent, replacing any existing profile.
     *
     * @param agentId The agent identifier
     * @param capabilities The agent's full capability list
     * @throws ValidationException if the id is blank, or the list is empty, contains null
     *                             or names a capability twice
     */
    public void registerAgent(String agentId, List<AgentCapability> capabilities) {
        String id = requireAgentId(agentId);
        if (capabilities == null || capabilities.isEmpty()) {
            throw new ValidationException("capabilities", "At least one capability is required for agent " + id);
        }
        Set<Capability> seen = EnumSet.noneOf(Capability.class);
        for (AgentCapability capability : capabilities) {
            if (capability == null) {
                throw new ValidationException("capabilities", "Capability entries cannot be null");
            }
            if (!seen.add(capability.getCapability())) {
                throw new ValidationException("capabilities",
                    "Capability " + capability.getCapability() + " listed more than once for agent " + id);
            }
        }

        Snapshot snapshot;
        lock.writeLock().lock();
        try {
            profiles.put(id, new ArrayList<>(capabilities));
            snapshot = snapshot();
        } finally {
            lock.writeLock().unlock();
        }

        logger.info("Registered agent {} with {} capabilities", id, capabilities.size());
        persist(snapshot);
    }

    /**
     * Updates a capability of a registered agent in place, or appends it.
     *
     * @return false if the agent is not registered
     */
    public boolean updateCapability(String agentId, AgentCapability capability) {
        if (capability == null) {
            throw new ValidationException("capability", "Capability is required");
        }
        String id = requireAgentId(agentId);

        Snapshot snapshot;
        lock.writeLock().lock();
        try {
            List<AgentCapability> profile = profiles.get(id);
            if (profile == null) {
                return false;
            }
            boolean replaced = false;
            for (int i = 0; i < profile.size(); i++) {
                if (profile.get(i).getCapability() == capability.getCapability()) {
                    profile.set(i, capability);
                    replaced = true;
                    break;
                }
            }
            if (!replaced) {
                profile.add(capability);
            }
            snapshot = snapshot();
        } finally {
            lock.writeLock().unlock();
        }

        logger.debug("Updated {} for agent {} to strength {}",
                     capability.getCapability(), id, capability.getStrength());
        persist(snapshot);
        return true;
    }

    /**
     * Removes a capability from a registered agent.
     *
     * @return true if a capability was removed
     */
    public boolean removeCapability(String agentId, Capability capability) {
        String id = requireAgentId(agentId);

        Snapshot snapshot;
        lock.writeLock().lock();
        try {
            List<AgentCapability> profile = profiles.get(id);
            if (profile == null || !profile.removeIf(c -> c.getCapability() == capability)) {
                return false;
            }
            snapshot = snapshot();
        } finally {
            lock.writeLock().unlock();
        }

        logger.debug("Removed {} from agent {}", capability, id);
        persist(snapshot);
        return true;
    }

    /**
     * Removes an agent and its whole profile.
     *
     * @return true if the agent was registered
     */
    public boolean removeAgent(String agentId) {
        String id = requireAgentId(agentId);

        Snapshot snapshot;
        lock.writeLock().lock();
        try {
            if (profiles.remove(id) == null) {
                return false;
            }
            snapshot = snapshot();
        } finally {
            lock.writeLock().unlock();
        }

        logger.info("Removed agent {}", id);
        persist(snapshot);
        return true;
    }

    public Optional<List<AgentCapability>> getAgentCapabilities(String agentId) {
        if (agentId == null) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            List<AgentCapability> profile = profiles.get(agentId.trim());
            return profile == null ? Optional.empty() : Optional.of(List.copyOf(profile));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Registered agent ids in ascending order
     */
    public List<String> getAgentIds() {
        lock.readLock().lock();
        try {
            return List.copyOf(profiles.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Finds the agent with the highest strength for a capability.
     * Equal strengths resolve to the lowest agent id.
     */
    public Optional<String> findBestAgent(Capability capability) {
        lock.readLock().lock();
        try {
            String bestAgent = null;
            double bestStrength = -1.0;
            for (Map.Entry<String, List<AgentCapability>> entry : profiles.entrySet()) {
                Optional<AgentCapability> held = findCapability(entry.getValue(), capability);
                if (held.isPresent() && held.get().getStrength() > bestStrength) {
                    bestAgent = entry.getKey();
                    bestStrength = held.get().getStrength();
                }
            }
            return Optional.ofNullable(bestAgent);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Finds every agent holding a capability with at least the given strength.
     *
     * @param minStrength Minimum strength in [0, 1]
     * @return Agent ids in ascending order
     */
    public List<String> findAgentsWithCapability(Capability capability, double minStrength) {
        if (Double.isNaN(minStrength) || minStrength < 0.0 || minStrength > 1.0) {
            throw new ValidationException("minStrength",
                "Minimum strength must be between 0.0 and 1.0 but was " + minStrength);
        }
        lock.readLock().lock();
        try {
            return profiles.entrySet().stream()
                .filter(entry -> findCapability(entry.getValue(), capability)
                    .map(c -> c.getStrength() >= minStrength)
                    .orElse(false))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Groups each agent's capabilities that fall into a category.
     * Agents without any capability in the category are left out.
     */
    public Map<String, List<AgentCapability>> getAgentsByCategory(CapabilityCategory category) {
        lock.readLock().lock();
        try {
            Map<String, List<AgentCapability>> result = new LinkedHashMap<>();
            for (Map.Entry<String, List<AgentCapability>> entry : profiles.entrySet()) {
                List<AgentCapability> matching = entry.getValue().stream()
                    .filter(c -> c.getCapability().getCategory() == category)
                    .collect(Collectors.toUnmodifiableList());
                if (!matching.isEmpty()) {
                    result.put(entry.getKey(), matching);
                }
            }
            return Collections.unmodifiableMap(result);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Snapshot of agent id to capability strengths
     */
    public Map<String, Map<Capability, Double>> getCapabilityMatrix() {
        lock.readLock().lock();
        try {
            Map<String, Map<Capability, Double>> matrix = new LinkedHashMap<>();
            for (Map.Entry<String, List<AgentCapability>> entry : profiles.entrySet()) {
                Map<Capability, Double> strengths = new EnumMap<>(Capability.class);
                for (AgentCapability capability : entry.getValue()) {
                    strengths.put(capability.getCapability(), capability.getStrength());
                }
                matrix.put(entry.getKey(), Collections.unmodifiableMap(strengths));
            }
            return Collections.unmodifiableMap(matrix);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Strength of one capability for an agent, empty if either is unknown
     */
    public Optional<Double> getStrength(String agentId, Capability capability) {
        lock.readLock().lock();
        try {
            List<AgentCapability> profile = profiles.get(agentId);
            if (profile == null) {
                return Optional.empty();
            }
            return findCapability(profile, capability).map(AgentCapability::getStrength);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getAgentCount() {
        lock.readLock().lock();
        try {
            return profiles.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private static Optional<AgentCapability> findCapability(List<AgentCapability> profile, Capability capability) {
        for (AgentCapability held : profile) {
            if (held.getCapability() == capability) {
                return Optional.of(held);
            }
        }
        return Optional.empty();
    }

    private static String requireAgentId(String agentId) {
        if (agentId == null || agentId.trim().isEmpty()) {
            throw new ValidationException("agentId", "Agent ID cannot be null or empty");
        }
        return agentId.trim();
    }

    // Caller must hold the write lock
    private Snapshot snapshot() {
        Map<String, List<AgentCapability>> copy = new LinkedHashMap<>();
        profiles.forEach((id, profile) -> copy.put(id, List.copyOf(profile)));
        return new Snapshot(++version, copy);
    }

    private void loadProfiles() {
        if (store == null) {
            return;
        }
        try {
            Map<String, List<AgentCapability>> loaded = store.loadAll();
            lock.writeLock().lock();
            try {
                loaded.forEach((id, profile) -> profiles.put(id, new ArrayList<>(profile)));
            } finally {
                lock.writeLock().unlock();
            }
            logger.info("Restored {} agent profiles from capability store", loaded.size());
        } catch (PersistenceException e) {
            logger.error("Failed to load agent profiles, starting with an empty registry", e);
        }
    }

    private void persist(Snapshot snapshot) {
        if (store == null) {
            return;
        }
        persistLock.lock();
        try {
            if (snapshot.version <= persistedVersion) {
                logger.debug("Skipping snapshot {}, snapshot {} already saved", snapshot.version, persistedVersion);
                return;
            }
            store.saveAll(snapshot.profiles);
            persistedVersion = snapshot.version;
        } catch (PersistenceException e) {
            logger.error("Failed to persist agent profiles", e);
        } finally {
            persistLock.unlock();
        }
    }

    private static final class Snapshot {
        private final long version;
        private final Map<String, List<AgentCapability>> profiles;

        private Snapshot(long version, Map<String, List<AgentCapability>> profiles) {
            this.version = version;
            this.profiles = profiles;
        }
    }
}
