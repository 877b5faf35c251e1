package com.enterprise.taskdistribution.registry;

import com.enterprise.taskdistribution.core.AgentCapability;
import com.enterprise.taskdistribution.exception.PersistenceException;

import java.util.List;
import java.util.Map;

/**
 * Persistence for agent capability profiles.
 */
public interface CapabilityStore {

    /**
     * Replaces the stored profiles with the given snapshot.
     *
     * @param profiles Agent id to that agent's capabilities
     * @throws PersistenceException if the snapshot could not be written
     */
    void saveAll(Map<String, List<AgentCapability>> profiles) throws PersistenceException;

    /**
     * Loads every stored profile.
     *
     * @return Agent id to that agent's capabilities
     * @throws PersistenceException if the stored data could not be read
     */
    Map<String, List<AgentCapability>> loadAll() throws PersistenceException;

    /**
     * Closes the store and releases resources.
     */
    void close();
}
