package com.enterprise.taskdistribution.registry;

import com.enterprise.taskdistribution.core.AgentCapability;
import com.enterprise.taskdistribution.exception.PersistenceException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.mapdb.DB;
import org.mapdb.DBMaker;
import org.mapdb.Serializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * MapDB-based capability store. Each agent's profile is kept as a JSON list.
 */
public class MapDBCapabilityStore implements CapabilityStore {

    private static final Logger logger = LoggerFactory.getLogger(MapDBCapabilityStore.class);

    private static final String STORE_NAME = "capability-store";
    private static final TypeReference<List<AgentCapability>> PROFILE_TYPE = new TypeReference<>() {};

    private final DB db;
    private final Map<String, String> profiles;
    private final ObjectMapper objectMapper;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public MapDBCapabilityStore(String dbPath) {
        this(DBMaker.fileDB(new File(dbPath))
            .fileMmapEnableIfSupported()
            .transactionEnable()
            .checksumHeaderBypass()
            .closeOnJvmShutdown()
            .make());
        logger.info("Capability store opened at {}", dbPath);
    }

    MapDBCapabilityStore(DB db) {
        this.db = db;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.profiles = db.hashMap("agentProfiles", Serializer.STRING, Serializer.STRING).createOrOpen();
    }

    /**
     * Creates a store backed by an in-memory MapDB instance
     */
    public static MapDBCapabilityStore inMemory() {
        return new MapDBCapabilityStore(DBMaker.memoryDB().transactionEnable().make());
    }

    @Override
    public void saveAll(Map<String, List<AgentCapability>> snapshot) throws PersistenceException {
        lock.writeLock().lock();
        try {
            Map<String, String> serialized = new LinkedHashMap<>();
            for (Map.Entry<String, List<AgentCapability>> entry : snapshot.entrySet()) {
                serialized.put(entry.getKey(), objectMapper.writeValueAsString(entry.getValue()));
            }

            profiles.keySet().retainAll(serialized.keySet());
            profiles.putAll(serialized);
            db.commit();

            logger.debug("Saved capability profiles for {} agents", serialized.size());

        } catch (JsonProcessingException e) {
            db.rollback();
            throw new PersistenceException(STORE_NAME, "Failed to serialize capability profiles", e);
        } catch (RuntimeException e) {
            db.rollback();
            throw new PersistenceException(STORE_NAME, "Failed to save capability profiles", e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Map<String, List<AgentCapability>> loadAll() throws PersistenceException {
        lock.readLock().lock();
        try {
            Map<String, List<AgentCapability>> loaded = new LinkedHashMap<>();
            for (Map.Entry<String, String> entry : profiles.entrySet()) {
                loaded.put(entry.getKey(), new ArrayList<>(objectMapper.readValue(entry.getValue(), PROFILE_TYPE)));
            }
            logger.info("Loaded capability profiles for {} agents", loaded.size());
            return loaded;

        } catch (JsonProcessingException e) {
            throw new PersistenceException(STORE_NAME, "Failed to deserialize capability profiles", e);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            if (!db.isClosed()) {
                db.close();
            }
            logger.info("Capability store closed");
        } catch (RuntimeException e) {
            logger.error("Error closing capability store", e);
        } finally {
            lock.writeLock().unlock();
        }
    }
}
