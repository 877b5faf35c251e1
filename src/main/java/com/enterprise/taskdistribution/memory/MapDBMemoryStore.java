package com.enterprise.taskdistribution.memory;

import com.enterprise.taskdistribution.exception.PersistenceException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.mapdb.DB;
import org.mapdb.DBMaker;
import org.mapdb.Serializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * MapDB-based implementation of the memory store. Records are stored as JSON.
 */
public class MapDBMemoryStore implements MemoryStore {

    private static final Logger logger = LoggerFactory.getLogger(MapDBMemoryStore.class);

    private static final String STORE_NAME = "memory-store";

    private final DB db;
    private final Map<String, String> recordStorage;
    private final Map<String, Long> recordTimestamps;
    private final ObjectMapper objectMapper;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final boolean enableRetentionPolicy;
    private final long retentionDays;
    private final Clock clock;

    public MapDBMemoryStore(String dbPath, boolean enableRetentionPolicy, long retentionDays) {
        this(dbPath, enableRetentionPolicy, retentionDays, Clock.systemUTC());
    }

    public MapDBMemoryStore(String dbPath, boolean enableRetentionPolicy, long retentionDays, Clock clock) {
        this(openFileDb(dbPath), enableRetentionPolicy, retentionDays, clock);
        logger.info("MapDB memory store opened at {}", dbPath);
    }

    MapDBMemoryStore(DB db, boolean enableRetentionPolicy, long retentionDays, Clock clock) {
        this.db = db;
        this.enableRetentionPolicy = enableRetentionPolicy;
        this.retentionDays = retentionDays;
        this.clock = clock;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        this.recordStorage = db.hashMap("memoryRecords", Serializer.STRING, Serializer.STRING).createOrOpen();
        this.recordTimestamps = db.hashMap("memoryTimestamps", Serializer.STRING, Serializer.LONG).createOrOpen();

        logger.info("Memory store initialized with {} records, retention: {} days (enabled: {})",
                    recordStorage.size(), retentionDays, enableRetentionPolicy);
    }

    /**
     * Creates a store backed by an in-memory MapDB instance
     */
    public static MapDBMemoryStore inMemory(long retentionDays, Clock clock) {
        DB db = DBMaker.memoryDB().transactionEnable().make();
        return new MapDBMemoryStore(db, true, retentionDays, clock);
    }

    private static DB openFileDb(String dbPath) {
        return DBMaker.fileDB(new File(dbPath))
            .fileMmapEnableIfSupported()
            .transactionEnable()
            .checksumHeaderBypass()
            .closeOnJvmShutdown()
            .make();
    }

    @Override
    public String store(String ownerId, String kind, Map<String, Object> content) throws PersistenceException {
        if (ownerId == null || ownerId.trim().isEmpty()) {
            throw new IllegalArgumentException("Owner ID is required");
        }
        if (kind == null || kind.trim().isEmpty()) {
            throw new IllegalArgumentException("Record kind is required");
        }

        lock.writeLock().lock();
        try {
            MemoryRecord record = MemoryRecord.create(ownerId, kind, content, clock.instant());

            String serializedRecord = objectMapper.writeValueAsString(record);
            recordStorage.put(record.getId(), serializedRecord);
            recordTimestamps.put(record.getId(), record.getCreatedAt().toEpochMilli());

            db.commit();

            logger.debug("Stored {} record {} for {}", kind, record.getId(), ownerId);
            return record.getId();

        } catch (JsonProcessingException e) {
            db.rollback();
            throw new PersistenceException(STORE_NAME, "Failed to serialize " + kind + " record for " + ownerId, e);
        } catch (RuntimeException e) {
            db.rollback();
            throw new PersistenceException(STORE_NAME, "Failed to store " + kind + " record for " + ownerId, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<MemoryRecord> getRecord(String recordId) {
        lock.readLock().lock();
        try {
            String serializedRecord = recordStorage.get(recordId);
            if (serializedRecord == null) {
                return Optional.empty();
            }
            return deserializeRecord(serializedRecord);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<MemoryRecord> retrieve(String ownerId, String kind) {
        lock.readLock().lock();
        try {
            return recordStorage.values().stream()
                .map(this::deserializeRecord)
                .filter(Optional::isPresent)
                .map(Optional::get)
                .filter(record -> record.getOwnerId().equals(ownerId))
                .filter(record -> kind == null || record.getKind().equals(kind))
                .sorted(Comparator.comparing(MemoryRecord::getCreatedAt).reversed())
                .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return recordStorage.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int cleanupOldEntries() {
        if (!enableRetentionPolicy) {
            return 0;
        }

        lock.writeLock().lock();
        try {
            Instant cutoffTime = clock.instant().minus(Duration.ofDays(retentionDays));
            List<String> toRemove = new ArrayList<>();

            for (Map.Entry<String, Long> entry : recordTimestamps.entrySet()) {
                if (Instant.ofEpochMilli(entry.getValue()).isBefore(cutoffTime)) {
                    toRemove.add(entry.getKey());
                }
            }

            for (String recordId : toRemove) {
                recordStorage.remove(recordId);
                recordTimestamps.remove(recordId);
            }

            if (!toRemove.isEmpty()) {
                db.commit();
                logger.info("Cleaned up {} old entries from memory store", toRemove.size());
            }
            return toRemove.size();

        } catch (RuntimeException e) {
            logger.error("Error cleaning up old memory store entries", e);
            db.rollback();
            return 0;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            if (!db.isClosed()) {
                db.close();
            }
            logger.info("Memory store closed");
        } catch (RuntimeException e) {
            logger.error("Error closing memory store", e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Optional<MemoryRecord> deserializeRecord(String serializedRecord) {
        try {
            return Optional.of(objectMapper.readValue(serializedRecord, MemoryRecord.class));
        } catch (JsonProcessingException e) {
            logger.error("Failed to deserialize memory record", e);
            return Optional.empty();
        }
    }
}
