package com.enterprise.taskdistribution.memory;

import com.enterprise.taskdistribution.exception.PersistenceException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Best-effort store for task progress and failure records.
 * <p>
 * In-memory scheduler state is authoritative; callers log store failures and
 * carry on.
 */
public interface MemoryStore {

    /** Record kind for subtask progress snapshots */
    String KIND_TASK_PROGRESS = "task_progress";

    /** Record kind for permanently failed tasks */
    String KIND_TASK_FAILURE = "task_failure";

    /**
     * Stores a record.
     *
     * @param ownerId The task or agent the record belongs to
     * @param kind The record kind, e.g. {@link #KIND_TASK_PROGRESS}
     * @param content The record payload
     * @return The generated record id
     * @throws PersistenceException if the record could not be written
     */
    String store(String ownerId, String kind, Map<String, Object> content) throws PersistenceException;

    /**
     * Retrieves a record by id.
     *
     * @param recordId The id returned by {@link #store}
     * @return Optional containing the record if found
     */
    Optional<MemoryRecord> getRecord(String recordId);

    /**
     * Retrieves the records of an owner, newest first.
     *
     * @param ownerId The owner to look up
     * @param kind The kind to filter on, or null for every kind
     * @return Matching records
     */
    List<MemoryRecord> retrieve(String ownerId, String kind);

    /**
     * Gets the number of stored records.
     *
     * @return Number of records
     */
    int size();

    /**
     * Removes records older than the retention period.
     *
     * @return Number of records removed
     */
    int cleanupOldEntries();

    /**
     * Closes the store and releases resources.
     */
    void close();
}
