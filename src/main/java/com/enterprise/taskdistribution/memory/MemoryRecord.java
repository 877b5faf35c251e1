package com.enterprise.taskdistribution.memory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A record written to the memory store: task progress, failure records and
 * similar best-effort history owned by a task or agent.
 */
public class MemoryRecord {

    private final String id;
    private final String ownerId;
    private final String kind;
    private final Map<String, Object> content;
    private final Instant createdAt;

    @JsonCreator
    public MemoryRecord(@JsonProperty("id") String id,
                        @JsonProperty("ownerId") String ownerId,
                        @JsonProperty("kind") String kind,
                        @JsonProperty("content") Map<String, Object> content,
                        @JsonProperty("createdAt") Instant createdAt) {
        this.id = Objects.requireNonNull(id, "Record ID cannot be null");
        this.ownerId = Objects.requireNonNull(ownerId, "Owner ID cannot be null");
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
        this.content = content != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(content))
            : Collections.emptyMap();
        this.createdAt = Objects.requireNonNull(createdAt, "Creation time cannot be null");
    }

    /**
     * Creates a new record with a generated id.
     */
    public static MemoryRecord create(String ownerId, String kind, Map<String, Object> content, Instant createdAt) {
        return new MemoryRecord(UUID.randomUUID().toString(), ownerId, kind, content, createdAt);
    }

    public String getId() {
        return id;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public String getKind() {
        return kind;
    }

    public Map<String, Object> getContent() {
        return content;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MemoryRecord that = (MemoryRecord) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "MemoryRecord{" +
                "id='" + id + '\'' +
                ", ownerId='" + ownerId + '\'' +
                ", kind='" + kind + '\'' +
                ", createdAt=" + createdAt +
                '}';
    }
}
