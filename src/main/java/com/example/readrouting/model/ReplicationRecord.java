package com.example.readrouting.model;

import java.time.LocalDateTime;

/**
 * One row of {@code replication_test}.
 */
public final class ReplicationRecord {

    private final long id;
    private final String data;
    private final String ownerId;
    private final LocalDateTime createdAt;

    public ReplicationRecord(long id, String data, String ownerId, LocalDateTime createdAt) {
        this.id = id;
        this.data = data;
        this.ownerId = ownerId;
        this.createdAt = createdAt;
    }

    public long getId() {
        return id;
    }

    public String getData() {
        return data;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "ReplicationRecord{id=" + id + ", owner=" + ownerId + ", data='" + data + "'}";
    }
}
