package com.example.readrouting.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Parameters of a "latest rows" read: newest first, bounded by {@code limit},
 * optionally restricted to rows owned by one session.
 */
public final class ReadQuery {

    public static final int DEFAULT_LIMIT = 5;

    private final int limit;
    private final String ownerId;

    private ReadQuery(int limit, String ownerId) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Read limit must be positive, got " + limit);
        }
        this.limit = limit;
        this.ownerId = ownerId;
    }

    public static ReadQuery latest(int limit) {
        return new ReadQuery(limit, null);
    }

    public static ReadQuery latestOwnedBy(String ownerId, int limit) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("Owner id must not be blank");
        }
        return new ReadQuery(limit, ownerId);
    }

    public int getLimit() {
        return limit;
    }

    public Optional<String> getOwnerId() {
        return Optional.ofNullable(ownerId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReadQuery)) {
            return false;
        }
        ReadQuery other = (ReadQuery) o;
        return limit == other.limit && Objects.equals(ownerId, other.ownerId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(limit, ownerId);
    }

    @Override
    public String toString() {
        return "ReadQuery{limit=" + limit + (ownerId != null ? ", owner=" + ownerId : "") + "}";
    }
}
