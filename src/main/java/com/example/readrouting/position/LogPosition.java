package com.example.readrouting.position;

import org.postgresql.replication.LogSequenceNumber;

import java.util.Objects;

/**
 * A point in the primary's write-ahead log.
 *
 * Ordering follows the WAL's own numeric order (an unsigned 64-bit offset), never the
 * textual form: "0/10" is after "0/9" even though it sorts before it as a string.
 */
public final class LogPosition implements Comparable<LogPosition> {

    private final LogSequenceNumber lsn;

    private LogPosition(LogSequenceNumber lsn) {
        this.lsn = lsn;
    }

    /**
     * Parse the server's textual LSN form, e.g. {@code 16/B374D848}.
     *
     * @throws IllegalArgumentException if the text is not a valid LSN
     */
    public static LogPosition parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Log position text must not be blank");
        }
        LogSequenceNumber parsed = LogSequenceNumber.valueOf(text.trim());
        if (LogSequenceNumber.INVALID_LSN.equals(parsed)) {
            throw new IllegalArgumentException("Not a valid log position: " + text);
        }
        return new LogPosition(parsed);
    }

    public static LogPosition of(LogSequenceNumber lsn) {
        Objects.requireNonNull(lsn, "lsn");
        if (LogSequenceNumber.INVALID_LSN.equals(lsn)) {
            throw new IllegalArgumentException("Invalid log sequence number");
        }
        return new LogPosition(lsn);
    }

    /**
     * @return true if a node that has replayed up to {@code replayed} contains this position
     */
    public boolean isReachedBy(LogPosition replayed) {
        return compareTo(replayed) <= 0;
    }

    public static LogPosition max(LogPosition a, LogPosition b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public long asLong() {
        return lsn.asLong();
    }

    @Override
    public int compareTo(LogPosition other) {
        return Long.compareUnsigned(lsn.asLong(), other.lsn.asLong());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LogPosition)) {
            return false;
        }
        return lsn.asLong() == ((LogPosition) o).lsn.asLong();
    }

    @Override
    public int hashCode() {
        return Long.hashCode(lsn.asLong());
    }

    @Override
    public String toString() {
        return lsn.asString();
    }
}
