package com.example.readrouting.session;

import com.example.readrouting.position.LogPosition;

import java.time.Instant;
import java.util.Optional;

/**
 * Immutable snapshot of what the router knows about one client session.
 * Updates replace the whole snapshot, so readers never observe a half-applied write.
 */
public final class SessionState {

    private final String sessionId;
    private final Instant lastWriteTime;
    private final LogPosition lastWritePosition;
    private final long writeSequence;
    private final long capturedSequence;
    private final long unknownSequence;

    private SessionState(String sessionId, Instant lastWriteTime, LogPosition lastWritePosition,
                         long writeSequence, long capturedSequence, long unknownSequence) {
        this.sessionId = sessionId;
        this.lastWriteTime = lastWriteTime;
        this.lastWritePosition = lastWritePosition;
        this.writeSequence = writeSequence;
        this.capturedSequence = capturedSequence;
        this.unknownSequence = unknownSequence;
    }

    public static SessionState fresh(String sessionId) {
        return new SessionState(sessionId, null, null, 0, 0, 0);
    }

    public String getSessionId() {
        return sessionId;
    }

    public Optional<Instant> getLastWriteTime() {
        return Optional.ofNullable(lastWriteTime);
    }

    public Optional<LogPosition> getLastWritePosition() {
        return Optional.ofNullable(lastWritePosition);
    }

    /**
     * Sequence number of the session's most recently committed write, 0 before the first.
     */
    public long getWriteSequence() {
        return writeSequence;
    }

    /**
     * True when the newest write whose position capture failed is newer than the newest
     * write whose capture succeeded.
     */
    public boolean isWritePositionUnknown() {
        return unknownSequence > capturedSequence;
    }

    SessionState withNextWriteSequence() {
        return new SessionState(sessionId, lastWriteTime, lastWritePosition,
                writeSequence + 1, capturedSequence, unknownSequence);
    }

    SessionState withLastWriteTime(Instant time) {
        Instant next = lastWriteTime == null || time.isAfter(lastWriteTime) ? time : lastWriteTime;
        return new SessionState(sessionId, next, lastWritePosition,
                writeSequence, capturedSequence, unknownSequence);
    }

    SessionState withWritePosition(long sequence, LogPosition position) {
        LogPosition next = lastWritePosition == null ? position : LogPosition.max(lastWritePosition, position);
        return new SessionState(sessionId, lastWriteTime, next,
                writeSequence, Math.max(capturedSequence, sequence), unknownSequence);
    }

    SessionState withWritePositionUnknown(long sequence) {
        return new SessionState(sessionId, lastWriteTime, lastWritePosition,
                writeSequence, capturedSequence, Math.max(unknownSequence, sequence));
    }

    @Override
    public String toString() {
        return "SessionState{" + sessionId
                + ", lastWriteTime=" + lastWriteTime
                + ", lastWritePosition=" + lastWritePosition
                + ", writeSequence=" + writeSequence
                + (isWritePositionUnknown() ? ", positionUnknown" : "")
                + "}";
    }
}
