package com.example.readrouting.session;

import com.example.readrouting.position.LogPosition;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

/**
 * Per-session routing state, keyed by session id.
 *
 * Every mutation runs inside {@link ConcurrentMap#compute}, which serialises updates for the
 * same key while leaving other sessions untouched.
 */
@Component
public class SessionStore {

    private final ConcurrentMap<String, SessionState> sessions = new ConcurrentHashMap<>();

    public SessionState getOrCreate(String sessionId) {
        return sessions.computeIfAbsent(requireId(sessionId), SessionState::fresh);
    }

    public Optional<SessionState> find(String sessionId) {
        return Optional.ofNullable(sessions.get(requireId(sessionId)));
    }

    /**
     * Record a write time. The stored time never moves backwards, so an update that lost a
     * race with a later write of the same session keeps the later time.
     */
    public SessionState recordWriteTime(String sessionId, Instant time) {
        Objects.requireNonNull(time, "time");
        return update(sessionId, state -> state.withLastWriteTime(time));
    }

    /**
     * Number a committed write of the session. Must be called after the write commits and
     * before its position is captured, so any capture for a higher number covers every
     * write with a lower one.
     *
     * @return the write's sequence number, starting at 1
     */
    public long nextWriteSequence(String sessionId) {
        return update(sessionId, SessionState::withNextWriteSequence).getWriteSequence();
    }

    /**
     * Record the primary position captured after write {@code sequence}. Positions never
     * move backwards. The capture clears an unknown position only if no newer write has
     * failed its capture.
     */
    public SessionState recordWritePosition(String sessionId, long sequence, LogPosition position) {
        Objects.requireNonNull(position, "position");
        return update(sessionId, state -> state.withWritePosition(sequence, position));
    }

    /**
     * Record that the position after write {@code sequence} could not be captured. The session
     * stays unknown until a capture for this write or a newer one succeeds.
     */
    public SessionState markWritePositionUnknown(String sessionId, long sequence) {
        return update(sessionId, state -> state.withWritePositionUnknown(sequence));
    }

    public void remove(String sessionId) {
        sessions.remove(requireId(sessionId));
    }

    public int size() {
        return sessions.size();
    }

    private SessionState update(String sessionId, UnaryOperator<SessionState> change) {
        return sessions.compute(requireId(sessionId),
                (id, current) -> change.apply(current != null ? current : SessionState.fresh(id)));
    }

    private static String requireId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("Session id must not be blank");
        }
        return sessionId;
    }
}
