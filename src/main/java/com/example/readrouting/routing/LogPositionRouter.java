package com.example.readrouting.routing;

import com.example.readrouting.endpoint.NodeEndpoint;
import com.example.readrouting.exception.PositionUnavailableException;
import com.example.readrouting.model.RoutingDecision;
import com.example.readrouting.position.LogPosition;
import com.example.readrouting.registry.ReplicaRegistry;
import com.example.readrouting.session.SessionState;
import com.example.readrouting.session.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Routes a read to the replica only if that replica has replayed the WAL up to the
 * position the primary reported right after the session's last write.
 *
 * <p>The check is exact at the moment it runs. Between the check and the read a newer
 * write of the same session may land; the replica can only fall further behind after
 * passing, so the exposure is bounded by the time between check and query.
 *
 * <p>Fails closed: if either position cannot be obtained the replica counts as lagging.
 * Captures are tagged with the session's write sequence, so a late capture of an older
 * write never releases a session pinned by a newer write whose capture failed.
 */
public class LogPositionRouter implements ReadRoutingStrategy {

    private static final Logger log = LoggerFactory.getLogger(LogPositionRouter.class);

    private final SessionStore sessionStore;
    private final ReplicaRegistry registry;
    private final NodeEndpoint preferredReplica;

    public LogPositionRouter(SessionStore sessionStore, ReplicaRegistry registry, String preferredReplicaId) {
        this.sessionStore = sessionStore;
        this.registry = registry;
        this.preferredReplica = registry.preferredReplica(preferredReplicaId);
    }

    @Override
    public StrategyType type() {
        return StrategyType.LOG_POSITION;
    }

    /**
     * Capture the primary's WAL position after a committed write.
     */
    @Override
    public void recordWrite(String sessionId) {
        long sequence = sessionStore.nextWriteSequence(sessionId);
        try {
            LogPosition position = registry.primary().currentWritePosition();
            SessionState state = sessionStore.recordWritePosition(sessionId, sequence, position);
            log.debug("Session {} wrote at {}", sessionId, state.getLastWritePosition().orElse(position));
        } catch (PositionUnavailableException e) {
            log.warn("Could not capture write position for session {}, pinning its reads to primary: {}",
                    sessionId, e.getMessage());
            sessionStore.markWritePositionUnknown(sessionId, sequence);
        }
    }

    /**
     * @return true if {@code replica} has replayed this session's last write
     */
    public boolean isCaughtUp(String sessionId, NodeEndpoint replica) {
        Optional<SessionState> state = sessionStore.find(sessionId);
        if (state.isEmpty()) {
            return true;
        }
        if (state.get().isWritePositionUnknown()) {
            return false;
        }
        Optional<LogPosition> written = state.get().getLastWritePosition();
        if (written.isEmpty()) {
            return true;
        }
        try {
            LogPosition replayed = replica.lastReplayPosition();
            boolean caughtUp = written.get().isReachedBy(replayed);
            log.debug("Session {} wrote at {}, {} replayed {}: caughtUp={}",
                    sessionId, written.get(), replica.node().getId(), replayed, caughtUp);
            return caughtUp;
        } catch (PositionUnavailableException e) {
            log.warn("Replay position of {} unavailable, treating it as lagging: {}",
                    replica.node().getId(), e.getMessage());
            return false;
        }
    }

    public RoutingDecision target(String sessionId, NodeEndpoint replica) {
        if (isCaughtUp(sessionId, replica)) {
            return new RoutingDecision(replica.node(), "REPLICA (" + replica.node().getId() + ", caught up)");
        }
        return new RoutingDecision(registry.primaryNode(), "PRIMARY (replica lagging)");
    }

    @Override
    public RoutingDecision route(String sessionId) {
        return target(sessionId, preferredReplica);
    }
}
