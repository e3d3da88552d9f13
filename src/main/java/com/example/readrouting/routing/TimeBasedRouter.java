package com.example.readrouting.routing;

import com.example.readrouting.exception.RoutingConfigurationException;
import com.example.readrouting.model.ReplicaNode;
import com.example.readrouting.model.RoutingDecision;
import com.example.readrouting.registry.ReplicaRegistry;
import com.example.readrouting.session.SessionState;
import com.example.readrouting.session.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Routes a session's reads to the primary for {@code threshold} after its last write,
 * and to the preferred replica otherwise.
 *
 * This is a heuristic. A replica that caught up early is skipped needlessly, and a replica
 * lagging longer than the threshold is read anyway. It gives approximate read-your-writes,
 * not a guarantee.
 */
public class TimeBasedRouter implements ReadRoutingStrategy {

    private static final Logger log = LoggerFactory.getLogger(TimeBasedRouter.class);

    public static final Duration DEFAULT_THRESHOLD = Duration.ofSeconds(5);

    private final SessionStore sessionStore;
    private final ReplicaRegistry registry;
    private final Clock clock;
    private final Duration threshold;
    private final ReplicaNode replica;

    public TimeBasedRouter(SessionStore sessionStore, ReplicaRegistry registry, Clock clock,
                           Duration threshold, String preferredReplicaId) {
        if (threshold == null || threshold.isNegative() || threshold.isZero()) {
            throw new RoutingConfigurationException("Time threshold must be positive, got " + threshold);
        }
        this.sessionStore = sessionStore;
        this.registry = registry;
        this.clock = clock;
        this.threshold = threshold;
        this.replica = registry.preferredReplica(preferredReplicaId).node();
    }

    @Override
    public StrategyType type() {
        return StrategyType.TIME_BASED;
    }

    @Override
    public void recordWrite(String sessionId) {
        sessionStore.recordWriteTime(sessionId, clock.instant());
    }

    /**
     * @return true while the session's last write is younger than the threshold
     */
    public boolean shouldReadFromPrimary(String sessionId) {
        Optional<Instant> lastWrite = sessionStore.find(sessionId).flatMap(SessionState::getLastWriteTime);
        if (lastWrite.isEmpty()) {
            return false;
        }
        Duration elapsed = Duration.between(lastWrite.get(), clock.instant());
        return elapsed.compareTo(threshold) < 0;
    }

    public ReplicaNode target(String sessionId) {
        return shouldReadFromPrimary(sessionId) ? registry.primaryNode() : replica;
    }

    @Override
    public RoutingDecision route(String sessionId) {
        RoutingDecision decision = shouldReadFromPrimary(sessionId)
                ? new RoutingDecision(registry.primaryNode(), "PRIMARY (recent write)")
                : new RoutingDecision(replica, "REPLICA (" + replica.getId() + ")");
        log.debug("Session {} routed to {}", sessionId, decision);
        return decision;
    }

    public Duration getThreshold() {
        return threshold;
    }
}
