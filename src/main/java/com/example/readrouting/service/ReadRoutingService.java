package com.example.readrouting.service;

import com.example.readrouting.endpoint.NodeEndpoint;
import com.example.readrouting.model.ReadQuery;
import com.example.readrouting.model.ReadResult;
import com.example.readrouting.model.ReplicationRecord;
import com.example.readrouting.model.RoutingDecision;
import com.example.readrouting.registry.ReplicaRegistry;
import com.example.readrouting.routing.ReadRoutingStrategy;
import com.example.readrouting.routing.StrategyType;
import com.example.readrouting.session.SessionState;
import com.example.readrouting.session.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Single entry point for session-scoped writes and reads.
 *
 * Writes always go to the primary. Reads go wherever the active strategy says, and
 * run only there: if that node fails, the error reaches the caller unchanged.
 */
public class ReadRoutingService {

    private static final Logger log = LoggerFactory.getLogger(ReadRoutingService.class);

    private final ReplicaRegistry registry;
    private final SessionStore sessionStore;
    private final ReadRoutingStrategy strategy;

    public ReadRoutingService(ReplicaRegistry registry, SessionStore sessionStore, ReadRoutingStrategy strategy) {
        this.registry = registry;
        this.sessionStore = sessionStore;
        this.strategy = strategy;
    }

    /**
     * Append {@code payload} on the primary, owned by the session, then update the
     * session's routing state for the active strategy.
     *
     * @return id of the new record
     */
    public long write(String sessionId, String payload) {
        if (payload == null || payload.isBlank()) {
            throw new IllegalArgumentException("Payload must not be blank");
        }
        sessionStore.getOrCreate(sessionId);
        long recordId = registry.primary().insert(payload, sessionId);
        strategy.recordWrite(sessionId);
        log.debug("Session {} wrote record {} to {}", sessionId, recordId, registry.primaryNode().getId());
        return recordId;
    }

    public ReadResult read(String sessionId, ReadQuery query) {
        sessionStore.getOrCreate(sessionId);
        RoutingDecision decision = strategy.route(sessionId);
        NodeEndpoint endpoint = registry.endpointFor(decision.getTarget());
        List<ReplicationRecord> rows = endpoint.selectLatest(query);
        log.debug("Session {} read {} rows from {}", sessionId, rows.size(), decision.getLabel());
        return new ReadResult(rows, decision);
    }

    public Optional<SessionState> session(String sessionId) {
        return sessionStore.find(sessionId);
    }

    public StrategyType activeStrategy() {
        return strategy.type();
    }
}
