package com.example.readrouting.routing;

import com.example.readrouting.model.RoutingDecision;

/**
 * Decides, per read, which node serves a session.
 *
 * Implementations never write anywhere; {@link #recordWrite(String)} only updates
 * session bookkeeping after the caller has committed a write on the primary.
 */
public interface ReadRoutingStrategy {

    StrategyType type();

    /**
     * Called after a write of this session committed on the primary.
     */
    void recordWrite(String sessionId);

    /**
     * Pick the node for the session's next read.
     */
    RoutingDecision route(String sessionId);
}
