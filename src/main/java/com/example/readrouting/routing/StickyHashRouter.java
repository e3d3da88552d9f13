package com.example.readrouting.routing;

import com.example.readrouting.exception.RoutingConfigurationException;
import com.example.readrouting.model.ReplicaNode;
import com.example.readrouting.model.RoutingDecision;
import com.example.readrouting.registry.ReplicaRegistry;
import com.example.readrouting.routing.hash.ReplicaSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Pins every session to one replica chosen by hashing the session key.
 *
 * Gives monotonic reads per session for a fixed replica set. It does not give
 * read-your-writes: the pinned replica may still lag behind the session's own write.
 */
public class StickyHashRouter implements ReadRoutingStrategy {

    private static final Logger log = LoggerFactory.getLogger(StickyHashRouter.class);

    private final ReplicaRegistry registry;
    private final ReplicaSelector selector;

    public StickyHashRouter(ReplicaRegistry registry, ReplicaSelector selector) {
        if (registry.replicaNodes().isEmpty()) {
            throw new RoutingConfigurationException("Sticky routing needs at least one replica");
        }
        this.registry = registry;
        this.selector = selector;
    }

    @Override
    public StrategyType type() {
        return StrategyType.STICKY_HASH;
    }

    /**
     * Writes carry no routing state for this strategy.
     */
    @Override
    public void recordWrite(String sessionId) {
    }

    public ReplicaNode selectReplica(String sessionKey, List<ReplicaNode> replicas) {
        return selector.select(sessionKey, replicas);
    }

    @Override
    public RoutingDecision route(String sessionId) {
        ReplicaNode node = selectReplica(sessionId, registry.replicaNodes());
        log.debug("Session {} pinned to {}", sessionId, node.getId());
        return new RoutingDecision(node, "REPLICA (" + node.getId() + ", sticky)");
    }
}
