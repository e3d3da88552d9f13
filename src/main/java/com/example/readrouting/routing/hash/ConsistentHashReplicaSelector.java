package com.example.readrouting.routing.hash;

import com.example.readrouting.exception.RoutingConfigurationException;
import com.example.readrouting.model.ReplicaNode;

import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Consistent-hash ring with virtual nodes. Adding or removing one of N replicas moves
 * roughly 1/N of the keys instead of nearly all of them.
 *
 * The ring for the most recently seen replica list is cached and rebuilt when the list changes.
 */
public class ConsistentHashReplicaSelector implements ReplicaSelector {

    public static final int DEFAULT_VIRTUAL_NODES = 160;

    private final int virtualNodes;
    private volatile Ring ring;

    public ConsistentHashReplicaSelector() {
        this(DEFAULT_VIRTUAL_NODES);
    }

    public ConsistentHashReplicaSelector(int virtualNodes) {
        if (virtualNodes <= 0) {
            throw new RoutingConfigurationException("Virtual node count must be positive, got " + virtualNodes);
        }
        this.virtualNodes = virtualNodes;
    }

    @Override
    public ReplicaNode select(String sessionKey, List<ReplicaNode> replicas) {
        if (replicas == null || replicas.isEmpty()) {
            throw new RoutingConfigurationException("Cannot select a replica from an empty replica set");
        }
        if (sessionKey == null) {
            throw new IllegalArgumentException("Session key must not be null");
        }
        return ringFor(replicas).locate(SessionKeyHasher.md5Prefix64(sessionKey));
    }

    private Ring ringFor(List<ReplicaNode> replicas) {
        Ring current = ring;
        if (current != null && current.members.equals(replicas)) {
            return current;
        }
        Ring rebuilt = new Ring(List.copyOf(replicas), virtualNodes);
        ring = rebuilt;
        return rebuilt;
    }

    private static final class Ring {

        private final List<ReplicaNode> members;
        private final NavigableMap<Long, ReplicaNode> points = new TreeMap<>();

        Ring(List<ReplicaNode> members, int virtualNodes) {
            this.members = members;
            for (ReplicaNode member : members) {
                for (int i = 0; i < virtualNodes; i++) {
                    // on a (vanishingly rare) collision the first member keeps the point
                    points.putIfAbsent(SessionKeyHasher.md5Prefix64(member.getId() + "#" + i), member);
                }
            }
        }

        ReplicaNode locate(long hash) {
            Map.Entry<Long, ReplicaNode> entry = points.ceilingEntry(hash);
            // wrap around past the highest point
            return entry != null ? entry.getValue() : points.firstEntry().getValue();
        }
    }
}
