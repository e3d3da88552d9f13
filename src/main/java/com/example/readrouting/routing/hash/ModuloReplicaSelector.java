package com.example.readrouting.routing.hash;

import com.example.readrouting.exception.RoutingConfigurationException;
import com.example.readrouting.model.ReplicaNode;

import java.math.BigInteger;
import java.util.List;

/**
 * {@code md5(key) mod N}.
 *
 * Changing N remaps almost every key. Use {@link ConsistentHashReplicaSelector} when
 * replica membership can change.
 */
public class ModuloReplicaSelector implements ReplicaSelector {

    @Override
    public ReplicaNode select(String sessionKey, List<ReplicaNode> replicas) {
        if (replicas == null || replicas.isEmpty()) {
            throw new RoutingConfigurationException("Cannot select a replica from an empty replica set");
        }
        if (sessionKey == null) {
            throw new IllegalArgumentException("Session key must not be null");
        }
        BigInteger hash = SessionKeyHasher.md5AsUnsigned(sessionKey);
        int index = hash.mod(BigInteger.valueOf(replicas.size())).intValue();
        return replicas.get(index);
    }
}
