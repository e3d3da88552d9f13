package com.example.readrouting.routing.hash;

import com.example.readrouting.model.ReplicaNode;

import java.util.List;

/**
 * Deterministically maps a session key onto one member of a replica set.
 */
public interface ReplicaSelector {

    /**
     * @throws com.example.readrouting.exception.RoutingConfigurationException if {@code replicas} is empty
     */
    ReplicaNode select(String sessionKey, List<ReplicaNode> replicas);
}
