package com.example.readrouting.registry;

import com.example.readrouting.endpoint.NodeEndpoint;
import com.example.readrouting.exception.RoutingConfigurationException;
import com.example.readrouting.model.NodeRole;
import com.example.readrouting.model.ReplicaNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static topology: exactly one primary and zero or more replicas, fixed for a run.
 *
 * Replica order is the configured order; routers that index into the replica list
 * rely on it being stable.
 */
public class ReplicaRegistry {

    private final NodeEndpoint primary;
    private final List<NodeEndpoint> replicas;
    private final List<ReplicaNode> replicaNodes;
    private final Map<String, NodeEndpoint> byId;

    public ReplicaRegistry(NodeEndpoint primary, List<NodeEndpoint> replicas) {
        if (primary == null) {
            throw new RoutingConfigurationException("A primary endpoint is required");
        }
        if (primary.node().getRole() != NodeRole.PRIMARY) {
            throw new RoutingConfigurationException("Node " + primary.node().getId() + " is not a primary");
        }
        Map<String, NodeEndpoint> index = new LinkedHashMap<>();
        index.put(primary.node().getId(), primary);

        List<ReplicaNode> nodes = new ArrayList<>();
        for (NodeEndpoint replica : replicas) {
            ReplicaNode node = replica.node();
            if (node.getRole() != NodeRole.REPLICA) {
                throw new RoutingConfigurationException("Node " + node.getId() + " is configured as a replica but has role " + node.getRole());
            }
            if (index.putIfAbsent(node.getId(), replica) != null) {
                throw new RoutingConfigurationException("Duplicate node id: " + node.getId());
            }
            nodes.add(node);
        }
        this.primary = primary;
        this.replicas = List.copyOf(replicas);
        this.replicaNodes = Collections.unmodifiableList(nodes);
        this.byId = Collections.unmodifiableMap(index);
    }

    public NodeEndpoint primary() {
        return primary;
    }

    public ReplicaNode primaryNode() {
        return primary.node();
    }

    public List<NodeEndpoint> replicas() {
        return replicas;
    }

    public List<ReplicaNode> replicaNodes() {
        return replicaNodes;
    }

    public Optional<NodeEndpoint> find(String nodeId) {
        return Optional.ofNullable(byId.get(nodeId));
    }

    /**
     * @throws RoutingConfigurationException if the node is not part of this topology
     */
    public NodeEndpoint endpointFor(ReplicaNode node) {
        NodeEndpoint endpoint = byId.get(node.getId());
        if (endpoint == null) {
            throw new RoutingConfigurationException("Unknown node: " + node.getId());
        }
        return endpoint;
    }

    /**
     * Resolve the replica used by strategies that target a single preferred replica.
     * A null or blank id selects the first configured replica.
     *
     * @throws RoutingConfigurationException if no replica is configured or the id is not a replica
     */
    public NodeEndpoint preferredReplica(String replicaId) {
        if (replicas.isEmpty()) {
            throw new RoutingConfigurationException("No replicas configured");
        }
        if (replicaId == null || replicaId.isBlank()) {
            return replicas.get(0);
        }
        NodeEndpoint endpoint = byId.get(replicaId);
        if (endpoint == null || endpoint.node().getRole() != NodeRole.REPLICA) {
            throw new RoutingConfigurationException("Preferred replica " + replicaId + " is not a configured replica");
        }
        return endpoint;
    }
}
