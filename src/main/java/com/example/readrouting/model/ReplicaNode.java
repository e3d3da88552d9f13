package com.example.readrouting.model;

import java.util.Objects;

/**
 * Static identity of a node in the topology. Immutable for the lifetime of a run.
 */
public final class ReplicaNode {

    private final String id;
    private final String endpoint;
    private final NodeRole role;

    public ReplicaNode(String id, String endpoint, NodeRole role) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Node id must not be blank");
        }
        this.id = id;
        this.endpoint = endpoint;
        this.role = Objects.requireNonNull(role, "role");
    }

    public static ReplicaNode primary(String id, String endpoint) {
        return new ReplicaNode(id, endpoint, NodeRole.PRIMARY);
    }

    public static ReplicaNode replica(String id, String endpoint) {
        return new ReplicaNode(id, endpoint, NodeRole.REPLICA);
    }

    public String getId() {
        return id;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public NodeRole getRole() {
        return role;
    }

    public boolean isPrimary() {
        return role == NodeRole.PRIMARY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReplicaNode)) {
            return false;
        }
        ReplicaNode that = (ReplicaNode) o;
        return id.equals(that.id) && role == that.role && Objects.equals(endpoint, that.endpoint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, role);
    }

    @Override
    public String toString() {
        return role + "(" + id + "@" + endpoint + ")";
    }
}
