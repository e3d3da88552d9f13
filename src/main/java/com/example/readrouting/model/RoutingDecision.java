package com.example.readrouting.model;

import java.util.Objects;

/**
 * Where one read goes, and a human-readable reason. Always exactly one target.
 */
public final class RoutingDecision {

    private final ReplicaNode target;
    private final String label;

    public RoutingDecision(ReplicaNode target, String label) {
        this.target = Objects.requireNonNull(target, "target");
        this.label = Objects.requireNonNull(label, "label");
    }

    public ReplicaNode getTarget() {
        return target;
    }

    public String getLabel() {
        return label;
    }

    public boolean isPrimary() {
        return target.isPrimary();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RoutingDecision)) {
            return false;
        }
        RoutingDecision that = (RoutingDecision) o;
        return target.equals(that.target) && label.equals(that.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, label);
    }

    @Override
    public String toString() {
        return label + " -> " + target.getId();
    }
}
