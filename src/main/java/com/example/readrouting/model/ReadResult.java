package com.example.readrouting.model;

import java.util.List;
import java.util.Objects;

/**
 * Rows returned by a routed read together with the decision that produced them.
 */
public final class ReadResult {

    private final List<ReplicationRecord> rows;
    private final RoutingDecision decision;

    public ReadResult(List<ReplicationRecord> rows, RoutingDecision decision) {
        this.rows = List.copyOf(rows);
        this.decision = Objects.requireNonNull(decision, "decision");
    }

    public List<ReplicationRecord> getRows() {
        return rows;
    }

    public RoutingDecision getDecision() {
        return decision;
    }

    public String getSource() {
        return decision.getLabel();
    }
}
