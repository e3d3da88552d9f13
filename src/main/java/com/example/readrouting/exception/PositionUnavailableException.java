package com.example.readrouting.exception;

/**
 * A node could not report its WAL position (query failed, timed out or returned NULL).
 * Callers deciding freshness must treat this as "not caught up".
 */
public class PositionUnavailableException extends ReadRoutingException {

    private final String nodeId;

    public PositionUnavailableException(String nodeId, String message) {
        super(message);
        this.nodeId = nodeId;
    }

    public PositionUnavailableException(String nodeId, String message, Throwable cause) {
        super(message, cause);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
