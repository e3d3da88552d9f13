package com.example.readrouting.exception;

/**
 * Malformed statement or constraint violation reported by an endpoint.
 */
public class EndpointQueryException extends ReadRoutingException {

    private final String nodeId;

    public EndpointQueryException(String nodeId, String message, Throwable cause) {
        super(message, cause);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
