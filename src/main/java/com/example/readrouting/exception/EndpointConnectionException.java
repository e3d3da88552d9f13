package com.example.readrouting.exception;

/**
 * Endpoint unreachable, pool exhausted or authentication rejected.
 * Fatal for the attempted operation; the core never retries it.
 */
public class EndpointConnectionException extends ReadRoutingException {

    private final String nodeId;

    public EndpointConnectionException(String nodeId, String message, Throwable cause) {
        super(message, cause);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
