package com.example.readrouting;

import com.example.readrouting.endpoint.NodeEndpoint;
import com.example.readrouting.model.ReplicaNode;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Mocked endpoints that already know their node identity.
 */
public final class TestNodes {

    private TestNodes() {
    }

    public static NodeEndpoint primary(String id) {
        return endpoint(ReplicaNode.primary(id, "localhost:5432/testdb"));
    }

    public static NodeEndpoint replica(String id, int port) {
        return endpoint(ReplicaNode.replica(id, "localhost:" + port + "/testdb"));
    }

    private static NodeEndpoint endpoint(ReplicaNode node) {
        NodeEndpoint endpoint = mock(NodeEndpoint.class);
        when(endpoint.node()).thenReturn(node);
        return endpoint;
    }
}
