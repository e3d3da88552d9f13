package com.example.readrouting.config;

import com.example.readrouting.endpoint.JdbcNodeEndpoint;
import com.example.readrouting.endpoint.NodeEndpoint;
import com.example.readrouting.exception.RoutingConfigurationException;
import com.example.readrouting.model.EndpointDescriptor;
import com.example.readrouting.model.NodeRole;
import com.example.readrouting.model.ReplicaNode;
import com.example.readrouting.registry.ReplicaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the primary/replica topology: one pooled JDBC endpoint per configured node.
 */
@Configuration
@EnableConfigurationProperties(RoutingProperties.class)
public class ReplicaRegistryConfig {

    private static final Logger log = LoggerFactory.getLogger(ReplicaRegistryConfig.class);

    @Bean
    public ReplicaRegistry replicaRegistry(RoutingProperties properties,
                                           EndpointDataSourceFactory dataSourceFactory,
                                           EndpointCredentialsResolver credentialsResolver) {
        NodeEndpoint primary = createEndpoint(properties.getPrimary(), NodeRole.PRIMARY, "primary",
                properties, dataSourceFactory, credentialsResolver);

        List<NodeEndpoint> replicas = new ArrayList<>();
        List<RoutingProperties.EndpointProperties> configured = properties.getReplicas();
        for (int i = 0; i < configured.size(); i++) {
            replicas.add(createEndpoint(configured.get(i), NodeRole.REPLICA, "replica" + (i + 1),
                    properties, dataSourceFactory, credentialsResolver));
        }

        ReplicaRegistry registry = new ReplicaRegistry(primary, replicas);
        log.info("Topology: primary={} replicas={}", registry.primaryNode(), registry.replicaNodes());
        return registry;
    }

    private NodeEndpoint createEndpoint(RoutingProperties.EndpointProperties endpoint, NodeRole role,
                                        String defaultId, RoutingProperties properties,
                                        EndpointDataSourceFactory dataSourceFactory,
                                        EndpointCredentialsResolver credentialsResolver) {
        if (endpoint == null) {
            throw new RoutingConfigurationException("Missing endpoint configuration for " + defaultId);
        }
        String id = endpoint.getId() == null || endpoint.getId().isBlank() ? defaultId : endpoint.getId();
        EndpointDescriptor descriptor = credentialsResolver.resolve(endpoint);
        ReplicaNode node = new ReplicaNode(id, descriptor.address(), role);
        return new JdbcNodeEndpoint(node,
                dataSourceFactory.createDataSource(node, descriptor),
                properties.getQueryTimeout(),
                properties.getPositionCheckTimeout());
    }
}
