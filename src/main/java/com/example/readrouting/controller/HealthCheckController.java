package com.example.readrouting.controller;

import com.example.readrouting.endpoint.NodeEndpoint;
import com.example.readrouting.registry.ReplicaRegistry;
import com.example.readrouting.service.ReadRoutingService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * Reachability of each configured node. Reporting only: routing never consults it.
 */
@RestController
@RequestMapping("/health")
public class HealthCheckController {

    private final ReplicaRegistry registry;
    private final ReadRoutingService routingService;

    public HealthCheckController(ReplicaRegistry registry, ReadRoutingService routingService) {
        this.registry = registry;
        this.routingService = routingService;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "UP");
        response.put("strategy", routingService.activeStrategy().name());
        response.put("timestamp", System.currentTimeMillis());
        return ResponseEntity.ok(response);
    }

    /**
     * 200 when every node answers, 200 with {@code degraded=true} when only replicas are down,
     * 503 when the primary is down.
     */
    @GetMapping("/db")
    public ResponseEntity<Map<String, Object>> databaseStatus() {
        Map<String, Object> nodes = new HashMap<>();
        boolean primaryUp = registry.primary().isAvailable();
        nodes.put(registry.primaryNode().getId(), primaryUp ? "HEALTHY" : "UNAVAILABLE");

        boolean replicasUp = true;
        for (NodeEndpoint replica : registry.replicas()) {
            boolean up = replica.isAvailable();
            replicasUp &= up;
            nodes.put(replica.node().getId(), up ? "HEALTHY" : "UNAVAILABLE");
        }

        Map<String, Object> response = new HashMap<>();
        response.put("database", nodes);
        response.put("degraded", !replicasUp);
        response.put("timestamp", System.currentTimeMillis());

        if (!primaryUp) {
            response.put("message", "Primary is unreachable, writes will fail");
            return new ResponseEntity<>(response, HttpStatus.SERVICE_UNAVAILABLE);
        }
        response.put("message", replicasUp ? "All systems operational" : "One or more replicas are unreachable");
        return ResponseEntity.ok(response);
    }
}
