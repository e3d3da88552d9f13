package com.example.readrouting.controller;

import com.example.readrouting.endpoint.NodeEndpoint;
import com.example.readrouting.exception.ReadRoutingException;
import com.example.readrouting.model.ReplicationLagReport;
import com.example.readrouting.position.LogPosition;
import com.example.readrouting.registry.ReplicaRegistry;
import com.example.readrouting.service.ReadRoutingService;
import com.example.readrouting.session.SessionState;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Monitoring view of replication progress and per-session routing state.
 */
@RestController
@RequestMapping("/api/db")
public class ReplicationStatusController {

    private final ReplicaRegistry registry;
    private final ReadRoutingService routingService;

    public ReplicationStatusController(ReplicaRegistry registry, ReadRoutingService routingService) {
        this.registry = registry;
        this.routingService = routingService;
    }

    /**
     * Primary write position next to every replica's replay position.
     * Positions that cannot be read are reported as unavailable rather than failing the request.
     */
    @GetMapping("/replication-status")
    public ResponseEntity<Map<String, Object>> getReplicationStatus() {
        Map<String, Object> response = new HashMap<>();
        response.put("strategy", routingService.activeStrategy().name());

        LogPosition primaryPosition = null;
        Map<String, Object> primary = new HashMap<>();
        primary.put("id", registry.primaryNode().getId());
        try {
            primaryPosition = registry.primary().currentWritePosition();
            primary.put("write_position", primaryPosition.toString());
        } catch (ReadRoutingException e) {
            primary.put("write_position", "UNAVAILABLE");
            primary.put("error", e.getMessage());
        }
        response.put("primary", primary);

        List<Map<String, Object>> replicas = new ArrayList<>();
        for (NodeEndpoint replica : registry.replicas()) {
            Map<String, Object> entry = new HashMap<>();
            entry.put("id", replica.node().getId());
            try {
                LogPosition replayed = replica.lastReplayPosition();
                entry.put("replay_position", replayed.toString());
                if (primaryPosition != null) {
                    boolean caughtUp = primaryPosition.isReachedBy(replayed);
                    entry.put("caught_up", caughtUp);
                    entry.put("status", caughtUp ? "SYNCHRONIZED" : "CATCHING_UP");
                }
            } catch (ReadRoutingException e) {
                entry.put("replay_position", "UNAVAILABLE");
                entry.put("status", "UNAVAILABLE");
                entry.put("error", e.getMessage());
            }
            replicas.add(entry);
        }
        response.put("replicas", replicas);

        try {
            List<Map<String, Object>> lag = new ArrayList<>();
            for (ReplicationLagReport report : registry.primary().replicationStatus()) {
                Map<String, Object> row = new HashMap<>();
                row.put("application_name", report.getApplicationName());
                row.put("state", report.getState());
                row.put("replay_lag_bytes", report.getReplayLagBytes());
                row.put("replay_lag_seconds", report.getReplayLagSeconds());
                lag.add(row);
            }
            response.put("standbys", lag);
        } catch (ReadRoutingException e) {
            response.put("standbys_error", e.getMessage());
        }

        return ResponseEntity.ok(response);
    }

    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<Map<String, Object>> getSession(@PathVariable String sessionId) {
        Optional<SessionState> state = routingService.session(sessionId);
        Map<String, Object> response = new HashMap<>();
        response.put("session_id", sessionId);
        if (state.isEmpty()) {
            response.put("message", "Unknown session");
            return new ResponseEntity<>(response, HttpStatus.NOT_FOUND);
        }
        response.put("last_write_time", state.get().getLastWriteTime().map(Object::toString).orElse(null));
        response.put("last_write_position", state.get().getLastWritePosition().map(Object::toString).orElse(null));
        response.put("write_position_unknown", state.get().isWritePositionUnknown());
        return ResponseEntity.ok(response);
    }
}
