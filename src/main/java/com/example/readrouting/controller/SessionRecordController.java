package com.example.readrouting.controller;

import com.example.readrouting.model.ReadQuery;
import com.example.readrouting.model.ReadResult;
import com.example.readrouting.model.ReplicationRecord;
import com.example.readrouting.service.ReadRoutingService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Session-scoped writes and routed reads over {@code replication_test}.
 */
@RestController
@RequestMapping("/api/sessions")
public class SessionRecordController {

    private final ReadRoutingService routingService;

    public SessionRecordController(ReadRoutingService routingService) {
        this.routingService = routingService;
    }

    /**
     * Write one record for the session. Always lands on the primary.
     */
    @PostMapping("/{sessionId}/records")
    public ResponseEntity<Map<String, Object>> write(@PathVariable String sessionId,
                                                     @RequestBody Map<String, String> body) {
        long id = routingService.write(sessionId, body.get("data"));

        Map<String, Object> response = new HashMap<>();
        response.put("id", id);
        response.put("session_id", sessionId);
        response.put("strategy", routingService.activeStrategy().name());
        return new ResponseEntity<>(response, HttpStatus.CREATED);
    }

    /**
     * Read the newest records. With {@code mine=true} only the session's own records are returned.
     */
    @GetMapping("/{sessionId}/records")
    public ResponseEntity<Map<String, Object>> read(@PathVariable String sessionId,
                                                    @RequestParam(defaultValue = "5") int limit,
                                                    @RequestParam(defaultValue = "false") boolean mine) {
        ReadQuery query = mine ? ReadQuery.latestOwnedBy(sessionId, limit) : ReadQuery.latest(limit);
        ReadResult result = routingService.read(sessionId, query);

        Map<String, Object> response = new HashMap<>();
        response.put("source", result.getSource());
        response.put("target", result.getDecision().getTarget().getId());
        response.put("count", result.getRows().size());
        response.put("rows", toRows(result.getRows()));
        return ResponseEntity.ok(response);
    }

    private static List<Map<String, Object>> toRows(List<ReplicationRecord> records) {
        List<Map<String, Object>> rows = new ArrayList<>(records.size());
        for (ReplicationRecord record : records) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", record.getId());
            row.put("data", record.getData());
            row.put("owner_id", record.getOwnerId());
            row.put("created_at", record.getCreatedAt() != null ? record.getCreatedAt().toString() : null);
            rows.add(row);
        }
        return rows;
    }
}
