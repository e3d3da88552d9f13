package com.example.readrouting.demo;

import com.example.readrouting.model.ReplicationLagReport;
import com.example.readrouting.registry.ReplicaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Widens primary/replica divergence by bulk-inserting padding rows on the primary.
 * Test tooling only; the routing core never calls it.
 */
@Component
public class LagGenerator {

    private static final Logger log = LoggerFactory.getLogger(LagGenerator.class);

    private static final Duration BULK_TIMEOUT = Duration.ofMinutes(10);

    private final ReplicaRegistry registry;

    public LagGenerator(ReplicaRegistry registry) {
        this.registry = registry;
    }

    public List<ReplicationLagReport> createLag(int rows, int padding) {
        log.info("Inserting {} rows of {} bytes on {} to create replication lag",
                rows, padding, registry.primaryNode().getId());
        long start = System.nanoTime();
        int inserted = registry.primary().bulkInsert(rows, padding, BULK_TIMEOUT);
        log.info("Inserted {} rows in {} ms", inserted, Duration.ofNanos(System.nanoTime() - start).toMillis());

        List<ReplicationLagReport> reports = registry.primary().replicationStatus();
        for (ReplicationLagReport report : reports) {
            log.info("  {}", report);
        }
        return reports;
    }
}
