package com.example.readrouting.util;

import com.example.readrouting.endpoint.NodeEndpoint;
import com.example.readrouting.exception.PositionUnavailableException;
import com.example.readrouting.position.LogPosition;
import com.example.readrouting.registry.ReplicaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Waits for replicas to replay up to a given WAL position by polling, instead of sleeping
 * for a fixed time and hoping replication kept up.
 */
public final class ReplayPositionAwaiter {

    private static final Logger log = LoggerFactory.getLogger(ReplayPositionAwaiter.class);

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(10);

    private ReplayPositionAwaiter() {
    }

    /**
     * Poll {@code replica} until its replay position reaches {@code target}.
     * An unavailable position while polling counts as "not yet".
     *
     * @return true if the replica reached the target before the timeout
     */
    public static boolean awaitReplay(NodeEndpoint replica, LogPosition target, Duration timeout, Duration pollInterval) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            try {
                if (target.isReachedBy(replica.lastReplayPosition())) {
                    return true;
                }
            } catch (PositionUnavailableException e) {
                log.debug("Replay position of {} unavailable while waiting: {}", replica.node().getId(), e.getMessage());
            }
            if (System.nanoTime() - deadline >= 0) {
                log.warn("{} did not replay {} within {}", replica.node().getId(), target, timeout);
                return false;
            }
            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    /**
     * Capture the primary's current position and wait for every replica to replay it.
     *
     * @return true if all replicas caught up within {@code timeout}
     */
    public static boolean awaitAllReplicas(ReplicaRegistry registry, Duration timeout) {
        LogPosition target = registry.primary().currentWritePosition();
        long deadline = System.nanoTime() + timeout.toNanos();
        for (NodeEndpoint replica : registry.replicas()) {
            Duration remaining = Duration.ofNanos(Math.max(0, deadline - System.nanoTime()));
            if (!awaitReplay(replica, target, remaining, DEFAULT_POLL_INTERVAL)) {
                return false;
            }
        }
        return true;
    }
}
