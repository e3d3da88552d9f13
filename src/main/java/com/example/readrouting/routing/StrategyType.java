package com.example.readrouting.routing;

/**
 * The read-routing strategies a deployment can run. Exactly one is active at a time.
 */
public enum StrategyType {
    /** Read from primary for a fixed window after the session's last write. */
    TIME_BASED,
    /** Read from a replica only once it has replayed the session's last write position. */
    LOG_POSITION,
    /** Pin each session to one replica by hashing its key. */
    STICKY_HASH
}
