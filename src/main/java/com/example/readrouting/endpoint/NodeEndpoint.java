package com.example.readrouting.endpoint;

import com.example.readrouting.model.ReadQuery;
import com.example.readrouting.model.ReplicaNode;
import com.example.readrouting.model.ReplicationLagReport;
import com.example.readrouting.model.ReplicationRecord;
import com.example.readrouting.position.LogPosition;

import java.time.Duration;
import java.util.List;

/**
 * Everything the routing core needs from one database node.
 *
 * Row operations throw {@link com.example.readrouting.exception.EndpointConnectionException}
 * or {@link com.example.readrouting.exception.EndpointQueryException}; position operations throw
 * {@link com.example.readrouting.exception.PositionUnavailableException}. Calling an operation that
 * does not apply to the node's role throws
 * {@link com.example.readrouting.exception.RoutingConfigurationException}.
 */
public interface NodeEndpoint {

    ReplicaNode node();

    /**
     * Append one row. Primary only.
     *
     * @return generated record id
     */
    long insert(String payload, String ownerId);

    /**
     * Newest rows first, bounded by the query limit.
     */
    List<ReplicationRecord> selectLatest(ReadQuery query);

    /**
     * The primary's current WAL write position.
     */
    LogPosition currentWritePosition();

    /**
     * The last WAL position this replica has replayed.
     */
    LogPosition lastReplayPosition();

    /**
     * Per-standby lag as reported by the primary. Primary only.
     */
    List<ReplicationLagReport> replicationStatus();

    /**
     * Insert {@code rows} generated rows of roughly {@code padding} bytes each. Primary only.
     *
     * @return number of rows inserted
     */
    int bulkInsert(int rows, int padding, Duration timeout);

    /**
     * Cheap reachability probe. Never throws.
     */
    boolean isAvailable();
}
