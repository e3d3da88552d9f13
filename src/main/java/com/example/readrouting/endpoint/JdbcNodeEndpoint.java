package com.example.readrouting.endpoint;

import com.example.readrouting.exception.EndpointConnectionException;
import com.example.readrouting.exception.EndpointQueryException;
import com.example.readrouting.exception.PositionUnavailableException;
import com.example.readrouting.exception.ReadRoutingException;
import com.example.readrouting.exception.RoutingConfigurationException;
import com.example.readrouting.model.NodeRole;
import com.example.readrouting.model.ReadQuery;
import com.example.readrouting.model.ReplicaNode;
import com.example.readrouting.model.ReplicationLagReport;
import com.example.readrouting.model.ReplicationRecord;
import com.example.readrouting.position.LogPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import javax.sql.DataSource;
import java.sql.Timestamp;
import java.time.Duration;
import java.util.List;

/**
 * {@link NodeEndpoint} backed by a pooled JDBC {@link DataSource} for one PostgreSQL node.
 *
 * Row statements and position probes use separate statement timeouts so a slow
 * position probe fails fast without shortening ordinary reads.
 */
public class JdbcNodeEndpoint implements NodeEndpoint {

    private static final Logger log = LoggerFactory.getLogger(JdbcNodeEndpoint.class);

    static final String INSERT_SQL =
            "INSERT INTO replication_test (data, owner_id) VALUES (?, ?) RETURNING id";
    static final String SELECT_LATEST_SQL =
            "SELECT id, data, owner_id, created_at FROM replication_test ORDER BY id DESC LIMIT ?";
    static final String SELECT_LATEST_OWNED_SQL =
            "SELECT id, data, owner_id, created_at FROM replication_test WHERE owner_id = ? ORDER BY id DESC LIMIT ?";
    static final String CURRENT_WAL_LSN_SQL = "SELECT pg_current_wal_lsn()::text";
    static final String REPLAY_WAL_LSN_SQL = "SELECT pg_last_wal_replay_lsn()::text";
    static final String REPLICATION_STATUS_SQL =
            "SELECT application_name, state, "
                    + "pg_wal_lsn_diff(pg_current_wal_lsn(), replay_lsn)::bigint AS lag_bytes, "
                    + "EXTRACT(EPOCH FROM replay_lag)::float8 AS lag_seconds "
                    + "FROM pg_stat_replication ORDER BY application_name";
    static final String BULK_INSERT_SQL =
            "INSERT INTO replication_test (data) "
                    + "SELECT 'Large-Data-' || i || '-' || repeat('X', ?) FROM generate_series(1, ?) i";

    private static final RowMapper<ReplicationRecord> RECORD_MAPPER = (rs, rowNum) -> {
        Timestamp createdAt = rs.getTimestamp("created_at");
        return new ReplicationRecord(
                rs.getLong("id"),
                rs.getString("data"),
                rs.getString("owner_id"),
                createdAt != null ? createdAt.toLocalDateTime() : null);
    };

    private final ReplicaNode node;
    private final DataSource dataSource;
    private final JdbcTemplate queryTemplate;
    private final JdbcTemplate positionTemplate;

    public JdbcNodeEndpoint(ReplicaNode node, DataSource dataSource, Duration queryTimeout, Duration positionTimeout) {
        this.node = node;
        this.dataSource = dataSource;
        this.queryTemplate = template(dataSource, queryTimeout);
        this.positionTemplate = template(dataSource, positionTimeout);
    }

    @Override
    public ReplicaNode node() {
        return node;
    }

    @Override
    public long insert(String payload, String ownerId) {
        requireRole(NodeRole.PRIMARY, "insert");
        try {
            Long id = queryTemplate.queryForObject(INSERT_SQL, Long.class, payload, ownerId);
            if (id == null) {
                throw new EndpointQueryException(node.getId(), "Insert on " + node.getId() + " returned no id", null);
            }
            return id;
        } catch (DataAccessException e) {
            throw translate("insert", e);
        }
    }

    @Override
    public List<ReplicationRecord> selectLatest(ReadQuery query) {
        try {
            if (query.getOwnerId().isPresent()) {
                return queryTemplate.query(SELECT_LATEST_OWNED_SQL, RECORD_MAPPER,
                        query.getOwnerId().get(), query.getLimit());
            }
            return queryTemplate.query(SELECT_LATEST_SQL, RECORD_MAPPER, query.getLimit());
        } catch (DataAccessException e) {
            throw translate("select", e);
        }
    }

    @Override
    public LogPosition currentWritePosition() {
        requireRole(NodeRole.PRIMARY, "currentWritePosition");
        return fetchPosition(CURRENT_WAL_LSN_SQL);
    }

    @Override
    public LogPosition lastReplayPosition() {
        requireRole(NodeRole.REPLICA, "lastReplayPosition");
        return fetchPosition(REPLAY_WAL_LSN_SQL);
    }

    @Override
    public List<ReplicationLagReport> replicationStatus() {
        requireRole(NodeRole.PRIMARY, "replicationStatus");
        try {
            return queryTemplate.query(REPLICATION_STATUS_SQL, (rs, rowNum) -> new ReplicationLagReport(
                    rs.getString("application_name"),
                    rs.getString("state"),
                    rs.getObject("lag_bytes", Long.class),
                    rs.getObject("lag_seconds", Double.class)));
        } catch (DataAccessException e) {
            throw translate("replicationStatus", e);
        }
    }

    @Override
    public int bulkInsert(int rows, int padding, Duration timeout) {
        requireRole(NodeRole.PRIMARY, "bulkInsert");
        if (rows <= 0 || padding < 0) {
            throw new IllegalArgumentException("rows must be positive and padding non-negative");
        }
        try {
            return template(dataSource, timeout).update(BULK_INSERT_SQL, padding, rows);
        } catch (DataAccessException e) {
            throw translate("bulkInsert", e);
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            positionTemplate.queryForObject("SELECT 1", Integer.class);
            return true;
        } catch (DataAccessException e) {
            log.debug("Availability probe failed for {}: {}", node.getId(), e.getMessage());
            return false;
        }
    }

    private LogPosition fetchPosition(String sql) {
        String text;
        try {
            text = positionTemplate.queryForObject(sql, String.class);
        } catch (DataAccessException e) {
            throw new PositionUnavailableException(node.getId(),
                    "Could not read WAL position from " + node.getId() + ": " + e.getMostSpecificCause().getMessage(), e);
        }
        if (text == null) {
            throw new PositionUnavailableException(node.getId(), node.getId() + " reported no WAL position");
        }
        try {
            return LogPosition.parse(text);
        } catch (IllegalArgumentException e) {
            throw new PositionUnavailableException(node.getId(), node.getId() + " reported unparsable WAL position " + text, e);
        }
    }

    private void requireRole(NodeRole role, String operation) {
        if (node.getRole() != role) {
            throw new RoutingConfigurationException(
                    operation + " is only supported on " + role + " nodes, " + node.getId() + " is " + node.getRole());
        }
    }

    private ReadRoutingException translate(String operation, DataAccessException e) {
        String detail = e.getMostSpecificCause().getMessage();
        if (SqlErrorClassifier.isConnectionFailure(e)) {
            log.warn("{} on {} failed, endpoint unreachable: {}", operation, node.getId(), detail);
            return new EndpointConnectionException(node.getId(),
                    operation + " on " + node.getId() + " failed, endpoint unreachable: " + detail, e);
        }
        return new EndpointQueryException(node.getId(), operation + " on " + node.getId() + " failed: " + detail, e);
    }

    private static JdbcTemplate template(DataSource dataSource, Duration timeout) {
        JdbcTemplate template = new JdbcTemplate(dataSource);
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            // JDBC statement timeouts have whole-second granularity
            long seconds = Math.max(1, (timeout.toMillis() + 999) / 1000);
            template.setQueryTimeout((int) Math.min(seconds, Integer.MAX_VALUE));
        }
        return template;
    }
}
