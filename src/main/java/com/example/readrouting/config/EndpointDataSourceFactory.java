package com.example.readrouting.config;

import com.example.readrouting.model.EndpointDescriptor;
import com.example.readrouting.model.ReplicaNode;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Builds one HikariCP pool per database node, so sessions hitting different nodes
 * never queue behind each other. Pools are closed when the context shuts down.
 */
@Component
public class EndpointDataSourceFactory implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(EndpointDataSourceFactory.class);

    private final RoutingProperties.Pool pool;
    private final List<HikariDataSource> created = new CopyOnWriteArrayList<>();

    public EndpointDataSourceFactory(RoutingProperties properties) {
        this.pool = properties.getPool();
    }

    /**
     * Create the pool for {@code node}. Replica pools hand out read-only connections.
     */
    public DataSource createDataSource(ReplicaNode node, EndpointDescriptor endpoint) {
        HikariDataSource dataSource = new HikariDataSource(buildConfig(node, endpoint));
        created.add(dataSource);
        log.info("Created pool {} for {} at {}", dataSource.getPoolName(), node.getRole(), endpoint.address());
        return dataSource;
    }

    HikariConfig buildConfig(ReplicaNode node, EndpointDescriptor endpoint) {
        HikariConfig config = new HikariConfig();
        config.setPoolName("pool-" + node.getId());
        config.setDriverClassName("org.postgresql.Driver");
        config.setJdbcUrl(endpoint.jdbcUrl());
        config.setUsername(endpoint.getUsername());
        config.setPassword(endpoint.getPassword());
        config.setReadOnly(!node.isPrimary());

        config.setMaximumPoolSize(pool.getMaximumPoolSize());
        config.setMinimumIdle(pool.getMinimumIdle());
        config.setConnectionTimeout(pool.getConnectionTimeout().toMillis());
        config.setIdleTimeout(pool.getIdleTimeout().toMillis());
        config.setMaxLifetime(pool.getMaxLifetime().toMillis());
        config.setAutoCommit(true);
        // start even when a node is down; failures surface per operation instead
        config.setInitializationFailTimeout(-1);

        long connectSeconds = Math.max(1, pool.getConnectionTimeout().toSeconds());
        config.addDataSourceProperty("connectTimeout", String.valueOf(connectSeconds));
        config.addDataSourceProperty("tcpKeepAlive", "true");
        config.addDataSourceProperty("ApplicationName", "read-routing-" + node.getId());
        return config;
    }

    @Override
    public void destroy() {
        for (HikariDataSource dataSource : created) {
            dataSource.close();
        }
        created.clear();
    }
}
