package com.example.readrouting.config;

import com.example.readrouting.routing.StrategyType;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Topology and routing settings, bound from {@code routing.*}.
 */
@ConfigurationProperties(prefix = "routing")
public class RoutingProperties {

    private StrategyType strategy = StrategyType.TIME_BASED;

    /**
     * How long after a write the time-based strategy keeps reading from primary.
     */
    private Duration timeThreshold = Duration.ofSeconds(5);

    /**
     * Replica read by the time-based and log-position strategies. Defaults to the first replica.
     */
    private String preferredReplica;

    private Duration queryTimeout = Duration.ofSeconds(5);

    private Duration positionCheckTimeout = Duration.ofSeconds(2);

    private EndpointProperties primary = new EndpointProperties();

    private List<EndpointProperties> replicas = new ArrayList<>();

    private Pool pool = new Pool();

    private Sticky sticky = new Sticky();

    private Aws aws = new Aws();

    private Demo demo = new Demo();

    public StrategyType getStrategy() {
        return strategy;
    }

    public void setStrategy(StrategyType strategy) {
        this.strategy = strategy;
    }

    public Duration getTimeThreshold() {
        return timeThreshold;
    }

    public void setTimeThreshold(Duration timeThreshold) {
        this.timeThreshold = timeThreshold;
    }

    public String getPreferredReplica() {
        return preferredReplica;
    }

    public void setPreferredReplica(String preferredReplica) {
        this.preferredReplica = preferredReplica;
    }

    public Duration getQueryTimeout() {
        return queryTimeout;
    }

    public void setQueryTimeout(Duration queryTimeout) {
        this.queryTimeout = queryTimeout;
    }

    public Duration getPositionCheckTimeout() {
        return positionCheckTimeout;
    }

    public void setPositionCheckTimeout(Duration positionCheckTimeout) {
        this.positionCheckTimeout = positionCheckTimeout;
    }

    public EndpointProperties getPrimary() {
        return primary;
    }

    public void setPrimary(EndpointProperties primary) {
        this.primary = primary;
    }

    public List<EndpointProperties> getReplicas() {
        return replicas;
    }

    public void setReplicas(List<EndpointProperties> replicas) {
        this.replicas = replicas;
    }

    public Pool getPool() {
        return pool;
    }

    public void setPool(Pool pool) {
        this.pool = pool;
    }

    public Sticky getSticky() {
        return sticky;
    }

    public void setSticky(Sticky sticky) {
        this.sticky = sticky;
    }

    public Aws getAws() {
        return aws;
    }

    public void setAws(Aws aws) {
        this.aws = aws;
    }

    public Demo getDemo() {
        return demo;
    }

    public void setDemo(Demo demo) {
        this.demo = demo;
    }

    /**
     * One node. When {@code secretName} is set, values from that AWS secret override the static ones.
     */
    public static class EndpointProperties {
        private String id;
        private String host = "localhost";
        private int port = 5432;
        private String database = "testdb";
        private String username;
        private String password;
        private String secretName;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getDatabase() {
            return database;
        }

        public void setDatabase(String database) {
            this.database = database;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getSecretName() {
            return secretName;
        }

        public void setSecretName(String secretName) {
            this.secretName = secretName;
        }
    }

    public static class Pool {
        private int maximumPoolSize = 10;
        private int minimumIdle = 2;
        private Duration connectionTimeout = Duration.ofSeconds(5);
        private Duration idleTimeout = Duration.ofMinutes(10);
        private Duration maxLifetime = Duration.ofMinutes(30);

        public int getMaximumPoolSize() {
            return maximumPoolSize;
        }

        public void setMaximumPoolSize(int maximumPoolSize) {
            this.maximumPoolSize = maximumPoolSize;
        }

        public int getMinimumIdle() {
            return minimumIdle;
        }

        public void setMinimumIdle(int minimumIdle) {
            this.minimumIdle = minimumIdle;
        }

        public Duration getConnectionTimeout() {
            return connectionTimeout;
        }

        public void setConnectionTimeout(Duration connectionTimeout) {
            this.connectionTimeout = connectionTimeout;
        }

        public Duration getIdleTimeout() {
            return idleTimeout;
        }

        public void setIdleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
        }

        public Duration getMaxLifetime() {
            return maxLifetime;
        }

        public void setMaxLifetime(Duration maxLifetime) {
            this.maxLifetime = maxLifetime;
        }
    }

    public static class Sticky {

        public enum SelectorType {
            MODULO,
            CONSISTENT_HASH
        }

        private SelectorType selector = SelectorType.MODULO;
        private int virtualNodes = 160;

        public SelectorType getSelector() {
            return selector;
        }

        public void setSelector(SelectorType selector) {
            this.selector = selector;
        }

        public int getVirtualNodes() {
            return virtualNodes;
        }

        public void setVirtualNodes(int virtualNodes) {
            this.virtualNodes = virtualNodes;
        }
    }

    public static class Aws {
        private String region = "us-east-1";

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }
    }

    public static class Demo {

        public enum Scenario {
            NONE,
            PATTERN,
            CREATE_LAG
        }

        private Scenario scenario = Scenario.NONE;
        private int lagRows = 500_000;
        private int lagPadding = 500;

        public Scenario getScenario() {
            return scenario;
        }

        public void setScenario(Scenario scenario) {
            this.scenario = scenario;
        }

        public int getLagRows() {
            return lagRows;
        }

        public void setLagRows(int lagRows) {
            this.lagRows = lagRows;
        }

        public int getLagPadding() {
            return lagPadding;
        }

        public void setLagPadding(int lagPadding) {
            this.lagPadding = lagPadding;
        }
    }
}
