package com.example.readrouting.model;

import java.util.Objects;

/**
 * Connection coordinates for one PostgreSQL node.
 * The password is deliberately left out of {@link #toString()}.
 */
public final class EndpointDescriptor {

    private final String host;
    private final int port;
    private final String database;
    private final String username;
    private final String password;

    public EndpointDescriptor(String host, int port, String database, String username, String password) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Endpoint host must not be blank");
        }
        if (database == null || database.isBlank()) {
            throw new IllegalArgumentException("Endpoint database must not be blank");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Endpoint port out of range: " + port);
        }
        this.host = host;
        this.port = port;
        this.database = database;
        this.username = username;
        this.password = password;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getDatabase() {
        return database;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public String jdbcUrl() {
        return String.format("jdbc:postgresql://%s:%d/%s", host, port, database);
    }

    /**
     * Address without credentials, used as the node's display endpoint.
     */
    public String address() {
        return host + ":" + port + "/" + database;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EndpointDescriptor)) {
            return false;
        }
        EndpointDescriptor that = (EndpointDescriptor) o;
        return port == that.port
                && host.equals(that.host)
                && database.equals(that.database)
                && Objects.equals(username, that.username)
                && Objects.equals(password, that.password);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port, database, username);
    }

    @Override
    public String toString() {
        return "EndpointDescriptor{" + address() + ", user=" + username + "}";
    }
}
