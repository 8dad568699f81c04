package com.phillippitts.streambridge.presentation.gateway;

import com.phillippitts.streambridge.config.properties.GatewayProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open connections by id, bounded by the configured maximum.
 */
@Component
class ConnectionRegistry {

    private final Map<String, Connection> connections = new ConcurrentHashMap<>();
    private final int maxConnections;

    ConnectionRegistry(GatewayProperties props) {
        this.maxConnections = props.getMaxConnections();
    }

    /**
     * Registers a connection unless the registry is full.
     *
     * @return {@code false} if the maximum number of connections is already open
     */
    synchronized boolean tryRegister(Connection connection) {
        if (connections.size() >= maxConnections) {
            return false;
        }
        connections.put(connection.id(), connection);
        return true;
    }

    Optional<Connection> get(String id) {
        return Optional.ofNullable(connections.get(id));
    }

    Optional<Connection> remove(String id) {
        return Optional.ofNullable(connections.remove(id));
    }

    int size() {
        return connections.size();
    }

    int maxConnections() {
        return maxConnections;
    }

    /** Snapshot of open connections. */
    List<Connection> all() {
        return new ArrayList<>(connections.values());
    }
}
