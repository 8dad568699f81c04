package com.phillippitts.streambridge.presentation.gateway;

import java.util.List;

/**
 * Read-only snapshot of the gateway, served by the status endpoint.
 *
 * @param activeConnections open connections
 * @param maxConnections    configured limit
 * @param connections       one entry per open connection
 */
public record GatewayStatus(int activeConnections, int maxConnections, List<ConnectionStatus> connections) {

    /**
     * Status of one connection.
     *
     * @param connectionId    server-assigned id
     * @param clientId        client-supplied or generated id
     * @param state           session state
     * @param uptimeSeconds   seconds since the connection was accepted
     * @param idleSeconds     seconds since the last message
     * @param totalSegments   segments sealed in the current or last recording
     * @param pendingSegments segments waiting at the backend
     * @param backendState    state of the connection's backend client
     */
    public record ConnectionStatus(
            String connectionId,
            String clientId,
            String state,
            long uptimeSeconds,
            long idleSeconds,
            int totalSegments,
            int pendingSegments,
            String backendState
    ) {
    }
}
