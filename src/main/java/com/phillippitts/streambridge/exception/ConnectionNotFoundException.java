package com.phillippitts.streambridge.exception;

/**
 * Thrown when a status lookup names a connection that is not (or no longer) registered.
 */
public class ConnectionNotFoundException extends StreamBridgeException {

    private final String connectionId;

    public ConnectionNotFoundException(String connectionId) {
        super("Connection not found: " + connectionId);
        this.connectionId = connectionId;
    }

    public String getConnectionId() {
        return connectionId;
    }
}
