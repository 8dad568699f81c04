package com.phillippitts.streambridge.exception;

/**
 * Thrown when the recognition backend cannot be reached after the configured retries,
 * or while the client is still cooling down from such a failure.
 */
public class BackendUnavailableException extends StreamBridgeException {

    private final String backendName;
    private final int attempts;

    public BackendUnavailableException(String backendName, int attempts) {
        super("Recognition backend unavailable: " + backendName + " (attempts=" + attempts + ")");
        this.backendName = backendName;
        this.attempts = attempts;
    }

    public BackendUnavailableException(String backendName, int attempts, Throwable cause) {
        super("Recognition backend unavailable: " + backendName + " (attempts=" + attempts + ")", cause);
        this.backendName = backendName;
        this.attempts = attempts;
    }

    public String getBackendName() {
        return backendName;
    }

    public int getAttempts() {
        return attempts;
    }
}
