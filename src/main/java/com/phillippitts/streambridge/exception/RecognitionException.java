package com.phillippitts.streambridge.exception;

/**
 * Thrown when the recognition backend fails mid-stream (transport error, connection closed)
 * or reports an error for a segment.
 */
public class RecognitionException extends StreamBridgeException {

    private final String backendName;

    public RecognitionException(String message) {
        super(message);
        this.backendName = "unknown";
    }

    public RecognitionException(String message, String backendName) {
        super(message + " (backend: " + backendName + ")");
        this.backendName = backendName;
    }

    public RecognitionException(String message, Throwable cause) {
        super(message, cause);
        this.backendName = "unknown";
    }

    public RecognitionException(String message, String backendName, Throwable cause) {
        super(message + " (backend: " + backendName + ")", cause);
        this.backendName = backendName;
    }

    public String getBackendName() {
        return backendName;
    }
}
