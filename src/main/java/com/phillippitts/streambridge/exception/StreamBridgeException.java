package com.phillippitts.streambridge.exception;

/**
 * Base exception for all stream-bridge application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class StreamBridgeException extends RuntimeException {

    public StreamBridgeException(String message) {
        super(message);
    }

    public StreamBridgeException(String message, Throwable cause) {
        super(message, cause);
    }

    public StreamBridgeException(Throwable cause) {
        super(cause);
    }
}
