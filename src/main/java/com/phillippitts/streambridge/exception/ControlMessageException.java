package com.phillippitts.streambridge.exception;

/**
 * Thrown when an inbound control message is malformed or of an unknown type.
 * The message is ignored and the connection continues.
 */
public class ControlMessageException extends StreamBridgeException {

    public ControlMessageException(String message) {
        super(message);
    }

    public ControlMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
