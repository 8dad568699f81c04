package com.phillippitts.streambridge.service.session;

/**
 * Why a connection is closed by the server.
 */
public enum TerminationReason {
    /** Audio or negotiated format violates the PCM contract. */
    FORMAT_ERROR,
    /** No audio or control message within the idle timeout. */
    IDLE_TIMEOUT,
    /** Connection exceeded the maximum session duration. */
    MAX_DURATION,
    /** Too many concurrent connections. */
    OVER_CAPACITY,
    /** Unexpected server-side failure. */
    SERVER_ERROR,
    /** Server shutting down. */
    SHUTDOWN
}
