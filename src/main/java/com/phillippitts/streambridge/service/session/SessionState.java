package com.phillippitts.streambridge.service.session;

/**
 * Lifecycle of a transcription session.
 *
 * <p>{@code READY -> RECORDING -> DRAINING -> READY}; any state moves to {@code CLOSED} on teardown.
 */
public enum SessionState {
    /** No active recording. */
    READY,
    /** Audio flows into the frame buffer. */
    RECORDING,
    /** Stop received; waiting for outstanding segments before the summary. */
    DRAINING,
    /** Connection gone; terminal. */
    CLOSED
}
