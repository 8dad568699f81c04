package com.phillippitts.streambridge.service.session;

/**
 * Point-in-time counters of one session, reported by {@code get_metrics} and the status endpoint.
 *
 * @param state           session state
 * @param totalSegments   segments sealed in the current or last recording
 * @param finalsEmitted   final results sent over the connection's lifetime
 * @param partialsEmitted partial results sent over the connection's lifetime
 * @param segmentErrors   segment-level errors sent over the connection's lifetime
 * @param framesDropped   frames received outside of a recording
 * @param pendingSegments segments queued or in flight at the backend
 * @param backend         backend name
 * @param backendState    state of the session's backend client
 */
public record SessionSnapshot(
        SessionState state,
        int totalSegments,
        long finalsEmitted,
        long partialsEmitted,
        long segmentErrors,
        long framesDropped,
        int pendingSegments,
        String backend,
        String backendState
) {
}
