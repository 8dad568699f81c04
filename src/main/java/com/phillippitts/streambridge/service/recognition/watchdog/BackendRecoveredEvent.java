package com.phillippitts.streambridge.service.recognition.watchdog;

import java.time.Instant;

/**
 * Published when a session client connects successfully after a previous failure.
 */
public record BackendRecoveredEvent(String backend, Instant at) {
    public BackendRecoveredEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
