package com.phillippitts.streambridge.service.events;

import com.phillippitts.streambridge.service.session.SessionState;

/**
 * Published when an audio frame arrives while the session is not recording.
 *
 * @param connectionId connection the frame arrived on
 * @param state        session state at arrival
 * @param bytes        frame size
 */
public record LateFrameDroppedEvent(String connectionId, SessionState state, int bytes) {
}
