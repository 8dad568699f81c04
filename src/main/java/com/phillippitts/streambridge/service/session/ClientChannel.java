package com.phillippitts.streambridge.service.session;

import com.phillippitts.streambridge.domain.RecognitionResult;
import com.phillippitts.streambridge.domain.SessionSummary;

/**
 * Outbound side of one client connection as seen by its session.
 *
 * <p>Implementations translate each call into the client wire envelope. Calls arrive on the
 * session's serial task and must not block on slow clients.
 */
public interface ClientChannel {

    void recordingStarted(RecordingConfig config);

    void recordingStopped(SessionSummary summary);

    void partial(RecognitionResult partial);

    void transcription(RecognitionResult finalResult);

    void configured(RecordingConfig config);

    void pong();

    void metrics(SessionSnapshot snapshot);

    /** Sends a non-terminal error envelope. */
    void error(String message);

    /**
     * Sends a terminal error envelope and closes the connection.
     *
     * @param reason  why the connection ends
     * @param message error text for the envelope
     */
    void terminate(TerminationReason reason, String message);
}
