package com.phillippitts.streambridge.service.recognition;

/**
 * One open bidirectional stream to a recognition backend.
 *
 * <p>Audio for a segment is framed by {@link #startSegment(long)} and {@link #endSegment(long)};
 * results for every segment arrive on {@link #events()}. A transport failure closes the stream
 * and fails the event channel. Send methods are called by a single worker thread; {@link #close()}
 * may be called from any thread.
 */
public interface BackendStream extends AutoCloseable {

    void startSegment(long segmentId);

    void sendAudio(long segmentId, byte[] pcm);

    void endSegment(long segmentId);

    /** Channel of partials, finals and errors read from the backend. */
    ResultChannel<BackendEvent> events();

    boolean isOpen();

    /** Closes the stream. Idempotent. */
    @Override
    void close();
}
