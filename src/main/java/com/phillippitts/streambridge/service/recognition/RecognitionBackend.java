package com.phillippitts.streambridge.service.recognition;

import com.phillippitts.streambridge.domain.PcmFormat;
import com.phillippitts.streambridge.exception.RecognitionException;

import java.time.Duration;

/**
 * Remote streaming speech recognition service.
 *
 * <p>Implementations are stateless factories for {@link BackendStream}s; each session client
 * holds at most one stream at a time. Two variants exist and are selected at construction time:
 * the real WebSocket backend and a local synthetic stand-in.
 */
public interface RecognitionBackend {

    /** Short backend name for logs, metrics and events. */
    String name();

    /**
     * Whether the backend accepts audio for a segment before the segment is sealed.
     * When {@code false} the client buffers until the segment is sealed.
     */
    boolean supportsIncrementalInput();

    /**
     * Opens a new stream.
     *
     * @param format  audio format of the stream
     * @param options recognition options
     * @param timeout connect timeout
     * @return an open stream
     * @throws RecognitionException if the stream cannot be opened
     */
    BackendStream connect(PcmFormat format, RecognitionOptions options, Duration timeout);
}
