package com.phillippitts.streambridge.service.recognition;

import com.phillippitts.streambridge.domain.RecognitionResult;

/**
 * One message read from a backend stream.
 *
 * @param kind      message kind
 * @param segmentId segment the message refers to; {@link #STREAM_LEVEL} for stream-wide errors
 * @param result    recognition result for partials and finals, otherwise {@code null}
 * @param error     backend error text for errors, otherwise {@code null}
 */
public record BackendEvent(Kind kind, long segmentId, RecognitionResult result, String error) {

    /** Segment id used by errors that are not tied to a segment. */
    public static final long STREAM_LEVEL = -1L;

    public enum Kind { PARTIAL, FINAL, ERROR }

    public static BackendEvent partial(RecognitionResult result) {
        return new BackendEvent(Kind.PARTIAL, result.segmentId(), result, null);
    }

    public static BackendEvent finalResult(RecognitionResult result) {
        return new BackendEvent(Kind.FINAL, result.segmentId(), result, null);
    }

    public static BackendEvent error(long segmentId, String error) {
        return new BackendEvent(Kind.ERROR, segmentId, null, error);
    }

    /** Whether this event concerns {@code segment} (stream-level errors concern every segment). */
    public boolean concerns(long segment) {
        return segmentId == segment || (kind == Kind.ERROR && segmentId == STREAM_LEVEL);
    }
}
