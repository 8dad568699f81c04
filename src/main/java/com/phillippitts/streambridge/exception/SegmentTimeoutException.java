package com.phillippitts.streambridge.exception;

/**
 * Thrown when a single segment does not produce a partial or final result in time.
 * Only the affected segment fails; the session continues.
 */
public class SegmentTimeoutException extends StreamBridgeException {

    private final long segmentId;
    private final long timeoutMs;

    public SegmentTimeoutException(long segmentId, long timeoutMs, String phase) {
        super("Segment " + segmentId + " timed out waiting for " + phase + " after " + timeoutMs + " ms");
        this.segmentId = segmentId;
        this.timeoutMs = timeoutMs;
    }

    public long getSegmentId() {
        return segmentId;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
