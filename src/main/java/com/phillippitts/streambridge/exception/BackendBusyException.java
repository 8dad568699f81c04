package com.phillippitts.streambridge.exception;

/**
 * Thrown when a segment cannot be queued because the per-session backlog is full.
 * Transient: the client may retry once the backend catches up.
 */
public class BackendBusyException extends StreamBridgeException {

    private final long segmentId;
    private final int queueDepth;

    public BackendBusyException(long segmentId, int queueDepth) {
        super("Recognition backlog full, segment " + segmentId + " rejected (queueDepth=" + queueDepth + ")");
        this.segmentId = segmentId;
        this.queueDepth = queueDepth;
    }

    public long getSegmentId() {
        return segmentId;
    }

    public int getQueueDepth() {
        return queueDepth;
    }
}
