package com.phillippitts.streambridge.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Contiguous, VAD-delimited span of audio for one connection.
 *
 * <p>A segment is opened at speech onset, grows while speech continues and is sealed exactly
 * once. After sealing no more frames can be appended. Readers on other threads (the backend
 * worker when streaming incrementally) use {@link #awaitFrames(int, Duration)} to follow the
 * segment as it grows.
 *
 * <p>Thread-safe.
 */
public final class AudioSegment {

    /** Why a segment was sealed. */
    public enum SealReason { SILENCE, MAX_DURATION, STOP }

    private final long sequence;
    private final PcmFormat format;
    private final Instant openedAt;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final List<AudioFrame> frames = new ArrayList<>();
    private long byteLength;
    private SealReason sealReason;
    private Instant sealedAt;

    public AudioSegment(long sequence, PcmFormat format, Instant openedAt) {
        if (sequence < 0) {
            throw new IllegalArgumentException("Segment sequence must be non-negative, got: " + sequence);
        }
        this.sequence = sequence;
        this.format = Objects.requireNonNull(format, "format");
        this.openedAt = Objects.requireNonNull(openedAt, "openedAt");
    }

    public long sequence() {
        return sequence;
    }

    public PcmFormat format() {
        return format;
    }

    public Instant openedAt() {
        return openedAt;
    }

    /**
     * Appends a frame to an open segment.
     *
     * @param frame frame to append
     * @throws IllegalStateException if the segment is already sealed
     */
    public void append(AudioFrame frame) {
        Objects.requireNonNull(frame, "frame");
        lock.lock();
        try {
            if (sealReason != null) {
                throw new IllegalStateException("Segment " + sequence + " is sealed");
            }
            frames.add(frame);
            byteLength += frame.length();
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Seals the segment. Sealing twice is rejected so that a segment has exactly one reason.
     *
     * @param reason why the segment ended
     * @param at     seal time
     */
    public void seal(SealReason reason, Instant at) {
        Objects.requireNonNull(reason, "reason");
        lock.lock();
        try {
            if (sealReason != null) {
                throw new IllegalStateException("Segment " + sequence + " already sealed (" + sealReason + ")");
            }
            sealReason = reason;
            sealedAt = at;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isSealed() {
        lock.lock();
        try {
            return sealReason != null;
        } finally {
            lock.unlock();
        }
    }

    /** Seal reason, or {@code null} while the segment is open. */
    public SealReason sealReason() {
        lock.lock();
        try {
            return sealReason;
        } finally {
            lock.unlock();
        }
    }

    /** Seal time, or {@code null} while the segment is open. */
    public Instant sealedAt() {
        lock.lock();
        try {
            return sealedAt;
        } finally {
            lock.unlock();
        }
    }

    public long byteLength() {
        lock.lock();
        try {
            return byteLength;
        } finally {
            lock.unlock();
        }
    }

    public int frameCount() {
        lock.lock();
        try {
            return frames.size();
        } finally {
            lock.unlock();
        }
    }

    /** Audio duration in milliseconds derived from the byte length. */
    public long durationMs() {
        return format.bytesToMillis(byteLength());
    }

    /** Snapshot of the frames appended so far. */
    public List<AudioFrame> frames() {
        lock.lock();
        try {
            return List.copyOf(frames);
        } finally {
            lock.unlock();
        }
    }

    /** Concatenated PCM of all frames appended so far. */
    public byte[] toPcm() {
        lock.lock();
        try {
            byte[] out = new byte[(int) byteLength];
            int offset = 0;
            for (AudioFrame frame : frames) {
                frame.copyTo(out, offset);
                offset += frame.length();
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits until frames beyond {@code fromIndex} are available or the segment is sealed.
     *
     * @param fromIndex index of the first frame the caller has not consumed yet
     * @param timeout   maximum time to wait
     * @return frames from {@code fromIndex} on; empty on timeout, or when the segment is sealed
     *         and everything was consumed
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public List<AudioFrame> awaitFrames(int fromIndex, Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (frames.size() <= fromIndex && sealReason == null) {
                if (remaining <= 0) {
                    return List.of();
                }
                remaining = changed.awaitNanos(remaining);
            }
            if (frames.size() <= fromIndex) {
                return List.of();
            }
            return List.copyOf(frames.subList(fromIndex, frames.size()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits for the segment to be sealed.
     *
     * @param timeout maximum time to wait
     * @return {@code true} if the segment is sealed
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean awaitSealed(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (sealReason == null) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = changed.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        lock.lock();
        try {
            return "AudioSegment[seq=" + sequence + ", frames=" + frames.size() + ", bytes=" + byteLength
                    + ", sealed=" + (sealReason != null ? sealReason : "no") + "]";
        } finally {
            lock.unlock();
        }
    }
}
