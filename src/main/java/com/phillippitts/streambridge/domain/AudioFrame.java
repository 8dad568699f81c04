package com.phillippitts.streambridge.domain;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable chunk of raw PCM samples as delivered by the transport, plus its arrival time.
 *
 * <p>The byte array is defensively copied on construction and on access.
 *
 * @param data      little-endian signed 16-bit mono PCM
 * @param arrivedAt when the transport delivered the frame
 */
public record AudioFrame(byte[] data, Instant arrivedAt) {

    public AudioFrame {
        Objects.requireNonNull(data, "Frame data must not be null");
        Objects.requireNonNull(arrivedAt, "Arrival timestamp must not be null");
        data = data.clone();
    }

    /**
     * Creates a frame stamped with the current time.
     *
     * @param data PCM bytes
     * @return a new frame
     */
    public static AudioFrame of(byte[] data) {
        return new AudioFrame(data, Instant.now());
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    /** Number of PCM bytes in the frame. */
    public int length() {
        return data.length;
    }

    /**
     * Returns the bytes {@code [from, to)} as a frame with the same arrival time. The whole range
     * returns this frame itself.
     *
     * @param from first byte, inclusive
     * @param to   last byte, exclusive
     * @return the slice
     */
    public AudioFrame slice(int from, int to) {
        if (from < 0 || to > data.length || from > to) {
            throw new IndexOutOfBoundsException("Invalid slice [" + from + ", " + to + ") of " + data.length + " bytes");
        }
        if (from == 0 && to == data.length) {
            return this;
        }
        return new AudioFrame(Arrays.copyOfRange(data, from, to), arrivedAt);
    }

    /**
     * Copies this frame's bytes into {@code target} without an intermediate clone.
     *
     * @param target destination array
     * @param offset destination offset
     */
    public void copyTo(byte[] target, int offset) {
        System.arraycopy(data, 0, target, offset, data.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AudioFrame other)) {
            return false;
        }
        return Arrays.equals(data, other.data) && arrivedAt.equals(other.arrivedAt);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(data) + arrivedAt.hashCode();
    }

    @Override
    public String toString() {
        return "AudioFrame[bytes=" + data.length + ", arrivedAt=" + arrivedAt + "]";
    }
}
