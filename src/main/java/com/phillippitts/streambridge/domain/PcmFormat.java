package com.phillippitts.streambridge.domain;

/**
 * Negotiated PCM audio format of a connection.
 *
 * @param sampleRate    samples per second
 * @param channels      channel count
 * @param bitsPerSample bit depth of a single sample
 */
public record PcmFormat(int sampleRate, int channels, int bitsPerSample) {

    /** The only format the bridge accepts: 16 kHz, mono, 16-bit little-endian PCM. */
    public static final PcmFormat REQUIRED = new PcmFormat(16_000, 1, 16);

    public PcmFormat {
        if (sampleRate <= 0 || channels <= 0 || bitsPerSample <= 0) {
            throw new IllegalArgumentException("Format fields must be positive: sampleRate=" + sampleRate
                    + ", channels=" + channels + ", bitsPerSample=" + bitsPerSample);
        }
    }

    /** Bytes per PCM frame (one sample for all channels). */
    public int blockAlign() {
        return (bitsPerSample / 8) * channels;
    }

    /** Bytes per second of audio. */
    public int byteRate() {
        return sampleRate * blockAlign();
    }

    /**
     * Converts a byte length to milliseconds of audio.
     *
     * @param bytes PCM byte count
     * @return duration in milliseconds (truncated)
     */
    public long bytesToMillis(long bytes) {
        return (bytes * 1000L) / byteRate();
    }

    /**
     * Converts milliseconds of audio to a block-aligned byte length.
     *
     * @param millis duration in milliseconds
     * @return byte count rounded down to a whole frame
     */
    public int millisToBytes(long millis) {
        long bytes = (millis * byteRate()) / 1000L;
        return (int) (bytes - (bytes % blockAlign()));
    }
}
