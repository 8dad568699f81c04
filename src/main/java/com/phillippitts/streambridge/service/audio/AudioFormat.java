package com.phillippitts.streambridge.service.audio;

/**
 * Single source of truth for the client audio contract.
 * Required: 16 kHz, 16-bit signed PCM, mono, little-endian.
 */
public final class AudioFormat {

    /** Required sample rate in Hz. */
    public static final int REQUIRED_SAMPLE_RATE = 16_000;
    /** Required bits per sample. */
    public static final int REQUIRED_BITS_PER_SAMPLE = 16;
    /** Required number of channels (mono). */
    public static final int REQUIRED_CHANNELS = 1;
    /** Required endian flag (false = little-endian). */
    public static final boolean REQUIRED_BIG_ENDIAN = false;

    /** Bytes per PCM frame (sample for all channels). */
    public static final int REQUIRED_BLOCK_ALIGN = (REQUIRED_BITS_PER_SAMPLE / 8) * REQUIRED_CHANNELS; // 2 bytes
    /** Bytes per second at required format. */
    public static final int REQUIRED_BYTE_RATE = REQUIRED_SAMPLE_RATE * REQUIRED_BLOCK_ALIGN;           // 32,000

    /** Full-scale amplitude of a signed 16-bit sample, used to normalise energy to [0, 1]. */
    public static final double FULL_SCALE_AMPLITUDE = 32_768.0;

    /** Size of the RIFF/WAVE preamble clients sometimes send by mistake. */
    public static final int RIFF_HEADER_SIZE = 12;

    private AudioFormat() {}
}
