package com.phillippitts.streambridge.service.audio;

/**
 * Energy measurements over PCM16LE mono audio.
 *
 * <p>Energy is reported as root-mean-square amplitude normalised to full scale, so a value of
 * {@code 0.02} means roughly -34 dBFS. Voice-activity thresholds are expressed in the same unit.
 */
public final class PcmEnergy {

    private PcmEnergy() {
        // Utility class
    }

    /**
     * Calculates the normalised RMS amplitude of a window.
     *
     * @param pcm    PCM16LE buffer
     * @param offset starting byte position (must be even)
     * @param length number of bytes to analyse
     * @return RMS amplitude in [0, 1]; 0 for an empty window
     */
    public static double normalizedRms(byte[] pcm, int offset, int length) {
        long sumSquares = 0;
        int sampleCount = 0;
        int end = Math.min(pcm.length, offset + length);

        for (int i = offset; i + 1 < end; i += 2) {
            // Convert 2 bytes to 16-bit signed sample (little-endian)
            int sample = (pcm[i] & 0xFF) | (pcm[i + 1] << 8);
            sumSquares += (long) sample * sample;
            sampleCount++;
        }

        if (sampleCount == 0) {
            return 0.0;
        }
        return Math.min(1.0, Math.sqrt((double) sumSquares / sampleCount) / AudioFormat.FULL_SCALE_AMPLITUDE);
    }

    /**
     * Returns whether a window's energy reaches the voice threshold.
     *
     * @param pcm       PCM16LE buffer
     * @param offset    starting byte position
     * @param length    number of bytes to analyse
     * @param threshold normalised RMS threshold
     * @return {@code true} if the window is considered speech
     */
    public static boolean isVoiced(byte[] pcm, int offset, int length, double threshold) {
        return normalizedRms(pcm, offset, length) >= threshold;
    }
}
