package com.phillippitts.streambridge.service.audio;

import com.phillippitts.streambridge.config.properties.VadProperties;

/**
 * Effective voice-activity parameters of one buffer. Starts from {@link VadProperties} and is
 * replaced when a client sends {@code configure}.
 *
 * @param energyThreshold      normalised RMS at or above which a window counts as speech
 * @param windowMs             analysis window length
 * @param onsetHoldMs          continuous speech needed before a segment opens
 * @param silenceDurationMs    trailing silence that seals a segment
 * @param maxSegmentDurationMs hard upper bound on a segment's audio
 */
public record VadSettings(
        double energyThreshold,
        int windowMs,
        int onsetHoldMs,
        int silenceDurationMs,
        int maxSegmentDurationMs
) {

    public VadSettings {
        if (energyThreshold < 0.0 || energyThreshold > 1.0) {
            throw new IllegalArgumentException("energyThreshold must be between 0.0 and 1.0, got: " + energyThreshold);
        }
        if (windowMs <= 0 || onsetHoldMs < 0 || silenceDurationMs <= 0 || maxSegmentDurationMs <= 0) {
            throw new IllegalArgumentException("VAD durations must be positive");
        }
        if (onsetHoldMs >= maxSegmentDurationMs || windowMs > maxSegmentDurationMs) {
            throw new IllegalArgumentException("Onset hold and window must be shorter than the max segment duration");
        }
    }

    public static VadSettings from(VadProperties props) {
        return new VadSettings(props.getEnergyThreshold(), props.getWindowMs(), props.getOnsetHoldMs(),
                props.getSilenceDurationMs(), props.getMaxSegmentDurationMs());
    }

    public VadSettings withEnergyThreshold(double threshold) {
        return new VadSettings(threshold, windowMs, onsetHoldMs, silenceDurationMs, maxSegmentDurationMs);
    }

    public VadSettings withSilenceDurationMs(int silenceMs) {
        return new VadSettings(energyThreshold, windowMs, onsetHoldMs, silenceMs, maxSegmentDurationMs);
    }
}
