package com.phillippitts.streambridge.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Default voice-activity detection parameters for new connections.
 * Clients may override threshold and silence duration per connection via {@code configure}.
 */
@ConfigurationProperties(prefix = "bridge.vad")
@Validated
public class VadProperties {

    /** Normalised RMS (0..1) at or above which a window counts as speech. */
    @DecimalMin(value = "0.0", message = "Energy threshold must be >= 0")
    @DecimalMax(value = "1.0", message = "Energy threshold must be <= 1")
    private double energyThreshold = 0.02;

    /** Analysis window length in milliseconds. */
    @Positive(message = "Window must be positive")
    private int windowMs = 20;

    /** Continuous speech required before a segment opens, in milliseconds. */
    @PositiveOrZero(message = "Onset hold must not be negative")
    private int onsetHoldMs = 60;

    /** Trailing silence that seals a segment, in milliseconds. */
    @Positive(message = "Silence duration must be positive")
    private int silenceDurationMs = 500;

    /** Hard upper bound on a segment's audio, in milliseconds. */
    @Positive(message = "Max segment duration must be positive")
    private int maxSegmentDurationMs = 5_000;

    /** Largest accepted binary frame, in bytes. */
    @Positive(message = "Max frame bytes must be positive")
    private int maxFrameBytes = 262_144;

    public double getEnergyThreshold() {
        return energyThreshold;
    }

    public void setEnergyThreshold(double energyThreshold) {
        this.energyThreshold = energyThreshold;
    }

    public int getWindowMs() {
        return windowMs;
    }

    public void setWindowMs(int windowMs) {
        this.windowMs = windowMs;
    }

    public int getOnsetHoldMs() {
        return onsetHoldMs;
    }

    public void setOnsetHoldMs(int onsetHoldMs) {
        this.onsetHoldMs = onsetHoldMs;
    }

    public int getSilenceDurationMs() {
        return silenceDurationMs;
    }

    public void setSilenceDurationMs(int silenceDurationMs) {
        this.silenceDurationMs = silenceDurationMs;
    }

    public int getMaxSegmentDurationMs() {
        return maxSegmentDurationMs;
    }

    public void setMaxSegmentDurationMs(int maxSegmentDurationMs) {
        this.maxSegmentDurationMs = maxSegmentDurationMs;
    }

    public int getMaxFrameBytes() {
        return maxFrameBytes;
    }

    public void setMaxFrameBytes(int maxFrameBytes) {
        this.maxFrameBytes = maxFrameBytes;
    }
}
