package com.phillippitts.streambridge.config.properties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for per-connection transcription sessions.
 */
@ConfigurationProperties(prefix = "bridge.session")
@Validated
public class SessionProperties {

    /** How partial hypotheses are forwarded to the client. */
    public enum PartialPolicy {
        /** Every partial is forwarded as it arrives. */
        LATEST,
        /** A partial shorter than the last one forwarded for the same segment is suppressed. */
        NON_SHRINKING
    }

    /** Upper bound on waiting for outstanding segments after stop_recording, in milliseconds. */
    @Positive(message = "Drain timeout must be positive")
    private long drainTimeoutMs = 15_000;

    /** Time backend workers get to acknowledge cancellation before they are interrupted. */
    @Positive(message = "Cancellation grace must be positive")
    private long cancellationGraceMs = 2_000;

    @NotNull
    private PartialPolicy partialPolicy = PartialPolicy.LATEST;

    public long getDrainTimeoutMs() {
        return drainTimeoutMs;
    }

    public void setDrainTimeoutMs(long drainTimeoutMs) {
        this.drainTimeoutMs = drainTimeoutMs;
    }

    public long getCancellationGraceMs() {
        return cancellationGraceMs;
    }

    public void setCancellationGraceMs(long cancellationGraceMs) {
        this.cancellationGraceMs = cancellationGraceMs;
    }

    public PartialPolicy getPartialPolicy() {
        return partialPolicy;
    }

    public void setPartialPolicy(PartialPolicy partialPolicy) {
        this.partialPolicy = partialPolicy;
    }
}
