package com.phillippitts.streambridge.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for the client-facing WebSocket gateway.
 */
@Validated
@ConfigurationProperties(prefix = "bridge.gateway")
public class GatewayProperties {

    @NotBlank
    private final String path;

    @NotBlank
    private final String protocolVersion;

    @Positive
    private final int maxConnections;

    @NotNull
    private final Duration idleTimeout;

    @NotNull
    private final Duration maxSessionDuration;

    @Positive
    private final long sweepIntervalMs;

    @Positive
    private final int maxMessageSizeBytes;

    @Positive
    private final int sendTimeLimitMs;

    @Positive
    private final int sendBufferSizeBytes;

    @NotBlank
    private final String allowedOrigins;

    @ConstructorBinding
    public GatewayProperties(String path,
                             String protocolVersion,
                             Integer maxConnections,
                             Duration idleTimeout,
                             Duration maxSessionDuration,
                             Long sweepIntervalMs,
                             Integer maxMessageSizeBytes,
                             Integer sendTimeLimitMs,
                             Integer sendBufferSizeBytes,
                             String allowedOrigins) {
        this.path = path == null ? "/ws/transcribe" : path;
        this.protocolVersion = protocolVersion == null ? "1.0" : protocolVersion;
        this.maxConnections = maxConnections == null ? 100 : maxConnections;
        this.idleTimeout = idleTimeout == null ? Duration.ofSeconds(60) : idleTimeout;
        this.maxSessionDuration = maxSessionDuration == null ? Duration.ofHours(1) : maxSessionDuration;
        this.sweepIntervalMs = sweepIntervalMs == null ? 5_000L : sweepIntervalMs;
        this.maxMessageSizeBytes = maxMessageSizeBytes == null ? 1_048_576 : maxMessageSizeBytes;
        this.sendTimeLimitMs = sendTimeLimitMs == null ? 10_000 : sendTimeLimitMs;
        this.sendBufferSizeBytes = sendBufferSizeBytes == null ? 524_288 : sendBufferSizeBytes;
        this.allowedOrigins = allowedOrigins == null ? "*" : allowedOrigins;
    }

    /** Defaults for tests and programmatic construction. */
    public static GatewayProperties defaults() {
        return new GatewayProperties(null, null, null, null, null, null, null, null, null, null);
    }

    public String getPath() {
        return path;
    }

    public String getProtocolVersion() {
        return protocolVersion;
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    public Duration getMaxSessionDuration() {
        return maxSessionDuration;
    }

    public long getSweepIntervalMs() {
        return sweepIntervalMs;
    }

    public int getMaxMessageSizeBytes() {
        return maxMessageSizeBytes;
    }

    public int getSendTimeLimitMs() {
        return sendTimeLimitMs;
    }

    public int getSendBufferSizeBytes() {
        return sendBufferSizeBytes;
    }

    public String getAllowedOrigins() {
        return allowedOrigins;
    }
}
