package com.phillippitts.streambridge.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the remote recognition backend and the per-session client
 * that talks to it.
 */
@ConfigurationProperties(prefix = "bridge.backend")
@Validated
public class BackendProperties {

    /** Which backend variant serves sessions. */
    public enum Mode { REAL, SYNTHETIC }

    /** What happens to segments while the backend is unreachable. */
    public enum DegradedMode {
        /** Segments fail with a backend-unavailable error. */
        REJECT,
        /** Segments are answered by the synthetic backend with clearly marked text. */
        SYNTHETIC
    }

    @NotNull
    private Mode mode = Mode.REAL;

    /** WebSocket URI of the streaming recognition service. */
    @NotBlank
    private String uri = "ws://localhost:8765/asr";

    @Positive(message = "Connect timeout must be positive")
    private long connectTimeoutMs = 3_000;

    /** Connect retries after the first failed attempt. */
    @PositiveOrZero(message = "Max retries must not be negative")
    private int maxRetries = 3;

    /** Initial backoff delay; doubles per retry. */
    @Positive(message = "Retry delay must be positive")
    private long retryDelayMs = 1_000;

    @Positive(message = "Max backoff must be positive")
    private long maxBackoffMs = 8_000;

    /** Bounds time-to-first-partial and time-to-final of one segment. */
    @Positive(message = "Request timeout must be positive")
    private long requestTimeoutMs = 5_000;

    /** Segments that may wait behind the one in flight before new ones are rejected as busy. */
    @Positive(message = "Queue depth must be positive")
    private int queueDepth = 4;

    @NotNull
    private DegradedMode degradedMode = DegradedMode.SYNTHETIC;

    /** Whether audio is streamed while a segment is still open. */
    private boolean incrementalInput = true;

    @Positive(message = "Chunk size must be positive")
    private int chunkSizeBytes = 8_192;

    @NotBlank
    private String languageCode = "en-US";

    private boolean enablePunctuation = true;

    private boolean enableWordOffsets = true;

    /** Default hotwords sent with every stream; clients may add more on start_recording. */
    private List<String> hotwords = new ArrayList<>();

    /** Sliding window for backend health, in minutes. */
    @Positive(message = "Health window must be positive")
    private int healthWindowMinutes = 5;

    /** Failures within the window that mark the backend unavailable. */
    @Positive(message = "Health failure threshold must be positive")
    private int healthFailureThreshold = 3;

    @Valid
    private Synthetic synthetic = new Synthetic();

    public Mode getMode() {
        return mode;
    }

    public void setMode(Mode mode) {
        this.mode = mode;
    }

    public String getUri() {
        return uri;
    }

    public void setUri(String uri) {
        this.uri = uri;
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(long connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public long getRetryDelayMs() {
        return retryDelayMs;
    }

    public void setRetryDelayMs(long retryDelayMs) {
        this.retryDelayMs = retryDelayMs;
    }

    public long getMaxBackoffMs() {
        return maxBackoffMs;
    }

    public void setMaxBackoffMs(long maxBackoffMs) {
        this.maxBackoffMs = maxBackoffMs;
    }

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(long requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
    }

    public int getQueueDepth() {
        return queueDepth;
    }

    public void setQueueDepth(int queueDepth) {
        this.queueDepth = queueDepth;
    }

    public DegradedMode getDegradedMode() {
        return degradedMode;
    }

    public void setDegradedMode(DegradedMode degradedMode) {
        this.degradedMode = degradedMode;
    }

    public boolean isIncrementalInput() {
        return incrementalInput;
    }

    public void setIncrementalInput(boolean incrementalInput) {
        this.incrementalInput = incrementalInput;
    }

    public int getChunkSizeBytes() {
        return chunkSizeBytes;
    }

    public void setChunkSizeBytes(int chunkSizeBytes) {
        this.chunkSizeBytes = chunkSizeBytes;
    }

    public String getLanguageCode() {
        return languageCode;
    }

    public void setLanguageCode(String languageCode) {
        this.languageCode = languageCode;
    }

    public boolean isEnablePunctuation() {
        return enablePunctuation;
    }

    public void setEnablePunctuation(boolean enablePunctuation) {
        this.enablePunctuation = enablePunctuation;
    }

    public boolean isEnableWordOffsets() {
        return enableWordOffsets;
    }

    public void setEnableWordOffsets(boolean enableWordOffsets) {
        this.enableWordOffsets = enableWordOffsets;
    }

    public List<String> getHotwords() {
        return hotwords;
    }

    public void setHotwords(List<String> hotwords) {
        this.hotwords = hotwords;
    }

    public int getHealthWindowMinutes() {
        return healthWindowMinutes;
    }

    public void setHealthWindowMinutes(int healthWindowMinutes) {
        this.healthWindowMinutes = healthWindowMinutes;
    }

    public int getHealthFailureThreshold() {
        return healthFailureThreshold;
    }

    public void setHealthFailureThreshold(int healthFailureThreshold) {
        this.healthFailureThreshold = healthFailureThreshold;
    }

    public Synthetic getSynthetic() {
        return synthetic;
    }

    public void setSynthetic(Synthetic synthetic) {
        this.synthetic = synthetic;
    }

    /**
     * Settings of the local synthetic backend.
     */
    public static class Synthetic {

        /** Delay between a segment's end and its final result. */
        @PositiveOrZero
        private long latencyMs = 150;

        /** Text returned for every segment; blank means a generated, marked description. */
        private String fixedText = "";

        public long getLatencyMs() {
            return latencyMs;
        }

        public void setLatencyMs(long latencyMs) {
            this.latencyMs = latencyMs;
        }

        public String getFixedText() {
            return fixedText;
        }

        public void setFixedText(String fixedText) {
            this.fixedText = fixedText;
        }
    }
}
