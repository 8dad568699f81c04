package com.phillippitts.streambridge.service.session;

import com.phillippitts.streambridge.config.properties.SessionProperties;
import com.phillippitts.streambridge.config.properties.SessionProperties.PartialPolicy;
import com.phillippitts.streambridge.domain.AudioFrame;
import com.phillippitts.streambridge.domain.AudioSegment;
import com.phillippitts.streambridge.domain.PcmFormat;
import com.phillippitts.streambridge.domain.RecognitionResult;
import com.phillippitts.streambridge.domain.SessionSummary;
import com.phillippitts.streambridge.exception.BackendBusyException;
import com.phillippitts.streambridge.exception.BackendUnavailableException;
import com.phillippitts.streambridge.exception.InvalidAudioException;
import com.phillippitts.streambridge.exception.SegmentTimeoutException;
import com.phillippitts.streambridge.service.audio.AudioFrameBuffer;
import com.phillippitts.streambridge.service.audio.FrameValidator;
import com.phillippitts.streambridge.service.audio.VadSettings;
import com.phillippitts.streambridge.service.events.LateFrameDroppedEvent;
import com.phillippitts.streambridge.service.metrics.BridgeMetrics;
import com.phillippitts.streambridge.service.recognition.RecognitionOptions;
import com.phillippitts.streambridge.service.recognition.RecognitionSessionClient;
import com.phillippitts.streambridge.util.LogSanitizer;
import com.phillippitts.streambridge.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Per-connection orchestrator between the frame buffer, the recognition client and the client
 * channel.
 *
 * <p><b>Threading:</b> every public method only enqueues work on the session's
 * {@link SerialExecutor}; all state below is confined to that serial task. Backend callbacks
 * (partials, finals, failures) are marshalled onto the same task, which gives two guarantees:
 * <ul>
 *   <li>results are routed by segment number, not arrival order;</li>
 *   <li>a partial for segment N is never emitted after N's final, because the final is
 *       delivered strictly after every partial the backend produced before it.</li>
 * </ul>
 *
 * <p><b>Stop:</b> {@code stop} flushes the buffer, then waits until every outstanding segment has
 * produced a final or failed (each bounded by the backend request timeout, the whole drain
 * bounded by the drain timeout) before sending the summary and returning to READY.
 */
public class TranscriptionSession {

    private static final Logger LOG = LogManager.getLogger(TranscriptionSession.class);

    private final String connectionId;
    private final PcmFormat format;
    private final ClientChannel channel;
    private final SerialExecutor serial;
    private final RecognitionSessionClient client;
    private final RecognitionOptions defaultOptions;
    private final AudioFrameBuffer buffer;
    private final FrameValidator validator;
    private final SessionProperties props;
    private final boolean incrementalInput;
    private final BridgeMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;
    private final Instant createdAt;

    private volatile SessionState state = SessionState.READY;
    private long nextSequence;

    // recording-scoped, reset on start
    private final TreeMap<Long, RecognitionResult> finals = new TreeMap<>();
    private final Map<Long, CompletableFuture<Void>> outstanding = new LinkedHashMap<>();
    private final Set<Long> submitted = new HashSet<>();
    private final Set<Long> settled = new HashSet<>();
    private final Map<Long, String> lastPartial = new HashMap<>();
    private long sealedDurationMs;
    private volatile int sealedSegments;
    private boolean partialsEnabled = true;
    private String languageCode;

    // connection-scoped counters
    private volatile long finalsEmitted;
    private volatile long partialsEmitted;
    private volatile long segmentErrors;
    private volatile long framesDropped;
    private SessionSummary closingSummary;

    /**
     * @param connectionId     connection id, used for logging
     * @param format           negotiated audio format
     * @param channel          outbound side of the connection
     * @param serial           the connection's serial task
     * @param clientFactory    creates the recognition client, given the partial listener
     * @param defaultOptions   recognition options before per-recording overrides
     * @param vadSettings      initial VAD settings
     * @param validator        frame validator
     * @param props            session settings
     * @param incrementalInput whether open segments are submitted before they are sealed
     * @param metrics          bridge metrics
     * @param publisher        application event publisher
     * @param clock            clock for frame and session timestamps
     */
    public TranscriptionSession(String connectionId,
                                PcmFormat format,
                                ClientChannel channel,
                                SerialExecutor serial,
                                Function<Consumer<RecognitionResult>, RecognitionSessionClient> clientFactory,
                                RecognitionOptions defaultOptions,
                                VadSettings vadSettings,
                                FrameValidator validator,
                                SessionProperties props,
                                boolean incrementalInput,
                                BridgeMetrics metrics,
                                ApplicationEventPublisher publisher,
                                Clock clock) {
        this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
        this.format = Objects.requireNonNull(format, "format");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.serial = Objects.requireNonNull(serial, "serial");
        this.defaultOptions = Objects.requireNonNull(defaultOptions, "defaultOptions");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.props = Objects.requireNonNull(props, "props");
        this.incrementalInput = incrementalInput;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.createdAt = clock.instant();
        this.languageCode = defaultOptions.languageCode();
        this.buffer = new AudioFrameBuffer(format, vadSettings, () -> nextSequence++, clock);
        this.client = clientFactory.apply(partial -> serial.execute(() -> onPartial(partial)));
    }

    public String connectionId() {
        return connectionId;
    }

    public SessionState state() {
        return state;
    }

    public Instant createdAt() {
        return createdAt;
    }

    /** Counters readable from any thread. */
    public SessionSnapshot snapshot() {
        return new SessionSnapshot(state, sealedSegments, finalsEmitted, partialsEmitted, segmentErrors,
                framesDropped, client.pendingSegments(), client.backendName(), client.state().name());
    }

    /** Handles {@code start_recording}. */
    public void start(RecordingRequest request) {
        Objects.requireNonNull(request, "request");
        serial.execute(() -> doStart(request));
    }

    /** Handles {@code stop_recording}. */
    public void stop() {
        serial.execute(this::doStop);
    }

    /**
     * Handles {@code configure}. Absent values keep their current setting.
     *
     * @param vadThreshold           normalised RMS threshold, or {@code null}
     * @param silenceDurationSeconds trailing silence in seconds, or {@code null}
     */
    public void configure(Double vadThreshold, Double silenceDurationSeconds) {
        serial.execute(() -> doConfigure(vadThreshold, silenceDurationSeconds));
    }

    /** Handles {@code ping}. */
    public void ping() {
        serial.execute(() -> {
            if (state != SessionState.CLOSED) {
                channel.pong();
            }
        });
    }

    /** Handles {@code get_metrics}. */
    public void reportMetrics() {
        serial.execute(() -> {
            if (state != SessionState.CLOSED) {
                channel.metrics(snapshot());
            }
        });
    }

    /** Handles one binary audio frame. */
    public void onAudio(AudioFrame frame) {
        Objects.requireNonNull(frame, "frame");
        serial.execute(() -> doAudio(frame));
    }

    /**
     * Tears the session down: abandons the open segment, cancels backend work and returns the
     * summary of whatever was recognised. Idempotent.
     *
     * @return future completed with the teardown summary
     */
    public CompletableFuture<SessionSummary> close() {
        CompletableFuture<SessionSummary> done = new CompletableFuture<>();
        serial.execute(() -> done.complete(doClose()));
        return done;
    }

    private void doStart(RecordingRequest request) {
        if (state == SessionState.RECORDING) {
            LOG.debug("start_recording while recording; ignored");
            return;
        }
        if (state == SessionState.DRAINING) {
            channel.error("Cannot start recording while the previous recording is stopping");
            return;
        }
        if (state == SessionState.CLOSED) {
            return;
        }
        if (request.sampleRate() != null && request.sampleRate() != format.sampleRate()) {
            String message = "Unsupported sample rate " + request.sampleRate() + "; connection negotiated "
                    + format.sampleRate() + " Hz";
            LOG.warn(message);
            channel.terminate(TerminationReason.FORMAT_ERROR, message);
            return;
        }

        partialsEnabled = request.partialsRequested();
        RecognitionOptions options = defaultOptions.withPartials(partialsEnabled);
        if (request.languageCode() != null && !request.languageCode().isBlank()) {
            options = options.withLanguageCode(request.languageCode());
        }
        if (!request.hotwords().isEmpty()) {
            options = options.withAdditionalHotwords(request.hotwords());
        }
        languageCode = options.languageCode();
        client.open(format, options);

        buffer.reset();
        finals.clear();
        outstanding.clear();
        submitted.clear();
        settled.clear();
        lastPartial.clear();
        sealedDurationMs = 0;
        sealedSegments = 0;

        state = SessionState.RECORDING;
        LOG.info("Recording started (partials={}, language={})", partialsEnabled, languageCode);
        channel.recordingStarted(currentConfig());
    }

    private void doAudio(AudioFrame frame) {
        if (state != SessionState.RECORDING) {
            framesDropped++;
            metrics.incrementFramesDropped();
            publisher.publishEvent(new LateFrameDroppedEvent(connectionId, state, frame.length()));
            return;
        }
        try {
            validator.validate(frame.data());
        } catch (InvalidAudioException e) {
            LOG.warn("Invalid audio frame: {}", e.getMessage());
            channel.terminate(TerminationReason.FORMAT_ERROR, e.getMessage());
            return;
        }

        for (AudioSegment sealed : buffer.ingest(frame)) {
            onSealed(sealed);
        }
        if (incrementalInput) {
            buffer.currentSegment().ifPresent(this::submit);
        }
    }

    private void doStop() {
        if (state != SessionState.RECORDING) {
            LOG.debug("stop_recording while {}; ignored", state);
            return;
        }
        state = SessionState.DRAINING;
        buffer.flush().ifPresent(this::onSealed);

        List<CompletableFuture<Void>> pending = new ArrayList<>(outstanding.values());
        LOG.info("Recording stopping; waiting for {} outstanding segment(s)", pending.size());
        CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]))
                .orTimeout(props.getDrainTimeoutMs(), TimeUnit.MILLISECONDS)
                .handleAsync((v, err) -> {
                    finishDrain();
                    return null;
                }, serial);
    }

    private void finishDrain() {
        if (state != SessionState.DRAINING) {
            return;
        }
        if (!outstanding.isEmpty()) {
            for (Long seq : new ArrayList<>(outstanding.keySet())) {
                reportFailure(seq, new SegmentTimeoutException(seq, props.getDrainTimeoutMs(), "drain"));
            }
            outstanding.clear();
        }
        SessionSummary summary = summary();
        state = SessionState.READY;
        LOG.info("Recording stopped: segments={}, durationSec={}, transcript='{}'",
                summary.totalSegments(), summary.totalDurationSeconds(),
                LogSanitizer.preview(summary.finalTranscript()));
        channel.recordingStopped(summary);
    }

    private void doConfigure(Double vadThreshold, Double silenceDurationSeconds) {
        if (state == SessionState.CLOSED) {
            return;
        }
        VadSettings settings = buffer.settings();
        try {
            if (vadThreshold != null) {
                settings = settings.withEnergyThreshold(vadThreshold);
            }
            if (silenceDurationSeconds != null) {
                long ms = Math.round(silenceDurationSeconds * 1000.0);
                if (ms <= 0 || ms > Integer.MAX_VALUE) {
                    throw new IllegalArgumentException("silence_duration must be positive, got: "
                            + silenceDurationSeconds);
                }
                settings = settings.withSilenceDurationMs((int) ms);
            }
        } catch (IllegalArgumentException e) {
            LOG.warn("Rejected configure: {}", e.getMessage());
            channel.error("Invalid configure: " + e.getMessage());
            return;
        }
        buffer.reconfigure(settings);
        channel.configured(currentConfig());
    }

    private SessionSummary doClose() {
        if (state == SessionState.CLOSED) {
            return closingSummary;
        }
        SessionState previous = state;
        state = SessionState.CLOSED;
        buffer.reset();
        client.close();
        outstanding.clear();
        lastPartial.clear();
        closingSummary = summary();
        LOG.info("Session closed (was {}): segments={}, durationSec={}, transcript='{}'",
                previous, closingSummary.totalSegments(), closingSummary.totalDurationSeconds(),
                LogSanitizer.preview(closingSummary.finalTranscript()));
        return closingSummary;
    }

    private void onSealed(AudioSegment segment) {
        sealedSegments++;
        sealedDurationMs += segment.durationMs();
        submit(segment);
    }

    private void submit(AudioSegment segment) {
        long seq = segment.sequence();
        if (!submitted.add(seq)) {
            return;
        }
        CompletableFuture<RecognitionResult> result = client.send(segment);
        CompletableFuture<Void> delivered = result.handleAsync((r, err) -> {
            onSegmentDone(seq, r, err);
            return null;
        }, serial);
        outstanding.put(seq, delivered);
        LOG.debug("Segment {} submitted (sealed={})", seq, segment.isSealed());
    }

    private void onSegmentDone(long seq, RecognitionResult result, Throwable error) {
        if (state == SessionState.CLOSED || outstanding.remove(seq) == null) {
            LOG.debug("Dropping late outcome for segment {}", seq);
            return;
        }
        if (error != null) {
            reportFailure(seq, error);
            return;
        }
        settled.add(seq);
        lastPartial.remove(seq);
        finals.put(seq, result);
        finalsEmitted++;
        metrics.incrementFinal();
        metrics.recordSegmentLatency(client.backendName(), result.processingTimeMs());
        LOG.debug("Final for segment {} after {} ms: '{}'", seq, result.processingTimeMs(),
                LogSanitizer.preview(result.text()));
        channel.transcription(result);
    }

    private void onPartial(RecognitionResult partial) {
        long seq = partial.segmentId();
        if (state == SessionState.CLOSED || !partialsEnabled
                || settled.contains(seq) || !outstanding.containsKey(seq)) {
            return;
        }
        String previous = lastPartial.get(seq);
        if (props.getPartialPolicy() == PartialPolicy.NON_SHRINKING
                && previous != null && partial.text().length() < previous.length()) {
            LOG.debug("Suppressing shrinking partial for segment {}", seq);
            return;
        }
        lastPartial.put(seq, partial.text());
        partialsEmitted++;
        metrics.incrementPartial();
        channel.partial(partial);
    }

    private void reportFailure(long seq, Throwable error) {
        Throwable cause = unwrap(error);
        settled.add(seq);
        lastPartial.remove(seq);
        if (cause instanceof CancellationException) {
            LOG.debug("Segment {} cancelled", seq);
            return;
        }
        segmentErrors++;
        metrics.incrementSegmentFailure(failureReason(cause));
        LOG.warn("Segment {} failed: {}", seq, cause.getMessage());
        channel.error(cause.getMessage() != null ? cause.getMessage() : "Segment " + seq + " failed");
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private static String failureReason(Throwable cause) {
        if (cause instanceof SegmentTimeoutException || cause instanceof TimeoutException) {
            return "timeout";
        }
        if (cause instanceof BackendBusyException) {
            return "busy";
        }
        if (cause instanceof BackendUnavailableException) {
            return "unavailable";
        }
        return "backend";
    }

    private SessionSummary summary() {
        StringJoiner transcript = new StringJoiner(" ");
        for (RecognitionResult r : finals.values()) {
            if (!r.text().isBlank()) {
                transcript.add(r.text().trim());
            }
        }
        return new SessionSummary(transcript.toString(), TimeUtils.millisToSeconds(sealedDurationMs),
                sealedSegments);
    }

    private RecordingConfig currentConfig() {
        VadSettings vad = buffer.settings();
        return new RecordingConfig(format.sampleRate(), format.channels(), format.bitsPerSample(),
                vad.energyThreshold(), vad.silenceDurationMs() / 1000.0, vad.maxSegmentDurationMs() / 1000.0,
                partialsEnabled, languageCode);
    }
}
