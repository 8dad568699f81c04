package com.phillippitts.streambridge.service.audio;

import com.phillippitts.streambridge.domain.AudioFrame;
import com.phillippitts.streambridge.domain.AudioSegment;
import com.phillippitts.streambridge.domain.AudioSegment.SealReason;
import com.phillippitts.streambridge.domain.PcmFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Per-connection frame accumulator that delimits speech segments with energy-based
 * voice-activity detection.
 *
 * <p><b>Algorithm:</b>
 * <ol>
 *   <li>Each frame is split into analysis windows and every window is classified as speech or
 *       silence by its normalised RMS energy. All decisions below are taken per window, so a
 *       frame may open, seal or split several segments.</li>
 *   <li>While idle, consecutive speech windows accumulate. Once they cover the onset hold, a
 *       segment opens and the held audio becomes its start. Shorter bursts are dropped.</li>
 *   <li>While a segment is open every window is appended; trailing silence longer than the
 *       configured duration seals it.</li>
 *   <li>A window that would push the segment past the maximum duration seals it first. If that
 *       window carries speech a new segment opens with it immediately, without a new hold.</li>
 * </ol>
 *
 * <p>Sequence numbers are drawn from the supplied source only when a segment actually opens,
 * so numbering stays gapless.
 *
 * <p>Not thread-safe: confined to the owning session's serial task.
 */
public final class AudioFrameBuffer {

    private static final Logger LOG = LogManager.getLogger(AudioFrameBuffer.class);

    private enum Phase { IDLE, ONSET, IN_SEGMENT }

    private final PcmFormat format;
    private final LongSupplier sequenceSource;
    private final Clock clock;

    private VadSettings settings;
    private Phase phase = Phase.IDLE;
    private final List<AudioFrame> onsetFrames = new ArrayList<>();
    private long voicedRunBytes;
    private long silenceRunBytes;
    private AudioSegment current;

    public AudioFrameBuffer(PcmFormat format, VadSettings settings, LongSupplier sequenceSource, Clock clock) {
        this.format = Objects.requireNonNull(format, "format");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.sequenceSource = Objects.requireNonNull(sequenceSource, "sequenceSource");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Ingests one frame in arrival order.
     *
     * @param frame validated PCM frame
     * @return segments sealed by this frame, in sequence order (usually empty)
     */
    public List<AudioSegment> ingest(AudioFrame frame) {
        Objects.requireNonNull(frame, "frame");
        if (frame.length() == 0) {
            return List.of();
        }
        List<AudioSegment> sealed = new ArrayList<>(1);
        byte[] pcm = frame.data();
        int windowBytes = windowBytes();
        long maxBytes = format.millisToBytes(settings.maxSegmentDurationMs());
        long silenceBytes = format.millisToBytes(settings.silenceDurationMs());
        long holdBytes = format.millisToBytes(settings.onsetHoldMs());
        // first byte of this frame not yet placed in the open segment
        int appendFrom = 0;
        // first byte of the voiced run inside this frame, -1 when there is none
        int runStart = voicedRunBytes > 0 ? 0 : -1;

        for (int pos = 0; pos < pcm.length; pos += windowBytes) {
            int len = Math.min(windowBytes, pcm.length - pos);
            boolean voiced = PcmEnergy.isVoiced(pcm, pos, len, settings.energyThreshold());

            if (phase == Phase.IN_SEGMENT) {
                long buffered = current.byteLength() + (pos - appendFrom);
                if (buffered > 0 && buffered + len > maxBytes) {
                    appendSlice(frame, appendFrom, pos);
                    sealed.add(sealCurrent(SealReason.MAX_DURATION, frame));
                    appendFrom = pos;
                    runStart = -1;
                    if (voiced) {
                        startSegment(List.of(), frame);
                        phase = Phase.IN_SEGMENT;
                    }
                }
            }

            if (phase == Phase.IN_SEGMENT) {
                silenceRunBytes = voiced ? 0 : silenceRunBytes + len;
                if (silenceRunBytes >= silenceBytes) {
                    appendSlice(frame, appendFrom, pos + len);
                    sealed.add(sealCurrent(SealReason.SILENCE, frame));
                }
                continue;
            }

            if (!voiced) {
                voicedRunBytes = 0;
                onsetFrames.clear();
                runStart = -1;
                phase = Phase.IDLE;
                continue;
            }
            if (runStart < 0) {
                runStart = pos;
            }
            voicedRunBytes += len;
            phase = Phase.ONSET;
            if (voicedRunBytes >= holdBytes) {
                List<AudioFrame> held = new ArrayList<>(onsetFrames);
                held.add(frame.slice(runStart, pos + len));
                onsetFrames.clear();
                startSegment(held, frame);
                phase = Phase.IN_SEGMENT;
                appendFrom = pos + len;
            }
        }

        if (phase == Phase.IN_SEGMENT) {
            appendSlice(frame, appendFrom, pcm.length);
        } else if (phase == Phase.ONSET && runStart >= 0) {
            onsetFrames.add(frame.slice(runStart, pcm.length));
        }
        return sealed;
    }

    /**
     * Forces closure of the open segment, e.g. on {@code stop_recording}. A pending onset that
     * never reached the hold time is discarded without consuming a sequence number.
     *
     * @return the sealed segment, or empty if no segment was open
     */
    public Optional<AudioSegment> flush() {
        onsetFrames.clear();
        voicedRunBytes = 0;
        if (phase != Phase.IN_SEGMENT) {
            phase = Phase.IDLE;
            return Optional.empty();
        }
        return Optional.of(sealCurrent(SealReason.STOP, null));
    }

    /** Segment currently collecting audio, if any. */
    public Optional<AudioSegment> currentSegment() {
        return phase == Phase.IN_SEGMENT ? Optional.of(current) : Optional.empty();
    }

    /**
     * Replaces the VAD thresholds. Takes effect from the next frame; an open segment is kept.
     *
     * @param newSettings settings to apply
     */
    public void reconfigure(VadSettings newSettings) {
        this.settings = Objects.requireNonNull(newSettings, "newSettings");
        LOG.debug("VAD reconfigured: threshold={}, silenceMs={}", newSettings.energyThreshold(),
                newSettings.silenceDurationMs());
    }

    public VadSettings settings() {
        return settings;
    }

    /**
     * Drops all buffered state. An open segment is abandoned unsealed; callers that care about it
     * must {@link #flush()} first.
     */
    public void reset() {
        onsetFrames.clear();
        voicedRunBytes = 0;
        silenceRunBytes = 0;
        current = null;
        phase = Phase.IDLE;
    }

    private void appendSlice(AudioFrame frame, int from, int to) {
        if (from < to) {
            current.append(frame.slice(from, to));
        }
    }

    private void startSegment(List<AudioFrame> held, AudioFrame trigger) {
        Instant openedAt = !held.isEmpty() ? held.get(0).arrivedAt() : trigger.arrivedAt();
        current = new AudioSegment(sequenceSource.getAsLong(), format, openedAt);
        for (AudioFrame f : held) {
            current.append(f);
        }
        voicedRunBytes = 0;
        silenceRunBytes = 0;
        LOG.debug("Segment opened (segment={})", current.sequence());
    }

    private AudioSegment sealCurrent(SealReason reason, AudioFrame trigger) {
        AudioSegment segment = current;
        segment.seal(reason, trigger != null ? trigger.arrivedAt() : clock.instant());
        current = null;
        phase = Phase.IDLE;
        voicedRunBytes = 0;
        silenceRunBytes = 0;
        LOG.debug("Segment sealed (segment={}, reason={}, durationMs={})",
                segment.sequence(), reason, segment.durationMs());
        return segment;
    }

    private int windowBytes() {
        return Math.max(format.blockAlign(), format.millisToBytes(settings.windowMs()));
    }
}
