package com.phillippitts.streambridge.presentation.protocol;

import com.phillippitts.streambridge.domain.RecognitionResult;
import com.phillippitts.streambridge.domain.SessionSummary;
import com.phillippitts.streambridge.domain.WordTiming;
import com.phillippitts.streambridge.service.session.RecordingConfig;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Envelopes sent to clients. Field names and order are a stable external contract.
 *
 * <p>{@link #toWire()} returns an insertion-ordered map with {@code type} first, followed by the
 * envelope's fields in their documented order.
 */
public interface OutboundMessage {

    /** Envelope {@code type} value. */
    String type();

    /** Ordered JSON object of the envelope. */
    Map<String, Object> toWire();

    private static Map<String, Object> envelope(String type) {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("type", type);
        return wire;
    }

    /** {@code {type:"connection", client_id, protocol_version}} */
    record Connection(String clientId, String protocolVersion) implements OutboundMessage {
        @Override
        public String type() {
            return "connection";
        }

        @Override
        public Map<String, Object> toWire() {
            Map<String, Object> wire = envelope(type());
            wire.put("client_id", clientId);
            wire.put("protocol_version", protocolVersion);
            return wire;
        }
    }

    /** {@code {type:"recording_started", config}} */
    record RecordingStarted(RecordingConfig config) implements OutboundMessage {
        @Override
        public String type() {
            return "recording_started";
        }

        @Override
        public Map<String, Object> toWire() {
            Map<String, Object> wire = envelope(type());
            wire.put("config", configToWire(config));
            return wire;
        }
    }

    /** {@code {type:"recording_stopped", final_transcript, total_duration, total_segments}} */
    record RecordingStopped(SessionSummary summary) implements OutboundMessage {
        @Override
        public String type() {
            return "recording_stopped";
        }

        @Override
        public Map<String, Object> toWire() {
            Map<String, Object> wire = envelope(type());
            wire.put("final_transcript", summary.finalTranscript());
            wire.put("total_duration", summary.totalDurationSeconds());
            wire.put("total_segments", summary.totalSegments());
            return wire;
        }
    }

    /** {@code {type:"partial", segment_id, text, is_final:false}} */
    record Partial(RecognitionResult result) implements OutboundMessage {
        @Override
        public String type() {
            return "partial";
        }

        @Override
        public Map<String, Object> toWire() {
            Map<String, Object> wire = envelope(type());
            wire.put("segment_id", result.segmentId());
            wire.put("text", result.text());
            wire.put("is_final", false);
            return wire;
        }
    }

    /**
     * {@code {type:"transcription", segment_id, text, is_final:true,
     * words:[{word, start, end, confidence}], processing_time_ms}}
     */
    record Transcription(RecognitionResult result) implements OutboundMessage {
        @Override
        public String type() {
            return "transcription";
        }

        @Override
        public Map<String, Object> toWire() {
            Map<String, Object> wire = envelope(type());
            wire.put("segment_id", result.segmentId());
            wire.put("text", result.text());
            wire.put("is_final", true);
            List<Map<String, Object>> words = new ArrayList<>(result.words().size());
            for (WordTiming w : result.words()) {
                Map<String, Object> word = new LinkedHashMap<>();
                word.put("word", w.word());
                word.put("start", w.start());
                word.put("end", w.end());
                word.put("confidence", w.confidence());
                words.add(word);
            }
            wire.put("words", words);
            wire.put("processing_time_ms", result.processingTimeMs());
            return wire;
        }
    }

    /** {@code {type:"error", error}} */
    record ClientError(String error) implements OutboundMessage {
        public ClientError {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public String type() {
            return "error";
        }

        @Override
        public Map<String, Object> toWire() {
            Map<String, Object> wire = envelope(type());
            wire.put("error", error);
            return wire;
        }
    }

    /** {@code {type:"configured", config}} */
    record Configured(RecordingConfig config) implements OutboundMessage {
        @Override
        public String type() {
            return "configured";
        }

        @Override
        public Map<String, Object> toWire() {
            Map<String, Object> wire = envelope(type());
            wire.put("config", configToWire(config));
            return wire;
        }
    }

    /** {@code {type:"pong"}} */
    record Pong() implements OutboundMessage {
        @Override
        public String type() {
            return "pong";
        }

        @Override
        public Map<String, Object> toWire() {
            return envelope(type());
        }
    }

    /** {@code {type:"metrics", connection:{...}, bridge:{...}}} */
    record Metrics(Map<String, Object> connection, Map<String, Object> bridge) implements OutboundMessage {
        @Override
        public String type() {
            return "metrics";
        }

        @Override
        public Map<String, Object> toWire() {
            Map<String, Object> wire = envelope(type());
            wire.put("connection", connection);
            wire.put("bridge", bridge);
            return wire;
        }
    }

    private static Map<String, Object> configToWire(RecordingConfig config) {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("sample_rate", config.sampleRate());
        wire.put("channels", config.channels());
        wire.put("bit_depth", config.bitDepth());
        wire.put("vad_threshold", config.vadThreshold());
        wire.put("silence_duration", config.silenceDuration());
        wire.put("max_segment_duration", config.maxSegmentDuration());
        wire.put("enable_partials", config.enablePartials());
        wire.put("language_code", config.languageCode());
        return wire;
    }
}
