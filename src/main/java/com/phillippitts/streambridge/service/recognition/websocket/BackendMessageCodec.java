package com.phillippitts.streambridge.service.recognition.websocket;

import com.phillippitts.streambridge.domain.PcmFormat;
import com.phillippitts.streambridge.domain.RecognitionResult;
import com.phillippitts.streambridge.domain.WordTiming;
import com.phillippitts.streambridge.service.recognition.BackendEvent;
import com.phillippitts.streambridge.service.recognition.RecognitionOptions;
import com.phillippitts.streambridge.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds and parses the JSON text frames exchanged with the streaming recognition service.
 *
 * <p>Outbound: {@code config} once per stream, then {@code segment_start} / binary audio /
 * {@code segment_end} per segment. Inbound: {@code partial}, {@code final} and {@code error}.
 *
 * <p>Thread-safe: All methods are static and stateless.
 *
 * <p><b>Security:</b> inbound messages are capped at {@link #MAX_JSON_SIZE} (1MB) before parsing.
 */
final class BackendMessageCodec {

    private static final Logger LOG = LogManager.getLogger(BackendMessageCodec.class);

    static final int MAX_JSON_SIZE = 1_048_576; // 1MB

    private BackendMessageCodec() {
        // Utility class - prevent instantiation
    }

    static String config(PcmFormat format, RecognitionOptions options) {
        JSONObject obj = new JSONObject();
        obj.put("type", "config");
        obj.put("sample_rate", format.sampleRate());
        obj.put("channels", format.channels());
        obj.put("encoding", "pcm16");
        obj.put("language_code", options.languageCode());
        obj.put("enable_partials", options.enablePartials());
        obj.put("enable_word_offsets", options.enableWordOffsets());
        obj.put("enable_punctuation", options.enablePunctuation());
        obj.put("hotwords", new JSONArray(options.hotwords()));
        return obj.toString();
    }

    static String segmentStart(long segmentId) {
        return new JSONObject().put("type", "segment_start").put("segment_id", segmentId).toString();
    }

    static String segmentEnd(long segmentId) {
        return new JSONObject().put("type", "segment_end").put("segment_id", segmentId).toString();
    }

    /**
     * Parses one inbound message.
     *
     * @param json text frame payload
     * @return the event, or empty if the message is malformed or of an unknown type
     */
    static Optional<BackendEvent> parse(String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        json = truncateJsonIfNeeded(json);
        try {
            JSONObject obj = new JSONObject(json);
            String type = obj.optString("type", "");
            long segmentId = obj.optLong("segment_id", BackendEvent.STREAM_LEVEL);
            return switch (type) {
                case "partial" -> {
                    requireSegment(segmentId, type);
                    yield Optional.of(BackendEvent.partial(
                            RecognitionResult.partial(segmentId, obj.optString("text", "").trim())));
                }
                case "final" -> {
                    requireSegment(segmentId, type);
                    yield Optional.of(BackendEvent.finalResult(RecognitionResult.finalResult(
                            segmentId,
                            obj.optString("text", "").trim(),
                            parseWords(obj.optJSONArray("words")),
                            clamp(obj.optDouble("confidence", 1.0)))));
                }
                case "error" -> Optional.of(BackendEvent.error(segmentId, obj.optString("error", "unknown error")));
                default -> {
                    LOG.warn("Ignoring backend message of unknown type '{}'", LogSanitizer.preview(type));
                    yield Optional.empty();
                }
            };
        } catch (JSONException | IllegalArgumentException e) {
            LOG.warn("Failed to parse backend message: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static List<WordTiming> parseWords(JSONArray arr) {
        List<WordTiming> words = new ArrayList<>();
        if (arr == null) {
            return words;
        }
        for (int i = 0; i < arr.length(); i++) {
            JSONObject w = arr.optJSONObject(i);
            if (w == null) {
                continue;
            }
            String word = w.optString("word", "");
            if (word.isBlank()) {
                continue;
            }
            double start = Math.max(0.0, w.optDouble("start", 0.0));
            double end = Math.max(start, w.optDouble("end", start));
            words.add(new WordTiming(word, start, end, clamp(w.optDouble("confidence", 1.0))));
        }
        return words;
    }

    private static void requireSegment(long segmentId, String type) {
        if (segmentId < 0) {
            throw new IllegalArgumentException("'" + type + "' message without segment_id");
        }
    }

    // Backends may report unnormalised scores; NaN (missing or non-numeric) counts as certain.
    private static double clamp(double confidence) {
        if (Double.isNaN(confidence)) {
            return 1.0;
        }
        return Math.min(1.0, Math.max(0.0, confidence));
    }

    private static String truncateJsonIfNeeded(String json) {
        if (json.length() > MAX_JSON_SIZE) {
            LOG.warn("Backend message exceeds {} bytes ({}); truncating", MAX_JSON_SIZE, json.length());
            return json.substring(0, MAX_JSON_SIZE);
        }
        return json;
    }
}
