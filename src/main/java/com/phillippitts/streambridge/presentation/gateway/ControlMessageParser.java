package com.phillippitts.streambridge.presentation.gateway;

import com.phillippitts.streambridge.exception.ControlMessageException;
import com.phillippitts.streambridge.util.LogSanitizer;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses client control messages from JSON text.
 *
 * <p>Option fields may appear at the top level or inside a {@code config} object; the nested form
 * wins when both are present.
 *
 * <p>Thread-safe: All methods are static and stateless.
 */
final class ControlMessageParser {

    private ControlMessageParser() {
        // Utility class - prevent instantiation
    }

    /**
     * @param json message text
     * @return the parsed message
     * @throws ControlMessageException if the text is not a JSON object, has no known {@code type},
     *                                 or carries fields of the wrong JSON type
     */
    static ControlMessage parse(String json) {
        if (json == null || json.isBlank()) {
            throw new ControlMessageException("Empty control message");
        }
        JSONObject obj;
        try {
            obj = new JSONObject(json);
        } catch (JSONException e) {
            throw new ControlMessageException("Invalid JSON: " + e.getMessage(), e);
        }
        String typeName = obj.optString("type", "");
        ControlMessage.Type type = ControlMessage.Type.fromWire(typeName);
        if (type == null) {
            throw new ControlMessageException(typeName.isEmpty()
                    ? "Control message without type"
                    : "Unknown message type: " + LogSanitizer.preview(typeName));
        }
        JSONObject config = obj.optJSONObject("config");
        try {
            return switch (type) {
                case START_RECORDING -> new ControlMessage(type,
                        optInt(obj, config, "sample_rate"),
                        optBoolean(obj, config, "enable_partials"),
                        optStrings(obj, config, "hotwords"),
                        optString(obj, config, "language_code"),
                        null, null);
                case CONFIGURE -> new ControlMessage(type, null, null, List.of(), null,
                        optDouble(obj, config, "vad_threshold"),
                        optDouble(obj, config, "silence_duration"));
                default -> ControlMessage.of(type);
            };
        } catch (JSONException e) {
            throw new ControlMessageException("Invalid '" + typeName + "' message: " + e.getMessage(), e);
        }
    }

    private static JSONObject source(JSONObject root, JSONObject config, String key) {
        return config != null && config.has(key) ? config : root;
    }

    private static Integer optInt(JSONObject root, JSONObject config, String key) {
        JSONObject src = source(root, config, key);
        return src.has(key) && !src.isNull(key) ? src.getInt(key) : null;
    }

    private static Boolean optBoolean(JSONObject root, JSONObject config, String key) {
        JSONObject src = source(root, config, key);
        return src.has(key) && !src.isNull(key) ? src.getBoolean(key) : null;
    }

    private static Double optDouble(JSONObject root, JSONObject config, String key) {
        JSONObject src = source(root, config, key);
        return src.has(key) && !src.isNull(key) ? src.getDouble(key) : null;
    }

    private static String optString(JSONObject root, JSONObject config, String key) {
        JSONObject src = source(root, config, key);
        return src.has(key) && !src.isNull(key) ? src.getString(key) : null;
    }

    private static List<String> optStrings(JSONObject root, JSONObject config, String key) {
        JSONObject src = source(root, config, key);
        List<String> out = new ArrayList<>();
        if (!src.has(key) || src.isNull(key)) {
            return out;
        }
        JSONArray arr = src.getJSONArray(key);
        for (int i = 0; i < arr.length(); i++) {
            String s = arr.getString(i);
            if (!s.isBlank()) {
                out.add(s.trim());
            }
        }
        return out;
    }
}
