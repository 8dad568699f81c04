package com.phillippitts.streambridge.presentation.gateway;

import java.util.List;
import java.util.Objects;

/**
 * Parsed inbound control message. Fields that the message type does not use, or that the client
 * omitted, are {@code null}.
 *
 * @param type            message type
 * @param sampleRate      {@code start_recording}: announced sample rate
 * @param enablePartials  {@code start_recording}: partials wanted
 * @param hotwords        {@code start_recording}: extra phrases to boost (never null)
 * @param languageCode    {@code start_recording}: recognition language
 * @param vadThreshold    {@code configure}: normalised RMS threshold
 * @param silenceDuration {@code configure}: trailing silence in seconds
 */
record ControlMessage(
        Type type,
        Integer sampleRate,
        Boolean enablePartials,
        List<String> hotwords,
        String languageCode,
        Double vadThreshold,
        Double silenceDuration
) {

    enum Type {
        START_RECORDING("start_recording"),
        STOP_RECORDING("stop_recording"),
        CONFIGURE("configure"),
        PING("ping"),
        GET_METRICS("get_metrics");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        String wireName() {
            return wireName;
        }

        static Type fromWire(String name) {
            for (Type t : values()) {
                if (t.wireName.equals(name)) {
                    return t;
                }
            }
            return null;
        }
    }

    ControlMessage {
        Objects.requireNonNull(type, "type");
        hotwords = hotwords == null ? List.of() : List.copyOf(hotwords);
    }

    static ControlMessage of(Type type) {
        return new ControlMessage(type, null, null, List.of(), null, null, null);
    }
}
