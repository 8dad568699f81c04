package com.phillippitts.streambridge.domain;

import java.util.Objects;

/**
 * Word-level timing of a final recognition result.
 *
 * @param word       recognised word
 * @param start      start offset in seconds from the beginning of the segment
 * @param end        end offset in seconds from the beginning of the segment
 * @param confidence confidence between 0.0 and 1.0
 */
public record WordTiming(String word, double start, double end, double confidence) {

    public WordTiming {
        Objects.requireNonNull(word, "Word must not be null");
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid word offsets: start=" + start + ", end=" + end);
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }
}
