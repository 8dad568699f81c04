package com.phillippitts.streambridge.domain;

import java.util.Objects;

/**
 * End-of-recording summary of a session.
 *
 * @param finalTranscript     final texts joined by single spaces in segment order
 * @param totalDurationSeconds summed duration of sealed segments, rounded to milliseconds
 * @param totalSegments        number of sealed segments
 */
public record SessionSummary(String finalTranscript, double totalDurationSeconds, int totalSegments) {

    public SessionSummary {
        Objects.requireNonNull(finalTranscript, "Transcript must not be null");
        if (totalSegments < 0 || totalDurationSeconds < 0) {
            throw new IllegalArgumentException("Summary counters must be non-negative");
        }
    }

    public static SessionSummary empty() {
        return new SessionSummary("", 0.0, 0);
    }
}
