package com.phillippitts.streambridge.domain;

import java.util.List;
import java.util.Objects;

/**
 * Immutable recognition event for one segment: either a provisional partial hypothesis or
 * the sealed final result.
 *
 * <p>Partials may be superseded any number of times; a final is produced at most once per
 * segment and carries word timings and the processing latency.
 *
 * @param segmentId        segment sequence number the result belongs to
 * @param text             hypothesis text (empty is valid, e.g. for noise)
 * @param words            word timings, empty for partials
 * @param confidence       overall confidence between 0.0 and 1.0
 * @param isFinal          whether the result is sealed
 * @param processingTimeMs milliseconds between the segment's submission and this result
 */
public record RecognitionResult(
        long segmentId,
        String text,
        List<WordTiming> words,
        double confidence,
        boolean isFinal,
        long processingTimeMs
) {

    public RecognitionResult {
        Objects.requireNonNull(text, "Result text must not be null");
        if (segmentId < 0) {
            throw new IllegalArgumentException("Segment id must be non-negative, got: " + segmentId);
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "Confidence must be between 0.0 and 1.0, got: " + confidence
            );
        }
        words = words == null ? List.of() : List.copyOf(words);
    }

    public static RecognitionResult partial(long segmentId, String text) {
        return new RecognitionResult(segmentId, text, List.of(), 0.0, false, 0L);
    }

    public static RecognitionResult finalResult(long segmentId, String text, List<WordTiming> words,
                                                double confidence) {
        return new RecognitionResult(segmentId, text, words, confidence, true, 0L);
    }

    /**
     * Returns a copy of this result carrying the given processing latency.
     *
     * @param processingTimeMs latency in milliseconds
     * @return a new result
     */
    public RecognitionResult withProcessingTime(long processingTimeMs) {
        return new RecognitionResult(segmentId, text, words, confidence, isFinal, processingTimeMs);
    }
}
