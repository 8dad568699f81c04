package com.phillippitts.streambridge.service.session;

/**
 * Effective configuration of a session, echoed in {@code recording_started} and {@code configured}.
 *
 * @param sampleRate            negotiated sample rate
 * @param channels              negotiated channel count
 * @param bitDepth              negotiated bit depth
 * @param vadThreshold          normalised RMS speech threshold
 * @param silenceDuration       trailing silence that ends a segment, in seconds
 * @param maxSegmentDuration    upper bound of a segment, in seconds
 * @param enablePartials        whether partials are forwarded
 * @param languageCode          recognition language
 */
public record RecordingConfig(
        int sampleRate,
        int channels,
        int bitDepth,
        double vadThreshold,
        double silenceDuration,
        double maxSegmentDuration,
        boolean enablePartials,
        String languageCode
) {
}
