package com.phillippitts.streambridge.service.session;

import java.util.List;

/**
 * Parameters of a {@code start_recording} request. Absent fields are {@code null}.
 *
 * @param sampleRate     sample rate the client intends to send; must equal the negotiated rate
 * @param enablePartials whether partial hypotheses are wanted
 * @param hotwords       extra phrases to boost
 * @param languageCode   recognition language override
 */
public record RecordingRequest(Integer sampleRate, Boolean enablePartials, List<String> hotwords,
                               String languageCode) {

    public RecordingRequest {
        hotwords = hotwords == null ? List.of() : List.copyOf(hotwords);
    }

    public static RecordingRequest defaults() {
        return new RecordingRequest(null, null, List.of(), null);
    }

    public boolean partialsRequested() {
        return enablePartials == null || enablePartials;
    }
}
