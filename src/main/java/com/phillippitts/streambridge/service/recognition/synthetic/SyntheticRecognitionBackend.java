package com.phillippitts.streambridge.service.recognition.synthetic;

import com.phillippitts.streambridge.config.properties.BackendProperties;
import com.phillippitts.streambridge.domain.PcmFormat;
import com.phillippitts.streambridge.service.recognition.BackendStream;
import com.phillippitts.streambridge.service.recognition.RecognitionBackend;
import com.phillippitts.streambridge.service.recognition.RecognitionOptions;

import java.time.Duration;
import java.util.Objects;

/**
 * Local stand-in for the remote recognition service.
 *
 * <p>Produces clearly marked {@code [synthetic]} transcripts describing each segment (or a fixed
 * configured text) after a configurable latency. Used for demos, tests, and as the fallback in
 * {@link BackendProperties.DegradedMode#SYNTHETIC} mode.
 */
public class SyntheticRecognitionBackend implements RecognitionBackend {

    public static final String NAME = "synthetic";

    private final BackendProperties.Synthetic settings;

    public SyntheticRecognitionBackend(BackendProperties.Synthetic settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean supportsIncrementalInput() {
        return true;
    }

    @Override
    public BackendStream connect(PcmFormat format, RecognitionOptions options, Duration timeout) {
        return new SyntheticBackendStream(format, options.enablePartials(),
                Duration.ofMillis(settings.getLatencyMs()), settings.getFixedText());
    }
}
