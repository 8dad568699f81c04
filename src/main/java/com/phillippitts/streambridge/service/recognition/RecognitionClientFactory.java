package com.phillippitts.streambridge.service.recognition;

import com.phillippitts.streambridge.config.properties.BackendProperties;
import com.phillippitts.streambridge.config.properties.SessionProperties;
import com.phillippitts.streambridge.domain.RecognitionResult;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Creates one {@link RecognitionSessionClient} per transcription session, wired to the configured
 * backend, the synthetic fallback and the shared backend executor.
 */
@Component
public class RecognitionClientFactory {

    private final RecognitionBackend backend;
    private final RecognitionBackend fallback;
    private final BackendProperties backendProperties;
    private final SessionProperties sessionProperties;
    private final Executor backendExecutor;
    private final ApplicationEventPublisher publisher;

    public RecognitionClientFactory(@Qualifier("recognitionBackend") RecognitionBackend backend,
                                    @Qualifier("syntheticBackend") RecognitionBackend fallback,
                                    BackendProperties backendProperties,
                                    SessionProperties sessionProperties,
                                    @Qualifier("backendExecutor") Executor backendExecutor,
                                    ApplicationEventPublisher publisher) {
        this.backend = backend;
        this.fallback = fallback;
        this.backendProperties = backendProperties;
        this.sessionProperties = sessionProperties;
        this.backendExecutor = backendExecutor;
        this.publisher = publisher;
    }

    /**
     * @param partialListener receives partial hypotheses on the backend worker thread
     * @return a new, unopened client
     */
    public RecognitionSessionClient create(Consumer<RecognitionResult> partialListener) {
        return new RecognitionSessionClient(backend, fallback, backendProperties, backendExecutor, publisher,
                Duration.ofMillis(sessionProperties.getCancellationGraceMs()), partialListener);
    }

    /** Options derived from configuration, before per-recording overrides. */
    public RecognitionOptions defaultOptions() {
        return RecognitionOptions.from(backendProperties);
    }

    public String backendName() {
        return backend.name();
    }
}
