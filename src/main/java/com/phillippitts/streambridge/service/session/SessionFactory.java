package com.phillippitts.streambridge.service.session;

import com.phillippitts.streambridge.config.properties.BackendProperties;
import com.phillippitts.streambridge.config.properties.SessionProperties;
import com.phillippitts.streambridge.config.properties.VadProperties;
import com.phillippitts.streambridge.domain.PcmFormat;
import com.phillippitts.streambridge.service.audio.FrameValidator;
import com.phillippitts.streambridge.service.audio.VadSettings;
import com.phillippitts.streambridge.service.metrics.BridgeMetrics;
import com.phillippitts.streambridge.service.recognition.RecognitionClientFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Creates a {@link TranscriptionSession} per accepted connection, each with its own serial task
 * over the shared session executor.
 */
@Component
public class SessionFactory {

    private final RecognitionClientFactory clientFactory;
    private final VadProperties vadProperties;
    private final SessionProperties sessionProperties;
    private final BackendProperties backendProperties;
    private final FrameValidator validator;
    private final Executor sessionExecutor;
    private final BridgeMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public SessionFactory(RecognitionClientFactory clientFactory,
                          VadProperties vadProperties,
                          SessionProperties sessionProperties,
                          BackendProperties backendProperties,
                          FrameValidator validator,
                          @Qualifier("sessionExecutor") Executor sessionExecutor,
                          BridgeMetrics metrics,
                          ApplicationEventPublisher publisher,
                          Clock clock) {
        this.clientFactory = clientFactory;
        this.vadProperties = vadProperties;
        this.sessionProperties = sessionProperties;
        this.backendProperties = backendProperties;
        this.validator = validator;
        this.sessionExecutor = sessionExecutor;
        this.metrics = metrics;
        this.publisher = publisher;
        this.clock = clock;
    }

    /**
     * @param connectionId connection id, also put into the serial task's logging context
     * @param format       negotiated audio format
     * @param channel      outbound side of the connection
     * @return a new session in {@link SessionState#READY}
     */
    public TranscriptionSession create(String connectionId, PcmFormat format, ClientChannel channel) {
        SerialExecutor serial = new SerialExecutor(sessionExecutor, Map.of("connectionId", connectionId));
        return new TranscriptionSession(connectionId, format, channel, serial,
                clientFactory::create,
                clientFactory.defaultOptions(),
                VadSettings.from(vadProperties),
                validator,
                sessionProperties,
                backendProperties.isIncrementalInput(),
                metrics,
                publisher,
                clock);
    }
}
