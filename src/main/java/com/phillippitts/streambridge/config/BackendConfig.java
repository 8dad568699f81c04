package com.phillippitts.streambridge.config;

import com.phillippitts.streambridge.config.properties.BackendProperties;
import com.phillippitts.streambridge.service.recognition.RecognitionBackend;
import com.phillippitts.streambridge.service.recognition.synthetic.SyntheticRecognitionBackend;
import com.phillippitts.streambridge.service.recognition.websocket.WebSocketRecognitionBackend;
import jakarta.websocket.ContainerProvider;
import jakarta.websocket.WebSocketContainer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

import java.net.URI;
import java.time.Clock;

/**
 * Selects the recognition backend from {@code bridge.backend.mode}.
 *
 * <p>{@code REAL} connects to the remote ASR service at {@code bridge.backend.uri};
 * {@code SYNTHETIC} answers locally and is also the degraded-mode fallback.
 */
@Configuration
public class BackendConfig {

    private static final Logger LOG = LogManager.getLogger(BackendConfig.class);

    /** Largest JSON result accepted from the backend. */
    private static final int BACKEND_TEXT_BUFFER_BYTES = 1_048_576;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "syntheticBackend")
    public RecognitionBackend syntheticBackend(BackendProperties props) {
        return new SyntheticRecognitionBackend(props.getSynthetic());
    }

    @Bean(name = "recognitionBackend")
    public RecognitionBackend recognitionBackend(BackendProperties props,
                                                 @Qualifier("syntheticBackend") RecognitionBackend synthetic) {
        if (props.getMode() == BackendProperties.Mode.SYNTHETIC) {
            LOG.info("Recognition backend: synthetic (latency={} ms)", props.getSynthetic().getLatencyMs());
            return synthetic;
        }
        URI uri = URI.create(props.getUri());
        WebSocketContainer container = ContainerProvider.getWebSocketContainer();
        container.setDefaultMaxTextMessageBufferSize(BACKEND_TEXT_BUFFER_BYTES);
        LOG.info("Recognition backend: websocket at {} (degradedMode={})", uri, props.getDegradedMode());
        return new WebSocketRecognitionBackend(new StandardWebSocketClient(container), uri);
    }
}
