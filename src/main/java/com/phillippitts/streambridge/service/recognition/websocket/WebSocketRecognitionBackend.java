package com.phillippitts.streambridge.service.recognition.websocket;

import com.phillippitts.streambridge.domain.PcmFormat;
import com.phillippitts.streambridge.exception.RecognitionExceptionBuilder;
import com.phillippitts.streambridge.service.recognition.BackendStream;
import com.phillippitts.streambridge.service.recognition.RecognitionBackend;
import com.phillippitts.streambridge.service.recognition.RecognitionOptions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Recognition backend reached over a WebSocket connection to a remote streaming ASR service.
 *
 * <p>Each {@link #connect} opens a new session and sends the stream's {@code config} frame.
 * Audio may be streamed before a segment is sealed.
 */
public class WebSocketRecognitionBackend implements RecognitionBackend {

    private static final Logger LOG = LogManager.getLogger(WebSocketRecognitionBackend.class);

    public static final String NAME = "websocket";

    private final WebSocketClient client;
    private final URI uri;

    public WebSocketRecognitionBackend(WebSocketClient client, URI uri) {
        this.client = Objects.requireNonNull(client, "client");
        this.uri = Objects.requireNonNull(uri, "uri");
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
        WebSocketBackendStream stream = new WebSocketBackendStream(NAME);
        CompletableFuture<WebSocketSession> pending =
                client.execute(stream.handler(), new WebSocketHttpHeaders(), uri);
        WebSocketSession session;
        try {
            session = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandon(pending);
            throw RecognitionExceptionBuilder.create("Interrupted while connecting to backend")
                    .backend(NAME)
                    .cause(e)
                    .metadata("uri", uri)
                    .build();
        } catch (ExecutionException e) {
            throw RecognitionExceptionBuilder.create("Failed to connect to backend")
                    .backend(NAME)
                    .cause(e.getCause())
                    .metadata("uri", uri)
                    .build();
        } catch (TimeoutException e) {
            abandon(pending);
            throw RecognitionExceptionBuilder.create("Timed out connecting to backend")
                    .backend(NAME)
                    .durationMs(timeout.toMillis())
                    .metadata("uri", uri)
                    .build();
        }
        stream.attach(session);
        stream.sendConfig(BackendMessageCodec.config(format, options));
        LOG.debug("Backend stream opened: uri={}, language={}", uri, options.languageCode());
        return stream;
    }

    // A session that completes after we gave up must not stay open.
    private static void abandon(CompletableFuture<WebSocketSession> pending) {
        pending.thenAccept(late -> {
            try {
                late.close(CloseStatus.GOING_AWAY);
            } catch (IOException e) {
                LOG.debug("Error closing abandoned backend session: {}", e.getMessage());
            }
        });
    }
}
