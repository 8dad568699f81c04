package com.phillippitts.streambridge.service.recognition.websocket;

import com.phillippitts.streambridge.exception.RecognitionException;
import com.phillippitts.streambridge.exception.RecognitionExceptionBuilder;
import com.phillippitts.streambridge.service.recognition.BackendEvent;
import com.phillippitts.streambridge.service.recognition.BackendStream;
import com.phillippitts.streambridge.service.recognition.ResultChannel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

import java.io.IOException;

/**
 * {@link BackendStream} over one WebSocket session to the recognition service.
 *
 * <p>Inbound frames are decoded by {@link BackendMessageCodec} on the container's I/O thread and
 * published to the event channel. A transport error or an abnormal close fails the channel so the
 * waiting worker notices immediately.
 */
final class WebSocketBackendStream implements BackendStream {

    private static final Logger LOG = LogManager.getLogger(WebSocketBackendStream.class);

    private final String backendName;
    private final ResultChannel<BackendEvent> events = new ResultChannel<>();
    private final Handler handler = new Handler();
    private volatile WebSocketSession session;
    private volatile boolean open;

    WebSocketBackendStream(String backendName) {
        this.backendName = backendName;
    }

    AbstractWebSocketHandler handler() {
        return handler;
    }

    void attach(WebSocketSession session) {
        this.session = session;
        this.open = session.isOpen();
    }

    @Override
    public void startSegment(long segmentId) {
        send(new TextMessage(BackendMessageCodec.segmentStart(segmentId)), segmentId);
    }

    @Override
    public void sendAudio(long segmentId, byte[] pcm) {
        send(new BinaryMessage(pcm), segmentId);
    }

    @Override
    public void endSegment(long segmentId) {
        send(new TextMessage(BackendMessageCodec.segmentEnd(segmentId)), segmentId);
    }

    void sendConfig(String configJson) {
        send(new TextMessage(configJson), BackendEvent.STREAM_LEVEL);
    }

    @Override
    public ResultChannel<BackendEvent> events() {
        return events;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
        events.close();
        WebSocketSession s = session;
        if (s != null && s.isOpen()) {
            try {
                s.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                LOG.debug("Error closing backend session: {}", e.getMessage());
            }
        }
    }

    private synchronized void send(WebSocketMessage<?> message, long segmentId) {
        if (!open) {
            throw streamError("Backend stream is closed", segmentId, null);
        }
        try {
            session.sendMessage(message);
        } catch (IOException | IllegalStateException e) {
            RecognitionException error = streamError("Failed to send to backend", segmentId, e);
            open = false;
            events.fail(error);
            throw error;
        }
    }

    private RecognitionException streamError(String message, long segmentId, Throwable cause) {
        RecognitionExceptionBuilder builder = RecognitionExceptionBuilder.create(message)
                .backend(backendName)
                .cause(cause);
        if (segmentId >= 0) {
            builder.segment(segmentId);
        }
        return builder.build();
    }

    private final class Handler extends AbstractWebSocketHandler {

        @Override
        protected void handleTextMessage(WebSocketSession s, TextMessage message) {
            BackendMessageCodec.parse(message.getPayload()).ifPresent(event -> {
                if (!events.publish(event)) {
                    LOG.debug("Dropping backend {} after stream close", event.kind());
                }
            });
        }

        @Override
        protected void handleBinaryMessage(WebSocketSession s, BinaryMessage message) {
            LOG.warn("Ignoring unexpected binary message from backend ({} bytes)", message.getPayloadLength());
        }

        @Override
        public void handleTransportError(WebSocketSession s, Throwable exception) {
            open = false;
            LOG.warn("Backend transport error: {}", exception.getMessage());
            events.fail(RecognitionExceptionBuilder.create("Backend transport error")
                    .backend(backendName)
                    .cause(exception)
                    .build());
        }

        @Override
        public void afterConnectionClosed(WebSocketSession s, CloseStatus status) {
            open = false;
            if (CloseStatus.NORMAL.equalsCode(status)) {
                events.close();
            } else {
                LOG.warn("Backend closed the stream: {}", status);
                events.fail(RecognitionExceptionBuilder.create("Backend closed the stream")
                        .backend(backendName)
                        .metadata("status", status.getCode())
                        .metadata("reason", status.getReason())
                        .build());
            }
        }
    }
}
