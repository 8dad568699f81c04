package com.phillippitts.streambridge.presentation.gateway;

import com.phillippitts.streambridge.domain.RecognitionResult;
import com.phillippitts.streambridge.domain.SessionSummary;
import com.phillippitts.streambridge.presentation.protocol.EnvelopeWriter;
import com.phillippitts.streambridge.presentation.protocol.OutboundMessage;
import com.phillippitts.streambridge.service.session.ClientChannel;
import com.phillippitts.streambridge.service.session.RecordingConfig;
import com.phillippitts.streambridge.service.session.SessionSnapshot;
import com.phillippitts.streambridge.service.session.TerminationReason;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Objects;
import java.util.function.Function;

/**
 * {@link ClientChannel} that writes envelopes to a client WebSocket.
 *
 * <p>The session is expected to be a
 * {@link org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator}, so sends from
 * session threads are serialised and bounded by the send time and buffer limits instead of
 * blocking on a slow client.
 */
class WebSocketClientChannel implements ClientChannel {

    private static final Logger LOG = LogManager.getLogger(WebSocketClientChannel.class);

    /** WebSocket close reasons are limited to 123 bytes. */
    private static final int MAX_REASON_LENGTH = 120;

    private final WebSocketSession session;
    private final EnvelopeWriter writer;
    private final Function<SessionSnapshot, OutboundMessage> metricsEnvelope;
    private volatile boolean terminated;

    WebSocketClientChannel(WebSocketSession session, EnvelopeWriter writer,
                           Function<SessionSnapshot, OutboundMessage> metricsEnvelope) {
        this.session = Objects.requireNonNull(session, "session");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.metricsEnvelope = Objects.requireNonNull(metricsEnvelope, "metricsEnvelope");
    }

    @Override
    public void recordingStarted(RecordingConfig config) {
        send(new OutboundMessage.RecordingStarted(config));
    }

    @Override
    public void recordingStopped(SessionSummary summary) {
        send(new OutboundMessage.RecordingStopped(summary));
    }

    @Override
    public void partial(RecognitionResult partial) {
        send(new OutboundMessage.Partial(partial));
    }

    @Override
    public void transcription(RecognitionResult finalResult) {
        send(new OutboundMessage.Transcription(finalResult));
    }

    @Override
    public void configured(RecordingConfig config) {
        send(new OutboundMessage.Configured(config));
    }

    @Override
    public void pong() {
        send(new OutboundMessage.Pong());
    }

    @Override
    public void metrics(SessionSnapshot snapshot) {
        send(metricsEnvelope.apply(snapshot));
    }

    @Override
    public void error(String message) {
        send(new OutboundMessage.ClientError(message));
    }

    @Override
    public void terminate(TerminationReason reason, String message) {
        if (terminated) {
            return;
        }
        terminated = true;
        send(new OutboundMessage.ClientError(message));
        LOG.info("Closing connection: reason={}", reason);
        close(closeStatus(reason, message));
    }

    /** Sends one envelope. Failures close the connection; the close callback tears the session down. */
    void send(OutboundMessage message) {
        if (!session.isOpen()) {
            LOG.debug("Dropping '{}' envelope for closed connection", message.type());
            return;
        }
        try {
            session.sendMessage(new TextMessage(writer.write(message)));
        } catch (IOException | IllegalStateException e) {
            LOG.warn("Failed to send '{}' envelope: {}", message.type(), e.getMessage());
            close(CloseStatus.SERVER_ERROR.withReason("Send failed"));
        }
    }

    boolean isTerminated() {
        return terminated;
    }

    static CloseStatus closeStatus(TerminationReason reason, String message) {
        String text = message == null ? "" : message;
        if (text.length() > MAX_REASON_LENGTH) {
            text = text.substring(0, MAX_REASON_LENGTH);
        }
        return switch (reason) {
            case FORMAT_ERROR -> CloseStatus.BAD_DATA.withReason(text);
            case OVER_CAPACITY -> CloseStatus.SERVICE_OVERLOAD.withReason(text);
            case SHUTDOWN -> CloseStatus.GOING_AWAY.withReason(text);
            case SERVER_ERROR -> CloseStatus.SERVER_ERROR.withReason(text);
            default -> CloseStatus.NORMAL.withReason(text);
        };
    }

    private void close(CloseStatus status) {
        try {
            session.close(status);
        } catch (IOException e) {
            LOG.debug("Error closing client connection: {}", e.getMessage());
        }
    }
}
