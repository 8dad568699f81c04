package com.phillippitts.streambridge.presentation.gateway;

import com.phillippitts.streambridge.config.properties.GatewayProperties;
import com.phillippitts.streambridge.domain.AudioFrame;
import com.phillippitts.streambridge.domain.PcmFormat;
import com.phillippitts.streambridge.exception.ControlMessageException;
import com.phillippitts.streambridge.presentation.protocol.EnvelopeWriter;
import com.phillippitts.streambridge.presentation.protocol.OutboundMessage;
import com.phillippitts.streambridge.service.events.ConnectionRejectedEvent;
import com.phillippitts.streambridge.service.metrics.BridgeMetrics;
import com.phillippitts.streambridge.service.recognition.RecognitionClientFactory;
import com.phillippitts.streambridge.service.recognition.watchdog.BackendHealthTracker;
import com.phillippitts.streambridge.service.session.RecordingRequest;
import com.phillippitts.streambridge.service.session.SessionFactory;
import com.phillippitts.streambridge.service.session.SessionSnapshot;
import com.phillippitts.streambridge.service.session.TerminationReason;
import com.phillippitts.streambridge.service.session.TranscriptionSession;
import com.phillippitts.streambridge.util.LogSanitizer;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Client-facing WebSocket endpoint.
 *
 * <p>Per connection it performs the handshake checks (format, capacity), creates a
 * {@link TranscriptionSession}, demultiplexes JSON control messages from binary PCM frames, and
 * tears the session down when the transport closes. Idle and maximum-duration limits are enforced
 * by a periodic sweep.
 *
 * <p>Every callback runs with the connection id in the Log4j ThreadContext.
 */
@Component
public class ConnectionGateway extends AbstractWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(ConnectionGateway.class);

    private final ConnectionRegistry registry;
    private final SessionFactory sessionFactory;
    private final EnvelopeWriter writer;
    private final GatewayProperties props;
    private final BridgeMetrics metrics;
    private final BackendHealthTracker healthTracker;
    private final RecognitionClientFactory clientFactory;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;
    private final Instant startedAt;

    ConnectionGateway(ConnectionRegistry registry,
                      SessionFactory sessionFactory,
                      EnvelopeWriter writer,
                      GatewayProperties props,
                      BridgeMetrics metrics,
                      BackendHealthTracker healthTracker,
                      RecognitionClientFactory clientFactory,
                      ApplicationEventPublisher publisher,
                      Clock clock) {
        this.registry = registry;
        this.sessionFactory = sessionFactory;
        this.writer = writer;
        this.props = props;
        this.metrics = metrics;
        this.healthTracker = healthTracker;
        this.clientFactory = clientFactory;
        this.publisher = publisher;
        this.clock = clock;
        this.startedAt = clock.instant();
        metrics.bindActiveConnections(registry::size);
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession ws) {
        String id = ws.getId();
        String clientId = (String) ws.getAttributes().getOrDefault(ClientHandshakeInterceptor.ATTR_CLIENT_ID, id);
        try (CloseableThreadContext.Instance ctc = CloseableThreadContext.put("connectionId", id)
                .put("clientId", clientId)) {
            WebSocketSession outbound = new ConcurrentWebSocketSessionDecorator(
                    ws, props.getSendTimeLimitMs(), props.getSendBufferSizeBytes());
            WebSocketClientChannel channel = new WebSocketClientChannel(outbound, writer,
                    snapshot -> metricsEnvelope(id, snapshot));

            String formatError = (String) ws.getAttributes().get(ClientHandshakeInterceptor.ATTR_FORMAT_ERROR);
            if (formatError != null) {
                reject(ws, channel, "format", TerminationReason.FORMAT_ERROR, formatError);
                return;
            }
            if (registry.size() >= registry.maxConnections()) {
                reject(ws, channel, "capacity", TerminationReason.OVER_CAPACITY,
                        "Server at capacity (" + registry.maxConnections() + " connections); try again later");
                return;
            }

            TranscriptionSession session = sessionFactory.create(id, PcmFormat.REQUIRED, channel);
            Connection connection = new Connection(id, clientId, clock.instant(), session, channel);
            if (!registry.tryRegister(connection)) {
                session.close();
                reject(ws, channel, "capacity", TerminationReason.OVER_CAPACITY,
                        "Server at capacity (" + registry.maxConnections() + " connections); try again later");
                return;
            }
            metrics.incrementConnectionAccepted();
            LOG.info("Connection accepted from {} ({} active)", remote(ws), registry.size());
            channel.send(new OutboundMessage.Connection(clientId, props.getProtocolVersion()));
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession ws, TextMessage message) {
        withConnection(ws, connection -> dispatch(connection, message.getPayload()));
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession ws, BinaryMessage message) {
        withConnection(ws, connection -> {
            ByteBuffer payload = message.getPayload();
            byte[] bytes = new byte[payload.remaining()];
            payload.get(bytes);
            Optional<String> json = asJsonText(bytes);
            if (json.isPresent()) {
                dispatch(connection, json.get());
            } else {
                connection.session().onAudio(new AudioFrame(bytes, clock.instant()));
            }
        });
    }

    @Override
    public void handleTransportError(WebSocketSession ws, Throwable exception) {
        try (CloseableThreadContext.Instance ctc = CloseableThreadContext.put("connectionId", ws.getId())) {
            LOG.warn("Transport error: {}", exception.getMessage());
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession ws, CloseStatus status) {
        try (CloseableThreadContext.Instance ctc = CloseableThreadContext.put("connectionId", ws.getId())) {
            registry.remove(ws.getId()).ifPresent(connection -> {
                LOG.info("Connection closed: status={}, uptimeSec={}", status,
                        connection.uptime(clock.instant()).toSeconds());
                connection.session().close();
            });
        }
    }

    /**
     * Closes connections that exceeded the idle timeout or the maximum session duration.
     */
    @Scheduled(fixedDelayString = "${bridge.gateway.sweep-interval-ms:5000}")
    public void enforceLimits() {
        Instant now = clock.instant();
        for (Connection connection : registry.all()) {
            try (CloseableThreadContext.Instance ctc = CloseableThreadContext.put("connectionId", connection.id())) {
                if (connection.uptime(now).compareTo(props.getMaxSessionDuration()) > 0) {
                    LOG.info("Maximum session duration {} reached", props.getMaxSessionDuration());
                    connection.channel().terminate(TerminationReason.MAX_DURATION,
                            "Maximum session duration exceeded");
                } else if (connection.idleFor(now).compareTo(props.getIdleTimeout()) > 0) {
                    LOG.info("Idle for more than {}", props.getIdleTimeout());
                    connection.channel().terminate(TerminationReason.IDLE_TIMEOUT,
                            "Idle timeout: no audio or control message for "
                                    + props.getIdleTimeout().toSeconds() + " s");
                }
            }
        }
    }

    /** Read-only snapshot of all open connections. */
    public GatewayStatus status() {
        Instant now = clock.instant();
        List<GatewayStatus.ConnectionStatus> list = new ArrayList<>();
        for (Connection connection : registry.all()) {
            list.add(toStatus(connection, now));
        }
        return new GatewayStatus(list.size(), registry.maxConnections(), list);
    }

    /** Snapshot of one connection, if open. */
    public Optional<GatewayStatus.ConnectionStatus> status(String connectionId) {
        Instant now = clock.instant();
        return registry.get(connectionId).map(connection -> toStatus(connection, now));
    }

    @PreDestroy
    void shutdown() {
        List<Connection> open = registry.all();
        if (!open.isEmpty()) {
            LOG.info("Closing {} connection(s) on shutdown", open.size());
        }
        for (Connection connection : open) {
            connection.channel().terminate(TerminationReason.SHUTDOWN, "Server shutting down");
        }
    }

    private void dispatch(Connection connection, String text) {
        ControlMessage message;
        try {
            message = ControlMessageParser.parse(text);
        } catch (ControlMessageException e) {
            LOG.warn("Ignoring control message: {}", e.getMessage());
            connection.channel().error(e.getMessage());
            return;
        }
        LOG.debug("Control message: {}", message.type().wireName());
        TranscriptionSession session = connection.session();
        switch (message.type()) {
            case START_RECORDING -> session.start(new RecordingRequest(message.sampleRate(),
                    message.enablePartials(), message.hotwords(), message.languageCode()));
            case STOP_RECORDING -> session.stop();
            case CONFIGURE -> session.configure(message.vadThreshold(), message.silenceDuration());
            case PING -> session.ping();
            case GET_METRICS -> session.reportMetrics();
            default -> throw new IllegalStateException("Unhandled control message " + message.type());
        }
    }

    private void withConnection(WebSocketSession ws, Consumer<Connection> action) {
        try (CloseableThreadContext.Instance ctc = CloseableThreadContext.put("connectionId", ws.getId())) {
            Optional<Connection> connection = registry.get(ws.getId());
            if (connection.isEmpty()) {
                LOG.debug("Message for unregistered connection ignored");
                return;
            }
            ctc.put("clientId", connection.get().clientId());
            connection.get().touch(clock.instant());
            action.accept(connection.get());
        }
    }

    private void reject(WebSocketSession ws, WebSocketClientChannel channel, String reason,
                        TerminationReason termination, String message) {
        metrics.incrementConnectionRejected(reason);
        publisher.publishEvent(new ConnectionRejectedEvent(reason, remote(ws), LogSanitizer.preview(message)));
        channel.terminate(termination, message);
    }

    private OutboundMessage metricsEnvelope(String connectionId, SessionSnapshot snapshot) {
        Instant now = clock.instant();
        Map<String, Object> connection = new LinkedHashMap<>();
        connection.put("connection_id", connectionId);
        registry.get(connectionId).ifPresent(c -> {
            connection.put("client_id", c.clientId());
            connection.put("uptime_seconds", c.uptime(now).toSeconds());
        });
        connection.put("state", snapshot.state().name().toLowerCase());
        connection.put("total_segments", snapshot.totalSegments());
        connection.put("finals_emitted", snapshot.finalsEmitted());
        connection.put("partials_emitted", snapshot.partialsEmitted());
        connection.put("segment_errors", snapshot.segmentErrors());
        connection.put("frames_dropped", snapshot.framesDropped());
        connection.put("pending_segments", snapshot.pendingSegments());
        connection.put("backend_state", snapshot.backendState().toLowerCase());

        Map<String, Object> bridge = new LinkedHashMap<>();
        bridge.put("active_connections", registry.size());
        bridge.put("max_connections", registry.maxConnections());
        bridge.put("uptime_seconds", Duration.between(startedAt, now).toSeconds());
        bridge.put("backend", snapshot.backend());
        bridge.put("backend_health", healthTracker.getState(clientFactory.backendName()).name().toLowerCase());
        return new OutboundMessage.Metrics(connection, bridge);
    }

    private GatewayStatus.ConnectionStatus toStatus(Connection connection, Instant now) {
        SessionSnapshot snapshot = connection.session().snapshot();
        return new GatewayStatus.ConnectionStatus(connection.id(), connection.clientId(),
                snapshot.state().name(), connection.uptime(now).toSeconds(), connection.idleFor(now).toSeconds(),
                snapshot.totalSegments(), snapshot.pendingSegments(), snapshot.backendState());
    }

    /** A binary frame starting with '{' that is valid UTF-8 is a control message sent as binary. */
    static Optional<String> asJsonText(byte[] bytes) {
        if (bytes.length == 0 || bytes[0] != '{') {
            return Optional.empty();
        }
        try {
            CharBuffer chars = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes));
            return Optional.of(chars.toString());
        } catch (CharacterCodingException e) {
            return Optional.empty();
        }
    }

    private static String remote(WebSocketSession ws) {
        InetSocketAddress address = ws.getRemoteAddress();
        return address != null ? address.getHostString() : "unknown";
    }
}
