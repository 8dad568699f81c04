package com.phillippitts.streambridge.service.recognition.websocket;

import com.phillippitts.streambridge.config.properties.BackendProperties;
import com.phillippitts.streambridge.domain.PcmFormat;
import com.phillippitts.streambridge.exception.RecognitionException;
import com.phillippitts.streambridge.service.recognition.BackendEvent;
import com.phillippitts.streambridge.service.recognition.BackendStream;
import com.phillippitts.streambridge.service.recognition.RecognitionOptions;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebSocketRecognitionBackendTest {

    private static final URI BACKEND_URI = URI.create("ws://asr.local:2700/stream");

    private final WebSocketClient client = mock(WebSocketClient.class);
    private final WebSocketSession session = mock(WebSocketSession.class);
    private final WebSocketRecognitionBackend backend = new WebSocketRecognitionBackend(client, BACKEND_URI);
    private RecognitionOptions options;

    @BeforeEach
    void setUp() {
        when(session.isOpen()).thenReturn(true);
        options = RecognitionOptions.from(new BackendProperties());
    }

    @Test
    void shouldSendConfigFrameOnConnect() throws Exception {
        // Arrange
        when(client.execute(any(WebSocketHandler.class), any(WebSocketHttpHeaders.class), eq(BACKEND_URI)))
                .thenReturn(CompletableFuture.completedFuture(session));

        // Act
        BackendStream stream = backend.connect(PcmFormat.REQUIRED, options, Duration.ofSeconds(1));

        // Assert
        assertThat(stream.isOpen()).isTrue();
        JSONObject config = new JSONObject(sentTexts().get(0));
        assertThat(config.getString("type")).isEqualTo("config");
        assertThat(config.getInt("sample_rate")).isEqualTo(16_000);
        assertThat(config.getString("encoding")).isEqualTo("pcm16");
    }

    @Test
    void shouldFrameSegmentWithStartAudioAndEnd() throws Exception {
        when(client.execute(any(WebSocketHandler.class), any(WebSocketHttpHeaders.class), eq(BACKEND_URI)))
                .thenReturn(CompletableFuture.completedFuture(session));
        BackendStream stream = backend.connect(PcmFormat.REQUIRED, options, Duration.ofSeconds(1));

        stream.startSegment(4);
        stream.sendAudio(4, new byte[]{1, 2, 3, 4});
        stream.endSegment(4);

        List<WebSocketMessage<?>> sent = sentMessages();
        assertThat(sent).hasSize(4);
        assertThat(new JSONObject(((TextMessage) sent.get(1)).getPayload()).getString("type"))
                .isEqualTo("segment_start");
        assertThat(sent.get(2)).isInstanceOf(BinaryMessage.class);
        assertThat(new JSONObject(((TextMessage) sent.get(3)).getPayload()).getLong("segment_id")).isEqualTo(4);
    }

    @Test
    void shouldPublishDecodedBackendMessages() throws Exception {
        // Arrange
        ArgumentCaptor<WebSocketHandler> handler = ArgumentCaptor.forClass(WebSocketHandler.class);
        when(client.execute(handler.capture(), any(WebSocketHttpHeaders.class), eq(BACKEND_URI)))
                .thenReturn(CompletableFuture.completedFuture(session));
        BackendStream stream = backend.connect(PcmFormat.REQUIRED, options, Duration.ofSeconds(1));

        // Act
        handler.getValue().handleMessage(session, new TextMessage(
                "{\"type\":\"final\",\"segment_id\":2,\"text\":\"over there\",\"confidence\":0.8}"));

        // Assert
        BackendEvent event = stream.events().poll(Duration.ofSeconds(1));
        assertThat(event.kind()).isEqualTo(BackendEvent.Kind.FINAL);
        assertThat(event.segmentId()).isEqualTo(2);
        assertThat(event.result().text()).isEqualTo("over there");
    }

    @Test
    void shouldFailEventsOnAbnormalClose() throws Exception {
        // Arrange
        ArgumentCaptor<WebSocketHandler> handler = ArgumentCaptor.forClass(WebSocketHandler.class);
        when(client.execute(handler.capture(), any(WebSocketHttpHeaders.class), eq(BACKEND_URI)))
                .thenReturn(CompletableFuture.completedFuture(session));
        BackendStream stream = backend.connect(PcmFormat.REQUIRED, options, Duration.ofSeconds(1));

        // Act
        handler.getValue().afterConnectionClosed(session, CloseStatus.SERVER_ERROR);

        // Assert
        assertThat(stream.isOpen()).isFalse();
        assertThatThrownBy(() -> stream.events().poll(Duration.ofSeconds(1)))
                .isInstanceOf(RecognitionException.class)
                .hasMessageContaining("Backend closed the stream");
    }

    @Test
    void shouldWrapConnectFailure() {
        when(client.execute(any(WebSocketHandler.class), any(WebSocketHttpHeaders.class), eq(BACKEND_URI)))
                .thenReturn(CompletableFuture.failedFuture(new ConnectException("Connection refused")));

        assertThatThrownBy(() -> backend.connect(PcmFormat.REQUIRED, options, Duration.ofSeconds(1)))
                .isInstanceOf(RecognitionException.class)
                .hasMessageContaining("Failed to connect to backend")
                .hasMessageContaining("ws://asr.local:2700/stream")
                .hasCauseInstanceOf(ConnectException.class);
    }

    @Test
    void shouldCloseLateSessionAfterConnectTimeout() throws Exception {
        // Arrange
        CompletableFuture<WebSocketSession> pending = new CompletableFuture<>();
        when(client.execute(any(WebSocketHandler.class), any(WebSocketHttpHeaders.class), eq(BACKEND_URI)))
                .thenReturn(pending);

        // Act
        assertThatThrownBy(() -> backend.connect(PcmFormat.REQUIRED, options, Duration.ofMillis(50)))
                .isInstanceOf(RecognitionException.class)
                .hasMessageContaining("Timed out connecting to backend");
        pending.complete(session);

        // Assert
        verify(session).close(CloseStatus.GOING_AWAY);
    }

    @Test
    void shouldFailStreamWhenSendFails() throws Exception {
        // Arrange
        when(client.execute(any(WebSocketHandler.class), any(WebSocketHttpHeaders.class), eq(BACKEND_URI)))
                .thenReturn(CompletableFuture.completedFuture(session));
        BackendStream stream = backend.connect(PcmFormat.REQUIRED, options, Duration.ofSeconds(1));
        doThrow(new IOException("reset")).when(session).sendMessage(any());

        // Act / Assert
        assertThatThrownBy(() -> stream.startSegment(0))
                .isInstanceOf(RecognitionException.class)
                .hasMessageContaining("Failed to send to backend");
        assertThat(stream.isOpen()).isFalse();
        assertThatThrownBy(() -> stream.sendAudio(0, new byte[2]))
                .hasMessageContaining("Backend stream is closed");
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private List<WebSocketMessage<?>> sentMessages() throws Exception {
        ArgumentCaptor<WebSocketMessage> captor = ArgumentCaptor.forClass(WebSocketMessage.class);
        verify(session, atLeastOnce()).sendMessage(captor.capture());
        return (List) captor.getAllValues();
    }

    private List<String> sentTexts() throws Exception {
        return sentMessages().stream()
                .filter(m -> m instanceof TextMessage)
                .map(m -> ((TextMessage) m).getPayload())
                .collect(Collectors.toList());
    }
}
