package com.phillippitts.streambridge.service.recognition;

import com.phillippitts.streambridge.PcmTestSignals;
import com.phillippitts.streambridge.config.properties.BackendProperties;
import com.phillippitts.streambridge.domain.AudioFrame;
import com.phillippitts.streambridge.domain.AudioSegment;
import com.phillippitts.streambridge.domain.PcmFormat;
import com.phillippitts.streambridge.domain.RecognitionResult;
import com.phillippitts.streambridge.exception.BackendBusyException;
import com.phillippitts.streambridge.exception.BackendUnavailableException;
import com.phillippitts.streambridge.exception.RecognitionException;
import com.phillippitts.streambridge.exception.SegmentTimeoutException;
import com.phillippitts.streambridge.service.recognition.synthetic.SyntheticRecognitionBackend;
import com.phillippitts.streambridge.service.recognition.watchdog.BackendFailureEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class RecognitionSessionClientTest {

    private final List<Object> events = new CopyOnWriteArrayList<>();
    private final ApplicationEventPublisher publisher = events::add;
    private final List<RecognitionResult> partials = new CopyOnWriteArrayList<>();

    private ExecutorService executor;
    private BackendProperties props;
    private RecognitionSessionClient client;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        props = new BackendProperties();
        props.setConnectTimeoutMs(100);
        props.setMaxRetries(2);
        props.setRetryDelayMs(50);
        props.setMaxBackoffMs(200);
        props.setRequestTimeoutMs(300);
        props.setQueueDepth(4);
        props.setIncrementalInput(false);
        props.setDegradedMode(BackendProperties.DegradedMode.REJECT);
    }

    @AfterEach
    void tearDown() {
        if (client != null) {
            client.close();
        }
        executor.shutdownNow();
    }

    @Test
    void shouldRecogniseSealedSegmentOnFirstConnect() throws Exception {
        // Arrange
        FakeRecognitionBackend backend = new FakeRecognitionBackend();
        client = newClient(backend, null);

        // Act
        RecognitionResult result = client.send(sealedSegment(0, 200)).get(2, TimeUnit.SECONDS);

        // Assert
        assertThat(result.isFinal()).isTrue();
        assertThat(result.segmentId()).isZero();
        assertThat(result.text()).isEqualTo("segment 0");
        assertThat(backend.connectAttempts()).isEqualTo(1);
        assertThat(client.state()).isEqualTo(RecognitionSessionClient.State.STREAMING);
    }

    @Test
    void shouldRetryConnectWithBackoffAndThenSucceed() throws Exception {
        // Arrange
        props.setRetryDelayMs(100);
        FakeRecognitionBackend backend = new FakeRecognitionBackend().failingFirst(1);
        client = newClient(backend, null);

        // Act
        RecognitionResult result = client.send(sealedSegment(0, 200)).get(2, TimeUnit.SECONDS);

        // Assert
        assertThat(result.text()).isEqualTo("segment 0");
        assertThat(backend.connectAttempts()).isEqualTo(2);
        long gapMs = TimeUnit.NANOSECONDS.toMillis(backend.connectNanos().get(1) - backend.connectNanos().get(0));
        assertThat(gapMs).isGreaterThanOrEqualTo(100);
        assertThat(result.processingTimeMs()).isGreaterThanOrEqualTo(100);
        assertThat(events).noneMatch(e -> e instanceof BackendFailureEvent);
    }

    @Test
    void shouldDoubleBackoffBetweenAttempts() throws Exception {
        // Arrange
        props.setRetryDelayMs(60);
        props.setMaxRetries(2);
        FakeRecognitionBackend backend = new FakeRecognitionBackend().failingFirst(2);
        client = newClient(backend, null);

        // Act
        client.send(sealedSegment(0, 100)).get(2, TimeUnit.SECONDS);

        // Assert
        List<Long> at = backend.connectNanos();
        assertThat(at).hasSize(3);
        assertThat(TimeUnit.NANOSECONDS.toMillis(at.get(2) - at.get(1))).isGreaterThanOrEqualTo(120);
    }

    @Test
    void shouldRejectSegmentsWhenRetriesExhaustedInRejectMode() {
        // Arrange
        props.setRetryDelayMs(300);
        props.setMaxBackoffMs(5_000);
        FakeRecognitionBackend backend = new FakeRecognitionBackend().failingFirst(100);
        client = newClient(backend, new SyntheticRecognitionBackend(new BackendProperties.Synthetic()));

        // Act
        CompletableFuture<RecognitionResult> future = client.send(sealedSegment(0, 100));

        // Assert
        assertThatThrownBy(() -> future.get(2, TimeUnit.SECONDS))
                .hasCauseInstanceOf(BackendUnavailableException.class);
        assertThat(backend.connectAttempts()).isEqualTo(3);
        assertThat(events).anyMatch(e -> e instanceof BackendFailureEvent);
        assertThat(client.state()).isEqualTo(RecognitionSessionClient.State.FAILED);
    }

    @Test
    void shouldReportIdleAfterBackoffAndReconnectOnNextSegment() throws Exception {
        // Arrange
        props.setRetryDelayMs(50);
        props.setMaxBackoffMs(100);
        FakeRecognitionBackend backend = new FakeRecognitionBackend().failingFirst(3);
        client = newClient(backend, null);
        CompletableFuture<RecognitionResult> failed = client.send(sealedSegment(0, 100));
        assertThatThrownBy(() -> failed.get(2, TimeUnit.SECONDS))
                .hasCauseInstanceOf(BackendUnavailableException.class);

        // Act
        await().atMost(Duration.ofSeconds(2))
                .until(() -> client.state() == RecognitionSessionClient.State.IDLE);
        RecognitionResult next = client.send(sealedSegment(1, 100)).get(2, TimeUnit.SECONDS);

        // Assert
        assertThat(next.text()).isEqualTo("segment 1");
        assertThat(backend.connectAttempts()).isEqualTo(4);
        assertThat(client.state())
                .as("reading the state must not overwrite the worker's transition")
                .isEqualTo(RecognitionSessionClient.State.STREAMING);
    }

    @Test
    void shouldAnswerFromSyntheticFallbackWhenDegraded() throws Exception {
        // Arrange
        props.setDegradedMode(BackendProperties.DegradedMode.SYNTHETIC);
        props.setRetryDelayMs(300);
        props.setMaxBackoffMs(5_000);
        BackendProperties.Synthetic synthetic = new BackendProperties.Synthetic();
        synthetic.setLatencyMs(0);
        FakeRecognitionBackend backend = new FakeRecognitionBackend().failingFirst(100);
        client = newClient(backend, new SyntheticRecognitionBackend(synthetic));

        // Act
        RecognitionResult first = client.send(sealedSegment(0, 500)).get(2, TimeUnit.SECONDS);
        RecognitionResult second = client.send(sealedSegment(1, 500)).get(2, TimeUnit.SECONDS);

        // Assert
        assertThat(first.text()).startsWith("[synthetic]").contains("segment 0");
        assertThat(second.text()).startsWith("[synthetic]").contains("segment 1");
        assertThat(backend.connectAttempts())
                .as("no reconnect while the failure backoff is pending")
                .isEqualTo(3);
    }

    @Test
    void shouldRejectSegmentWhenBacklogIsFull() throws Exception {
        // Arrange
        props.setQueueDepth(1);
        props.setRequestTimeoutMs(2_000);
        FakeRecognitionBackend backend = new FakeRecognitionBackend().silentOn(0);
        client = newClient(backend, null);
        client.send(sealedSegment(0, 100));
        await().atMost(Duration.ofSeconds(2))
                .until(() -> !backend.streams().isEmpty() && backend.lastStream().ended().contains(0L));

        // Act
        CompletableFuture<RecognitionResult> queued = client.send(sealedSegment(1, 100));
        CompletableFuture<RecognitionResult> rejected = client.send(sealedSegment(2, 100));

        // Assert
        assertThat(queued.isDone()).isFalse();
        assertThat(rejected).isCompletedExceptionally();
        assertThatThrownBy(() -> rejected.get(1, TimeUnit.SECONDS))
                .hasCauseInstanceOf(BackendBusyException.class);
        assertThat(client.pendingSegments()).isEqualTo(2);
    }

    @Test
    void shouldTimeOutSegmentWithoutFinalAndRecoverOnNextSegment() throws Exception {
        // Arrange
        props.setRequestTimeoutMs(200);
        FakeRecognitionBackend backend = new FakeRecognitionBackend().silentOn(0);
        client = newClient(backend, null);

        // Act
        CompletableFuture<RecognitionResult> lost = client.send(sealedSegment(0, 100));
        RecognitionResult next = client.send(sealedSegment(1, 100)).get(2, TimeUnit.SECONDS);

        // Assert
        assertThatThrownBy(() -> lost.get(1, TimeUnit.SECONDS))
                .hasCauseInstanceOf(SegmentTimeoutException.class)
                .hasMessageContaining("final result");
        assertThat(next.text()).isEqualTo("segment 1");
        assertThat(backend.connectAttempts())
                .as("timed-out stream is discarded")
                .isEqualTo(2);
        assertThat(backend.streams().get(0).isOpen()).isFalse();
    }

    @Test
    void shouldTimeOutWhenNoFirstResultArrivesForStreamedAudio() {
        // Arrange
        props.setIncrementalInput(true);
        props.setRequestTimeoutMs(200);
        FakeRecognitionBackend backend = new FakeRecognitionBackend().incremental(true);
        client = newClient(backend, null);
        AudioSegment open = new AudioSegment(0, PcmFormat.REQUIRED, Instant.now());
        open.append(AudioFrame.of(PcmTestSignals.speech(100)));

        // Act
        CompletableFuture<RecognitionResult> future = client.send(open);

        // Assert
        assertThatThrownBy(() -> future.get(2, TimeUnit.SECONDS))
                .hasCauseInstanceOf(SegmentTimeoutException.class)
                .hasMessageContaining("first result");
    }

    @Test
    void shouldStreamOpenSegmentAndReportPartialsBeforeFinal() throws Exception {
        // Arrange
        props.setIncrementalInput(true);
        FakeRecognitionBackend backend = new FakeRecognitionBackend().incremental(true).withPartials();
        client = newClient(backend, null);
        ResultChannel<RecognitionResult> all = client.results();
        AudioSegment open = new AudioSegment(0, PcmFormat.REQUIRED, Instant.now());
        open.append(AudioFrame.of(PcmTestSignals.speech(100)));

        // Act
        CompletableFuture<RecognitionResult> future = client.send(open);
        await().atMost(Duration.ofSeconds(2)).until(() -> !partials.isEmpty());
        open.append(AudioFrame.of(PcmTestSignals.speech(100)));
        open.seal(AudioSegment.SealReason.SILENCE, Instant.now());
        RecognitionResult result = future.get(2, TimeUnit.SECONDS);

        // Assert
        assertThat(result.text()).isEqualTo("segment 0");
        assertThat(partials).hasSizeGreaterThanOrEqualTo(2).allMatch(p -> !p.isFinal() && p.segmentId() == 0);
        RecognitionResult r;
        RecognitionResult last = null;
        while ((r = all.tryPoll()) != null) {
            last = r;
        }
        assertThat(last).isNotNull();
        assertThat(last.isFinal()).isTrue();
    }

    @Test
    void shouldFailSegmentOnBackendErrorWithoutDroppingStream() throws Exception {
        // Arrange
        FakeRecognitionBackend backend = new FakeRecognitionBackend().errorOn(0);
        client = newClient(backend, null);

        // Act
        CompletableFuture<RecognitionResult> failed = client.send(sealedSegment(0, 100));
        RecognitionResult next = client.send(sealedSegment(1, 100)).get(2, TimeUnit.SECONDS);

        // Assert
        assertThatThrownBy(() -> failed.get(1, TimeUnit.SECONDS))
                .hasCauseInstanceOf(RecognitionException.class)
                .hasMessageContaining("recognizer crashed");
        assertThat(next.text()).isEqualTo("segment 1");
        assertThat(backend.connectAttempts()).isEqualTo(1);
    }

    @Test
    void shouldReconnectAfterTransportFailure() throws Exception {
        // Arrange
        FakeRecognitionBackend backend = new FakeRecognitionBackend();
        client = newClient(backend, null);
        client.send(sealedSegment(0, 100)).get(2, TimeUnit.SECONDS);

        // Act
        backend.lastStream().failTransport();
        RecognitionResult result = client.send(sealedSegment(1, 100)).get(2, TimeUnit.SECONDS);

        // Assert
        assertThat(result.text()).isEqualTo("segment 1");
        assertThat(backend.connectAttempts()).isEqualTo(2);
    }

    @Test
    void shouldReopenStreamWhenOptionsChange() throws Exception {
        // Arrange
        FakeRecognitionBackend backend = new FakeRecognitionBackend();
        client = newClient(backend, null);
        client.send(sealedSegment(0, 100)).get(2, TimeUnit.SECONDS);

        // Act
        client.open(PcmFormat.REQUIRED, defaultOptions().withLanguageCode("de-DE"));
        client.send(sealedSegment(1, 100)).get(2, TimeUnit.SECONDS);

        // Assert
        assertThat(backend.connectAttempts()).isEqualTo(2);
        assertThat(backend.lastStream().options().languageCode()).isEqualTo("de-DE");
        assertThat(backend.streams().get(0).isOpen()).isFalse();
    }

    @Test
    void shouldCancelQueuedAndInFlightSegmentsOnClose() {
        // Arrange
        props.setRequestTimeoutMs(10_000);
        FakeRecognitionBackend backend = new FakeRecognitionBackend().silentOn(0);
        client = newClient(backend, null);
        CompletableFuture<RecognitionResult> inFlight = client.send(sealedSegment(0, 100));
        CompletableFuture<RecognitionResult> queued = client.send(sealedSegment(1, 100));
        await().atMost(Duration.ofSeconds(2))
                .until(() -> !backend.streams().isEmpty() && backend.lastStream().ended().contains(0L));

        // Act
        long start = System.nanoTime();
        client.close();
        long closeMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        // Assert
        assertThat(queued).isCancelled();
        assertThat(inFlight).isCompletedExceptionally();
        assertThat(closeMs).isLessThan(1_000);
        assertThat(client.isClosed()).isTrue();
        assertThat(backend.lastStream().isOpen()).isFalse();
        assertThatThrownBy(() -> client.send(sealedSegment(2, 100)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldReturnFromCloseWithoutWaitingForHungConnect() throws Exception {
        // Arrange
        FakeRecognitionBackend backend = new FakeRecognitionBackend().hangingConnect();
        client = newClient(backend, null);
        CompletableFuture<RecognitionResult> pending = client.send(sealedSegment(0, 100));
        await().atMost(Duration.ofSeconds(2)).until(() -> backend.connectAttempts() == 1);

        // Act
        long start = System.nanoTime();
        client.close();
        long closeMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        // Assert
        assertThat(closeMs).as("close must not wait out the cancellation grace").isLessThan(250);
        assertThat(pending).isCancelled();
        assertThat(backend.awaitConnectInterrupted(Duration.ofSeconds(3))).isTrue();
        client.terminated().get(3, TimeUnit.SECONDS);
    }

    @Test
    void shouldRejectSendBeforeOpen() {
        // Arrange
        RecognitionSessionClient unopened = new RecognitionSessionClient(new FakeRecognitionBackend(), null,
                props, executor, publisher, Duration.ofMillis(200), partials::add);

        // Act + Assert
        assertThatThrownBy(() -> unopened.send(sealedSegment(0, 100)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not opened");
        unopened.close();
    }

    @Test
    void shouldHandOutResultSequenceOnlyOnce() {
        // Arrange
        client = newClient(new FakeRecognitionBackend(), null);
        client.results();

        // Act + Assert
        assertThatThrownBy(() -> client.results()).isInstanceOf(IllegalStateException.class);
    }

    private RecognitionSessionClient newClient(RecognitionBackend backend, RecognitionBackend fallback) {
        return new RecognitionSessionClient(backend, fallback, props, executor, publisher,
                Duration.ofMillis(500), partials::add)
                .open(PcmFormat.REQUIRED, defaultOptions());
    }

    private RecognitionOptions defaultOptions() {
        return RecognitionOptions.from(props);
    }

    private static AudioSegment sealedSegment(long seq, int millis) {
        AudioSegment segment = new AudioSegment(seq, PcmFormat.REQUIRED, Instant.now());
        segment.append(AudioFrame.of(PcmTestSignals.speech(millis)));
        segment.seal(AudioSegment.SealReason.SILENCE, Instant.now());
        return segment;
    }
}
