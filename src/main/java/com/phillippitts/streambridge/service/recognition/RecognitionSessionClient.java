package com.phillippitts.streambridge.service.recognition;

import com.phillippitts.streambridge.config.properties.BackendProperties;
import com.phillippitts.streambridge.config.properties.BackendProperties.DegradedMode;
import com.phillippitts.streambridge.domain.AudioFrame;
import com.phillippitts.streambridge.domain.AudioSegment;
import com.phillippitts.streambridge.domain.PcmFormat;
import com.phillippitts.streambridge.domain.RecognitionResult;
import com.phillippitts.streambridge.exception.BackendBusyException;
import com.phillippitts.streambridge.exception.BackendUnavailableException;
import com.phillippitts.streambridge.exception.RecognitionException;
import com.phillippitts.streambridge.exception.RecognitionExceptionBuilder;
import com.phillippitts.streambridge.exception.SegmentTimeoutException;
import com.phillippitts.streambridge.service.recognition.watchdog.BackendFailureEvent;
import com.phillippitts.streambridge.service.recognition.watchdog.BackendRecoveredEvent;
import com.phillippitts.streambridge.util.TimeUtils;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Per-session client of the recognition backend.
 *
 * <p>Segments are submitted in sequence order and recognised strictly one at a time on a worker
 * borrowed from the backend executor. The worker owns the backend stream: it connects lazily,
 * retries failed connects with exponential backoff, and on exhaustion either rejects segments
 * or answers them from the synthetic fallback, depending on {@link DegradedMode}.
 *
 * <p><b>Timeouts:</b> with partials enabled and incremental input, the first result must arrive
 * within the request timeout of the first audio chunk; the final must arrive within the request
 * timeout of the segment end. Either timeout fails only that segment and discards the stream, so
 * late messages of the abandoned segment cannot leak into the next one.
 *
 * <p><b>Threading:</b> {@link #send(AudioSegment)} and {@link #close()} may be called from any
 * thread. Partials are reported to the partial listener on the worker thread.
 */
public class RecognitionSessionClient implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(RecognitionSessionClient.class);

    /** Slice used while following a growing segment or waiting for results, so close is noticed. */
    private static final Duration POLL_SLICE = Duration.ofMillis(50);

    public enum State { IDLE, CONNECTING, STREAMING, CLOSING, FAILED }

    private record PendingSegment(AudioSegment segment, long submittedNanos,
                                  CompletableFuture<RecognitionResult> future) {
    }

    private final RecognitionBackend backend;
    private final RecognitionBackend fallback;
    private final BackendProperties props;
    private final Executor executor;
    private final ApplicationEventPublisher publisher;
    private final Duration cancellationGrace;
    private final Consumer<RecognitionResult> partialListener;

    private final BlockingQueue<PendingSegment> queue;
    private final AtomicBoolean draining = new AtomicBoolean();
    private final AtomicBoolean resultsTaken = new AtomicBoolean();
    private final ResultChannel<RecognitionResult> results = new ResultChannel<>();
    private final CountDownLatch closeSignal = new CountDownLatch(1);

    private volatile State state = State.IDLE;
    private volatile long failedUntilNanos;
    private volatile boolean closed;
    private volatile boolean stale;
    private volatile PcmFormat format;
    private volatile RecognitionOptions options;

    private volatile BackendStream stream;
    private volatile BackendStream degradedStream;
    private volatile PendingSegment inFlight;
    private final Object workerLock = new Object();
    private volatile Thread workerThread;
    private volatile CompletableFuture<Void> workerDone = CompletableFuture.completedFuture(null);
    private final CompletableFuture<Void> terminated = new CompletableFuture<>();
    private boolean failedBefore;

    /**
     * @param backend           primary backend
     * @param fallback          synthetic stand-in used in degraded mode; may be {@code null}
     * @param props             backend settings
     * @param executor          executor that lends the worker thread
     * @param publisher         sink for backend failure and recovery events
     * @param cancellationGrace time a busy worker gets to notice {@link #close()} before interruption
     * @param partialListener   receives partial hypotheses on the worker thread
     */
    public RecognitionSessionClient(RecognitionBackend backend,
                                    RecognitionBackend fallback,
                                    BackendProperties props,
                                    Executor executor,
                                    ApplicationEventPublisher publisher,
                                    Duration cancellationGrace,
                                    Consumer<RecognitionResult> partialListener) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.fallback = fallback;
        this.props = Objects.requireNonNull(props, "props");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.cancellationGrace = Objects.requireNonNull(cancellationGrace, "cancellationGrace");
        this.partialListener = partialListener != null ? partialListener : r -> { };
        this.queue = new LinkedBlockingQueue<>(props.getQueueDepth());
    }

    /**
     * Sets the audio format and options used for the next stream. Changing them on an open client
     * makes the current stream stale; it is replaced before the next segment.
     *
     * @return this client
     */
    public RecognitionSessionClient open(PcmFormat format, RecognitionOptions options) {
        if (closed) {
            throw new IllegalStateException("Recognition client is closed");
        }
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(options, "options");
        boolean changed = this.format != null
                && (!this.format.equals(format) || !this.options.equals(options));
        this.format = format;
        this.options = options;
        if (changed) {
            stale = true;
            LOG.debug("Recognition options changed; stream will be reopened");
        }
        return this;
    }

    /**
     * Submits a segment for recognition. The segment may still be open when incremental input
     * is enabled; its audio is then streamed as it arrives.
     *
     * @param segment segment to recognise
     * @return future completed with the final result; failed with {@link BackendBusyException}
     *         when the backlog is full, {@link BackendUnavailableException} in reject mode,
     *         {@link SegmentTimeoutException} or {@link RecognitionException}
     * @throws IllegalStateException if the client is closed or was never opened
     */
    public CompletableFuture<RecognitionResult> send(AudioSegment segment) {
        Objects.requireNonNull(segment, "segment");
        if (closed) {
            throw new IllegalStateException("Recognition client is closed");
        }
        if (format == null) {
            throw new IllegalStateException("Recognition client was not opened");
        }
        CompletableFuture<RecognitionResult> future = new CompletableFuture<>();
        PendingSegment pending = new PendingSegment(segment, System.nanoTime(), future);
        if (!queue.offer(pending)) {
            LOG.warn("Recognition backlog full, rejecting segment {} (queueDepth={})",
                    segment.sequence(), props.getQueueDepth());
            future.completeExceptionally(new BackendBusyException(segment.sequence(), props.getQueueDepth()));
            return future;
        }
        scheduleDrain();
        return future;
    }

    /**
     * Lazy sequence of every partial and final result, in the order they are produced.
     * Results are only buffered once this has been called.
     *
     * @throws IllegalStateException on a second call
     */
    public ResultChannel<RecognitionResult> results() {
        if (!resultsTaken.compareAndSet(false, true)) {
            throw new IllegalStateException("Result sequence already taken");
        }
        return results;
    }

    /** Current connection state. A failed client becomes idle again once its backoff has passed. */
    public State state() {
        State s = state;
        if (s == State.FAILED && System.nanoTime() - failedUntilNanos >= 0) {
            return State.IDLE;
        }
        return s;
    }

    /** Segments waiting or in flight. */
    public int pendingSegments() {
        return queue.size() + (inFlight != null ? 1 : 0);
    }

    public String backendName() {
        return backend.name();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Cancels queued and in-flight segments and closes the backend stream. Does not wait for the
     * worker: a worker that has not finished within the cancellation grace period is interrupted
     * from a timer callback. Idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        state = State.CLOSING;
        closeSignal.countDown();

        PendingSegment queued;
        while ((queued = queue.poll()) != null) {
            queued.future().cancel(false);
        }
        PendingSegment current = inFlight;
        if (current != null) {
            current.future().cancel(false);
        }
        closeStreams();
        results.close();

        workerDone.copy()
                .orTimeout(cancellationGrace.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((v, err) -> {
                    if (err instanceof TimeoutException) {
                        interruptWorker();
                    }
                    state = State.IDLE;
                    terminated.complete(null);
                    LOG.debug("Recognition client closed");
                });
    }

    /** Completes once a closed client's worker has stopped or been interrupted. */
    public CompletableFuture<Void> terminated() {
        return terminated;
    }

    private void interruptWorker() {
        synchronized (workerLock) {
            Thread worker = workerThread;
            if (worker != null) {
                LOG.warn("Recognition worker did not stop within {} ms; interrupting",
                        cancellationGrace.toMillis());
                worker.interrupt();
            }
        }
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        CompletableFuture<Void> done = new CompletableFuture<>();
        workerDone = done;
        try {
            executor.execute(() -> drain(done));
        } catch (RejectedExecutionException e) {
            draining.set(false);
            done.complete(null);
            LOG.warn("Backend executor saturated; rejecting queued segments");
            PendingSegment pending;
            while ((pending = queue.poll()) != null) {
                pending.future().completeExceptionally(
                        new BackendBusyException(pending.segment().sequence(), props.getQueueDepth()));
            }
        }
    }

    private void drain(CompletableFuture<Void> done) {
        workerThread = Thread.currentThread();
        try {
            PendingSegment next;
            while (!closed && (next = queue.poll()) != null) {
                process(next);
            }
        } finally {
            synchronized (workerLock) {
                workerThread = null;
                // pool threads must not carry an interrupt from close() into the next task
                Thread.interrupted();
            }
            draining.set(false);
            done.complete(null);
        }
        if (!closed && !queue.isEmpty()) {
            scheduleDrain();
        }
    }

    private void process(PendingSegment pending) {
        inFlight = pending;
        long seq = pending.segment().sequence();
        try (CloseableThreadContext.Instance ctc = CloseableThreadContext.put("segmentId", String.valueOf(seq))) {
            if (pending.future().isDone()) {
                return;
            }
            RecognitionResult result = recognize(pending);
            publishResult(result);
            pending.future().complete(result);
            LOG.debug("Segment {} recognised in {} ms", seq, result.processingTimeMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pending.future().completeExceptionally(
                    new RecognitionException("Interrupted while recognising segment " + seq, backend.name(), e));
        } catch (RuntimeException e) {
            if (!closed) {
                LOG.warn("Segment {} failed: {}", seq, e.getMessage());
            }
            pending.future().completeExceptionally(e);
        } finally {
            inFlight = null;
        }
    }

    private RecognitionResult recognize(PendingSegment pending) throws InterruptedException {
        long seq = pending.segment().sequence();
        BackendStream target = acquireStream();
        boolean degraded = target == degradedStream;
        boolean incremental = props.isIncrementalInput()
                && (degraded ? fallback.supportsIncrementalInput() : backend.supportsIncrementalInput());
        try {
            RecognitionResult result = streamSegment(target, incremental, pending.segment());
            return result.withProcessingTime(TimeUtils.elapsedMillis(pending.submittedNanos()));
        } catch (SegmentTimeoutException e) {
            discard(target, e.getMessage(), e, false);
            throw e;
        } catch (RecognitionException e) {
            if (!target.isOpen()) {
                discard(target, "Backend stream failed during segment " + seq, e, !degraded);
            }
            throw e;
        }
    }

    private BackendStream acquireStream() throws InterruptedException {
        if (state() == State.FAILED) {
            return degrade(0, null);
        }
        BackendStream current = stream;
        if (current != null && current.isOpen() && !stale) {
            return current;
        }
        if (current != null) {
            current.close();
            stream = null;
        }
        stale = false;
        return connectWithRetry();
    }

    private BackendStream connectWithRetry() throws InterruptedException {
        state = State.CONNECTING;
        int attempts = 1 + props.getMaxRetries();
        long delay = props.getRetryDelayMs();
        Duration connectTimeout = Duration.ofMillis(props.getConnectTimeoutMs());
        RecognitionException last = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            ensureOpen();
            try {
                BackendStream opened = backend.connect(format, options, connectTimeout);
                stream = opened;
                state = State.STREAMING;
                LOG.info("Connected to backend {} (attempt {}/{})", backend.name(), attempt, attempts);
                if (failedBefore) {
                    failedBefore = false;
                    publisher.publishEvent(new BackendRecoveredEvent(backend.name(), Instant.now()));
                }
                return opened;
            } catch (RecognitionException e) {
                last = e;
                LOG.warn("Backend connect attempt {}/{} failed: {}", attempt, attempts, e.getMessage());
                if (attempt < attempts) {
                    if (closeSignal.await(delay, TimeUnit.MILLISECONDS)) {
                        ensureOpen();
                    }
                    delay = Math.min(delay * 2, props.getMaxBackoffMs());
                }
            }
        }

        failedBefore = true;
        failedUntilNanos = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(delay);
        state = State.FAILED;
        LOG.error("Backend {} unreachable after {} attempts; degraded for {} ms (mode={})",
                backend.name(), attempts, delay, props.getDegradedMode());
        publisher.publishEvent(new BackendFailureEvent(backend.name(), Instant.now(),
                "Connect failed after " + attempts + " attempts", last,
                Map.of("uri", props.getUri(), "attempts", String.valueOf(attempts))));
        return degrade(attempts, last);
    }

    private BackendStream degrade(int attempts, Throwable cause) {
        if (props.getDegradedMode() == DegradedMode.REJECT || fallback == null) {
            throw new BackendUnavailableException(backend.name(), attempts, cause);
        }
        BackendStream current = degradedStream;
        if (current == null || !current.isOpen()) {
            current = fallback.connect(format, options, Duration.ofMillis(props.getConnectTimeoutMs()));
            degradedStream = current;
            LOG.info("Serving segments from {} backend while {} is unavailable", fallback.name(), backend.name());
        }
        return current;
    }

    private RecognitionResult streamSegment(BackendStream target, boolean incremental, AudioSegment segment)
            throws InterruptedException {
        long seq = segment.sequence();
        long timeoutMs = props.getRequestTimeoutMs();
        long timeoutNanos = TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        ResultChannel<BackendEvent> events = target.events();
        RecognitionResult finalResult = null;

        target.startSegment(seq);
        if (incremental) {
            int index = 0;
            long firstAudioNanos = 0;
            boolean heard = false;
            while (true) {
                ensureOpen();
                List<AudioFrame> frames = segment.awaitFrames(index, POLL_SLICE);
                if (!frames.isEmpty()) {
                    index += frames.size();
                    sendChunked(target, seq, concat(frames));
                    if (firstAudioNanos == 0) {
                        firstAudioNanos = System.nanoTime();
                    }
                } else if (segment.isSealed() && index >= segment.frameCount()) {
                    break;
                }
                BackendEvent event;
                while ((event = events.tryPoll()) != null) {
                    RecognitionResult r = handleEvent(event, seq);
                    if (r != null) {
                        heard = true;
                        if (r.isFinal()) {
                            finalResult = r;
                        }
                    }
                }
                if (options.enablePartials() && !heard && firstAudioNanos != 0
                        && System.nanoTime() - firstAudioNanos > timeoutNanos) {
                    throw new SegmentTimeoutException(seq, timeoutMs, "first result");
                }
            }
        } else {
            while (!segment.awaitSealed(POLL_SLICE)) {
                ensureOpen();
            }
            sendChunked(target, seq, segment.toPcm());
        }
        target.endSegment(seq);
        if (finalResult != null) {
            return finalResult;
        }

        long deadline = System.nanoTime() + timeoutNanos;
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new SegmentTimeoutException(seq, timeoutMs, "final result");
            }
            ensureOpen();
            BackendEvent event = events.poll(Duration.ofNanos(Math.min(remaining, POLL_SLICE.toNanos())));
            if (event == null) {
                continue;
            }
            RecognitionResult r = handleEvent(event, seq);
            if (r != null && r.isFinal()) {
                return r;
            }
        }
    }

    /**
     * Applies one backend event to the segment in flight.
     *
     * @return the event's result if it belongs to {@code seq}, otherwise {@code null}
     */
    private RecognitionResult handleEvent(BackendEvent event, long seq) {
        if (!event.concerns(seq)) {
            LOG.debug("Dropping stale {} for segment {} (current={})", event.kind(), event.segmentId(), seq);
            return null;
        }
        return switch (event.kind()) {
            case PARTIAL -> {
                partialListener.accept(event.result());
                publishResult(event.result());
                yield event.result();
            }
            case FINAL -> event.result();
            case ERROR -> throw RecognitionExceptionBuilder.create("Backend reported error: " + event.error())
                    .backend(backend.name())
                    .segment(seq)
                    .build();
        };
    }

    private void sendChunked(BackendStream target, long seq, byte[] pcm) {
        int chunk = props.getChunkSizeBytes();
        for (int offset = 0; offset < pcm.length; offset += chunk) {
            int end = Math.min(pcm.length, offset + chunk);
            target.sendAudio(seq, offset == 0 && end == pcm.length ? pcm : Arrays.copyOfRange(pcm, offset, end));
        }
    }

    private static byte[] concat(List<AudioFrame> frames) {
        int total = 0;
        for (AudioFrame frame : frames) {
            total += frame.length();
        }
        byte[] out = new byte[total];
        int offset = 0;
        for (AudioFrame frame : frames) {
            frame.copyTo(out, offset);
            offset += frame.length();
        }
        return out;
    }

    private void discard(BackendStream target, String reason, Throwable cause, boolean reportFailure) {
        target.close();
        if (target == stream) {
            state = State.CLOSING;
            stream = null;
            state = State.IDLE;
        } else if (target == degradedStream) {
            degradedStream = null;
        }
        if (reportFailure && !closed) {
            publisher.publishEvent(new BackendFailureEvent(backend.name(), Instant.now(), reason, cause,
                    Map.of("uri", props.getUri())));
        }
        LOG.info("Backend stream discarded: {}", reason);
    }

    private void publishResult(RecognitionResult result) {
        if (resultsTaken.get()) {
            results.publish(result);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new RecognitionException("Recognition client closed", backend.name());
        }
    }

    private void closeStreams() {
        BackendStream s = stream;
        if (s != null) {
            s.close();
        }
        BackendStream d = degradedStream;
        if (d != null) {
            d.close();
        }
    }
}
