package com.phillippitts.streambridge.service.metrics;

import com.phillippitts.streambridge.service.recognition.watchdog.BackendFailureEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Centralized metrics tracking for the transcription bridge.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Segment latency (submission to final result) per backend</li>
 *   <li>Final and partial result counts</li>
 *   <li>Segment failures by reason (timeout, busy, unavailable, backend)</li>
 *   <li>Accepted and rejected client connections, and the number currently open</li>
 *   <li>Frames dropped outside of a recording</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class BridgeMetrics {

    static final String METRIC_PREFIX = "streambridge";

    private final MeterRegistry registry;

    public BridgeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the latency of one segment, from submission to final result.
     *
     * @param backend backend that produced the final
     * @param latencyMs latency in milliseconds
     */
    public void recordSegmentLatency(String backend, long latencyMs) {
        Timer.builder(METRIC_PREFIX + ".segment.latency")
                .description("Time from segment submission to final result")
                .tag("backend", backend)
                .register(registry)
                .record(latencyMs, TimeUnit.MILLISECONDS);
    }

    public void incrementFinal() {
        Counter.builder(METRIC_PREFIX + ".results.final")
                .description("Final results emitted to clients")
                .register(registry)
                .increment();
    }

    public void incrementPartial() {
        Counter.builder(METRIC_PREFIX + ".results.partial")
                .description("Partial results emitted to clients")
                .register(registry)
                .increment();
    }

    /**
     * Increments the segment failure counter.
     *
     * @param reason failure reason (timeout, busy, unavailable, backend)
     */
    public void incrementSegmentFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".segment.failure")
                .description("Segments that did not produce a final result")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementConnectionAccepted() {
        Counter.builder(METRIC_PREFIX + ".connections.accepted")
                .description("Client connections accepted")
                .register(registry)
                .increment();
    }

    /**
     * @param reason rejection reason (capacity, format)
     */
    public void incrementConnectionRejected(String reason) {
        Counter.builder(METRIC_PREFIX + ".connections.rejected")
                .description("Client connections rejected during handshake")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementFramesDropped() {
        Counter.builder(METRIC_PREFIX + ".frames.dropped")
                .description("Audio frames received outside of a recording")
                .register(registry)
                .increment();
    }

    /**
     * Registers the gauge of currently open connections.
     *
     * @param activeConnections supplier read on every scrape
     */
    public void bindActiveConnections(Supplier<Number> activeConnections) {
        Gauge.builder(METRIC_PREFIX + ".connections.active", activeConnections)
                .description("Client connections currently open")
                .register(registry);
    }

    @EventListener
    void onBackendFailure(BackendFailureEvent event) {
        Counter.builder(METRIC_PREFIX + ".backend.failure")
                .description("Backend connect exhaustion and mid-stream failures")
                .tag("backend", event.backend())
                .register(registry)
                .increment();
    }
}
