package com.phillippitts.streambridge.service.recognition.watchdog;

import com.phillippitts.streambridge.config.properties.BackendProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Event-driven view of recognition backend health, aggregated across all sessions.
 *
 * Detection model:
 * - Session clients publish {@link BackendFailureEvent} on connect exhaustion and mid-stream failures.
 * - Failures are tracked per backend in a sliding time window.
 * - One failure marks the backend DEGRADED; reaching the threshold within the window marks it UNAVAILABLE.
 * - A {@link BackendRecoveredEvent} (a later successful connect) restores HEALTHY and clears the window.
 *
 * The tracker only observes; retry and degraded-mode decisions stay with each session client.
 */
@Component
public class BackendHealthTracker {

    private static final Logger LOG = LogManager.getLogger(BackendHealthTracker.class);

    public enum BackendState { HEALTHY, DEGRADED, UNAVAILABLE }

    private final BackendProperties props;
    private final Clock clock;

    private final ConcurrentMap<String, Deque<Instant>> failureWindow = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, BackendState> state = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Instant> lastFailure = new ConcurrentHashMap<>();

    public BackendHealthTracker(BackendProperties props, Clock clock) {
        this.props = Objects.requireNonNull(props, "props");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Current state of a backend. Backends never seen failing are HEALTHY.
     *
     * @param backend backend name
     * @return current state
     */
    public BackendState getState(String backend) {
        BackendState s = state.getOrDefault(backend, BackendState.HEALTHY);
        if (s == BackendState.HEALTHY) {
            return s;
        }
        // failures age out of the window even without new traffic
        Deque<Instant> window = failureWindow.get(backend);
        if (window != null) {
            synchronized (window) {
                pruneOld(window);
                if (window.isEmpty()) {
                    state.put(backend, BackendState.HEALTHY);
                    return BackendState.HEALTHY;
                }
            }
        }
        return s;
    }

    /** Snapshot of all tracked backends and their states. */
    public Map<String, BackendState> snapshot() {
        Map<String, BackendState> copy = new ConcurrentHashMap<>();
        state.keySet().forEach(name -> copy.put(name, getState(name)));
        return copy;
    }

    /** Time of the most recent failure, or {@code null}. */
    public Instant lastFailureAt(String backend) {
        return lastFailure.get(backend);
    }

    @EventListener
    public void onFailure(BackendFailureEvent event) {
        String backend = event.backend();
        Deque<Instant> window = failureWindow.computeIfAbsent(backend, k -> new ArrayDeque<>());
        BackendState next;
        int failures;
        synchronized (window) {
            pruneOld(window);
            window.addLast(event.at());
            failures = window.size();
            next = failures >= props.getHealthFailureThreshold()
                    ? BackendState.UNAVAILABLE
                    : BackendState.DEGRADED;
        }
        lastFailure.put(backend, event.at());
        BackendState previous = state.put(backend, next);
        if (previous != next) {
            LOG.warn("Backend {} is now {} ({} failures within {}m): {}",
                    backend, next, failures, props.getHealthWindowMinutes(), event.message());
        } else {
            LOG.debug("Backend failure: backend={}, msg={}", backend, event.message());
        }
    }

    @EventListener
    public void onRecovered(BackendRecoveredEvent event) {
        String backend = event.backend();
        Deque<Instant> window = failureWindow.get(backend);
        if (window != null) {
            synchronized (window) {
                window.clear();
            }
        }
        BackendState previous = state.put(backend, BackendState.HEALTHY);
        if (previous != null && previous != BackendState.HEALTHY) {
            LOG.info("Backend recovered: {}", backend);
        }
    }

    @Scheduled(fixedRate = 60_000)
    void logHealthSummary() {
        if (state.isEmpty()) {
            return;
        }
        StringBuilder sb = new StringBuilder("Backend states: ");
        snapshot().forEach((name, st) -> sb.append(name).append('=').append(st).append(' '));
        LOG.info(sb.toString().trim());
    }

    private void pruneOld(Deque<Instant> window) {
        Instant cutoff = clock.instant().minus(Duration.ofMinutes(props.getHealthWindowMinutes()));
        while (!window.isEmpty() && window.peekFirst().isBefore(cutoff)) {
            window.removeFirst();
        }
    }
}
