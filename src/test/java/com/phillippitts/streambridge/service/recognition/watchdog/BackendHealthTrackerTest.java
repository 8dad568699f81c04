package com.phillippitts.streambridge.service.recognition.watchdog;

import com.phillippitts.streambridge.MutableClock;
import com.phillippitts.streambridge.config.properties.BackendProperties;
import com.phillippitts.streambridge.service.recognition.watchdog.BackendHealthTracker.BackendState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BackendHealthTrackerTest {

    private MutableClock clock;
    private BackendHealthTracker tracker;

    @BeforeEach
    void setUp() {
        BackendProperties props = new BackendProperties();
        props.setHealthWindowMinutes(5);
        props.setHealthFailureThreshold(3);
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        tracker = new BackendHealthTracker(props, clock);
    }

    @Test
    void shouldReportHealthyForUnknownBackend() {
        assertThat(tracker.getState("websocket")).isEqualTo(BackendState.HEALTHY);
        assertThat(tracker.lastFailureAt("websocket")).isNull();
    }

    @Test
    void shouldDegradeOnFirstFailureAndBecomeUnavailableAtThreshold() {
        // Arrange + Act
        tracker.onFailure(failure());
        BackendState afterOne = tracker.getState("websocket");
        tracker.onFailure(failure());
        tracker.onFailure(failure());

        // Assert
        assertThat(afterOne).isEqualTo(BackendState.DEGRADED);
        assertThat(tracker.getState("websocket")).isEqualTo(BackendState.UNAVAILABLE);
        assertThat(tracker.lastFailureAt("websocket")).isEqualTo(clock.instant());
    }

    @Test
    void shouldAgeFailuresOutOfWindow() {
        // Arrange
        tracker.onFailure(failure());
        tracker.onFailure(failure());
        tracker.onFailure(failure());

        // Act
        clock.advance(Duration.ofMinutes(6));

        // Assert
        assertThat(tracker.getState("websocket")).isEqualTo(BackendState.HEALTHY);
    }

    @Test
    void shouldResetOnRecovery() {
        // Arrange
        tracker.onFailure(failure());
        tracker.onFailure(failure());
        tracker.onFailure(failure());

        // Act
        tracker.onRecovered(new BackendRecoveredEvent("websocket", clock.instant()));
        tracker.onFailure(failure());

        // Assert
        assertThat(tracker.getState("websocket")).isEqualTo(BackendState.DEGRADED);
        assertThat(tracker.snapshot()).containsEntry("websocket", BackendState.DEGRADED);
    }

    private BackendFailureEvent failure() {
        return new BackendFailureEvent("websocket", clock.instant(), "connect refused", null, Map.of());
    }
}
