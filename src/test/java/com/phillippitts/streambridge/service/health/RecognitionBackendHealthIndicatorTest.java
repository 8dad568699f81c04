package com.phillippitts.streambridge.service.health;

import com.phillippitts.streambridge.config.properties.BackendProperties;
import com.phillippitts.streambridge.service.recognition.RecognitionClientFactory;
import com.phillippitts.streambridge.service.recognition.watchdog.BackendHealthTracker;
import com.phillippitts.streambridge.service.recognition.watchdog.BackendHealthTracker.BackendState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RecognitionBackendHealthIndicatorTest {

    private BackendHealthTracker tracker;
    private RecognitionBackendHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        tracker = mock(BackendHealthTracker.class);
        RecognitionClientFactory factory = mock(RecognitionClientFactory.class);
        when(factory.backendName()).thenReturn("websocket");
        indicator = new RecognitionBackendHealthIndicator(tracker, factory, new BackendProperties());
    }

    @Test
    void shouldReportUpWhenBackendHealthy() {
        when(tracker.getState("websocket")).thenReturn(BackendState.HEALTHY);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("backend", "websocket");
        assertThat(health.getDetails()).containsEntry("degradedMode", "SYNTHETIC");
        assertThat(health.getDetails()).doesNotContainKey("lastFailure");
    }

    @Test
    void shouldReportDegradedWithLastFailure() {
        Instant failedAt = Instant.parse("2024-03-01T10:15:30Z");
        when(tracker.getState("websocket")).thenReturn(BackendState.DEGRADED);
        when(tracker.lastFailureAt("websocket")).thenReturn(failedAt);

        Health health = indicator.health();

        assertThat(health.getStatus().getCode()).isEqualTo("DEGRADED");
        assertThat(health.getDetails()).containsEntry("lastFailure", failedAt.toString());
    }

    @Test
    void shouldReportDownWhenBackendUnavailable() {
        when(tracker.getState("websocket")).thenReturn(BackendState.UNAVAILABLE);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("status", "Backend unavailable");
    }
}
