package com.phillippitts.streambridge.service.health;

import com.phillippitts.streambridge.config.properties.BackendProperties;
import com.phillippitts.streambridge.service.recognition.RecognitionClientFactory;
import com.phillippitts.streambridge.service.recognition.watchdog.BackendHealthTracker;
import com.phillippitts.streambridge.service.recognition.watchdog.BackendHealthTracker.BackendState;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Health indicator for the recognition backend.
 *
 * <p>Reports backend health for monitoring and alerting:
 * <ul>
 *   <li>UP: no recent failures</li>
 *   <li>DEGRADED: recent failures below the threshold</li>
 *   <li>DOWN: failure threshold reached within the window</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class RecognitionBackendHealthIndicator implements HealthIndicator {

    private final BackendHealthTracker tracker;
    private final RecognitionClientFactory clientFactory;
    private final BackendProperties props;

    public RecognitionBackendHealthIndicator(BackendHealthTracker tracker,
                                             RecognitionClientFactory clientFactory,
                                             BackendProperties props) {
        this.tracker = tracker;
        this.clientFactory = clientFactory;
        this.props = props;
    }

    @Override
    public Health health() {
        String backend = clientFactory.backendName();
        BackendState state = tracker.getState(backend);

        Health.Builder builder = new Health.Builder();
        switch (state) {
            case HEALTHY -> builder.up().withDetail("status", "Backend operational");
            case DEGRADED -> builder.status("DEGRADED").withDetail("status", "Recent backend failures");
            default -> builder.down().withDetail("status", "Backend unavailable");
        }
        builder.withDetail("backend", backend)
                .withDetail("mode", props.getMode().name())
                .withDetail("degradedMode", props.getDegradedMode().name());
        Instant lastFailure = tracker.lastFailureAt(backend);
        if (lastFailure != null) {
            builder.withDetail("lastFailure", lastFailure.toString());
        }
        return builder.build();
    }
}
