package com.phillippitts.streambridge.service.events;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for noisy gateway conditions. Throttled per key to avoid log spam.
 */
@Component
class GatewayEventsListener {
    private static final Logger LOG = LogManager.getLogger(GatewayEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onLateFrameDropped(LateFrameDroppedEvent e) {
        if (shouldLog("late-frame-" + e.state())) {
            LOG.warn("Dropping audio frame received while {} ({} bytes, connection={}); further drops "
                    + "are throttled", e.state(), e.bytes(), e.connectionId());
        }
    }

    @EventListener
    void onConnectionRejected(ConnectionRejectedEvent e) {
        if (shouldLog("rejected-" + e.reason())) {
            LOG.warn("Connection rejected: reason={}, remote={}, detail={}", e.reason(), e.remote(), e.detail());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
