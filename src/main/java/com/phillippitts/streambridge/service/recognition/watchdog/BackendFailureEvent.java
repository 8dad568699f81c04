package com.phillippitts.streambridge.service.recognition.watchdog;

import java.time.Instant;
import java.util.Map;

/**
 * Published when the recognition backend cannot be reached or a stream fails mid-flight.
 *
 * <p>PII note: Do not include transcript text in context. Restrict to technical diagnostics.
 */
public record BackendFailureEvent(
        String backend,
        Instant at,
        String message,
        Throwable cause,
        Map<String, String> context
) {
    public BackendFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
