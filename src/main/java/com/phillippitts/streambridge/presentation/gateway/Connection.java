package com.phillippitts.streambridge.presentation.gateway;

import com.phillippitts.streambridge.service.session.TranscriptionSession;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One accepted client connection. Owned by the {@link ConnectionRegistry}; the session only
 * knows its id.
 */
final class Connection {

    private final String id;
    private final String clientId;
    private final Instant createdAt;
    private final TranscriptionSession session;
    private final WebSocketClientChannel channel;
    private volatile Instant lastActivity;

    Connection(String id, String clientId, Instant createdAt, TranscriptionSession session,
               WebSocketClientChannel channel) {
        this.id = Objects.requireNonNull(id, "id");
        this.clientId = Objects.requireNonNull(clientId, "clientId");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.session = Objects.requireNonNull(session, "session");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.lastActivity = createdAt;
    }

    String id() {
        return id;
    }

    String clientId() {
        return clientId;
    }

    Instant createdAt() {
        return createdAt;
    }

    TranscriptionSession session() {
        return session;
    }

    WebSocketClientChannel channel() {
        return channel;
    }

    Instant lastActivity() {
        return lastActivity;
    }

    void touch(Instant now) {
        lastActivity = now;
    }

    Duration uptime(Instant now) {
        return Duration.between(createdAt, now);
    }

    Duration idleFor(Instant now) {
        return Duration.between(lastActivity, now);
    }
}
