package com.phillippitts.streambridge.service.events;

/**
 * Published when the gateway refuses a connection during or right after the handshake.
 *
 * @param reason  short reason key (capacity, format)
 * @param remote  remote address, may be {@code null}
 * @param detail  human-readable detail
 */
public record ConnectionRejectedEvent(String reason, String remote, String detail) {
}
