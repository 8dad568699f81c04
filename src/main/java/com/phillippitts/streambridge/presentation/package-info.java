/**
 * Presentation layer: the client-facing WebSocket gateway and the REST status endpoints.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.gateway} - WebSocket handler, handshake checks, control-message parsing
 *       and the connection registry</li>
 *   <li>{@code presentation.protocol} - outbound JSON envelopes</li>
 *   <li>{@code presentation.controller} - read-only connection status over HTTP</li>
 *   <li>{@code presentation.exception} - global exception handling for HTTP responses</li>
 * </ul>
 *
 * <p>Presentation depends on service but not vice versa: sessions talk to the transport only
 * through {@link com.phillippitts.streambridge.service.session.ClientChannel}.
 */
package com.phillippitts.streambridge.presentation;
