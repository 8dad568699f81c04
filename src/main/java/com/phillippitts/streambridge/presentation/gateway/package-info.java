/**
 * WebSocket connection gateway.
 *
 * <p>{@link com.phillippitts.streambridge.presentation.gateway.ConnectionGateway} accepts client
 * connections, enforces the connection limit, idle timeout and maximum session duration, and
 * routes text frames to the control-message parser and binary frames to the session as PCM.
 */
package com.phillippitts.streambridge.presentation.gateway;
