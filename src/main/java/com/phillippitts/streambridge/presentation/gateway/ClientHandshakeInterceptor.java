package com.phillippitts.streambridge.presentation.gateway;

import com.phillippitts.streambridge.domain.PcmFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.util.MultiValueMap;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;
import java.util.UUID;

/**
 * Reads the handshake query parameters into session attributes.
 *
 * <p>{@code client_id} is echoed back to the client (a random UUID when absent). Optional
 * {@code sample_rate}, {@code channels} and {@code bit_depth} must match the fixed PCM contract; a
 * mismatch does not refuse the upgrade, so that the gateway can still send a terminal error
 * envelope before closing.
 */
public class ClientHandshakeInterceptor implements HandshakeInterceptor {

    private static final Logger LOG = LogManager.getLogger(ClientHandshakeInterceptor.class);

    static final String ATTR_CLIENT_ID = "streambridge.clientId";
    static final String ATTR_FORMAT_ERROR = "streambridge.formatError";

    private static final int MAX_CLIENT_ID_LENGTH = 128;

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        MultiValueMap<String, String> params = UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams();

        String clientId = params.getFirst("client_id");
        if (clientId == null || clientId.isBlank()) {
            clientId = UUID.randomUUID().toString();
        } else if (clientId.length() > MAX_CLIENT_ID_LENGTH) {
            clientId = clientId.substring(0, MAX_CLIENT_ID_LENGTH);
        }
        attributes.put(ATTR_CLIENT_ID, clientId);

        String formatError = checkFormat(params);
        if (formatError != null) {
            LOG.debug("Handshake format mismatch: {}", formatError);
            attributes.put(ATTR_FORMAT_ERROR, formatError);
        }
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        // nothing to do
    }

    static String checkFormat(MultiValueMap<String, String> params) {
        PcmFormat required = PcmFormat.REQUIRED;
        String error = checkParam(params, "sample_rate", required.sampleRate());
        if (error == null) {
            error = checkParam(params, "channels", required.channels());
        }
        if (error == null) {
            error = checkParam(params, "bit_depth", required.bitsPerSample());
        }
        return error;
    }

    private static String checkParam(MultiValueMap<String, String> params, String name, int expected) {
        String raw = params.getFirst(name);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value != expected) {
                return "Unsupported " + name + " " + value + "; expected " + expected;
            }
            return null;
        } catch (NumberFormatException e) {
            return "Invalid " + name + ": not a number";
        }
    }
}
