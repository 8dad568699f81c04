package com.phillippitts.streambridge.presentation.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.streambridge.exception.StreamBridgeException;
import org.springframework.stereotype.Component;

/**
 * Serialises {@link OutboundMessage}s to the JSON text sent over the client WebSocket.
 */
@Component
public class EnvelopeWriter {

    private final ObjectMapper objectMapper;

    public EnvelopeWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param message envelope to write
     * @return compact JSON text
     * @throws StreamBridgeException if the envelope cannot be serialised
     */
    public String write(OutboundMessage message) {
        try {
            return objectMapper.writeValueAsString(message.toWire());
        } catch (JsonProcessingException e) {
            throw new StreamBridgeException("Failed to serialise '" + message.type() + "' envelope", e);
        }
    }
}
