package com.phillippitts.streambridge.exception;

/**
 * Thrown when an inbound audio frame or the negotiated format does not match the fixed
 * contract (16kHz, 16-bit signed PCM, mono, little-endian).
 *
 * <p>A format error is fatal to the connection that produced it.
 */
public class InvalidAudioException extends StreamBridgeException {

    private final int audioSize;
    private final String reason;

    public InvalidAudioException(String reason) {
        super("Invalid audio data: " + reason);
        this.audioSize = 0;
        this.reason = reason;
    }

    public InvalidAudioException(int audioSize, String reason) {
        super("Invalid audio data (" + audioSize + " bytes): " + reason);
        this.audioSize = audioSize;
        this.reason = reason;
    }

    public int getAudioSize() {
        return audioSize;
    }

    public String getReason() {
        return reason;
    }
}
