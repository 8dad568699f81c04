package com.phillippitts.streambridge.service.audio;

import com.phillippitts.streambridge.config.properties.VadProperties;
import com.phillippitts.streambridge.exception.InvalidAudioException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import static com.phillippitts.streambridge.service.audio.AudioFormat.REQUIRED_BLOCK_ALIGN;
import static com.phillippitts.streambridge.service.audio.AudioFormat.RIFF_HEADER_SIZE;

/**
 * Validates inbound binary frames against the raw PCM contract before they reach the buffer.
 *
 * <p>Frames must be raw PCM16LE (no container), aligned to whole samples and bounded in size.
 */
@Component
public class FrameValidator {

    private final int maxFrameBytes;

    @Autowired
    public FrameValidator(VadProperties props) {
        this(props.getMaxFrameBytes());
    }

    FrameValidator(int maxFrameBytes) {
        this.maxFrameBytes = maxFrameBytes;
    }

    /**
     * Validate one inbound frame.
     *
     * @param data frame bytes
     * @throws InvalidAudioException when the frame violates the format contract
     */
    public void validate(byte[] data) {
        if (data == null) {
            throw new InvalidAudioException("Audio frame is null");
        }
        if (data.length > maxFrameBytes) {
            throw new InvalidAudioException(data.length,
                    "Audio frame too large. Max: " + maxFrameBytes + " bytes");
        }
        if (isWav(data)) {
            throw new InvalidAudioException(data.length,
                    "WAV container not accepted; send raw 16kHz mono PCM16LE");
        }
        if (data.length % REQUIRED_BLOCK_ALIGN != 0) {
            throw new InvalidAudioException(data.length,
                    "PCM not aligned to block size (" + REQUIRED_BLOCK_ALIGN + " bytes)");
        }
    }

    private boolean isWav(byte[] a) {
        return a.length >= RIFF_HEADER_SIZE
            && a[0] == 'R' && a[1] == 'I' && a[2] == 'F' && a[3] == 'F'
            && a[8] == 'W' && a[9] == 'A' && a[10] == 'V' && a[11] == 'E';
    }
}
