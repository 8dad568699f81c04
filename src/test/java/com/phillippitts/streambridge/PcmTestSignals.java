package com.phillippitts.streambridge;

import com.phillippitts.streambridge.domain.AudioFrame;
import com.phillippitts.streambridge.domain.PcmFormat;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Synthetic 16 kHz mono PCM16LE audio for tests.
 */
public final class PcmTestSignals {

    /** Bytes in one 20 ms frame at the required format. */
    public static final int FRAME_BYTES = PcmFormat.REQUIRED.millisToBytes(20);

    private PcmTestSignals() {
    }

    /** Digital silence. */
    public static byte[] silence(int millis) {
        return new byte[PcmFormat.REQUIRED.millisToBytes(millis)];
    }

    /**
     * A 440 Hz sine wave.
     *
     * @param millis    duration
     * @param amplitude peak amplitude as a fraction of full scale
     */
    public static byte[] tone(int millis, double amplitude) {
        int samples = PcmFormat.REQUIRED.millisToBytes(millis) / 2;
        byte[] pcm = new byte[samples * 2];
        for (int i = 0; i < samples; i++) {
            short s = (short) Math.round(Math.sin(2 * Math.PI * 440 * i / 16_000.0) * amplitude * 32_767);
            pcm[2 * i] = (byte) (s & 0xFF);
            pcm[2 * i + 1] = (byte) ((s >> 8) & 0xFF);
        }
        return pcm;
    }

    /** Loud enough to pass the default VAD threshold. */
    public static byte[] speech(int millis) {
        return tone(millis, 0.3);
    }

    /** Splits PCM into 20 ms frames stamped with the given instant. */
    public static List<AudioFrame> frames(byte[] pcm, Instant at) {
        List<AudioFrame> frames = new ArrayList<>();
        for (int offset = 0; offset < pcm.length; offset += FRAME_BYTES) {
            int end = Math.min(pcm.length, offset + FRAME_BYTES);
            byte[] chunk = new byte[end - offset];
            System.arraycopy(pcm, offset, chunk, 0, chunk.length);
            frames.add(new AudioFrame(chunk, at));
        }
        return frames;
    }

    /** Concatenates PCM buffers. */
    public static byte[] concat(byte[]... parts) {
        int total = 0;
        for (byte[] p : parts) {
            total += p.length;
        }
        byte[] out = new byte[total];
        int offset = 0;
        for (byte[] p : parts) {
            System.arraycopy(p, 0, out, offset, p.length);
            offset += p.length;
        }
        return out;
    }
}
