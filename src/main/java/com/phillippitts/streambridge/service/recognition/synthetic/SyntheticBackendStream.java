package com.phillippitts.streambridge.service.recognition.synthetic;

import com.phillippitts.streambridge.domain.PcmFormat;
import com.phillippitts.streambridge.domain.RecognitionResult;
import com.phillippitts.streambridge.domain.WordTiming;
import com.phillippitts.streambridge.exception.RecognitionException;
import com.phillippitts.streambridge.service.recognition.BackendEvent;
import com.phillippitts.streambridge.service.recognition.BackendStream;
import com.phillippitts.streambridge.service.recognition.ResultChannel;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Synthetic stream: counts audio per segment, emits a partial per audio chunk when partials are
 * enabled, and publishes the final after the configured latency.
 */
final class SyntheticBackendStream implements BackendStream {

    static final String MARKER = "[synthetic]";

    private final PcmFormat format;
    private final boolean partials;
    private final String fixedText;
    private final Executor delayed;
    private final ResultChannel<BackendEvent> events = new ResultChannel<>();
    private final Map<Long, long[]> bytesPerSegment = new ConcurrentHashMap<>();
    private volatile boolean open = true;

    SyntheticBackendStream(PcmFormat format, boolean partials, Duration latency, String fixedText) {
        this.format = format;
        this.partials = partials;
        this.fixedText = fixedText == null ? "" : fixedText.trim();
        this.delayed = CompletableFuture.delayedExecutor(latency.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void startSegment(long segmentId) {
        ensureOpen();
        bytesPerSegment.put(segmentId, new long[1]);
    }

    @Override
    public void sendAudio(long segmentId, byte[] pcm) {
        ensureOpen();
        long[] counter = bytesPerSegment.computeIfAbsent(segmentId, k -> new long[1]);
        counter[0] += pcm.length;
        if (partials) {
            events.publish(BackendEvent.partial(RecognitionResult.partial(segmentId, partialText(segmentId, counter[0]))));
        }
    }

    @Override
    public void endSegment(long segmentId) {
        ensureOpen();
        long[] counter = bytesPerSegment.remove(segmentId);
        long bytes = counter == null ? 0 : counter[0];
        String text = textFor(segmentId, bytes);
        List<WordTiming> words = spreadWords(text, format.bytesToMillis(bytes) / 1000.0);
        RecognitionResult result = RecognitionResult.finalResult(segmentId, text, words, 1.0);
        delayed.execute(() -> events.publish(BackendEvent.finalResult(result)));
    }

    @Override
    public ResultChannel<BackendEvent> events() {
        return events;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
        events.close();
    }

    private String textFor(long segmentId, long bytes) {
        if (!fixedText.isEmpty()) {
            return fixedText;
        }
        double seconds = format.bytesToMillis(bytes) / 1000.0;
        return String.format(Locale.ROOT, "%s segment %d %.2fs", MARKER, segmentId, seconds);
    }

    // Fixed text is revealed word by word, one word per chunk.
    private String partialText(long segmentId, long bytes) {
        if (fixedText.isEmpty()) {
            return textFor(segmentId, bytes);
        }
        String[] words = fixedText.split("\\s+");
        int chunks = (int) Math.min(words.length, Math.max(1, bytes / Math.max(1, format.millisToBytes(100))));
        return String.join(" ", Arrays.copyOf(words, chunks));
    }

    private static List<WordTiming> spreadWords(String text, double durationSeconds) {
        String[] tokens = text.isBlank() ? new String[0] : text.trim().split("\\s+");
        List<WordTiming> words = new ArrayList<>(tokens.length);
        double step = tokens.length == 0 ? 0 : durationSeconds / tokens.length;
        for (int i = 0; i < tokens.length; i++) {
            double start = round3(step * i);
            double end = Math.max(start, round3(step * (i + 1)));
            words.add(new WordTiming(tokens[i], start, end, 1.0));
        }
        return words;
    }

    private static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }

    private void ensureOpen() {
        if (!open) {
            throw new RecognitionException("Synthetic stream is closed", SyntheticRecognitionBackend.NAME);
        }
    }
}
