package com.phillippitts.streambridge.service.recognition;

import com.phillippitts.streambridge.exception.RecognitionException;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Unbounded single-consumer channel of items produced by one stream, readable either by
 * timed polling or as a lazy blocking sequence.
 *
 * <p>The sequence ends when the producer closes the channel and fails when the producer fails it.
 * It can be iterated once; it is not restartable.
 *
 * @param <T> item type
 */
public final class ResultChannel<T> implements Iterable<T> {

    private record Entry<T>(T item) {
    }

    private final Entry<T> end = new Entry<>(null);
    private final BlockingQueue<Entry<T>> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean iterated = new AtomicBoolean();
    private volatile boolean closed;
    private volatile Throwable failure;

    /**
     * Appends an item.
     *
     * @param item item to publish
     * @return {@code false} if the channel is already closed and the item was dropped
     */
    public boolean publish(T item) {
        Objects.requireNonNull(item, "item");
        if (closed) {
            return false;
        }
        return queue.offer(new Entry<>(item));
    }

    /** Ends the sequence normally. Idempotent. */
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        queue.offer(end);
    }

    /**
     * Ends the sequence with a failure that readers observe after draining buffered items.
     * Ignored if the channel is already closed.
     *
     * @param cause failure cause
     */
    public synchronized void fail(Throwable cause) {
        if (closed) {
            return;
        }
        failure = cause;
        closed = true;
        queue.offer(end);
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Waits for the next item.
     *
     * @param timeout maximum time to wait
     * @return the next item, or {@code null} if none arrived in time
     * @throws RecognitionException if the channel is closed or failed and fully drained
     * @throws InterruptedException if interrupted while waiting
     */
    public T poll(Duration timeout) throws InterruptedException {
        Entry<T> next = queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
        return unwrap(next);
    }

    /**
     * Returns the next item if one is buffered, without waiting.
     *
     * @return the next item or {@code null}
     * @throws RecognitionException if the channel is closed or failed and fully drained
     */
    public T tryPoll() {
        return unwrap(queue.poll());
    }

    private T unwrap(Entry<T> next) {
        if (next == null) {
            return null;
        }
        if (next == end) {
            // keep the terminal marker visible to later reads
            queue.offer(end);
            throw endOfStream();
        }
        return next.item();
    }

    private RecognitionException endOfStream() {
        Throwable cause = failure;
        if (cause instanceof RecognitionException re) {
            return re;
        }
        return cause != null
                ? new RecognitionException("Result stream failed", cause)
                : new RecognitionException("Result stream closed");
    }

    /**
     * Returns the lazy blocking sequence of items. {@code hasNext()} blocks until an item arrives
     * or the channel ends; a failed channel surfaces its failure from {@code hasNext()}.
     *
     * @throws IllegalStateException on a second call
     */
    @Override
    public Iterator<T> iterator() {
        if (!iterated.compareAndSet(false, true)) {
            throw new IllegalStateException("Result sequence is not restartable");
        }
        return new Iterator<>() {
            private Entry<T> next;

            @Override
            public boolean hasNext() {
                if (next != null) {
                    return next != end;
                }
                try {
                    next = queue.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RecognitionException("Interrupted while waiting for results", e);
                }
                if (next == end) {
                    queue.offer(end);
                    if (failure != null) {
                        throw endOfStream();
                    }
                    return false;
                }
                return true;
            }

            @Override
            public T next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                T item = next.item();
                next = null;
                return item;
            }
        };
    }
}
