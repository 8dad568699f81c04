package com.phillippitts.streambridge.service.session;

import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs tasks one at a time, in submission order, on a shared delegate executor.
 *
 * <p>This is the logical task of one connection: every state change of a session happens on it,
 * so session state needs no locking while sessions still share the pool. A busy session yields its
 * pool thread after {@link #BATCH} tasks so other sessions are not starved.
 *
 * <p>Tasks run with the given ThreadContext entries (e.g. {@code connectionId}). A task that throws
 * is logged and does not stop later tasks.
 */
public final class SerialExecutor implements Executor {

    private static final Logger LOG = LogManager.getLogger(SerialExecutor.class);

    static final int BATCH = 64;

    private final Executor delegate;
    private final Map<String, String> context;
    private final Queue<Runnable> tasks = new ArrayDeque<>();
    private final Object lock = new Object();
    private boolean running;

    public SerialExecutor(Executor delegate, Map<String, String> context) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.context = context == null ? Map.of() : Map.copyOf(context);
    }

    @Override
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "task");
        synchronized (lock) {
            tasks.add(task);
            if (running) {
                return;
            }
            running = true;
        }
        schedule();
    }

    /** Tasks waiting to run, excluding the one running. */
    public int backlog() {
        synchronized (lock) {
            return tasks.size();
        }
    }

    private void schedule() {
        try {
            delegate.execute(this::drain);
        } catch (RejectedExecutionException e) {
            int dropped;
            synchronized (lock) {
                dropped = tasks.size();
                tasks.clear();
                running = false;
            }
            LOG.error("Session executor rejected work; {} task(s) dropped", dropped);
            throw e;
        }
    }

    private void drain() {
        try (CloseableThreadContext.Instance ctc = CloseableThreadContext.putAll(context)) {
            for (int i = 0; i < BATCH; i++) {
                Runnable next;
                synchronized (lock) {
                    next = tasks.poll();
                    if (next == null) {
                        running = false;
                        return;
                    }
                }
                try {
                    next.run();
                } catch (RuntimeException e) {
                    LOG.error("Session task failed", e);
                }
            }
        }
        // batch exhausted with work left: requeue behind other sessions
        schedule();
    }
}
