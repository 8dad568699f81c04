package com.phillippitts.streambridge.service.session;

import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class SerialExecutorTest {

    private final ExecutorService pool = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void shouldRunTasksInSubmissionOrder() {
        SerialExecutor serial = new SerialExecutor(pool, Map.of());
        List<Integer> seen = new CopyOnWriteArrayList<>();

        for (int i = 0; i < 500; i++) {
            int n = i;
            serial.execute(() -> seen.add(n));
        }

        await().atMost(Duration.ofSeconds(5)).until(() -> seen.size() == 500);
        assertThat(seen).isEqualTo(IntStream.range(0, 500).boxed().collect(Collectors.toList()));
    }

    @Test
    void shouldNeverRunTwoTasksAtOnce() throws Exception {
        SerialExecutor serial = new SerialExecutor(pool, Map.of());
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxSeen = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(200);

        for (int i = 0; i < 200; i++) {
            pool.execute(() -> serial.execute(() -> {
                maxSeen.accumulateAndGet(running.incrementAndGet(), Math::max);
                running.decrementAndGet();
                done.countDown();
            }));
        }

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(maxSeen.get()).isEqualTo(1);
    }

    @Test
    void shouldKeepRunningAfterTaskThrows() {
        SerialExecutor serial = new SerialExecutor(pool, Map.of());
        List<String> seen = new CopyOnWriteArrayList<>();

        serial.execute(() -> {
            throw new IllegalStateException("boom");
        });
        serial.execute(() -> seen.add("after"));

        await().atMost(Duration.ofSeconds(5)).until(() -> seen.contains("after"));
    }

    @Test
    void shouldRunTasksWithLoggingContext() {
        SerialExecutor serial = new SerialExecutor(pool, Map.of("connectionId", "conn-42"));
        List<String> seen = new CopyOnWriteArrayList<>();

        serial.execute(() -> seen.add(ThreadContext.get("connectionId")));

        await().atMost(Duration.ofSeconds(5)).until(() -> !seen.isEmpty());
        assertThat(seen).containsExactly("conn-42");
    }

    @Test
    void shouldPropagateRejectionFromDelegate() {
        ExecutorService closed = Executors.newSingleThreadExecutor();
        closed.shutdown();
        SerialExecutor serial = new SerialExecutor(closed, Map.of());

        assertThatThrownBy(() -> serial.execute(() -> { }))
                .isInstanceOf(RejectedExecutionException.class);
        assertThat(serial.backlog()).isZero();
    }
}
