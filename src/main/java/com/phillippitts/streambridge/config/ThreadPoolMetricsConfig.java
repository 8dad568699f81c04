package com.phillippitts.streambridge.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes the session and backend executors via Micrometer.
 *
 * <p>For each pool ({@code session}, {@code backend}) the gauges are
 * {@code streambridge.pool.<name>.size}, {@code .active}, {@code .queued}, {@code .completed},
 * {@code .core.size} and {@code .max.size}. Prometheus names use underscores, e.g.
 * {@code streambridge_pool_backend_active}.
 *
 * <p>Additionally logs a health summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> sessionExecutorProvider;
    private final ObjectProvider<ThreadPoolTaskExecutor> backendExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("sessionExecutor") ObjectProvider<ThreadPoolTaskExecutor> sessionExecutorProvider,
            @Qualifier("backendExecutor") ObjectProvider<ThreadPoolTaskExecutor> backendExecutorProvider) {
        this.sessionExecutorProvider = sessionExecutorProvider;
        this.backendExecutorProvider = backendExecutorProvider;
    }

    @Bean
    public MeterBinder threadPoolMetrics() {
        return registry -> {
            bind(registry, "session", sessionExecutorProvider.getObject().getThreadPoolExecutor());
            bind(registry, "backend", backendExecutorProvider.getObject().getThreadPoolExecutor());
            LOG.info("Thread pool metrics registered: streambridge.pool.* available via /actuator/metrics");
        };
    }

    private static void bind(MeterRegistry registry, String pool, ThreadPoolExecutor executor) {
        String prefix = "streambridge.pool." + pool;
        Gauge.builder(prefix + ".size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the " + pool + " pool")
                .register(registry);
        Gauge.builder(prefix + ".active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Number of threads actively executing " + pool + " tasks")
                .register(registry);
        Gauge.builder(prefix + ".queued", executor, e -> e.getQueue().size())
                .description("Number of " + pool + " tasks waiting in the queue")
                .register(registry);
        Gauge.builder(prefix + ".completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .description("Cumulative count of completed " + pool + " tasks")
                .register(registry);
        Gauge.builder(prefix + ".core.size", executor, ThreadPoolExecutor::getCorePoolSize)
                .description("Configured core pool size")
                .register(registry);
        Gauge.builder(prefix + ".max.size", executor, ThreadPoolExecutor::getMaximumPoolSize)
                .description("Configured maximum pool size")
                .register(registry);
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        log("Session", sessionExecutorProvider.getObject().getThreadPoolExecutor());
        log("Backend", backendExecutorProvider.getObject().getThreadPoolExecutor());
    }

    private static void log(String name, ThreadPoolExecutor executor) {
        LOG.info("{} Thread Pool Health: size={}/{}, active={}, queued={}, completed={}",
                name,
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount()
        );
    }
}
