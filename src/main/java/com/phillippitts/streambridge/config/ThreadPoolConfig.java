package com.phillippitts.streambridge.config;

import com.phillippitts.streambridge.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors shared by all connections.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} ({@code threadpool.*}).
 * Both pools copy the Log4j2 ThreadContext of the submitting thread to the worker so
 * connection and segment ids stay on every log line.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Runs the per-connection serial tasks (state machine, outbound envelopes).
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. When the pool and queue
     * are full the submitting thread runs the drain loop itself, slowing down the reader of
     * that connection instead of dropping control events.
     *
     * @return executor for session tasks
     */
    @Bean(name = "sessionExecutor")
    public Executor sessionExecutor() {
        return build(threadPoolProperties.getSession(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /**
     * Runs the blocking recognition workers, one active per connection at most.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. A rejected worker fails its
     * queued segments as busy rather than blocking a WebSocket reader thread.
     *
     * @return executor for backend I/O
     */
    @Bean(name = "backendExecutor")
    public Executor backendExecutor() {
        return build(threadPoolProperties.getBackend(), new ThreadPoolExecutor.AbortPolicy());
    }

    private static ThreadPoolTaskExecutor build(ThreadPoolProperties.PoolProperties props,
                                                RejectedExecutionHandler rejection) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejection);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(threadContextPropagation());
        executor.initialize();
        return executor;
    }

    static TaskDecorator threadContextPropagation() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
