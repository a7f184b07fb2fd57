package com.phillippitts.meetingscribe.config;

import com.phillippitts.meetingscribe.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors for the streaming pipeline.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on hardware and workload.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Runs transcription backend calls, one task per dispatched speaker window.
     *
     * <p>Pool sizing via {@code threadpool.stt.*}:
     * <ul>
     *   <li>Core pool: default 4 - one in-flight call per speaker plus headroom</li>
     *   <li>Max pool: default 8 - burst traffic</li>
     *   <li>Queue: default 50 tasks - bounded memory</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. The dispatcher submits from its
     * ingestion loop, which must never run a backend call itself, so a rejected window is reported
     * as a failure and dropped.
     *
     * <p>MDC propagation: copies Log4j2 ThreadContext (session, generation, speaker) to the worker.
     *
     * @return executor for backend calls
     */
    @Bean(name = "transcriptionExecutor")
    public ThreadPoolTaskExecutor transcriptionExecutor() {
        ThreadPoolProperties.SttPoolProperties sttProps = threadPoolProperties.getStt();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(sttProps.getCorePoolSize());
        executor.setMaxPoolSize(sttProps.getMaxPoolSize());
        executor.setQueueCapacity(sttProps.getQueueCapacity());
        executor.setThreadNamePrefix(sttProps.getThreadNamePrefix());
        executor.setKeepAliveSeconds(sttProps.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(threadContextPropagating());
        executor.initialize();
        return executor;
    }

    /**
     * Runs long-lived blocking loops: the two merger readers and the dispatcher's consumption loop.
     *
     * <p>Queue capacity 0 means a direct hand-off, so every loop gets its own thread right away
     * instead of waiting behind another loop that never ends. Sized via {@code threadpool.stream.*}.
     *
     * @return executor for stream loops
     */
    @Bean(name = "streamExecutor")
    public ThreadPoolTaskExecutor streamExecutor() {
        ThreadPoolProperties.StreamPoolProperties streamProps = threadPoolProperties.getStream();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(streamProps.getCorePoolSize());
        executor.setMaxPoolSize(streamProps.getMaxPoolSize());
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix(streamProps.getThreadNamePrefix());
        executor.setKeepAliveSeconds(streamProps.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setTaskDecorator(threadContextPropagating());
        executor.initialize();
        return executor;
    }

    static TaskDecorator threadContextPropagating() {
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
