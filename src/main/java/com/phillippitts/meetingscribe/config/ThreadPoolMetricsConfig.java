package com.phillippitts.meetingscribe.config;

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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Gauges for both pipeline executors, tagged {@code pool=stt} or {@code pool=stream}:
 * {@code meetingscribe.pool.size}, {@code .active}, {@code .queued} and {@code .completed}.
 * A queued count above zero on the stt pool means windows are waiting on the backend.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> transcriptionExecutor;
    private final ObjectProvider<ThreadPoolTaskExecutor> streamExecutor;

    public ThreadPoolMetricsConfig(
            @Qualifier("transcriptionExecutor") ObjectProvider<ThreadPoolTaskExecutor> transcriptionExecutor,
            @Qualifier("streamExecutor") ObjectProvider<ThreadPoolTaskExecutor> streamExecutor) {
        this.transcriptionExecutor = transcriptionExecutor;
        this.streamExecutor = streamExecutor;
    }

    @Bean
    public MeterBinder pipelineExecutorMetrics() {
        return registry -> {
            pools().forEach((name, executor) -> bindPool(registry, name, executor));
            LOG.info("Executor metrics registered for pools {}", pools().keySet());
        };
    }

    private static void bindPool(MeterRegistry registry, String pool, ThreadPoolExecutor executor) {
        Gauge.builder("meetingscribe.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .tag("pool", pool)
                .register(registry);
        Gauge.builder("meetingscribe.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .tag("pool", pool)
                .register(registry);
        Gauge.builder("meetingscribe.pool.queued", executor, e -> e.getQueue().size())
                .tag("pool", pool)
                .description("Tasks waiting for a thread")
                .register(registry);
        Gauge.builder("meetingscribe.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .tag("pool", pool)
                .register(registry);
    }

    @Scheduled(fixedRate = 300_000)
    public void logThreadPoolHealth() {
        pools().forEach((name, executor) -> LOG.info("Pool {}: size={}/{}, active={}, queued={}, completed={}",
                name,
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount()));
    }

    private Map<String, ThreadPoolExecutor> pools() {
        Map<String, ThreadPoolExecutor> pools = new LinkedHashMap<>();
        pools.put("stt", transcriptionExecutor.getObject().getThreadPoolExecutor());
        pools.put("stream", streamExecutor.getObject().getThreadPoolExecutor());
        return pools;
    }
}
