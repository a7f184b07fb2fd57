package com.phillippitts.meetingscribe.config;

import com.phillippitts.meetingscribe.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadPoolConfigTest {

    private final ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());

    @AfterEach
    void clearContext() {
        ThreadContext.clearAll();
    }

    @Test
    void transcriptionExecutorUsesDefaults() {
        ThreadPoolTaskExecutor executor = config.transcriptionExecutor();
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(4);
            assertThat(executor.getMaxPoolSize()).isEqualTo(8);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("stt-pool-");
            assertThat(executor.getThreadPoolExecutor().getRejectedExecutionHandler())
                    .isInstanceOf(ThreadPoolExecutor.AbortPolicy.class);
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void shouldHandleConcurrentTasks() throws InterruptedException {
        ThreadPoolTaskExecutor executor = config.transcriptionExecutor();
        int taskCount = 10;
        CountDownLatch latch = new CountDownLatch(taskCount);
        AtomicInteger completedTasks = new AtomicInteger(0);

        for (int i = 0; i < taskCount; i++) {
            executor.execute(() -> {
                try {
                    Thread.sleep(10);
                    completedTasks.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    latch.countDown();
                }
            });
        }

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(completedTasks.get()).isEqualTo(taskCount);
        executor.shutdown();
    }

    @Test
    void streamExecutorHandsOffDirectlyAndRejectsWhenSaturated() throws InterruptedException {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getStream().setCorePoolSize(1);
        properties.getStream().setMaxPoolSize(1);
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(properties).streamExecutor();
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        try {
            executor.execute(() -> {
                started.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();

            assertThatThrownBy(() -> executor.execute(() -> { }))
                    .isInstanceOf(RejectedExecutionException.class);
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }

    @Test
    void shouldUseStreamThreadNamePrefix() throws InterruptedException {
        ThreadPoolTaskExecutor executor = config.streamExecutor();
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> threadName = new AtomicReference<>();

        executor.execute(() -> {
            threadName.set(Thread.currentThread().getName());
            latch.countDown();
        });

        assertThat(latch.await(1, TimeUnit.SECONDS)).isTrue();
        assertThat(threadName.get()).startsWith("stream-pool-");
        executor.shutdown();
    }

    @Test
    void propagatesThreadContextToWorkers() throws InterruptedException {
        ThreadPoolTaskExecutor executor = config.transcriptionExecutor();
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> seen = new AtomicReference<>();

        ThreadContext.put("sessionId", "abc123");
        executor.execute(() -> {
            seen.set(ThreadContext.get("sessionId"));
            latch.countDown();
        });

        assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("abc123");
        executor.shutdown();
    }
}
