package com.phillippitts.modelorchestrator.config;

import com.phillippitts.modelorchestrator.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    private final ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void modelExecutorIsSingleWorker() {
        ThreadPoolTaskExecutor executor = config.modelExecutor();
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(1);
            assertThat(executor.getMaxPoolSize()).isEqualTo(1);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("model-pool-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void modelExecutorRunsTasksOneAtATime() throws InterruptedException {
        ThreadPoolTaskExecutor executor = config.modelExecutor();
        int taskCount = 10;
        CountDownLatch latch = new CountDownLatch(taskCount);
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        try {
            for (int i = 0; i < taskCount; i++) {
                executor.execute(() -> {
                    maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                    try {
                        Thread.sleep(5);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        running.decrementAndGet();
                        latch.countDown();
                    }
                });
            }

            assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(maxRunning.get()).isEqualTo(1);
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void eventExecutorUsesConfiguredPrefix() throws InterruptedException {
        ThreadPoolTaskExecutor executor = config.eventExecutor();
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> threadName = new AtomicReference<>();
        try {
            executor.execute(() -> {
                threadName.set(Thread.currentThread().getName());
                latch.countDown();
            });

            assertThat(latch.await(1, TimeUnit.SECONDS)).isTrue();
            assertThat(threadName.get()).startsWith("event-pool-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void monitorSchedulerUsesConfiguredPrefix() {
        ThreadPoolTaskScheduler scheduler = config.monitorScheduler();
        try {
            assertThat(scheduler.getThreadNamePrefix()).isEqualTo("degradation-monitor-");
        } finally {
            scheduler.shutdown();
        }
    }

    @Test
    void decoratorCopiesSubmitterContextAndRestoresWorkerContext() {
        AtomicReference<String> seen = new AtomicReference<>();
        ThreadContext.put("taskId", "t-1");
        Runnable decorated = ThreadPoolConfig.mdcPropagating().decorate(() -> seen.set(ThreadContext.get("taskId")));

        ThreadContext.clearAll();
        ThreadContext.put("worker", "w");
        decorated.run();

        assertThat(seen.get()).isEqualTo("t-1");
        assertThat(ThreadContext.get("taskId")).isNull();
        assertThat(ThreadContext.get("worker")).isEqualTo("w");
    }
}
