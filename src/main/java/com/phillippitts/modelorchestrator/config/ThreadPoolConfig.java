package com.phillippitts.modelorchestrator.config;

import com.phillippitts.modelorchestrator.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the orchestrator's thread pools.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor for model loads, unloads and pipeline steps.
     *
     * <p>Must stay a single worker ({@code threadpool.model.core-pool-size=1},
     * {@code max-pool-size=1}): the sequential orchestrator relies on it to keep one model active.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. Running rejected work on the
     * caller would put a second thread on the model, so a full queue fails the submission instead.
     *
     * @return Configured executor for model work
     */
    @Bean(name = "modelExecutor")
    public ThreadPoolTaskExecutor modelExecutor() {
        ThreadPoolProperties.PoolProperties props = threadPoolProperties.getModel();
        ThreadPoolTaskExecutor executor = newExecutor(props);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        return executor;
    }

    /**
     * Executor for task completion work (scoring feedback, metrics, release).
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}
     * When pool and queue are full, the submitting thread executes the task, providing
     * backpressure instead of dropping completions.
     *
     * @return Configured executor for completion offload
     */
    @Bean(name = "eventExecutor")
    public ThreadPoolTaskExecutor eventExecutor() {
        ThreadPoolProperties.PoolProperties props = threadPoolProperties.getEvent();
        ThreadPoolTaskExecutor executor = newExecutor(props);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    /**
     * Scheduler driving the degradation monitor tick.
     */
    @Bean(name = "monitorScheduler")
    public ThreadPoolTaskScheduler monitorScheduler() {
        ThreadPoolProperties.MonitorProperties props = threadPoolProperties.getMonitor();
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    private static ThreadPoolTaskExecutor newExecutor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagating());
        return executor;
    }

    /**
     * Copies Log4j2 ThreadContext (MDC) from the submitting thread to the worker thread so
     * request and task ids survive the hop, then restores the worker's own context.
     */
    static TaskDecorator mdcPropagating() {
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
