package com.phillippitts.modelorchestrator.config;

import io.micrometer.core.instrument.Gauge;
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
 * Exposes the model executor through Micrometer:
 * <ul>
 *   <li>model.pool.active - 1 while a load, unload or step is running</li>
 *   <li>model.pool.queued - model work waiting for the worker</li>
 *   <li>model.pool.completed - cumulative count of finished model work</li>
 * </ul>
 *
 * <p>Available at {@code GET /actuator/metrics/model.pool.queued} and as {@code model_pool_queued}
 * in Prometheus. A health summary is logged every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> modelExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("modelExecutor") ObjectProvider<ThreadPoolTaskExecutor> modelExecutorProvider) {
        this.modelExecutorProvider = modelExecutorProvider;
    }

    @Bean
    public MeterBinder modelExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = this.modelExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("model.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Model work currently running")
                    .register(registry);

            Gauge.builder("model.pool.queued", executor, e -> e.getQueue().size())
                    .description("Model work waiting in the queue")
                    .register(registry);

            Gauge.builder("model.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed model work")
                    .register(registry);

            LOG.info("Model thread pool metrics registered: model.pool.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = this.modelExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Model Thread Pool Health: active={}, queued={}, completed={}",
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount()
        );
    }
}
