package com.phillippitts.ozconverter.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes the worker pool through Micrometer:
 * {@code ozconverter.workers.size}, {@code ozconverter.workers.active}, {@code ozconverter.workers.max.size}.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> workerExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("workerExecutor") ObjectProvider<ThreadPoolTaskExecutor> workerExecutorProvider) {
        this.workerExecutorProvider = workerExecutorProvider;
    }

    @Bean
    public MeterBinder workerExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = this.workerExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("ozconverter.workers.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of worker threads")
                    .register(registry);

            // Idle workers block in the queue, so this counts live loops, not busy ones
            Gauge.builder("ozconverter.workers.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of worker loops running")
                    .register(registry);

            Gauge.builder("ozconverter.workers.max.size", executor, ThreadPoolExecutor::getMaximumPoolSize)
                    .description("Configured worker count")
                    .register(registry);

            LOG.debug("Worker pool metrics registered");
        };
    }
}
