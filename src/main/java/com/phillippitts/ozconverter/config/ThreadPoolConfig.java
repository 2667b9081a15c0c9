package com.phillippitts.ozconverter.config;

import com.phillippitts.ozconverter.config.properties.EngineProperties;
import com.phillippitts.ozconverter.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for the job engine.
 *
 * <ul>
 *   <li>{@code workerExecutor}: one thread per worker loop, core = max = {@code converter.engine.worker-count}</li>
 *   <li>{@code coordinatorScheduler}: single thread driving the results drain tick</li>
 * </ul>
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;
    private final EngineProperties engineProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties, EngineProperties engineProperties) {
        this.threadPoolProperties = threadPoolProperties;
        this.engineProperties = engineProperties;
    }

    /**
     * Executor hosting the worker loops. Each loop occupies its thread for the life of the pool,
     * so the pool is sized exactly to the worker count.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}.
     * On shutdown the executor waits for in-flight jobs instead of interrupting their tools.
     *
     * @return executor for {@code WorkerPool}
     */
    @Bean(name = "workerExecutor")
    public ThreadPoolTaskExecutor workerExecutor() {
        ThreadPoolProperties.WorkerPoolProperties workerProps = threadPoolProperties.getWorker();
        int workers = engineProperties.getWorkerCount();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setThreadNamePrefix(workerProps.getThreadNamePrefix());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(workerProps.getAwaitTerminationSeconds());
        executor.setTaskDecorator(threadContextDecorator());
        executor.initialize();
        return executor;
    }

    @Bean(name = "coordinatorScheduler")
    public ThreadPoolTaskScheduler coordinatorScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix(threadPoolProperties.getCoordinator().getThreadNamePrefix());
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Copies the submitting thread's Log4j2 ThreadContext into the task and restores the
     * pool thread's own context afterwards.
     */
    static TaskDecorator threadContextDecorator() {
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
