package com.phillippitts.ozconverter.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Thread naming and shutdown behaviour for the worker pool and the coordinator's poll scheduler.
 * Worker pool size comes from {@code converter.engine.worker-count}.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private WorkerPoolProperties worker = new WorkerPoolProperties();
    private CoordinatorProperties coordinator = new CoordinatorProperties();

    public WorkerPoolProperties getWorker() {
        return worker;
    }

    public void setWorker(WorkerPoolProperties worker) {
        this.worker = worker;
    }

    public CoordinatorProperties getCoordinator() {
        return coordinator;
    }

    public void setCoordinator(CoordinatorProperties coordinator) {
        this.coordinator = coordinator;
    }

    public static class WorkerPoolProperties {
        private String threadNamePrefix = "convert-worker-";
        private int awaitTerminationSeconds = 30;

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getAwaitTerminationSeconds() {
            return awaitTerminationSeconds;
        }

        public void setAwaitTerminationSeconds(int awaitTerminationSeconds) {
            this.awaitTerminationSeconds = awaitTerminationSeconds;
        }
    }

    public static class CoordinatorProperties {
        private String threadNamePrefix = "batch-poll-";

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
