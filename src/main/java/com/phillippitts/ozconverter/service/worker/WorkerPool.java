package com.phillippitts.ozconverter.service.worker;

import com.phillippitts.ozconverter.config.properties.EngineProperties;
import com.phillippitts.ozconverter.service.metrics.ConversionMetrics;
import com.phillippitts.ozconverter.service.pipeline.JobPipeline;
import com.phillippitts.ozconverter.service.queue.JobQueue;
import com.phillippitts.ozconverter.service.queue.ResultsChannel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of {@link JobWorker} loops running on the {@code workerExecutor} pool.
 *
 * <p>Started with the application context. Stopping enqueues one sentinel per live worker;
 * queued jobs ahead of the sentinels still run, and in-flight jobs are never interrupted.
 */
@Service
public class WorkerPool implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(WorkerPool.class);

    private final JobQueue queue;
    private final JobPipeline pipeline;
    private final ResultsChannel results;
    private final ConversionMetrics metrics;
    private final TaskExecutor executor;
    private final int workerCount;

    private final AtomicInteger liveWorkers = new AtomicInteger();
    private volatile boolean running;

    public WorkerPool(JobQueue queue,
                      JobPipeline pipeline,
                      ResultsChannel results,
                      ConversionMetrics metrics,
                      @Qualifier("workerExecutor") TaskExecutor executor,
                      EngineProperties engineProperties) {
        this.queue = queue;
        this.pipeline = pipeline;
        this.results = results;
        this.metrics = metrics;
        this.executor = executor;
        this.workerCount = engineProperties.getWorkerCount();
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        for (int i = 0; i < workerCount; i++) {
            liveWorkers.incrementAndGet();
            executor.execute(new JobWorker(i, queue, pipeline, results, metrics, liveWorkers::decrementAndGet));
        }
        running = true;
        LOG.info("Worker pool started with {} worker(s)", workerCount);
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        int live = liveWorkers.get();
        for (int i = 0; i < live; i++) {
            queue.putSentinel();
        }
        running = false;
        LOG.info("Worker pool stopping; sent {} sentinel(s)", live);
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public int getLiveWorkers() {
        return liveWorkers.get();
    }
}
