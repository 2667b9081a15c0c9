package com.phillippitts.ozconverter.service.worker;

import com.phillippitts.ozconverter.config.properties.EngineProperties;
import com.phillippitts.ozconverter.domain.FailureCategory;
import com.phillippitts.ozconverter.domain.JobDescriptor;
import com.phillippitts.ozconverter.domain.StageResult;
import com.phillippitts.ozconverter.service.events.ErrorLine;
import com.phillippitts.ozconverter.service.events.JobCompleted;
import com.phillippitts.ozconverter.service.events.JobEventSink;
import com.phillippitts.ozconverter.service.events.JobStarted;
import com.phillippitts.ozconverter.service.metrics.ConversionMetrics;
import com.phillippitts.ozconverter.service.pipeline.JobPipeline;
import com.phillippitts.ozconverter.service.queue.JobQueue;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.Optional;

/**
 * One long-lived worker loop: take a job, run it, report it, repeat until a sentinel arrives.
 *
 * <p>Every throwable is caught per job so a malformed job never ends the loop; only fatal JVM
 * errors (see {@link JobPipeline#isFatal(Throwable)}) are rethrown after the job is reported.
 * Each dequeued job produces {@link JobStarted} first and {@link JobCompleted} last.
 */
final class JobWorker implements Runnable {

    private static final Logger LOG = LogManager.getLogger(JobWorker.class);

    static final String JOB_ID_KEY = "jobId";

    private final int index;
    private final JobQueue queue;
    private final JobPipeline pipeline;
    private final JobEventSink sink;
    private final ConversionMetrics metrics;
    private final Runnable onExit;

    JobWorker(int index, JobQueue queue, JobPipeline pipeline, JobEventSink sink, ConversionMetrics metrics,
              Runnable onExit) {
        this.index = index;
        this.queue = queue;
        this.pipeline = pipeline;
        this.sink = sink;
        this.metrics = metrics;
        this.onExit = onExit;
    }

    @Override
    public void run() {
        LOG.debug("Worker {} started", index);
        try {
            while (true) {
                Optional<JobDescriptor> next;
                try {
                    next = queue.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOG.warn("Worker {} interrupted while waiting for work", index);
                    return;
                }
                if (next.isEmpty()) {
                    LOG.debug("Worker {} received shutdown sentinel", index);
                    return;
                }
                process(next.get());
            }
        } finally {
            onExit.run();
        }
    }

    void process(JobDescriptor job) {
        ThreadContext.put(JOB_ID_KEY, String.valueOf(job.jobId()));
        long start = System.nanoTime();
        boolean success = false;
        FailureCategory category = FailureCategory.UNHANDLED;
        Error fatal = null;
        try {
            LOG.info("Worker {} processing {} with {}", index, job.filename(), job.routineId());
            sink.emit(new JobStarted(job.jobId(), job.filename(), EngineProperties.STAGE_COUNT));
            StageResult result = pipeline.run(job, sink);
            success = result.success();
            category = result.category();
        } catch (Throwable e) {
            LOG.error("Worker {} failed on job {}", index, job.jobId(), e);
            sink.emit(new ErrorLine(job.jobId(), FailureCategory.UNHANDLED + ": " + e));
            if (JobPipeline.isFatal(e)) {
                fatal = (Error) e;
            }
        } finally {
            sink.emit(success ? JobCompleted.succeeded(job.jobId()) : JobCompleted.failed(job.jobId(), category));
            recordMetrics(job, success, category, System.nanoTime() - start);
            ThreadContext.remove(JOB_ID_KEY);
        }
        if (fatal != null) {
            throw fatal;
        }
    }

    private void recordMetrics(JobDescriptor job, boolean success, FailureCategory category, long nanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordDuration(job.routineId(), success, nanos);
        if (success) {
            metrics.incrementSuccess(job.routineId());
        } else {
            metrics.incrementFailure(job.routineId(), category);
        }
    }
}
