package com.phillippitts.ozconverter.service.coordinator;

import com.phillippitts.ozconverter.config.properties.EngineProperties;
import com.phillippitts.ozconverter.domain.BatchSummary;
import com.phillippitts.ozconverter.domain.FailureCategory;
import com.phillippitts.ozconverter.domain.JobDescriptor;
import com.phillippitts.ozconverter.domain.JobRequest;
import com.phillippitts.ozconverter.domain.JobState;
import com.phillippitts.ozconverter.domain.JobStatus;
import com.phillippitts.ozconverter.domain.SettingsSnapshot;
import com.phillippitts.ozconverter.service.events.BatchCompletedEvent;
import com.phillippitts.ozconverter.service.events.ErrorLine;
import com.phillippitts.ozconverter.service.events.JobCompleted;
import com.phillippitts.ozconverter.service.events.JobEvent;
import com.phillippitts.ozconverter.service.events.JobStarted;
import com.phillippitts.ozconverter.service.events.OutputLine;
import com.phillippitts.ozconverter.service.events.StageProgress;
import com.phillippitts.ozconverter.service.metrics.ConversionMetrics;
import com.phillippitts.ozconverter.service.queue.JobQueue;
import com.phillippitts.ozconverter.service.queue.ResultsChannel;
import com.phillippitts.ozconverter.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Submits jobs, drains worker events and decides when a batch is done.
 *
 * <p>Owns every {@link JobState}; workers never touch them. All state changes happen under this
 * object's monitor, from {@link #drainResults()}, {@link #submit(JobRequest)} or
 * {@link #cancelPending()}. Draining never blocks on the results channel.
 *
 * <p>A batch is complete when the queue holds no jobs and every tracked job is terminal. On
 * completion a summary is logged, batch metrics are recorded and a {@link BatchCompletedEvent}
 * is published, once per batch.
 */
@Service
public class BatchCoordinator {

    private static final Logger LOG = LogManager.getLogger(BatchCoordinator.class);

    private final JobQueue queue;
    private final ResultsChannel results;
    private final SettingsSnapshotFactory snapshotFactory;
    private final JobLogSink logSink;
    private final ApplicationEventPublisher publisher;
    private final ConversionMetrics metrics;
    private final TaskScheduler scheduler;
    private final Duration pollInterval;

    // Ids stay unique across batches run by the same coordinator
    private final AtomicLong nextJobId = new AtomicLong(1);

    private final Map<Long, JobState> states = new LinkedHashMap<>();
    private int submitted;
    private int succeeded;
    private int failed;
    private int cancelled;
    private boolean batchOpen;
    private ScheduledFuture<?> pollTask;

    public BatchCoordinator(JobQueue queue,
                            ResultsChannel results,
                            SettingsSnapshotFactory snapshotFactory,
                            JobLogSink logSink,
                            ApplicationEventPublisher publisher,
                            ConversionMetrics metrics,
                            @Qualifier("coordinatorScheduler") TaskScheduler scheduler,
                            EngineProperties engineProperties) {
        this.queue = queue;
        this.results = results;
        this.snapshotFactory = snapshotFactory;
        this.logSink = logSink;
        this.publisher = publisher;
        this.metrics = metrics;
        this.scheduler = scheduler;
        this.pollInterval = Duration.ofMillis(engineProperties.getPollIntervalMs());
    }

    /**
     * Assigns an id, snapshots the current settings and enqueues the job.
     *
     * @return the new job id
     */
    public synchronized long submit(JobRequest request) {
        long jobId = nextJobId.getAndIncrement();
        SettingsSnapshot snapshot = snapshotFactory.snapshot();
        JobDescriptor job = JobDescriptor.of(jobId, request, snapshot);
        states.put(jobId, new JobState(jobId, job.filename()));
        submitted++;
        batchOpen = true;
        queue.put(job);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Submitted job {} ({} via {}), settings {}", jobId, job.filename(), job.routineId(),
                    job.settingsJson());
        }
        return jobId;
    }

    public List<Long> submitAll(List<JobRequest> requests) {
        List<Long> ids = new ArrayList<>(requests.size());
        for (JobRequest request : requests) {
            ids.add(submit(request));
        }
        return ids;
    }

    /**
     * Applies every event currently in the results channel, then checks for batch completion.
     *
     * @return number of events applied
     */
    public synchronized int drainResults() {
        List<JobEvent> events = results.drain();
        for (JobEvent event : events) {
            apply(event);
        }
        checkCompletion();
        return events.size();
    }

    private void apply(JobEvent event) {
        JobState state = states.get(event.jobId());
        if (state == null) {
            LOG.warn("Ignoring {} for unknown job {}", event.type(), event.jobId());
            return;
        }
        if (LOG.isTraceEnabled()) {
            LOG.trace("Event {}", event.toJson());
        }
        if (event instanceof JobStarted) {
            state.markRunning();
        } else if (event instanceof StageProgress progress) {
            state.recordStage(progress.current(), progress.percentage());
        } else if (event instanceof OutputLine line) {
            logSink.output(state.getJobId(), state.getFilename(), line.line());
        } else if (event instanceof ErrorLine line) {
            logSink.error(state.getJobId(), state.getFilename(), line.line());
        } else if (event instanceof JobCompleted completed) {
            complete(state, completed);
        }
    }

    private void complete(JobState state, JobCompleted completed) {
        if (state.isTerminal()) {
            LOG.warn("Job {} completed twice; keeping {}", state.getJobId(), state.getStatus());
            return;
        }
        if (completed.success()) {
            state.complete(true);
            succeeded++;
            LOG.info("Job {} ({}) succeeded", state.getJobId(), state.getFilename());
        } else {
            state.recordFailureCategory(completed.failureCategory());
            state.complete(false);
            failed++;
            LOG.warn("Job {} ({}) failed: {}", state.getJobId(), state.getFilename(), state.getFailureCategory());
        }
    }

    /**
     * Drops every job no worker has taken yet. Running jobs are left to finish on their own.
     *
     * @return ids of the cancelled jobs
     */
    public synchronized List<Long> cancelPending() {
        List<Long> ids = new ArrayList<>();
        for (JobDescriptor job : queue.drainPending()) {
            JobState state = states.get(job.jobId());
            if (state == null || state.isTerminal()) {
                continue;
            }
            state.fail(FailureCategory.CANCELLED);
            failed++;
            cancelled++;
            ids.add(job.jobId());
            logSink.error(job.jobId(), job.filename(), "Cancelled before start");
        }
        if (!ids.isEmpty()) {
            LOG.info("Cancelled {} queued job(s)", ids.size());
        }
        checkCompletion();
        return ids;
    }

    public synchronized boolean isBatchComplete() {
        if (queue.hasPendingJobs()) {
            return false;
        }
        for (JobState state : states.values()) {
            if (!state.isTerminal()) {
                return false;
            }
        }
        return true;
    }

    private void checkCompletion() {
        if (!batchOpen || !isBatchComplete()) {
            return;
        }
        batchOpen = false;
        BatchSummary summary = summary();
        LOG.info("Batch complete: {} submitted, {} succeeded, {} failed, {} cancelled",
                summary.submitted(), summary.succeeded(), summary.failed(), summary.cancelled());
        metrics.recordBatch(summary);
        publisher.publishEvent(new BatchCompletedEvent(summary, Instant.now()));
    }

    /**
     * Drives the drain loop on the calling thread until the batch completes or the timeout passes.
     *
     * @return true if the batch completed
     */
    public boolean awaitCompletion(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            drainResults();
            if (isBatchComplete()) {
                return true;
            }
            if (System.nanoTime() >= deadline) {
                return false;
            }
            if (!TimeUtils.sleepQuietly(pollInterval.toMillis())) {
                return isBatchComplete();
            }
        }
    }

    /**
     * Starts draining on the coordinator scheduler at the configured tick.
     */
    public synchronized void startPolling() {
        if (pollTask != null && !pollTask.isDone()) {
            return;
        }
        pollTask = scheduler.scheduleAtFixedRate(this::pollOnce, pollInterval);
        LOG.debug("Polling results every {}ms", pollInterval.toMillis());
    }

    public synchronized void stopPolling() {
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
        }
    }

    private void pollOnce() {
        try {
            drainResults();
        } catch (RuntimeException e) {
            // Keep the schedule alive; a failing tick must not stop later ones
            LOG.error("Results drain failed", e);
        }
    }

    /**
     * Forgets the finished batch so the next one starts from zero counts.
     *
     * @throws IllegalStateException if the current batch is still running
     */
    public synchronized void resetBatch() {
        if (!isBatchComplete()) {
            throw new IllegalStateException("Batch still in progress");
        }
        states.clear();
        submitted = 0;
        succeeded = 0;
        failed = 0;
        cancelled = 0;
        batchOpen = false;
    }

    public synchronized BatchSummary summary() {
        return new BatchSummary(submitted, succeeded, failed, cancelled);
    }

    public synchronized Optional<JobStatus> statusOf(long jobId) {
        JobState state = states.get(jobId);
        return state == null ? Optional.empty() : Optional.of(state.getStatus());
    }

    public synchronized double percentageOf(long jobId) {
        JobState state = states.get(jobId);
        return state == null ? 0.0 : state.getPercentage();
    }

    public synchronized Optional<FailureCategory> failureCategoryOf(long jobId) {
        JobState state = states.get(jobId);
        return state == null ? Optional.empty() : Optional.ofNullable(state.getFailureCategory());
    }

    /**
     * @return one line per tracked job, in submission order
     */
    public synchronized List<String> describeJobs() {
        List<String> lines = new ArrayList<>(states.size());
        for (JobState state : states.values()) {
            lines.add(state.toString());
        }
        return lines;
    }
}
