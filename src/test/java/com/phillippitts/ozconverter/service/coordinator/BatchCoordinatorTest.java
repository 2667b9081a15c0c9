package com.phillippitts.ozconverter.service.coordinator;

import com.phillippitts.ozconverter.config.properties.ConverterProperties;
import com.phillippitts.ozconverter.config.properties.EngineProperties;
import com.phillippitts.ozconverter.config.properties.ToolPathsConfig;
import com.phillippitts.ozconverter.domain.BatchSummary;
import com.phillippitts.ozconverter.domain.FailureCategory;
import com.phillippitts.ozconverter.domain.JobStatus;
import com.phillippitts.ozconverter.service.events.ErrorLine;
import com.phillippitts.ozconverter.service.events.FileProgress;
import com.phillippitts.ozconverter.service.events.JobCompleted;
import com.phillippitts.ozconverter.service.events.JobStarted;
import com.phillippitts.ozconverter.service.events.OutputLine;
import com.phillippitts.ozconverter.service.events.StageProgress;
import com.phillippitts.ozconverter.service.metrics.ConversionMetrics;
import com.phillippitts.ozconverter.service.queue.JobQueue;
import com.phillippitts.ozconverter.service.queue.ResultsChannel;
import com.phillippitts.ozconverter.testutil.EventCapturingPublisher;
import com.phillippitts.ozconverter.testutil.Jobs;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class BatchCoordinatorTest {

    @TempDir
    Path tempDir;

    private final JobQueue queue = new JobQueue();
    private final ResultsChannel results = new ResultsChannel();
    private final RecordingJobLogSink logSink = new RecordingJobLogSink();
    private final EventCapturingPublisher publisher = new EventCapturingPublisher();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private ThreadPoolTaskScheduler scheduler;
    private BatchCoordinator coordinator;

    @BeforeEach
    void setUp() {
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.initialize();
        coordinator = new BatchCoordinator(queue, results,
                new SettingsSnapshotFactory(new ConverterProperties(), new ToolPathsConfig()),
                logSink, publisher, new ConversionMetrics(registry), scheduler,
                new EngineProperties(2, 20L, 1, 0L, 999));
    }

    @AfterEach
    void tearDown() {
        coordinator.stopPolling();
        scheduler.shutdown();
    }

    private long submit(String name) {
        return coordinator.submit(Jobs.request(tempDir.resolve(name), "chdman-createcd", tempDir, "chd"));
    }

    /** Plays the worker side for one job. */
    private void finish(long jobId, boolean success) {
        results.emit(new JobStarted(jobId, "x", 3));
        for (int stage = 1; stage <= 3; stage++) {
            StageProgress progress = new StageProgress(jobId, "stage", stage, 3);
            results.emit(progress);
            results.emit(new FileProgress(jobId, progress.percentage()));
        }
        results.emit(success ? JobCompleted.succeeded(jobId) : JobCompleted.failed(jobId, FailureCategory.CONVERSION));
    }

    @Test
    void submitSnapshotsSettingsAndQueuesJob() {
        long first = submit("a.cue");
        long second = submit("b.cue");

        assertThat(second).isEqualTo(first + 1);
        assertThat(queue.pendingJobs()).isEqualTo(2);
        assertThat(coordinator.statusOf(first)).contains(JobStatus.QUEUED);
        assertThat(coordinator.isBatchComplete()).isFalse();
        assertThat(coordinator.summary()).isEqualTo(new BatchSummary(2, 0, 0, 0));
    }

    @Test
    void emptyBatchPublishesNothing() {
        assertThat(coordinator.drainResults()).isZero();
        assertThat(coordinator.isBatchComplete()).isTrue();
        assertThat(publisher.batchEvents()).isEmpty();
    }

    @Test
    void singleJobBatchCompletesOnce() throws InterruptedException {
        long id = submit("a.iso");
        queue.take();
        results.emit(new OutputLine(id, ">> working"));
        results.emit(new ErrorLine(id, "WARNING: slow"));
        finish(id, true);

        coordinator.drainResults();
        coordinator.drainResults();

        assertThat(coordinator.statusOf(id)).contains(JobStatus.COMPLETED_SUCCESS);
        assertThat(coordinator.percentageOf(id)).isEqualTo(100.0);
        assertThat(logSink.output).containsExactly(id + " >> working");
        assertThat(logSink.errors).containsExactly(id + " WARNING: slow");
        assertThat(publisher.batchEvents()).singleElement()
                .satisfies(e -> assertThat(e.summary()).isEqualTo(new BatchSummary(1, 1, 0, 0)));
        assertThat(registry.get("ozconverter.batch.completed").tag("outcome", "clean").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void batchWaitsForEveryJob() throws InterruptedException {
        long a = submit("a.iso");
        long b = submit("b.iso");
        long c = submit("c.iso");
        queue.take();
        queue.take();
        queue.take();

        finish(a, true);
        finish(b, false);
        coordinator.drainResults();
        assertThat(coordinator.isBatchComplete()).isFalse();
        assertThat(publisher.batchEvents()).isEmpty();

        finish(c, true);
        coordinator.drainResults();

        assertThat(coordinator.failureCategoryOf(b)).contains(FailureCategory.CONVERSION);
        assertThat(publisher.batchEvents()).singleElement()
                .satisfies(e -> assertThat(e.summary()).isEqualTo(new BatchSummary(3, 2, 1, 0)));
        assertThat(coordinator.describeJobs()).hasSize(3).first().asString().contains("COMPLETED_SUCCESS");
    }

    @Test
    void jobStillQueuedKeepsBatchOpen() {
        long id = submit("a.iso");
        finish(id, true);
        submit("b.iso");

        coordinator.drainResults();

        assertThat(coordinator.isBatchComplete()).isFalse();
    }

    @Test
    void cancelPendingFailsQueuedJobsOnly() throws InterruptedException {
        long running = submit("a.iso");
        long queued1 = submit("b.iso");
        long queued2 = submit("c.iso");
        queue.take();
        results.emit(new JobStarted(running, "a.iso", 3));
        coordinator.drainResults();

        List<Long> cancelled = coordinator.cancelPending();

        assertThat(cancelled).containsExactly(queued1, queued2);
        assertThat(coordinator.failureCategoryOf(queued1)).contains(FailureCategory.CANCELLED);
        assertThat(coordinator.statusOf(running)).contains(JobStatus.RUNNING);
        assertThat(logSink.errors).contains(queued1 + " Cancelled before start");
        assertThat(publisher.batchEvents()).isEmpty();

        finish(running, true);
        coordinator.drainResults();

        assertThat(publisher.batchEvents()).singleElement()
                .satisfies(e -> assertThat(e.summary()).isEqualTo(new BatchSummary(3, 1, 2, 2)));
        assertThat(registry.get("ozconverter.job.cancelled").counter().count()).isEqualTo(2.0);
    }

    @Test
    void unknownAndDuplicateEventsAreIgnored() throws InterruptedException {
        long id = submit("a.iso");
        queue.take();
        results.emit(JobCompleted.succeeded(999));
        results.emit(JobCompleted.failed(id, FailureCategory.CONVERSION));
        results.emit(JobCompleted.succeeded(id));

        coordinator.drainResults();

        assertThat(coordinator.statusOf(id)).contains(JobStatus.COMPLETED_FAILURE);
        assertThat(coordinator.statusOf(999)).isEqualTo(Optional.empty());
        assertThat(coordinator.summary()).isEqualTo(new BatchSummary(1, 0, 1, 0));
        assertThat(publisher.batchEvents()).hasSize(1);
    }

    @Test
    void resetBatchRefusesWhileRunningAndKeepsIdsUnique() throws InterruptedException {
        long first = submit("a.iso");
        assertThatThrownBy(coordinator::resetBatch)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Batch still in progress");

        queue.take();
        finish(first, true);
        coordinator.drainResults();
        coordinator.resetBatch();

        assertThat(coordinator.summary()).isEqualTo(new BatchSummary(0, 0, 0, 0));
        assertThat(coordinator.statusOf(first)).isEmpty();
        assertThat(submit("b.iso")).isGreaterThan(first);
    }

    @Test
    void pollingDrainsOnSchedulerThread() throws InterruptedException {
        long id = submit("a.iso");
        queue.take();
        coordinator.startPolling();
        coordinator.startPolling();

        finish(id, true);

        await().atMost(Duration.ofSeconds(5)).until(() -> publisher.batchEvents().size() == 1);
        assertThat(results.isEmpty()).isTrue();
    }

    @Test
    void awaitCompletionTimesOut() {
        submit("a.iso");

        assertThat(coordinator.awaitCompletion(Duration.ofMillis(60))).isFalse();
    }
}
