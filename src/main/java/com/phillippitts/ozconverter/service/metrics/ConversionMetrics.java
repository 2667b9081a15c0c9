package com.phillippitts.ozconverter.service.metrics;

import com.phillippitts.ozconverter.domain.BatchSummary;
import com.phillippitts.ozconverter.domain.FailureCategory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for conversion jobs and batches.
 *
 * <p>Meters:
 * <ul>
 *   <li>{@code ozconverter.job.duration}: wall time per job, tagged by routine and outcome</li>
 *   <li>{@code ozconverter.job.success}: successful jobs per routine</li>
 *   <li>{@code ozconverter.job.failure}: failed jobs per routine and failure category</li>
 *   <li>{@code ozconverter.batch.completed}: finished batches</li>
 * </ul>
 * Safe to call from any worker thread.
 */
@Component
public class ConversionMetrics {

    static final String METRIC_PREFIX = "ozconverter";

    private final MeterRegistry registry;

    public ConversionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDuration(String routineId, boolean success, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".job.duration")
                .description("Time taken to run one conversion job")
                .tag("routine", routineId)
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String routineId) {
        Counter.builder(METRIC_PREFIX + ".job.success")
                .description("Number of successful conversion jobs")
                .tag("routine", routineId)
                .register(registry)
                .increment();
    }

    public void incrementFailure(String routineId, FailureCategory category) {
        Counter.builder(METRIC_PREFIX + ".job.failure")
                .description("Number of failed conversion jobs")
                .tag("routine", routineId)
                .tag("category", category == null ? FailureCategory.UNHANDLED.name() : category.name())
                .register(registry)
                .increment();
    }

    /**
     * Cancelled jobs never reach a worker, so they are counted here rather than per job.
     */
    public void recordBatch(BatchSummary summary) {
        Counter.builder(METRIC_PREFIX + ".batch.completed")
                .description("Number of finished batches")
                .tag("outcome", summary.failed() == 0 ? "clean" : "with_failures")
                .register(registry)
                .increment();
        if (summary.cancelled() > 0) {
            Counter.builder(METRIC_PREFIX + ".job.cancelled")
                    .description("Number of jobs cancelled before they started")
                    .register(registry)
                    .increment(summary.cancelled());
        }
    }
}
