package com.phillippitts.ozconverter.service.metrics;

import com.phillippitts.ozconverter.domain.BatchSummary;
import com.phillippitts.ozconverter.domain.FailureCategory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ConversionMetricsTest {

    private MeterRegistry registry;
    private ConversionMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ConversionMetrics(registry);
    }

    @Test
    void shouldRecordDurationPerRoutineAndOutcome() {
        long durationNanos = TimeUnit.MILLISECONDS.toNanos(1500);

        metrics.recordDuration("chdman-createcd", true, durationNanos);
        metrics.recordDuration("chdman-createcd", false, durationNanos);

        Timer success = registry.find("ozconverter.job.duration")
                .tag("routine", "chdman-createcd")
                .tag("outcome", "success")
                .timer();

        assertThat(success).isNotNull();
        assertThat(success.count()).isEqualTo(1);
        assertThat(success.totalTime(TimeUnit.NANOSECONDS)).isEqualTo(durationNanos);
        assertThat(registry.find("ozconverter.job.duration").timers()).hasSize(2);
    }

    @Test
    void shouldCountSuccessesPerRoutine() {
        metrics.incrementSuccess("maxcso-compress");
        metrics.incrementSuccess("maxcso-compress");
        metrics.incrementSuccess("dolphin-convert");

        Counter counter = registry.find("ozconverter.job.success").tag("routine", "maxcso-compress").counter();

        assertThat(counter).isNotNull();
        assertThat(counter.count()).isEqualTo(2.0);
    }

    @Test
    void shouldTagFailuresWithCategory() {
        metrics.incrementFailure("chdman-verify", FailureCategory.CONVERSION);
        metrics.incrementFailure("chdman-verify", null);

        assertThat(registry.find("ozconverter.job.failure").tag("category", "CONVERSION").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("ozconverter.job.failure").tag("category", "UNHANDLED").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldRecordBatchOutcomeAndCancellations() {
        metrics.recordBatch(new BatchSummary(3, 3, 0, 0));
        metrics.recordBatch(new BatchSummary(4, 1, 3, 2));

        assertThat(registry.find("ozconverter.batch.completed").tag("outcome", "clean").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("ozconverter.batch.completed").tag("outcome", "with_failures").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("ozconverter.job.cancelled").counter().count()).isEqualTo(2.0);
    }
}
