package com.phillippitts.ozconverter.service.pipeline;

import com.phillippitts.ozconverter.domain.JobSettings;
import com.phillippitts.ozconverter.domain.StageResult;
import com.phillippitts.ozconverter.service.events.ErrorLine;
import com.phillippitts.ozconverter.service.events.FileProgress;
import com.phillippitts.ozconverter.service.events.JobEventSink;
import com.phillippitts.ozconverter.service.events.StageProgress;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Mutable per-run state of one job on its worker: stage counter, outcome and the
 * resources the cleanup step must release.
 *
 * <p>Confined to the worker thread running the job.
 */
final class JobExecutionContext {

    private final long jobId;
    private final int stageCount;
    private final JobEventSink sink;

    private int stagesDone;
    private StageResult outcome = StageResult.ok();
    private JobSettings settings;
    private Path workspace;

    JobExecutionContext(long jobId, int stageCount, JobEventSink sink) {
        if (stageCount <= 0) {
            throw new IllegalArgumentException("stageCount must be positive");
        }
        this.jobId = jobId;
        this.stageCount = stageCount;
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Emits the next stage event and the matching file progress. Ignored once all stages are reported.
     */
    void reportStage(String description) {
        if (stagesDone >= stageCount) {
            return;
        }
        stagesDone++;
        StageProgress progress = new StageProgress(jobId, description, stagesDone, stageCount);
        sink.emit(progress);
        sink.emit(new FileProgress(jobId, progress.percentage()));
    }

    /**
     * Reports every stage not reached yet, so progress always ends at 100%.
     */
    void completeRemainingStages(String description) {
        while (stagesDone < stageCount) {
            reportStage(description);
        }
    }

    /**
     * Records the first failure; later ones are reported but do not replace it.
     */
    void fail(StageResult failure) {
        sink.emit(new ErrorLine(jobId, failure.category() + ": " + failure.message()));
        if (outcome.success()) {
            outcome = failure;
        }
    }

    void error(String line) {
        sink.emit(new ErrorLine(jobId, line));
    }

    boolean succeeded() {
        return outcome.success();
    }

    StageResult outcome() {
        return outcome;
    }

    JobEventSink sink() {
        return sink;
    }

    int stagesDone() {
        return stagesDone;
    }

    JobSettings settings() {
        return settings;
    }

    void settings(JobSettings settings) {
        this.settings = settings;
    }

    Path workspace() {
        return workspace;
    }

    void workspace(Path workspace) {
        this.workspace = workspace;
    }
}
