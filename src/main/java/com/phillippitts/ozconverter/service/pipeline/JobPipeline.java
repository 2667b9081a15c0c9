package com.phillippitts.ozconverter.service.pipeline;

import com.phillippitts.ozconverter.config.properties.EngineProperties;
import com.phillippitts.ozconverter.domain.FailureCategory;
import com.phillippitts.ozconverter.domain.JobDescriptor;
import com.phillippitts.ozconverter.domain.JobSettings;
import com.phillippitts.ozconverter.domain.StageResult;
import com.phillippitts.ozconverter.exception.SettingsSnapshotException;
import com.phillippitts.ozconverter.exception.StagingException;
import com.phillippitts.ozconverter.exception.UnknownRoutineException;
import com.phillippitts.ozconverter.exception.WorkspaceException;
import com.phillippitts.ozconverter.service.events.JobEventSink;
import com.phillippitts.ozconverter.service.finalize.OutputPlacer;
import com.phillippitts.ozconverter.service.finalize.SourceDeletionService;
import com.phillippitts.ozconverter.service.routine.ConversionRoutine;
import com.phillippitts.ozconverter.service.routine.ConversionRoutineRegistry;
import com.phillippitts.ozconverter.service.routine.RoutineContext;
import com.phillippitts.ozconverter.service.staging.StagedInput;
import com.phillippitts.ozconverter.service.staging.StagingService;
import com.phillippitts.ozconverter.service.workspace.TempResourceManager;
import com.phillippitts.ozconverter.util.FileNames;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Runs one job from start to finish on the calling worker thread.
 *
 * <p>States: preparing, staging, converting, finalizing, cleanup. Expected failures are
 * {@link StageResult} values tagged with the stage's {@link FailureCategory}; anything thrown is
 * reported as {@link FailureCategory#UNHANDLED}. Whatever happens:
 * <ul>
 *   <li>the workspace is released</li>
 *   <li>the source is deleted only after success, and only when the job's settings ask for it</li>
 *   <li>exactly {@link EngineProperties#STAGE_COUNT} stage events are emitted</li>
 * </ul>
 */
@Service
public class JobPipeline {

    private static final Logger LOG = LogManager.getLogger(JobPipeline.class);

    private final ConversionRoutineRegistry routines;
    private final TempResourceManager tempResources;
    private final StagingService stagingService;
    private final OutputPlacer outputPlacer;
    private final SourceDeletionService sourceDeletion;

    public JobPipeline(ConversionRoutineRegistry routines,
                       TempResourceManager tempResources,
                       StagingService stagingService,
                       OutputPlacer outputPlacer,
                       SourceDeletionService sourceDeletion) {
        this.routines = Objects.requireNonNull(routines, "routines");
        this.tempResources = Objects.requireNonNull(tempResources, "tempResources");
        this.stagingService = Objects.requireNonNull(stagingService, "stagingService");
        this.outputPlacer = Objects.requireNonNull(outputPlacer, "outputPlacer");
        this.sourceDeletion = Objects.requireNonNull(sourceDeletion, "sourceDeletion");
    }

    /**
     * @return success, or the failure that ended the job
     */
    public StageResult run(JobDescriptor job, JobEventSink sink) {
        JobExecutionContext ctx = new JobExecutionContext(job.jobId(), EngineProperties.STAGE_COUNT, sink);
        Error fatal = null;
        try {
            StageResult result = execute(job, ctx);
            if (result.failed()) {
                LOG.warn("Job {} failed in {}: {}", job.jobId(), result.category(), result.message());
                ctx.fail(result);
            }
        } catch (Throwable e) {
            LOG.error("Unexpected fault in job {}", job.jobId(), e);
            ctx.fail(StageResult.failure(FailureCategory.UNHANDLED, e.toString()));
            if (isFatal(e)) {
                fatal = (Error) e;
            }
        } finally {
            releaseWorkspace(ctx);
        }

        if (ctx.succeeded() && ctx.settings() != null && ctx.settings().deleteSourceOnSuccess()) {
            RoutineContext routineContext = new RoutineContext(job.jobId(), ctx.settings(), job.primaryOutputExt(), sink);
            sourceDeletion.deleteSource(job, routineContext);
        }
        ctx.completeRemainingStages(ctx.succeeded() ? "Completed" : "Failed");
        if (fatal != null) {
            throw fatal;
        }
        return ctx.outcome();
    }

    /**
     * JVM failures a job cannot recover from. A stack overflow only unwinds the faulting job's
     * stack, so it is treated like any other job failure.
     */
    public static boolean isFatal(Throwable t) {
        return t instanceof VirtualMachineError && !(t instanceof StackOverflowError);
    }

    private StageResult execute(JobDescriptor job, JobExecutionContext ctx) {
        // Preparing
        JobSettings settings;
        try {
            settings = JobSettings.decode(job.settings());
        } catch (SettingsSnapshotException e) {
            return StageResult.failure(FailureCategory.SETUP, "Invalid settings: " + e.getMessage());
        }
        ctx.settings(settings);

        ConversionRoutine routine;
        try {
            routine = routines.require(job.routineId());
        } catch (UnknownRoutineException e) {
            return StageResult.failure(FailureCategory.SETUP, e.getMessage());
        }

        try {
            Files.createDirectories(job.outputDir());
        } catch (IOException e) {
            return StageResult.failure(FailureCategory.SETUP,
                    "Cannot create output directory " + job.outputDir() + ": " + e.getMessage());
        }

        try {
            ctx.workspace(tempResources.allocate(job, settings));
        } catch (WorkspaceException e) {
            return StageResult.failure(FailureCategory.SETUP, e.getMessage());
        }
        Path workspace = ctx.workspace();
        RoutineContext routineContext = new RoutineContext(job.jobId(), settings, job.primaryOutputExt(), ctx.sink());

        // Staging
        StagedInput staged;
        try {
            staged = stagingService.stage(job, settings, workspace, routine, routineContext);
        } catch (StagingException | IOException e) {
            return StageResult.failure(FailureCategory.STAGING, e.getMessage());
        }
        ctx.reportStage("Staged");

        // Converting
        boolean converted;
        try {
            converted = routine.convert(staged.path(), workspace, FileNames.baseName(job.inputPath()), routineContext);
        } finally {
            if (staged.fromArchive()) {
                tempResources.release(staged.extractionDir());
            }
        }
        if (!converted) {
            return StageResult.failure(FailureCategory.CONVERSION, "Conversion failed (" + routine.id() + ")");
        }
        ctx.reportStage("Converted");

        // Finalizing
        StageResult placed = outputPlacer.place(job, workspace, routine.outputMode(), routineContext);
        if (placed.failed()) {
            return placed;
        }
        ctx.reportStage("Finalized");
        return StageResult.ok();
    }

    private void releaseWorkspace(JobExecutionContext ctx) {
        if (ctx.workspace() != null && !tempResources.release(ctx.workspace())) {
            ctx.error("WARNING: Could not remove temporary directory " + ctx.workspace());
        }
    }
}
