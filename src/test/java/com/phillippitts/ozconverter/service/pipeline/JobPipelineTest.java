package com.phillippitts.ozconverter.service.pipeline;

import com.phillippitts.ozconverter.config.properties.EngineProperties;
import com.phillippitts.ozconverter.domain.FailureCategory;
import com.phillippitts.ozconverter.domain.JobDescriptor;
import com.phillippitts.ozconverter.domain.JobSettings;
import com.phillippitts.ozconverter.domain.SettingsSnapshot;
import com.phillippitts.ozconverter.domain.StageResult;
import com.phillippitts.ozconverter.service.events.FileProgress;
import com.phillippitts.ozconverter.service.events.JobEvent;
import com.phillippitts.ozconverter.service.events.StageProgress;
import com.phillippitts.ozconverter.service.finalize.OutputPlacer;
import com.phillippitts.ozconverter.service.finalize.SourceDeletionService;
import com.phillippitts.ozconverter.service.routine.ConversionRoutineRegistry;
import com.phillippitts.ozconverter.service.staging.DescriptorDependencyResolver;
import com.phillippitts.ozconverter.service.staging.StagingService;
import com.phillippitts.ozconverter.service.workspace.TempResourceManager;
import com.phillippitts.ozconverter.testutil.Jobs;
import com.phillippitts.ozconverter.testutil.RecordingEventSink;
import com.phillippitts.ozconverter.testutil.StubRoutine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class JobPipelineTest {

    private static final EngineProperties ENGINE = new EngineProperties(1, 100L, 2, 0L, 999);

    @TempDir
    Path tempDir;

    private Path input;
    private Path outputDir;
    private final List<Path> recycled = new CopyOnWriteArrayList<>();
    private final RecordingEventSink sink = new RecordingEventSink();

    @BeforeEach
    void setUp() throws IOException {
        input = Files.writeString(Files.createDirectories(tempDir.resolve("in")).resolve("game.iso"), "iso");
        outputDir = tempDir.resolve("out");
    }

    private JobPipeline pipeline(StubRoutine... routines) {
        DescriptorDependencyResolver resolver = new DescriptorDependencyResolver();
        return new JobPipeline(
                new ConversionRoutineRegistry(List.of(routines)),
                new TempResourceManager(ENGINE),
                new StagingService(resolver, (archive, dest, ctx) -> false),
                new OutputPlacer(ENGINE),
                new SourceDeletionService(file -> {
                    recycled.add(file);
                    Files.delete(file);
                    return true;
                }, resolver));
    }

    private JobDescriptor job(String routineId, SettingsSnapshot settings) {
        return Jobs.descriptor(7, input, routineId, outputDir, "chd", settings);
    }

    private SettingsSnapshot settings() {
        return Jobs.settings(tempDir.resolve("temp"));
    }

    private void assertStageEventsComplete() {
        List<StageProgress> stages = sink.ofType(StageProgress.class);
        assertThat(stages).extracting(StageProgress::current).containsExactly(1, 2, 3);
        assertThat(stages).allSatisfy(s -> assertThat(s.total()).isEqualTo(3));

        List<JobEvent> events = sink.events();
        for (StageProgress stage : stages) {
            int index = events.indexOf(stage);
            assertThat(events.get(index + 1)).isInstanceOfSatisfying(FileProgress.class,
                    p -> assertThat(p.percentage()).isEqualTo(stage.percentage()));
        }
    }

    private void assertNoWorkspaceLeft() throws IOException {
        Path inPlaceTemps = input.getParent().resolve("_processing_temps_");
        if (Files.isDirectory(inPlaceTemps)) {
            try (Stream<Path> entries = Files.list(inPlaceTemps)) {
                assertThat(entries).isEmpty();
            }
        }
    }

    @Test
    void successfulJobPlacesOutputAndReportsEveryStage() throws IOException {
        StubRoutine routine = StubRoutine.producing("convert");

        StageResult result = pipeline(routine).run(job("convert", settings()), sink);

        assertThat(result.success()).isTrue();
        assertThat(outputDir.resolve("game.chd")).hasContent("converted");
        assertThat(routine.lastInput()).isEqualTo(input.toAbsolutePath());
        assertThat(sink.ofType(StageProgress.class)).extracting(StageProgress::description)
                .containsExactly("Staged", "Converted", "Finalized");
        assertStageEventsComplete();
        assertNoWorkspaceLeft();
        assertThat(input).exists();
        assertThat(recycled).isEmpty();
    }

    @Test
    void conversionFailureFillsRemainingStages() throws IOException {
        StageResult result = pipeline(StubRoutine.failing("convert")).run(job("convert", settings()), sink);

        assertThat(result.category()).isEqualTo(FailureCategory.CONVERSION);
        assertThat(sink.ofType(StageProgress.class)).extracting(StageProgress::description)
                .containsExactly("Staged", "Failed", "Failed");
        assertThat(sink.errorLines()).contains("ERROR: simulated tool failure")
                .anySatisfy(l -> assertThat(l).startsWith("CONVERSION: Conversion failed (convert)"));
        assertStageEventsComplete();
        assertNoWorkspaceLeft();
        assertThat(outputDir.resolve("game.chd")).doesNotExist();
    }

    @Test
    void stackOverflowInRoutineStillReportsEveryStage() throws IOException {
        StubRoutine routine = StubRoutine.withBehavior("convert", (in, ws, base, ctx) -> {
            throw new StackOverflowError("deep");
        });

        StageResult result = pipeline(routine).run(job("convert", settings()), sink);

        assertThat(result.category()).isEqualTo(FailureCategory.UNHANDLED);
        assertThat(result.message()).contains("deep");
        assertThat(sink.ofType(StageProgress.class)).extracting(StageProgress::description)
                .containsExactly("Staged", "Failed", "Failed");
        assertStageEventsComplete();
        assertNoWorkspaceLeft();
    }

    @Test
    void thrownRoutineErrorIsUnhandled() throws IOException {
        StageResult result = pipeline(StubRoutine.throwing("convert")).run(job("convert", settings()), sink);

        assertThat(result.category()).isEqualTo(FailureCategory.UNHANDLED);
        assertThat(result.message()).contains("routine blew up");
        assertStageEventsComplete();
        assertNoWorkspaceLeft();
    }

    @Test
    void unknownRoutineFailsSetupWithoutWorkspace() {
        StageResult result = pipeline(StubRoutine.producing("convert")).run(job("missing", settings()), sink);

        assertThat(result.category()).isEqualTo(FailureCategory.SETUP);
        assertThat(sink.ofType(StageProgress.class)).extracting(StageProgress::description)
                .containsExactly("Failed", "Failed", "Failed");
        assertThat(input.getParent().resolve("_processing_temps_")).doesNotExist();
    }

    @Test
    void malformedSettingsFailSetup() {
        SettingsSnapshot bad = settings().with(JobSettings.SUBPROCESS_TIMEOUT_SECONDS, "soon");
        StubRoutine routine = StubRoutine.producing("convert");

        StageResult result = pipeline(routine).run(job("convert", bad), sink);

        assertThat(result.category()).isEqualTo(FailureCategory.SETUP);
        assertThat(result.message()).startsWith("Invalid settings").contains(JobSettings.SUBPROCESS_TIMEOUT_SECONDS);
        assertThat(routine.calls()).isZero();
        assertStageEventsComplete();
    }

    @Test
    void unreadableSettingsDocumentFailsSetup() {
        JobDescriptor valid = job("convert", settings());
        JobDescriptor corrupt = new JobDescriptor(valid.jobId(), valid.inputPath(), valid.routineId(),
                valid.outputDir(), valid.primaryOutputExt(), valid.secondaryOutputExt(), valid.overwriteAllowed(),
                valid.multiFileInput(), "{not json");
        StubRoutine routine = StubRoutine.producing("convert");

        StageResult result = pipeline(routine).run(corrupt, sink);

        assertThat(result.category()).isEqualTo(FailureCategory.SETUP);
        assertThat(result.message()).startsWith("Invalid settings");
        assertThat(routine.calls()).isZero();
        assertStageEventsComplete();
    }

    @Test
    void missingInputFailsStaging() throws IOException {
        Files.delete(input);
        StubRoutine routine = StubRoutine.producing("convert");

        StageResult result = pipeline(routine).run(job("convert", settings()), sink);

        assertThat(result.category()).isEqualTo(FailureCategory.STAGING);
        assertThat(routine.calls()).isZero();
        assertNoWorkspaceLeft();
    }

    @Test
    void missingOutputFailsConversion() {
        StubRoutine routine = StubRoutine.withBehavior("convert", (in, ws, base, ctx) -> true);

        StageResult result = pipeline(routine).run(job("convert", settings()), sink);

        assertThat(result.category()).isEqualTo(FailureCategory.CONVERSION);
        assertThat(result.message()).contains("Expected output not found");
        assertThat(sink.ofType(StageProgress.class)).extracting(StageProgress::description)
                .containsExactly("Staged", "Converted", "Failed");
    }

    @Test
    void sourceIsDeletedOnlyAfterSuccess() {
        SettingsSnapshot deleting = settings().with(JobSettings.DELETE_SOURCE_ON_SUCCESS, true);

        pipeline(StubRoutine.failing("fail")).run(job("fail", deleting), sink);
        assertThat(input).exists();

        StageResult result = pipeline(StubRoutine.producing("convert")).run(job("convert", deleting), sink);

        assertThat(result.success()).isTrue();
        assertThat(recycled).containsExactly(input.toAbsolutePath());
        assertThat(input).doesNotExist();
        assertThat(sink.outputLines()).contains(">> Moved to trash: game.iso");
    }

    @Test
    void copyLocallyStagesIntoMainTempDir() throws IOException {
        SettingsSnapshot local = settings().with(JobSettings.COPY_LOCALLY, true);
        AtomicReference<Path> seenWorkspace = new AtomicReference<>();
        StubRoutine routine = StubRoutine.withBehavior("convert", (in, ws, base, ctx) -> {
            seenWorkspace.set(ws);
            return StubRoutine.writeTarget(in, ws, base, ctx);
        });

        StageResult result = pipeline(routine).run(job("convert", local), sink);

        assertThat(result.success()).isTrue();
        assertThat(seenWorkspace.get()).startsWithRaw(tempDir.resolve("temp").toAbsolutePath());
        assertThat(routine.lastInput()).isEqualTo(seenWorkspace.get().resolve(StagingService.SOURCE_DIR)
                .resolve("game.iso"));
        assertThat(seenWorkspace.get()).doesNotExist();
        assertThat(input.getParent().resolve("_processing_temps_")).doesNotExist();
    }
}
