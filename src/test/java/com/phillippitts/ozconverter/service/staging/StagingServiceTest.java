package com.phillippitts.ozconverter.service.staging;

import com.phillippitts.ozconverter.domain.JobDescriptor;
import com.phillippitts.ozconverter.domain.JobRequest;
import com.phillippitts.ozconverter.domain.JobSettings;
import com.phillippitts.ozconverter.domain.SettingsSnapshot;
import com.phillippitts.ozconverter.exception.StagingException;
import com.phillippitts.ozconverter.service.routine.OutputMode;
import com.phillippitts.ozconverter.service.routine.RoutineContext;
import com.phillippitts.ozconverter.testutil.Jobs;
import com.phillippitts.ozconverter.testutil.RecordingEventSink;
import com.phillippitts.ozconverter.testutil.ScriptedToolRunner;
import com.phillippitts.ozconverter.testutil.StubRoutine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StagingServiceTest {

    @TempDir
    Path tempDir;

    private Path sourceDir;
    private Path workspace;
    private final RecordingEventSink sink = new RecordingEventSink();
    private final List<Path> extracted = new ArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        sourceDir = Files.createDirectories(tempDir.resolve("roms"));
        workspace = Files.createDirectories(tempDir.resolve("workspace"));
    }

    private StagingService service(ArchiveStager stager) {
        return new StagingService(new DescriptorDependencyResolver(), stager);
    }

    /** Stager that writes the given relative files into the destination. */
    private ArchiveStager unpacking(String... files) {
        return (archive, dest, ctx) -> {
            extracted.add(archive);
            try {
                for (String f : files) {
                    ScriptedToolRunner.write(dest.resolve(f));
                }
                return true;
            } catch (IOException e) {
                return false;
            }
        };
    }

    private static StubRoutine routineReading(String... mediaExtensions) {
        return new StubRoutine("stub", OutputMode.SINGLE_FILE, List.of(mediaExtensions), StubRoutine::writeTarget);
    }

    private JobDescriptor job(Path input, boolean multiFile) {
        return Jobs.descriptor(1, new JobRequest(input, "stub", tempDir.resolve("out"), "chd", null, false, multiFile),
                SettingsSnapshot.empty());
    }

    private RoutineContext context(JobSettings settings) {
        return new RoutineContext(1, settings, "chd", sink);
    }

    private static JobSettings copyLocally(boolean on) {
        return JobSettings.decode(SettingsSnapshot.empty().with(JobSettings.COPY_LOCALLY, on));
    }

    @Test
    void missingInputIsAStagingFailure() {
        Path missing = sourceDir.resolve("gone.iso");
        JobSettings settings = copyLocally(false);

        assertThatThrownBy(() -> service(unpacking()).stage(job(missing, false), settings, workspace,
                routineReading(), context(settings)))
                .isInstanceOf(StagingException.class)
                .hasMessageContaining("Input not found");
    }

    @Test
    void inPlaceUsesTheOriginalFile() throws IOException {
        Path iso = Files.writeString(sourceDir.resolve("game.iso"), "iso");
        JobSettings settings = copyLocally(false);

        StagedInput staged = service(unpacking()).stage(job(iso, false), settings, workspace, routineReading(),
                context(settings));

        assertThat(staged.path()).isEqualTo(iso.toAbsolutePath());
        assertThat(staged.fromArchive()).isFalse();
        assertThat(workspace.resolve(StagingService.SOURCE_DIR)).doesNotExist();
    }

    @Test
    void copyLocallyCopiesIntoSourceDir() throws IOException {
        Path iso = Files.writeString(sourceDir.resolve("game.iso"), "iso");
        JobSettings settings = copyLocally(true);

        StagedInput staged = service(unpacking()).stage(job(iso, false), settings, workspace, routineReading(),
                context(settings));

        assertThat(staged.path()).isEqualTo(workspace.resolve(StagingService.SOURCE_DIR).resolve("game.iso"));
        assertThat(staged.path()).hasContent("iso");
        assertThat(iso).exists();
    }

    @Test
    void cueTracksAreCopiedWithTheSheet() throws IOException {
        Files.createDirectories(sourceDir.resolve("tracks"));
        Files.writeString(sourceDir.resolve("tracks/game (Track 1).bin"), "t1");
        Files.writeString(sourceDir.resolve("game (Track 2).bin"), "t2");
        Path cue = Files.writeString(sourceDir.resolve("game.cue"), """
                FILE "tracks/game (Track 1).bin" BINARY
                FILE "game (Track 2).bin" BINARY
                """);
        JobSettings settings = copyLocally(true);

        StagedInput staged = service(unpacking()).stage(job(cue, true), settings, workspace, routineReading(),
                context(settings));

        Path stagedDir = staged.path().getParent();
        assertThat(stagedDir.resolve("tracks/game (Track 1).bin")).hasContent("t1");
        assertThat(stagedDir.resolve("game (Track 2).bin")).hasContent("t2");
        assertThat(sink.errorLines()).isEmpty();
    }

    @Test
    void missingTrackIsOnlyAWarning() throws IOException {
        Path cue = Files.writeString(sourceDir.resolve("game.cue"), "FILE \"missing.bin\" BINARY\n");
        JobSettings settings = copyLocally(true);

        StagedInput staged = service(unpacking()).stage(job(cue, true), settings, workspace, routineReading(),
                context(settings));

        assertThat(staged.path()).exists();
        assertThat(sink.errorLines()).anySatisfy(line ->
                assertThat(line).startsWith("WARNING").contains("missing.bin"));
    }

    @Test
    void archiveIsUnpackedAndPreferredMediaPicked() throws IOException {
        Path zip = Files.writeString(sourceDir.resolve("game.zip"), "zip");
        JobSettings settings = copyLocally(false);

        StagedInput staged = service(unpacking("readme.txt", "disc/game.img", "game.cue"))
                .stage(job(zip, false), settings, workspace, routineReading("iso", "cue", "img"), context(settings));

        assertThat(staged.fromArchive()).isTrue();
        assertThat(staged.path().getFileName().toString()).isEqualTo("game.cue");
        assertThat(staged.extractionDir()).startsWith(workspace);
        assertThat(extracted).containsExactly(zip.toAbsolutePath());
    }

    @Test
    void archiveWithoutMediaFailsStaging() throws IOException {
        Path zip = Files.writeString(sourceDir.resolve("game.zip"), "zip");
        JobSettings settings = copyLocally(false);

        assertThatThrownBy(() -> service(unpacking("readme.txt")).stage(job(zip, false), settings, workspace,
                routineReading("iso"), context(settings)))
                .isInstanceOf(StagingException.class)
                .hasMessageContaining("No supported media");
    }

    @Test
    void failedExtractionFailsStaging() throws IOException {
        Path zip = Files.writeString(sourceDir.resolve("game.zip"), "zip");
        JobSettings settings = copyLocally(false);
        ArchiveStager broken = (archive, dest, ctx) -> false;

        assertThatThrownBy(() -> service(broken).stage(job(zip, false), settings, workspace,
                routineReading("iso"), context(settings)))
                .isInstanceOf(StagingException.class)
                .hasMessageContaining("Failed to extract archive");
    }

    @Test
    void archiveRoutinesReceiveTheArchiveItself() throws IOException {
        Path zip = Files.writeString(sourceDir.resolve("game.zip"), "zip");
        JobSettings settings = copyLocally(false);

        StagedInput staged = service(unpacking("game.iso")).stage(job(zip, false), settings, workspace,
                routineReading(), context(settings));

        assertThat(staged.path()).isEqualTo(zip.toAbsolutePath());
        assertThat(extracted).isEmpty();
    }

    @Test
    void findMediaPrefersTheArchiveRoot() throws IOException {
        Path dir = Files.createDirectories(tempDir.resolve("content"));
        ScriptedToolRunner.write(dir.resolve("a/b/nested.iso"));
        ScriptedToolRunner.write(dir.resolve("root.iso"));

        assertThat(StagingService.findMedia(dir, List.of("iso"))).contains(dir.resolve("root.iso"));
        assertThat(StagingService.findMedia(dir, List.of("chd"))).isEmpty();
    }
}
