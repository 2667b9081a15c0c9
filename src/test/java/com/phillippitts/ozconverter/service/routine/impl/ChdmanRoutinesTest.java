package com.phillippitts.ozconverter.service.routine.impl;

import com.phillippitts.ozconverter.domain.JobSettings;
import com.phillippitts.ozconverter.domain.SettingsSnapshot;
import com.phillippitts.ozconverter.service.routine.OutputMode;
import com.phillippitts.ozconverter.service.routine.RoutineContext;
import com.phillippitts.ozconverter.testutil.Jobs;
import com.phillippitts.ozconverter.testutil.RecordingEventSink;
import com.phillippitts.ozconverter.testutil.ScriptedToolRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ChdmanRoutinesTest {

    @TempDir
    Path tempDir;

    private Path workspace;
    private final RecordingEventSink sink = new RecordingEventSink();
    private final ScriptedToolRunner runner = new ScriptedToolRunner();

    @BeforeEach
    void setUp() throws IOException {
        workspace = Files.createDirectories(tempDir.resolve("ws"));
    }

    private RoutineContext ctx(SettingsSnapshot settings, String ext) {
        return Jobs.context(1, settings, ext, sink);
    }

    @Test
    void createCdBuildsTheChdmanCommand() throws IOException {
        Path cue = Files.writeString(tempDir.resolve("game.cue"), "cue");
        runner.script(ScriptedToolRunner.writesArgAfter("-o"));
        ChdmanCompressRoutine routine = new ChdmanCompressRoutine(ChdmanMediaType.CD, runner);

        boolean ok = routine.convert(cue, workspace, "game", ctx(SettingsSnapshot.empty(), "chd"));

        assertThat(ok).isTrue();
        assertThat(routine.id()).isEqualTo("chdman-createcd");
        assertThat(runner.lastCommand()).containsExactly(
                "chdman", "createcd", "-i", cue.toString(), "-o", workspace.resolve("game.chd").toString());
        assertThat(sink.outputLines()).anySatisfy(l -> assertThat(l).startsWith(">> Running: chdman createcd"));
    }

    @Test
    void perMediaAndProcessorSettingsAreApplied() throws IOException {
        Path iso = Files.writeString(tempDir.resolve("movie.iso"), "iso");
        runner.script(ScriptedToolRunner.writesArgAfter("-o"));
        SettingsSnapshot settings = SettingsSnapshot.empty()
                .with(JobSettings.TOOL_CHDMAN, "/opt/mame/chdman")
                .with(JobSettings.CHDMAN_NUM_PROCESSORS_MODE, "manual")
                .with(JobSettings.CHDMAN_NUM_PROCESSORS_MANUAL, 4)
                .with("chdman.dvd.hunks", 2048)
                .with("chdman.dvd.compression", "lzma,zlib")
                .with("chdman.cd.hunks", 9999);

        new ChdmanCompressRoutine(ChdmanMediaType.DVD, runner).convert(iso, workspace, "movie", ctx(settings, "chd"));

        assertThat(runner.lastCommand()).containsExactly(
                "/opt/mame/chdman", "createdvd", "-i", iso.toString(), "-o", workspace.resolve("movie.chd").toString(),
                "--numprocessors", "4", "--hunksize", "2048", "--compression", "lzma,zlib");
    }

    @Test
    void rawMediaUsesHardDiskCommand() throws IOException {
        Path img = Files.writeString(tempDir.resolve("disk.img"), "img");
        runner.script(ScriptedToolRunner.writesArgAfter("-o"));
        ChdmanCompressRoutine routine = new ChdmanCompressRoutine(ChdmanMediaType.RAW, runner);

        routine.convert(img, workspace, "disk", ctx(SettingsSnapshot.empty(), "chd"));

        assertThat(routine.id()).isEqualTo("chdman-createraw");
        assertThat(runner.lastCommand().get(1)).isEqualTo("createhd");
    }

    @Test
    void missingOutputFailsEvenWhenToolSucceeds() throws IOException {
        Path cue = Files.writeString(tempDir.resolve("game.cue"), "cue");
        ChdmanCompressRoutine routine = new ChdmanCompressRoutine(ChdmanMediaType.CD, runner);

        boolean ok = routine.convert(cue, workspace, "game", ctx(SettingsSnapshot.empty(), "chd"));

        assertThat(ok).isFalse();
        assertThat(sink.errorLines()).anySatisfy(l -> assertThat(l).contains("not created or empty"));
    }

    @Test
    void toolFailureIsReportedNotThrown() throws IOException {
        Path cue = Files.writeString(tempDir.resolve("game.cue"), "cue");
        runner.script(ScriptedToolRunner.failsWith(1));

        boolean ok = new ChdmanCompressRoutine(ChdmanMediaType.CD, runner)
                .convert(cue, workspace, "game", ctx(SettingsSnapshot.empty(), "chd"));

        assertThat(ok).isFalse();
        assertThat(sink.errorLines()).anySatisfy(l -> assertThat(l).startsWith("ERROR").contains("code 1"));
    }

    @Test
    void missingInputNeverRunsTheTool() {
        boolean ok = new ChdmanCompressRoutine(ChdmanMediaType.CD, runner)
                .convert(tempDir.resolve("nope.cue"), workspace, "nope", ctx(SettingsSnapshot.empty(), "chd"));

        assertThat(ok).isFalse();
        assertThat(runner.commands()).isEmpty();
    }

    @Test
    void extractVerifiesFirstAndRequiresTracks() throws IOException {
        Path chd = Files.writeString(tempDir.resolve("game.chd"), "chd");
        runner.script((command, dir, listener) -> {
            if (command.get(1).equals("extractcd")) {
                ScriptedToolRunner.write(workspace.resolve("game.cue"));
                ScriptedToolRunner.write(workspace.resolve("game.bin"));
            }
        });
        ChdmanExtractRoutine routine = new ChdmanExtractRoutine(ChdmanMediaType.CD, runner);

        boolean ok = routine.convert(chd, workspace, "game", ctx(SettingsSnapshot.empty(), "cue"));

        assertThat(ok).isTrue();
        assertThat(runner.commands()).extracting(c -> c.get(1)).containsExactly("verify", "extractcd");
        assertThat(runner.lastCommand()).contains("-o", workspace.resolve("game.cue").toString());
    }

    @Test
    void extractWithoutTrackFilesFails() throws IOException {
        Path chd = Files.writeString(tempDir.resolve("game.chd"), "chd");
        runner.script((command, dir, listener) -> {
            if (command.get(1).equals("extractcd")) {
                ScriptedToolRunner.write(workspace.resolve("game.cue"));
            }
        });

        boolean ok = new ChdmanExtractRoutine(ChdmanMediaType.CD, runner)
                .convert(chd, workspace, "game", ctx(SettingsSnapshot.empty(), "cue"));

        assertThat(ok).isFalse();
        assertThat(sink.errorLines()).anySatisfy(l -> assertThat(l).contains("Track files"));
    }

    @Test
    void failedVerifyIsOnlyAWarning() throws IOException {
        Path chd = Files.writeString(tempDir.resolve("movie.chd"), "chd");
        runner.script((command, dir, listener) -> {
            if (command.get(1).equals("verify")) {
                ScriptedToolRunner.failsWith(1).run(command, dir, listener);
            }
            ScriptedToolRunner.writesArgAfter("-o").run(command, dir, listener);
        });

        boolean ok = new ChdmanExtractRoutine(ChdmanMediaType.DVD, runner)
                .convert(chd, workspace, "movie", ctx(SettingsSnapshot.empty(), ""));

        assertThat(ok).isTrue();
        assertThat(workspace.resolve("movie.iso")).exists();
        assertThat(sink.errorLines()).anySatisfy(l -> assertThat(l).startsWith("WARNING: CHD verification failed"));
    }

    @Test
    void laserDiscExtractSkipsVerify() throws IOException {
        Path chd = Files.writeString(tempDir.resolve("film.chd"), "chd");
        runner.script(ScriptedToolRunner.writesArgAfter("-o"));

        new ChdmanExtractRoutine(ChdmanMediaType.LD, runner)
                .convert(chd, workspace, "film", ctx(SettingsSnapshot.empty(), ""));

        assertThat(runner.commands()).extracting(c -> c.get(1)).containsExactly("extractld");
        assertThat(workspace.resolve("film.raw")).exists();
    }

    @Test
    void verifyRoutineAddsFixWhenEnabled() throws IOException {
        Path chd = Files.writeString(tempDir.resolve("game.chd"), "chd");
        SettingsSnapshot settings = SettingsSnapshot.empty().with(JobSettings.CHDMAN_VERIFY_FIX, true);
        ChdmanVerifyRoutine routine = new ChdmanVerifyRoutine(runner);

        boolean ok = routine.convert(chd, workspace, "game", ctx(settings, ""));

        assertThat(ok).isTrue();
        assertThat(routine.outputMode()).isEqualTo(OutputMode.NONE);
        assertThat(runner.lastCommand()).containsExactly("chdman", "verify", "-i", chd.toString(), "--fix");
    }

    @Test
    void infoRoutineReportsToolFailure() throws IOException {
        Path chd = Files.writeString(tempDir.resolve("game.chd"), "chd");
        runner.script(ScriptedToolRunner.failsWith(1));

        boolean ok = new ChdmanInfoRoutine(runner).convert(chd, workspace, "game", ctx(SettingsSnapshot.empty(), ""));

        assertThat(ok).isFalse();
        assertThat(runner.lastCommand()).containsExactly("chdman", "info", "-i", chd.toString());
        assertThat(sink.errorLines()).anySatisfy(l -> assertThat(l).contains("Failed to get info"));
    }

    @Test
    void compressRoutinesAcceptArchivedMedia() {
        assertThat(new ChdmanCompressRoutine(ChdmanMediaType.CD, runner).archiveMediaExtensions())
                .isEqualTo(List.of("iso", "cue", "img", "toc", "gdi"));
        assertThat(new ChdmanExtractRoutine(ChdmanMediaType.CD, runner).archiveMediaExtensions()).isEmpty();
    }
}
