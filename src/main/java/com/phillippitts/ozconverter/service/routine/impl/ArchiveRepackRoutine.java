package com.phillippitts.ozconverter.service.routine.impl;

import com.phillippitts.ozconverter.service.process.ToolCommandRunner;
import com.phillippitts.ozconverter.service.routine.AbstractToolRoutine;
import com.phillippitts.ozconverter.service.routine.RoutineContext;
import com.phillippitts.ozconverter.service.staging.ArchiveStager;
import com.phillippitts.ozconverter.service.staging.SevenZipArchiveStager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Re-packs any supported archive as a solid, maximum-compression 7z.
 */
public class ArchiveRepackRoutine extends AbstractToolRoutine {

    private static final Logger LOG = LogManager.getLogger(ArchiveRepackRoutine.class);

    public static final String ID = "archive-repack-7z";
    static final String CONTENT_SUFFIX = "_repack_content";

    private final ArchiveStager archiveStager;

    public ArchiveRepackRoutine(ArchiveStager archiveStager, ToolCommandRunner runner) {
        super(ID, runner);
        this.archiveStager = Objects.requireNonNull(archiveStager, "archiveStager");
    }

    @Override
    public boolean convert(Path stagedInput, Path workspaceDir, String baseName, RoutineContext ctx) {
        if (!requireInputFile(ctx, stagedInput)) {
            return false;
        }
        Path contentDir = workspaceDir.resolve(baseName + CONTENT_SUFFIX);
        try {
            Files.createDirectories(contentDir);
            ctx.output(">> Converting archive \"" + stagedInput.getFileName() + "\" to 7Z");
            if (!archiveStager.extract(stagedInput, contentDir, ctx)) {
                return false;
            }
            if (isEmptyDir(contentDir)) {
                ctx.error("ERROR: No content found after extraction to re-compress.");
                return false;
            }
            return repack(ctx, contentDir, workspaceDir.resolve(baseName + ".7z"));
        } catch (IOException e) {
            ctx.error("ERROR: " + e.getMessage());
            return false;
        } finally {
            deleteQuietly(contentDir);
        }
    }

    private boolean repack(RoutineContext ctx, Path contentDir, Path output) {
        String sevenZip = ctx.settings().tools().sevenZip();
        ctx.output(">> Re-compressing extracted content to 7Z");
        List<String> command = List.of(sevenZip, "a", "-t7z", "-mx9", "-md=128m", output.toString(), ".");
        if (!runTool(ctx, command, contentDir, SevenZipArchiveStager.SEVEN_ZIP_ERRORS) || !requireOutput(ctx, output)) {
            return false;
        }
        if (ctx.settings().validateOutput()) {
            ctx.output(">> Validating new 7Z archive");
            if (!runTool(ctx, List.of(sevenZip, "t", output.toString()), null, SevenZipArchiveStager.SEVEN_ZIP_ERRORS)) {
                ctx.error("ERROR: Validation failed for \"" + output.getFileName() + "\".");
                return false;
            }
            ctx.output(">> Validation passed.");
        }
        return true;
    }

    private static boolean isEmptyDir(Path dir) throws IOException {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.findAny().isEmpty();
        }
    }

    private static void deleteQuietly(Path dir) {
        try {
            FileSystemUtils.deleteRecursively(dir);
        } catch (IOException e) {
            LOG.warn("Could not remove {}: {}", dir, e.toString());
        }
    }
}
