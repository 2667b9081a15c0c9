package com.phillippitts.ozconverter.service.routine.impl;

import com.phillippitts.ozconverter.service.routine.ConversionRoutine;
import com.phillippitts.ozconverter.service.routine.OutputMode;
import com.phillippitts.ozconverter.service.routine.RoutineContext;
import com.phillippitts.ozconverter.service.staging.ArchiveStager;
import com.phillippitts.ozconverter.service.staging.StagingService;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Unpacks an archive into the workspace; finalizing moves the content to {@code <output>/<base>/}.
 */
public class ArchiveExtractRoutine implements ConversionRoutine {

    public static final String ID = "archive-extract";

    private final ArchiveStager archiveStager;

    public ArchiveExtractRoutine(ArchiveStager archiveStager) {
        this.archiveStager = Objects.requireNonNull(archiveStager, "archiveStager");
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean convert(Path stagedInput, Path workspaceDir, String baseName, RoutineContext ctx) {
        ctx.output(">> Extracting archive \"" + stagedInput.getFileName() + "\"");
        if (!archiveStager.extract(stagedInput, workspaceDir, ctx)) {
            return false;
        }
        if (isEmpty(workspaceDir)) {
            ctx.error("WARNING: Archive \"" + stagedInput.getFileName() + "\" extracted, but it was empty.");
        }
        return true;
    }

    private static boolean isEmpty(Path workspaceDir) {
        try (Stream<Path> entries = Files.list(workspaceDir)) {
            return entries.noneMatch(p -> !StagingService.SOURCE_DIR.equals(p.getFileName().toString()));
        } catch (IOException e) {
            return false;
        }
    }

    @Override
    public OutputMode outputMode() {
        return OutputMode.FOLDER;
    }

    @Override
    public String toString() {
        return "ArchiveExtractRoutine[" + ID + "]";
    }
}
