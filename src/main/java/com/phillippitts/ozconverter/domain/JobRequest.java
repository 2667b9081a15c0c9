package com.phillippitts.ozconverter.domain;

import com.phillippitts.ozconverter.util.FileNames;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A conversion the caller wants performed, before the coordinator assigns an id
 * and attaches a settings snapshot.
 *
 * @param inputPath file or directory to convert
 * @param routineId stable id of the conversion routine
 * @param outputDir final destination directory
 * @param primaryOutputExt extension of the main output, without dot (may be blank for info routines)
 * @param secondaryOutputExt extension of companion outputs such as {@code bin}, or null
 * @param overwriteAllowed replace existing destination files instead of renaming
 * @param multiFileInput input is a descriptor (cue/gdi) that references sibling data files
 */
public record JobRequest(
        Path inputPath,
        String routineId,
        Path outputDir,
        String primaryOutputExt,
        String secondaryOutputExt,
        boolean overwriteAllowed,
        boolean multiFileInput
) {
    public JobRequest {
        Objects.requireNonNull(inputPath, "inputPath");
        Objects.requireNonNull(routineId, "routineId");
        Objects.requireNonNull(outputDir, "outputDir");
        primaryOutputExt = FileNames.normalizeExtension(primaryOutputExt);
        secondaryOutputExt = secondaryOutputExt == null || secondaryOutputExt.isBlank()
                ? null : FileNames.normalizeExtension(secondaryOutputExt);
    }
}
