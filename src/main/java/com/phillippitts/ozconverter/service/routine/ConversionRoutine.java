package com.phillippitts.ozconverter.service.routine;

import java.nio.file.Path;
import java.util.List;

/**
 * One external-tool conversion, selected by its stable {@link #id()}.
 *
 * <p>Implementations must not throw from {@link #convert}: tool failures become a {@code false}
 * result plus error lines on the context. Outputs are written into the workspace only.
 */
public interface ConversionRoutine {

    /**
     * Stable identifier used in job descriptors, e.g. {@code chdman-createcd}.
     */
    String id();

    /**
     * Runs the conversion.
     *
     * @param stagedInput input file as prepared by staging (copy, in-place original, or extracted media)
     * @param workspaceDir job workspace; outputs go to its root
     * @param baseName input file name without extension, used to name outputs
     * @param context job id, settings and event sink
     * @return true if the expected output was produced
     */
    boolean convert(Path stagedInput, Path workspaceDir, String baseName, RoutineContext context);

    default OutputMode outputMode() {
        return OutputMode.SINGLE_FILE;
    }

    /**
     * Media extensions to look for when the input is an archive that staging should unpack first,
     * in preference order. Empty means archives are passed to the routine as-is.
     */
    default List<String> archiveMediaExtensions() {
        return List.of();
    }
}
