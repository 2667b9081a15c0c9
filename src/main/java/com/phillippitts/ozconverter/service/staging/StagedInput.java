package com.phillippitts.ozconverter.service.staging;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Result of staging.
 *
 * @param path file or directory the routine should read
 * @param extractionDir workspace subdirectory holding unpacked archive content, or null
 */
public record StagedInput(Path path, Path extractionDir) {

    public StagedInput {
        Objects.requireNonNull(path, "path");
    }

    public static StagedInput of(Path path) {
        return new StagedInput(path, null);
    }

    public boolean fromArchive() {
        return extractionDir != null;
    }
}
