package com.phillippitts.ozconverter.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Immutable job payload that crosses the job queue. Carries everything a worker needs,
 * including its own copy of the settings as a JSON document, so workers never read coordinator state.
 */
public record JobDescriptor(
        long jobId,
        Path inputPath,
        String routineId,
        Path outputDir,
        String primaryOutputExt,
        String secondaryOutputExt,
        boolean overwriteAllowed,
        boolean multiFileInput,
        String settingsJson
) {
    public JobDescriptor {
        if (jobId <= 0) {
            throw new IllegalArgumentException("jobId must be positive");
        }
        Objects.requireNonNull(inputPath, "inputPath");
        Objects.requireNonNull(routineId, "routineId");
        Objects.requireNonNull(outputDir, "outputDir");
        Objects.requireNonNull(settingsJson, "settingsJson");
    }

    public static JobDescriptor of(long jobId, JobRequest request, SettingsSnapshot settings) {
        return new JobDescriptor(jobId, request.inputPath(), request.routineId(), request.outputDir(),
                request.primaryOutputExt(), request.secondaryOutputExt(), request.overwriteAllowed(),
                request.multiFileInput(), settings.toJson());
    }

    /**
     * @throws com.phillippitts.ozconverter.exception.SettingsSnapshotException if the JSON is unreadable
     */
    public SettingsSnapshot settings() {
        return SettingsSnapshot.fromJson(settingsJson);
    }

    public String filename() {
        return inputPath.getFileName().toString();
    }
}
