package com.phillippitts.ozconverter.service.planning;

import com.phillippitts.ozconverter.util.FileNames;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One selectable (job, media) entry.
 *
 * @param jobName top-level job, e.g. "Compress media"
 * @param mediaName media type within the job, e.g. "CD image"
 * @param inputExtensions accepted input extensions
 * @param outputExtensions selectable primary output formats; empty for jobs that write no file
 * @param secondaryExtensions companion extension per output format (same index), null entries allowed
 * @param routineId registry id of the routine that performs the conversion
 */
public record RoutineDefinition(
        String jobName,
        String mediaName,
        List<String> inputExtensions,
        List<String> outputExtensions,
        List<String> secondaryExtensions,
        String routineId
) {
    public RoutineDefinition {
        Objects.requireNonNull(jobName, "jobName");
        Objects.requireNonNull(mediaName, "mediaName");
        Objects.requireNonNull(routineId, "routineId");
        inputExtensions = List.copyOf(inputExtensions);
        outputExtensions = List.copyOf(outputExtensions);
        // List.copyOf rejects nulls, and "no companion" is a legitimate entry
        secondaryExtensions = Collections.unmodifiableList(new ArrayList<>(secondaryExtensions));
    }

    public boolean acceptsInput(String extension) {
        return inputExtensions.contains(FileNames.normalizeExtension(extension));
    }

    /**
     * @return the output format when it is offered, the first one when {@code requested} is blank,
     *         null when it is not offered
     */
    public String resolveOutputFormat(String requested) {
        if (outputExtensions.isEmpty()) {
            return "";
        }
        String normalized = FileNames.normalizeExtension(requested);
        if (normalized.isEmpty()) {
            return outputExtensions.get(0);
        }
        return outputExtensions.contains(normalized) ? normalized : null;
    }

    public String secondaryFor(String outputFormat) {
        int index = outputExtensions.indexOf(outputFormat);
        if (index < 0 || index >= secondaryExtensions.size()) {
            return null;
        }
        return secondaryExtensions.get(index);
    }
}
