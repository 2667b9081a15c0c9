package com.phillippitts.ozconverter.service.staging;

import com.phillippitts.ozconverter.exception.ToolExecutionException;
import com.phillippitts.ozconverter.service.process.ToolCommandRunner;
import com.phillippitts.ozconverter.service.routine.RoutineContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Extracts archives with {@code 7za x <archive> -o<dir> -y}.
 */
@Component
public class SevenZipArchiveStager implements ArchiveStager {

    private static final Logger LOG = LogManager.getLogger(SevenZipArchiveStager.class);

    /** 7-Zip exit codes worth explaining; 0 is success. */
    public static final Map<Integer, String> SEVEN_ZIP_ERRORS = Map.of(
            1, "Warning (non-fatal error, e.g. locked files)",
            2, "Fatal error (corrupt or unsupported archive)",
            7, "Command line error",
            8, "Not enough memory",
            255, "Stopped by user");

    private final ToolCommandRunner runner;

    public SevenZipArchiveStager(ToolCommandRunner runner) {
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    @Override
    public boolean extract(Path archive, Path destinationDir, RoutineContext context) {
        List<String> command = List.of(context.settings().tools().sevenZip(), "x",
                archive.toString(), "-o" + destinationDir, "-y");
        context.output(">> Running: " + String.join(" ", command));
        try {
            runner.execute(command, null, context.settings().subprocessTimeout(), context.toolListener(),
                    SEVEN_ZIP_ERRORS);
            return true;
        } catch (ToolExecutionException e) {
            LOG.warn("Archive extraction failed for {}: {}", archive.getFileName(), e.getMessage());
            context.error("ERROR: Failed to extract archive \"" + archive.getFileName() + "\": " + e.getMessage());
            return false;
        }
    }
}
