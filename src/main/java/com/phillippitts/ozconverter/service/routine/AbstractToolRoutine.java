package com.phillippitts.ozconverter.service.routine;

import com.phillippitts.ozconverter.exception.ToolExecutionException;
import com.phillippitts.ozconverter.service.process.ToolCommandRunner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base class for routines that shell out to a tool. Provides the never-throw contract:
 * tool failures are logged, reported as error lines and returned as {@code false}.
 */
public abstract class AbstractToolRoutine implements ConversionRoutine {

    private static final Logger LOG = LogManager.getLogger(AbstractToolRoutine.class);

    protected final ToolCommandRunner runner;
    private final String id;

    protected AbstractToolRoutine(String id, ToolCommandRunner runner) {
        this.id = Objects.requireNonNull(id, "id");
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    @Override
    public final String id() {
        return id;
    }

    protected boolean runTool(RoutineContext ctx, List<String> command, Path workingDir) {
        return runTool(ctx, command, workingDir, Map.of());
    }

    /**
     * Runs a tool with the job's timeout, streaming its output to the job.
     *
     * @return false on start failure, timeout or non-zero exit
     */
    protected boolean runTool(RoutineContext ctx, List<String> command, Path workingDir,
                              Map<Integer, String> knownErrorCodes) {
        ctx.output(">> Running: " + String.join(" ", command));
        try {
            runner.execute(command, workingDir, ctx.settings().subprocessTimeout(), ctx.toolListener(),
                    knownErrorCodes);
            return true;
        } catch (ToolExecutionException e) {
            LOG.warn("Routine {} tool failure: {}", id, e.getMessage());
            ctx.error("ERROR: " + e.getMessage());
            return false;
        }
    }

    protected boolean requireInputFile(RoutineContext ctx, Path input) {
        if (Files.isRegularFile(input)) {
            return true;
        }
        ctx.error("ERROR: Input file not found: " + input);
        return false;
    }

    /**
     * Checks that the tool actually produced a non-empty file.
     */
    protected boolean requireOutput(RoutineContext ctx, Path output) {
        if (isNonEmptyFile(output)) {
            return true;
        }
        ctx.error("ERROR: Output \"" + output.getFileName() + "\" not created or empty.");
        return false;
    }

    protected static boolean isNonEmptyFile(Path path) {
        try {
            return Files.isRegularFile(path) && Files.size(path) > 0;
        } catch (IOException e) {
            return false;
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id + "]";
    }
}
