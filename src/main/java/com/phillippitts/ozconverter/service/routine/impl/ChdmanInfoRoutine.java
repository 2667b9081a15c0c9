package com.phillippitts.ozconverter.service.routine.impl;

import com.phillippitts.ozconverter.service.process.ToolCommandRunner;
import com.phillippitts.ozconverter.service.routine.OutputMode;
import com.phillippitts.ozconverter.service.routine.RoutineContext;

import java.nio.file.Path;

/**
 * {@code chdman info}. The report itself is the tool output on the job log.
 */
public class ChdmanInfoRoutine extends AbstractChdmanRoutine {

    public ChdmanInfoRoutine(ToolCommandRunner runner) {
        super("chdman-info", runner);
    }

    @Override
    public boolean convert(Path stagedInput, Path workspaceDir, String baseName, RoutineContext ctx) {
        if (!requireInputFile(ctx, stagedInput)) {
            return false;
        }
        ctx.output(">> Getting info for CHD: \"" + stagedInput.getFileName() + "\"");
        if (!runTool(ctx, chdmanCommand(ctx, "info", stagedInput), null)) {
            ctx.error("ERROR: Failed to get info for \"" + stagedInput.getFileName() + "\".");
            return false;
        }
        return true;
    }

    @Override
    public OutputMode outputMode() {
        return OutputMode.NONE;
    }
}
