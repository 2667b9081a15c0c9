package com.phillippitts.ozconverter.service.routine.impl;

import com.phillippitts.ozconverter.service.process.ToolCommandRunner;
import com.phillippitts.ozconverter.service.routine.OutputMode;
import com.phillippitts.ozconverter.service.routine.RoutineContext;

import java.nio.file.Path;

/**
 * {@code chdman verify}, with {@code --fix} when {@code converter.chdman.verify-fix} is set.
 */
public class ChdmanVerifyRoutine extends AbstractChdmanRoutine {

    public ChdmanVerifyRoutine(ToolCommandRunner runner) {
        super("chdman-verify", runner);
    }

    @Override
    public boolean convert(Path stagedInput, Path workspaceDir, String baseName, RoutineContext ctx) {
        if (!requireInputFile(ctx, stagedInput)) {
            return false;
        }
        ctx.output(">> Verifying CHD: \"" + stagedInput.getFileName() + "\"");
        if (ctx.settings().chdman().verifyFix()) {
            ctx.output("   Attempting to fix errors if found (--fix enabled)");
        }
        if (!verify(ctx, stagedInput)) {
            ctx.error("ERROR: CHD \"" + stagedInput.getFileName() + "\" verification failed or found errors.");
            return false;
        }
        ctx.output("CHD \"" + stagedInput.getFileName() + "\" verified successfully.");
        return true;
    }

    @Override
    public OutputMode outputMode() {
        return OutputMode.NONE;
    }
}
