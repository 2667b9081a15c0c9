package com.phillippitts.ozconverter.service.routine.impl;

import com.phillippitts.ozconverter.domain.JobSettings;
import com.phillippitts.ozconverter.service.process.ToolCommandRunner;
import com.phillippitts.ozconverter.service.routine.AbstractToolRoutine;
import com.phillippitts.ozconverter.service.routine.RoutineContext;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared chdman argument handling.
 */
abstract class AbstractChdmanRoutine extends AbstractToolRoutine {

    protected AbstractChdmanRoutine(String id, ToolCommandRunner runner) {
        super(id, runner);
    }

    protected static List<String> chdmanCommand(RoutineContext ctx, String subCommand, Path input) {
        List<String> command = new ArrayList<>();
        command.add(ctx.settings().tools().chdman());
        command.add(subCommand);
        command.add("-i");
        command.add(input.toString());
        return command;
    }

    protected static void addProcessorArgs(List<String> command, JobSettings.Chdman chdman) {
        if (chdman.manualProcessors() && chdman.numProcessors() > 0) {
            command.add("--numprocessors");
            command.add(String.valueOf(chdman.numProcessors()));
        }
    }

    protected boolean verify(RoutineContext ctx, Path chd) {
        List<String> command = chdmanCommand(ctx, "verify", chd);
        if (ctx.settings().chdman().verifyFix()) {
            command.add("--fix");
        }
        return runTool(ctx, command, null);
    }
}
