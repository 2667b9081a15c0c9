package com.phillippitts.ozconverter.service.routine.impl;

import com.phillippitts.ozconverter.service.process.ToolCommandRunner;
import com.phillippitts.ozconverter.service.routine.AbstractToolRoutine;
import com.phillippitts.ozconverter.service.routine.RoutineContext;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * PSP ISO to CSO with maxcso.
 *
 * <p>maxcso sometimes exits non-zero after writing a good file, so a failed run with an
 * output present is downgraded to a warning.
 */
public class MaxcsoRoutine extends AbstractToolRoutine {

    public static final String ID = "maxcso-compress";

    public MaxcsoRoutine(ToolCommandRunner runner) {
        super(ID, runner);
    }

    @Override
    public boolean convert(Path stagedInput, Path workspaceDir, String baseName, RoutineContext ctx) {
        if (!requireInputFile(ctx, stagedInput)) {
            return false;
        }
        ctx.output(">> Compressing ISO to CSO: \"" + stagedInput.getFileName() + "\"");
        Path output = workspaceDir.resolve(baseName + ".cso");
        List<String> command = List.of(ctx.settings().tools().maxcso(), stagedInput.toString(),
                "--output", output.toString());
        if (!runTool(ctx, command, null)) {
            if (!Files.exists(output)) {
                ctx.error("ERROR: maxcso failed and output CSO is missing.");
                return false;
            }
            ctx.error("WARNING: maxcso returned an error code, but output CSO exists. Assuming success.");
        }
        return requireOutput(ctx, output);
    }

    @Override
    public List<String> archiveMediaExtensions() {
        return List.of("iso");
    }
}
