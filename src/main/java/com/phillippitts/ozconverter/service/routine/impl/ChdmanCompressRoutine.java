package com.phillippitts.ozconverter.service.routine.impl;

import com.phillippitts.ozconverter.domain.JobSettings;
import com.phillippitts.ozconverter.service.process.ToolCommandRunner;
import com.phillippitts.ozconverter.service.routine.RoutineContext;

import java.nio.file.Path;
import java.util.List;

/**
 * {@code chdman create*}: disc or disk image to {@code <base>.chd}.
 */
public class ChdmanCompressRoutine extends AbstractChdmanRoutine {

    private final ChdmanMediaType mediaType;

    public ChdmanCompressRoutine(ChdmanMediaType mediaType, ToolCommandRunner runner) {
        super("chdman-create" + mediaType.key(), runner);
        this.mediaType = mediaType;
    }

    @Override
    public boolean convert(Path stagedInput, Path workspaceDir, String baseName, RoutineContext ctx) {
        if (!requireInputFile(ctx, stagedInput)) {
            return false;
        }
        ctx.output(">> Compressing to CHD: \"" + stagedInput.getFileName() + "\"");
        Path output = workspaceDir.resolve(baseName + ".chd");
        List<String> command = chdmanCommand(ctx, mediaType.createCommand(), stagedInput);
        command.add("-o");
        command.add(output.toString());

        JobSettings.Chdman chdman = ctx.settings().chdman();
        addProcessorArgs(command, chdman);
        JobSettings.ChdmanMedia media = chdman.forMedia(mediaType.key());
        if (media.hasCustomHunks()) {
            command.add("--hunksize");
            command.add(String.valueOf(media.hunkSize()));
        }
        if (media.hasCustomCompression()) {
            command.add("--compression");
            command.add(media.compression());
        }
        return runTool(ctx, command, null) && requireOutput(ctx, output);
    }

    @Override
    public List<String> archiveMediaExtensions() {
        return mediaType.mediaExtensions();
    }
}
