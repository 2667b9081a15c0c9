package com.phillippitts.ozconverter.service.routine.impl;

import com.phillippitts.ozconverter.service.process.ToolCommandRunner;
import com.phillippitts.ozconverter.service.routine.RoutineContext;
import com.phillippitts.ozconverter.util.FileNames;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * {@code chdman extract*}: CHD back to {@code <base>.<format>}.
 *
 * <p>The CHD is verified first where chdman supports it; a failed verify is only a warning.
 * CUE and GDI outputs must come with at least one non-empty track file.
 */
public class ChdmanExtractRoutine extends AbstractChdmanRoutine {

    private static final Logger LOG = LogManager.getLogger(ChdmanExtractRoutine.class);

    private final ChdmanMediaType mediaType;

    public ChdmanExtractRoutine(ChdmanMediaType mediaType, ToolCommandRunner runner) {
        super("chdman-extract" + mediaType.key(), runner);
        this.mediaType = mediaType;
    }

    @Override
    public boolean convert(Path stagedInput, Path workspaceDir, String baseName, RoutineContext ctx) {
        if (!requireInputFile(ctx, stagedInput)) {
            return false;
        }
        if (mediaType.verifyBeforeExtract()) {
            ctx.output(">> Verifying CHD: \"" + stagedInput.getFileName() + "\"");
            if (!verify(ctx, stagedInput)) {
                ctx.error("WARNING: CHD verification failed. Attempting extraction anyway.");
            }
        }

        String format = ctx.targetExtensionOr(mediaType.defaultExtractFormat());
        Path output = workspaceDir.resolve(baseName + "." + format);
        ctx.output(">> Extracting CHD to " + format.toUpperCase(Locale.ROOT) + " (" + output.getFileName() + ")");
        List<String> command = chdmanCommand(ctx, mediaType.extractCommand(), stagedInput);
        command.add("-o");
        command.add(output.toString());
        addProcessorArgs(command, ctx.settings().chdman());

        if (!runTool(ctx, command, null) || !requireOutput(ctx, output)) {
            return false;
        }
        return switch (format) {
            case "cue" -> requireTracks(ctx, workspaceDir, baseName, Set.of("bin"), output);
            case "gdi" -> requireTracks(ctx, workspaceDir, baseName, Set.of("bin", "raw"), output);
            default -> true;
        };
    }

    private boolean requireTracks(RoutineContext ctx, Path workspaceDir, String baseName, Set<String> extensions,
                                  Path sheet) {
        boolean found;
        try (Stream<Path> files = Files.list(workspaceDir)) {
            found = files.filter(p -> p.getFileName().toString().startsWith(baseName))
                    .filter(p -> extensions.contains(FileNames.extension(p)))
                    .anyMatch(AbstractChdmanRoutine::isNonEmptyFile);
        } catch (IOException e) {
            LOG.warn("Could not list {}: {}", workspaceDir, e.toString());
            found = false;
        }
        if (!found) {
            ctx.error("ERROR: Track files (" + String.join("/", extensions) + ") for \""
                    + sheet.getFileName() + "\" not found or empty.");
        }
        return found;
    }
}
