package com.phillippitts.ozconverter.service.routine.impl;

import com.phillippitts.ozconverter.domain.JobSettings;
import com.phillippitts.ozconverter.service.process.ToolCommandRunner;
import com.phillippitts.ozconverter.service.routine.AbstractToolRoutine;
import com.phillippitts.ozconverter.service.routine.RoutineContext;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * GameCube/Wii image conversion with {@code DolphinTool convert}.
 *
 * <p>Compression targets rvz, wia or gcz; extraction targets iso. Format-specific options come
 * from the {@code converter.dolphin.*} settings.
 */
public class DolphinToolRoutine extends AbstractToolRoutine {

    public static final String CONVERT_ID = "dolphin-convert";
    public static final String EXTRACT_ID = "dolphin-extract";

    private static final List<String> MEDIA_EXTENSIONS = List.of("iso", "gcm", "rvz", "gcz", "wbfs", "ciso", "wad");

    private final boolean compress;

    private DolphinToolRoutine(String id, boolean compress, ToolCommandRunner runner) {
        super(id, runner);
        this.compress = compress;
    }

    public static DolphinToolRoutine compressor(ToolCommandRunner runner) {
        return new DolphinToolRoutine(CONVERT_ID, true, runner);
    }

    public static DolphinToolRoutine extractor(ToolCommandRunner runner) {
        return new DolphinToolRoutine(EXTRACT_ID, false, runner);
    }

    @Override
    public boolean convert(Path stagedInput, Path workspaceDir, String baseName, RoutineContext ctx) {
        if (!requireInputFile(ctx, stagedInput)) {
            return false;
        }
        String format = ctx.targetExtensionOr(compress ? "rvz" : "iso").toLowerCase(Locale.ROOT);
        Path output = workspaceDir.resolve(baseName + "." + format);
        ctx.output(">> Converting to " + format.toUpperCase(Locale.ROOT) + ": \"" + stagedInput.getFileName() + "\"");

        List<String> command = new ArrayList<>(List.of(
                ctx.settings().tools().dolphinTool(), "convert",
                "--input=" + stagedInput, "--output=" + output, "--format=" + format));
        command.addAll(formatOptions(format, ctx.settings().dolphin()));
        return runTool(ctx, command, null) && requireOutput(ctx, output);
    }

    static List<String> formatOptions(String format, JobSettings.Dolphin dolphin) {
        List<String> args = new ArrayList<>();
        switch (format) {
            case "rvz" -> {
                if (isCompressed(dolphin.rvzCompressionType())) {
                    args.add("--compression");
                    args.add(dolphin.rvzCompressionType());
                    if (dolphin.rvzCompressionLevel() > 0) {
                        args.add("--compression_level=" + dolphin.rvzCompressionLevel());
                    }
                }
                if (dolphin.rvzBlockSize() > 0) {
                    args.add("--block_size=" + dolphin.rvzBlockSize());
                }
            }
            case "wia" -> {
                String type = dolphin.wiaCompressionType();
                if (isCompressed(type)) {
                    args.add("--compression");
                    args.add(type);
                    if (!"purge".equals(type) && dolphin.wiaCompressionLevel() > 0) {
                        args.add("--compression_level=" + dolphin.wiaCompressionLevel());
                    }
                }
            }
            case "gcz" -> {
                if (dolphin.gczBlockSize() > 0) {
                    args.add("--block_size=" + dolphin.gczBlockSize());
                }
            }
            default -> {
                // iso and other plain formats take no options
            }
        }
        return args;
    }

    private static boolean isCompressed(String type) {
        return type != null && !type.isBlank() && !"none".equalsIgnoreCase(type);
    }

    @Override
    public List<String> archiveMediaExtensions() {
        return compress ? MEDIA_EXTENSIONS : List.of();
    }
}
