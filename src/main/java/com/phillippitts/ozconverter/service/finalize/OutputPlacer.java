package com.phillippitts.ozconverter.service.finalize;

import com.phillippitts.ozconverter.config.properties.EngineProperties;
import com.phillippitts.ozconverter.domain.FailureCategory;
import com.phillippitts.ozconverter.domain.JobDescriptor;
import com.phillippitts.ozconverter.domain.StageResult;
import com.phillippitts.ozconverter.service.routine.OutputMode;
import com.phillippitts.ozconverter.service.routine.RoutineContext;
import com.phillippitts.ozconverter.service.staging.StagingService;
import com.phillippitts.ozconverter.util.FileNames;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Moves finished outputs from a job workspace to the destination directory.
 *
 * <p>Collision policy for single files: with overwrite allowed an existing target is removed and
 * replaced; otherwise the output is renamed to the first free {@code name_N.ext}, trying at most
 * {@code converter.engine.max-rename-attempts} suffixes.
 */
@Component
public class OutputPlacer {

    private static final Logger LOG = LogManager.getLogger(OutputPlacer.class);

    /** Track files that travel with a {@code .gdi} sheet. */
    private static final Set<String> GDI_TRACK_EXTENSIONS = Set.of("bin", "raw");

    private final int maxRenameAttempts;

    @Autowired
    public OutputPlacer(EngineProperties engineProperties) {
        this(engineProperties.getMaxRenameAttempts());
    }

    OutputPlacer(int maxRenameAttempts) {
        if (maxRenameAttempts < 1) {
            throw new IllegalArgumentException("maxRenameAttempts must be >= 1");
        }
        this.maxRenameAttempts = maxRenameAttempts;
    }

    public StageResult place(JobDescriptor job, Path workspace, OutputMode mode, RoutineContext context) {
        String baseName = FileNames.baseName(job.inputPath());
        return switch (mode) {
            case NONE -> StageResult.ok();
            case FOLDER -> placeFolder(job, workspace, baseName, context);
            case SINGLE_FILE -> placeSingleFile(job, workspace, baseName, context);
        };
    }

    private StageResult placeSingleFile(JobDescriptor job, Path workspace, String baseName, RoutineContext context) {
        String primaryExt = job.primaryOutputExt();
        if (primaryExt == null || primaryExt.isBlank()) {
            return StageResult.failure(FailureCategory.CONVERSION, "No output format selected");
        }
        Path primary = workspace.resolve(baseName + "." + primaryExt);
        if (!Files.isRegularFile(primary)) {
            return StageResult.failure(FailureCategory.CONVERSION,
                    "Expected output not found: " + primary.getFileName());
        }

        Path placed;
        try {
            placed = moveWithCollisionPolicy(primary, job.outputDir(), job.overwriteAllowed());
        } catch (IOException e) {
            LOG.warn("Could not move {} to {}: {}", primary.getFileName(), job.outputDir(), e.toString());
            return StageResult.failure(FailureCategory.FINALIZE,
                    "Could not move \"" + primary.getFileName() + "\": " + e.getMessage());
        }
        context.output(">> Output: " + placed);

        for (Path companion : companionFiles(workspace, primaryExt, job.secondaryOutputExt())) {
            try {
                Path moved = moveWithCollisionPolicy(companion, job.outputDir(), job.overwriteAllowed());
                LOG.debug("Moved companion {} to {}", companion.getFileName(), moved);
            } catch (IOException e) {
                context.error("WARNING: Could not move \"" + companion.getFileName() + "\": " + e.getMessage());
            }
        }
        return StageResult.ok();
    }

    private List<Path> companionFiles(Path workspace, String primaryExt, String secondaryExt) {
        Set<String> extensions = "gdi".equals(primaryExt)
                ? GDI_TRACK_EXTENSIONS
                : secondaryExt == null ? Set.of() : Set.of(secondaryExt);
        if (extensions.isEmpty()) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(workspace)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> extensions.contains(FileNames.extension(p)))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            LOG.warn("Could not list workspace {}: {}", workspace, e.toString());
            return List.of();
        }
    }

    private StageResult placeFolder(JobDescriptor job, Path workspace, String baseName, RoutineContext context) {
        Path destination = job.outputDir().resolve(baseName);
        List<Path> items = new ArrayList<>();
        try {
            Files.createDirectories(destination);
            try (Stream<Path> entries = Files.list(workspace)) {
                entries.filter(p -> !StagingService.SOURCE_DIR.equals(p.getFileName().toString()))
                        .sorted()
                        .forEach(items::add);
            }
        } catch (IOException e) {
            return StageResult.failure(FailureCategory.FINALIZE,
                    "Could not prepare output folder \"" + destination + "\": " + e.getMessage());
        }

        int moved = 0;
        for (Path item : items) {
            Path target = destination.resolve(item.getFileName().toString());
            try {
                if (Files.exists(target)) {
                    if (!job.overwriteAllowed()) {
                        context.error("WARNING: Skipping existing \"" + target.getFileName() + "\" (overwrite disabled)");
                        continue;
                    }
                    FileSystemUtils.deleteRecursively(target);
                }
                moveItem(item, target);
                moved++;
            } catch (IOException e) {
                return StageResult.failure(FailureCategory.FINALIZE,
                        "Could not move \"" + item.getFileName() + "\": " + e.getMessage());
            }
        }
        context.output(">> Placed " + moved + " item(s) in " + destination);
        return StageResult.ok();
    }

    /**
     * Moves a file into {@code destinationDir} under its own name, or a suffixed one if taken.
     *
     * @return where the file ended up
     * @throws IOException if the move fails or no free name is found
     */
    public Path moveWithCollisionPolicy(Path source, Path destinationDir, boolean overwrite) throws IOException {
        String name = source.getFileName().toString();
        Path target = destinationDir.resolve(name);
        if (overwrite) {
            Files.deleteIfExists(target);
            return Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }

        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        String ext = dot > 0 ? name.substring(dot) : "";
        for (int n = 0; n <= maxRenameAttempts; n++) {
            Path candidate = n == 0 ? target : destinationDir.resolve(stem + "_" + n + ext);
            if (Files.exists(candidate)) {
                continue;
            }
            try {
                // No REPLACE_EXISTING: a file created since the check makes this fail instead of being clobbered
                return Files.move(source, candidate);
            } catch (FileAlreadyExistsException e) {
                LOG.debug("{} appeared concurrently; trying next suffix", candidate.getFileName());
            }
        }
        throw new FileAlreadyExistsException(target.toString(), null,
                "no free name after " + maxRenameAttempts + " attempts");
    }

    private static void moveItem(Path source, Path target) throws IOException {
        try {
            Files.move(source, target);
        } catch (IOException e) {
            if (!Files.isDirectory(source)) {
                throw e;
            }
            // Directories cannot be moved across file systems
            FileSystemUtils.copyRecursively(source, target);
            FileSystemUtils.deleteRecursively(source);
        }
    }
}
