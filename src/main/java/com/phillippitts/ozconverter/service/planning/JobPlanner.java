package com.phillippitts.ozconverter.service.planning;

import com.phillippitts.ozconverter.domain.JobRequest;
import com.phillippitts.ozconverter.util.FileNames;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Turns a (job, media, inputs, format) selection into job requests.
 *
 * <p>Rules:
 * <ul>
 *   <li>unknown job or media, or an output format the media does not offer: error plan</li>
 *   <li>the secondary extension is the one at the same index as the chosen format</li>
 *   <li>directories are kept; files must have an accepted input extension</li>
 *   <li>{@code .cue} and {@code .gdi} inputs are flagged as multi-file</li>
 *   <li>without an output directory, outputs go next to each input</li>
 * </ul>
 */
@Service
public class JobPlanner {

    private static final Logger LOG = LogManager.getLogger(JobPlanner.class);

    private static final Set<String> MULTI_FILE_EXTENSIONS = Set.of("cue", "gdi");
    private static final String IN_PLACE_TEMP_DIR = "_processing_temps_";

    private final RoutineCatalog catalog;

    public JobPlanner(RoutineCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    /**
     * @param outputFormat requested primary format, blank for the media's first format
     * @param outputDir destination directory, or null for each input's own directory
     */
    public JobPlan plan(String jobName, String mediaName, List<Path> inputs, String outputFormat, Path outputDir,
                        boolean overwrite) {
        RoutineDefinition definition = catalog.find(jobName, mediaName).orElse(null);
        if (definition == null) {
            return JobPlan.error("Invalid job or media type selection: " + jobName + " / " + mediaName);
        }
        String format = definition.resolveOutputFormat(outputFormat);
        if (format == null) {
            return JobPlan.error("Output format '" + outputFormat + "' is not available for "
                    + definition.mediaName() + " (choose from " + definition.outputExtensions() + ")");
        }
        String secondary = definition.secondaryFor(format);

        List<JobRequest> requests = new ArrayList<>();
        List<Path> skipped = new ArrayList<>();
        for (Path input : inputs) {
            boolean directory = Files.isDirectory(input);
            String ext = FileNames.extension(input);
            if (!directory && !definition.acceptsInput(ext)) {
                skipped.add(input);
                continue;
            }
            Path destination = outputDir != null ? outputDir : parentOf(input);
            requests.add(new JobRequest(input, definition.routineId(), destination, format, secondary, overwrite,
                    !directory && MULTI_FILE_EXTENSIONS.contains(ext)));
        }
        if (!skipped.isEmpty()) {
            LOG.info("Skipped {} input(s) not matching {} / {}", skipped.size(), definition.jobName(),
                    definition.mediaName());
        }
        return new JobPlan(requests, skipped, null);
    }

    /**
     * Lists files under {@code folder} whose extension the selection accepts. Scratch directories
     * and anything under {@code tempRoot} are never descended into.
     */
    public List<Path> scanFolder(Path folder, boolean recursive, RoutineDefinition definition, Path tempRoot)
            throws IOException {
        Path normalizedTemp = tempRoot == null ? null : tempRoot.toAbsolutePath().normalize();
        List<Path> found = new ArrayList<>();
        int depth = recursive ? Integer.MAX_VALUE : 1;
        Files.walkFileTree(folder.toAbsolutePath().normalize(), EnumSet.noneOf(FileVisitOption.class), depth,
                new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.getFileName() != null && IN_PLACE_TEMP_DIR.equals(dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                if (normalizedTemp != null && dir.startsWith(normalizedTemp)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && definition.acceptsInput(FileNames.extension(file))) {
                    found.add(file);
                }
                return FileVisitResult.CONTINUE;
            }
        });
        found.sort(null);
        return found;
    }

    public RoutineCatalog catalog() {
        return catalog;
    }

    private static Path parentOf(Path input) {
        Path parent = input.toAbsolutePath().getParent();
        return parent != null ? parent : input.toAbsolutePath();
    }
}
