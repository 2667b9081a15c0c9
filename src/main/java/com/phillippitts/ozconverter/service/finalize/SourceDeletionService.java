package com.phillippitts.ozconverter.service.finalize;

import com.phillippitts.ozconverter.domain.JobDescriptor;
import com.phillippitts.ozconverter.service.routine.RoutineContext;
import com.phillippitts.ozconverter.service.staging.DescriptorDependencyResolver;
import com.phillippitts.ozconverter.util.FileNames;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Removes a job's source after a successful conversion, together with the companion files
 * multi-file formats bring along. Errors are reported on the job and never change its outcome.
 */
@Service
public class SourceDeletionService {

    private static final Logger LOG = LogManager.getLogger(SourceDeletionService.class);

    private final RecycleBin recycleBin;
    private final DescriptorDependencyResolver dependencyResolver;

    public SourceDeletionService(RecycleBin recycleBin, DescriptorDependencyResolver dependencyResolver) {
        this.recycleBin = Objects.requireNonNull(recycleBin, "recycleBin");
        this.dependencyResolver = Objects.requireNonNull(dependencyResolver, "dependencyResolver");
    }

    /**
     * @return number of files or directories removed
     */
    public int deleteSource(JobDescriptor job, RoutineContext context) {
        Path input = job.inputPath().toAbsolutePath();
        int removed = 0;
        for (Path target : targetsFor(input, context)) {
            if (!Files.exists(target)) {
                continue;
            }
            try {
                boolean trashed = recycleBin.remove(target);
                context.output(">> " + (trashed ? "Moved to trash: " : "Deleted: ") + target.getFileName());
                removed++;
            } catch (IOException | RuntimeException e) {
                LOG.warn("Could not delete source {}: {}", target, e.toString());
                context.error("WARNING: Could not delete \"" + target.getFileName() + "\": " + e.getMessage());
            }
        }
        return removed;
    }

    Set<Path> targetsFor(Path input, RoutineContext context) {
        Set<Path> targets = new LinkedHashSet<>();
        targets.add(input);
        if (!Files.isRegularFile(input) || !dependencyResolver.isDescriptor(input)) {
            return targets;
        }
        try {
            targets.addAll(dependencyResolver.resolve(input));
        } catch (IOException e) {
            context.error("WARNING: Could not read \"" + input.getFileName() + "\" to find companion files");
        }
        if (FileNames.hasExtension(input, "cue")) {
            String prefix = FileNames.baseName(input);
            try (Stream<Path> siblings = Files.list(input.getParent())) {
                siblings.filter(Files::isRegularFile)
                        .filter(p -> FileNames.hasExtension(p, "bin"))
                        .filter(p -> p.getFileName().toString().startsWith(prefix))
                        .sorted()
                        .forEach(targets::add);
            } catch (IOException e) {
                LOG.debug("Could not list {}: {}", input.getParent(), e.toString());
            }
        }
        return targets;
    }
}
