package com.phillippitts.ozconverter.service.staging;

import com.phillippitts.ozconverter.domain.JobDescriptor;
import com.phillippitts.ozconverter.domain.JobSettings;
import com.phillippitts.ozconverter.exception.StagingException;
import com.phillippitts.ozconverter.service.routine.ConversionRoutine;
import com.phillippitts.ozconverter.service.routine.RoutineContext;
import com.phillippitts.ozconverter.util.FileNames;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Prepares a job's input inside its workspace before the routine runs.
 *
 * <p>Steps, in order:
 * <ol>
 *   <li>copy-locally on: copy the input (file or directory) into {@code <workspace>/_source}</li>
 *   <li>cue/gdi input: make sure every referenced track sits next to the staged descriptor</li>
 *   <li>archive input for a routine that reads disc images: unpack it and pick the media file</li>
 * </ol>
 * With copy-locally off the original input is used in place.
 */
@Service
public class StagingService {

    private static final Logger LOG = LogManager.getLogger(StagingService.class);

    public static final String SOURCE_DIR = "_source";
    static final String EXTRACTED_SUFFIX = "_extracted_content";

    private final DescriptorDependencyResolver dependencyResolver;
    private final ArchiveStager archiveStager;

    public StagingService(DescriptorDependencyResolver dependencyResolver, ArchiveStager archiveStager) {
        this.dependencyResolver = Objects.requireNonNull(dependencyResolver, "dependencyResolver");
        this.archiveStager = Objects.requireNonNull(archiveStager, "archiveStager");
    }

    /**
     * @throws StagingException if the input is missing or an archive yields no usable media
     * @throws IOException if copying into the workspace fails
     */
    public StagedInput stage(JobDescriptor job, JobSettings settings, Path workspace, ConversionRoutine routine,
                             RoutineContext context) throws IOException {
        Path input = job.inputPath().toAbsolutePath();
        if (!Files.exists(input)) {
            throw new StagingException("Input not found: " + input);
        }

        Path staged = input;
        if (settings.copyLocally()) {
            staged = copyIntoWorkspace(input, workspace, context);
        }

        if (job.multiFileInput() || dependencyResolver.isDescriptor(input)) {
            colocateDependencies(input, staged, settings.copyLocally(), context);
        }

        String ext = FileNames.extension(staged);
        List<String> mediaExtensions = routine.archiveMediaExtensions();
        if (ArchiveStager.ARCHIVE_EXTENSIONS.contains(ext) && !mediaExtensions.isEmpty()
                && Files.isRegularFile(staged)) {
            return unpackArchive(staged, workspace, mediaExtensions, context);
        }
        return StagedInput.of(staged);
    }

    private Path copyIntoWorkspace(Path input, Path workspace, RoutineContext context) throws IOException {
        Path sourceDir = Files.createDirectories(workspace.resolve(SOURCE_DIR));
        Path target = sourceDir.resolve(input.getFileName().toString());
        context.output(">> Copying \"" + input.getFileName() + "\" to local workspace");
        if (Files.isDirectory(input)) {
            FileSystemUtils.copyRecursively(input, target);
        } else {
            Files.copy(input, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
        }
        LOG.debug("Copied {} to {}", input, target);
        return target;
    }

    /**
     * Missing tracks are only warned about; the tool reports the real failure.
     */
    private void colocateDependencies(Path originalDescriptor, Path stagedDescriptor, boolean copy,
                                      RoutineContext context) throws IOException {
        List<Path> dependencies;
        try {
            dependencies = dependencyResolver.resolve(originalDescriptor);
        } catch (IOException e) {
            LOG.warn("Could not read descriptor {}: {}", originalDescriptor, e.toString());
            context.error("WARNING: Could not read \"" + originalDescriptor.getFileName() + "\": " + e.getMessage());
            return;
        }

        Path originalDir = originalDescriptor.getParent();
        Path stagedDir = stagedDescriptor.getParent();
        for (Path dependency : dependencies) {
            if (!Files.isRegularFile(dependency)) {
                context.error("WARNING: Referenced file not found: " + dependency.getFileName());
                continue;
            }
            if (!copy) {
                continue;
            }
            Path relative = dependency.startsWith(originalDir)
                    ? originalDir.relativize(dependency)
                    : dependency.getFileName();
            Path target = stagedDir.resolve(relative.toString());
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.copy(dependency, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            LOG.debug("Copied dependency {}", relative);
        }
    }

    private StagedInput unpackArchive(Path archive, Path workspace, List<String> mediaExtensions,
                                      RoutineContext context) throws IOException {
        Path extractionDir = Files.createDirectories(
                workspace.resolve(FileNames.baseName(archive) + EXTRACTED_SUFFIX));
        context.output(">> Extracting archive \"" + archive.getFileName() + "\"");
        if (!archiveStager.extract(archive, extractionDir, context)) {
            throw new StagingException("Failed to extract archive: " + archive.getFileName());
        }
        Path media = findMedia(extractionDir, mediaExtensions)
                .orElseThrow(() -> new StagingException("No supported media (" + String.join(", ", mediaExtensions)
                        + ") found in archive: " + archive.getFileName()));
        context.output(">> Using \"" + extractionDir.relativize(media) + "\" from archive");
        return new StagedInput(media, extractionDir);
    }

    /**
     * First match by extension preference; for each extension the archive root wins over subfolders.
     */
    static Optional<Path> findMedia(Path dir, List<String> mediaExtensions) throws IOException {
        for (String ext : mediaExtensions) {
            Optional<Path> atRoot;
            try (Stream<Path> files = Files.list(dir)) {
                atRoot = files.filter(Files::isRegularFile)
                        .filter(p -> FileNames.hasExtension(p, ext))
                        .sorted()
                        .findFirst();
            }
            if (atRoot.isPresent()) {
                return atRoot;
            }
            Optional<Path> nested;
            try (Stream<Path> files = Files.walk(dir)) {
                nested = files.filter(Files::isRegularFile)
                        .filter(p -> FileNames.hasExtension(p, ext))
                        .sorted()
                        .findFirst();
            }
            if (nested.isPresent()) {
                return nested;
            }
        }
        return Optional.empty();
    }
}
