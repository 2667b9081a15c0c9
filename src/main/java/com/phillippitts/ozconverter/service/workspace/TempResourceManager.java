package com.phillippitts.ozconverter.service.workspace;

import com.phillippitts.ozconverter.config.properties.EngineProperties;
import com.phillippitts.ozconverter.domain.JobDescriptor;
import com.phillippitts.ozconverter.domain.JobSettings;
import com.phillippitts.ozconverter.exception.WorkspaceException;
import com.phillippitts.ozconverter.util.FileNames;
import com.phillippitts.ozconverter.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Allocates and destroys per-job scratch directories ("workspaces").
 *
 * <p>Every workspace is created with {@link Files#createTempDirectory(Path, String, java.nio.file.attribute.FileAttribute[])},
 * so two jobs with the same input name never collide. Release is idempotent and retried on
 * transient I/O errors (files still held open by a just-exited tool, antivirus scanners).
 *
 * <p>Placement:
 * <ul>
 *   <li>copy-locally on: under the configured main temp dir</li>
 *   <li>copy-locally off: under {@code <input dir>/_processing_temps_}, next to the source</li>
 * </ul>
 */
@Component
public class TempResourceManager {

    private static final Logger LOG = LogManager.getLogger(TempResourceManager.class);

    static final String IN_PLACE_TEMP_DIR = "_processing_temps_";

    private final int cleanupRetries;
    private final long cleanupBackoffMs;

    @Autowired
    public TempResourceManager(EngineProperties engineProperties) {
        this(engineProperties.getCleanupRetries(), engineProperties.getCleanupBackoffMs());
    }

    TempResourceManager(int cleanupRetries, long cleanupBackoffMs) {
        if (cleanupRetries < 1) {
            throw new IllegalArgumentException("cleanupRetries must be >= 1");
        }
        this.cleanupRetries = cleanupRetries;
        this.cleanupBackoffMs = Math.max(0, cleanupBackoffMs);
    }

    /**
     * Creates a fresh, uniquely named workspace for the job.
     *
     * @return absolute path of the new directory
     * @throws WorkspaceException if the base directory or the workspace cannot be created
     */
    public Path allocate(JobDescriptor job, JobSettings settings) {
        Objects.requireNonNull(job, "job");
        Objects.requireNonNull(settings, "settings");

        Path base = baseDirectoryFor(job.inputPath(), settings);
        try {
            Files.createDirectories(base);
            Path workspace = Files.createTempDirectory(base, FileNames.baseName(job.inputPath()) + "_");
            LOG.debug("Allocated workspace {} for job {}", workspace, job.jobId());
            return workspace.toAbsolutePath();
        } catch (IOException | SecurityException e) {
            throw new WorkspaceException(base, e);
        }
    }

    Path baseDirectoryFor(Path input, JobSettings settings) {
        if (settings.copyLocally()) {
            return settings.mainTempDir();
        }
        Path parent = input.toAbsolutePath().getParent();
        if (parent == null) {
            return settings.mainTempDir();
        }
        return parent.resolve(IN_PLACE_TEMP_DIR);
    }

    /**
     * Recursively deletes a workspace. Safe to call any number of times, including with
     * null or an already-deleted path.
     *
     * @return true if the directory no longer exists when this returns
     */
    public boolean release(Path workspace) {
        if (workspace == null || Files.notExists(workspace)) {
            return true;
        }
        for (int attempt = 1; attempt <= cleanupRetries; attempt++) {
            try {
                FileSystemUtils.deleteRecursively(workspace);
                LOG.debug("Removed workspace {}", workspace);
                return true;
            } catch (IOException e) {
                if (attempt == cleanupRetries) {
                    LOG.error("Failed to remove workspace {} after {} attempts: {}", workspace, attempt, e.toString());
                    return false;
                }
                LOG.warn("Failed to remove workspace {} (attempt {}/{}): {}; retrying",
                        workspace, attempt, cleanupRetries, e.toString());
                if (!TimeUtils.sleepQuietly(cleanupBackoffMs)) {
                    return Files.notExists(workspace);
                }
            }
        }
        return Files.notExists(workspace);
    }
}
