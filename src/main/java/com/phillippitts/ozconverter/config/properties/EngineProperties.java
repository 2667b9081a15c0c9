package com.phillippitts.ozconverter.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the job engine itself (pool size, polling, cleanup policy).
 * These are not part of the per-job settings snapshot.
 */
@Validated
@ConfigurationProperties(prefix = "converter.engine")
public class EngineProperties {

    /** Stage events each job reports; progress is stagesDone / this. */
    public static final int STAGE_COUNT = 3;

    @Min(1)
    @Max(64)
    private final int workerCount;

    @Min(10)
    private final long pollIntervalMs;

    @Min(1)
    private final int cleanupRetries;

    @Min(0)
    private final long cleanupBackoffMs;

    /**
     * Upper bound on {@code name_N.ext} attempts when an output name is taken.
     */
    @Min(1)
    private final int maxRenameAttempts;

    @ConstructorBinding
    public EngineProperties(Integer workerCount, Long pollIntervalMs, Integer cleanupRetries,
                            Long cleanupBackoffMs, Integer maxRenameAttempts) {
        this.workerCount = workerCount == null ? defaultWorkerCount() : workerCount;
        this.pollIntervalMs = pollIntervalMs == null ? 100 : pollIntervalMs;
        this.cleanupRetries = cleanupRetries == null ? 3 : cleanupRetries;
        this.cleanupBackoffMs = cleanupBackoffMs == null ? 500 : cleanupBackoffMs;
        this.maxRenameAttempts = maxRenameAttempts == null ? 999 : maxRenameAttempts;
    }

    /**
     * Defaults for tests and programmatic use.
     */
    public EngineProperties(int workerCount) {
        this(workerCount, 100L, 3, 500L, 999);
    }

    private static int defaultWorkerCount() {
        return Math.max(1, Runtime.getRuntime().availableProcessors() / 2);
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public int getCleanupRetries() {
        return cleanupRetries;
    }

    public long getCleanupBackoffMs() {
        return cleanupBackoffMs;
    }

    public int getMaxRenameAttempts() {
        return maxRenameAttempts;
    }

    public int getStageCount() {
        return STAGE_COUNT;
    }
}
