package com.phillippitts.ozconverter.util;

import java.time.Duration;

/**
 * Standard timeout values for external tool processes and their stream readers.
 *
 * <p>Used by {@link com.phillippitts.ozconverter.service.process.ToolCommandRunner}. The subprocess
 * run timeout itself is a per-job setting; these only bound the teardown phase.
 *
 * @see com.phillippitts.ozconverter.service.process.ToolCommandRunner
 * @since 1.0
 */
public final class ProcessTimeouts {

    /**
     * Time given to the stdout/stderr reader threads to forward their last lines after the tool exits.
     *
     * <p>chdman prints its final ratio line right before exiting, so this must not be zero.
     */
    public static final Duration READER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /**
     * Best-effort join of reader threads during cleanup. They are daemon threads.
     */
    public static final Duration READER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /**
     * Grace period after {@link Process#destroy()} before escalating.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Deadline for {@link Process#destroyForcibly()} to take effect.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
