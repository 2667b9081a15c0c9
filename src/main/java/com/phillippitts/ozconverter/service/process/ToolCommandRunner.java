package com.phillippitts.ozconverter.service.process;

import com.phillippitts.ozconverter.exception.ToolExecutionException;
import com.phillippitts.ozconverter.exception.ToolExecutionExceptionBuilder;
import com.phillippitts.ozconverter.util.LogSanitizer;
import com.phillippitts.ozconverter.util.ProcessTimeouts;
import com.phillippitts.ozconverter.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs one external conversion tool to completion.
 *
 * <p>Responsibilities:
 * - Start the process via {@link ProcessFactory}
 * - Stream stdout and stderr line by line to a {@link ToolOutputListener} while the tool runs
 * - Enforce the per-job timeout and terminate runaway processes
 * - Report start failures, timeouts and non-zero exits as {@link ToolExecutionException}
 *
 * <p>Stateless and safe to share between workers; each call owns its process and reader threads.
 */
@Component
public class ToolCommandRunner {

    private static final Logger LOG = LogManager.getLogger(ToolCommandRunner.class);

    static final int STDERR_SNIPPET_MAX_CHARS = 500;
    private static final int STDERR_CAPTURE_MAX_CHARS = 8192;

    private final ProcessFactory processFactory;

    public ToolCommandRunner() {
        this(new DefaultProcessFactory());
    }

    public ToolCommandRunner(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    /**
     * Holds one running tool and its reader threads.
     */
    private record ProcessExecution(
            Process process,
            Thread outReader,
            Thread errReader,
            StringBuffer stderr,
            OutputGate gate
    ) {}

    public void execute(List<String> command, Path workingDir, Duration timeout, ToolOutputListener listener) {
        execute(command, workingDir, timeout, listener, Map.of());
    }

    /**
     * Runs the command and blocks until it exits.
     *
     * @param command executable followed by its arguments
     * @param workingDir working directory, or null to inherit
     * @param timeout maximum run time before the process is destroyed
     * @param listener receives output lines as they are produced
     * @param knownErrorCodes optional explanations for tool-specific exit codes
     * @throws ToolExecutionException if the tool cannot start, times out, is interrupted or exits non-zero
     */
    public void execute(List<String> command, Path workingDir, Duration timeout, ToolOutputListener listener,
                        Map<Integer, String> knownErrorCodes) {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(listener, "listener");
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }

        String tool = toolName(command.get(0));
        long startTime = System.nanoTime();
        ProcessExecution exec = null;
        try {
            exec = startWithReaders(command, workingDir, tool, listener);

            boolean finished = exec.process().waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                destroyProcess(exec.process());
                throw toolError("Timeout after " + timeout.toSeconds() + "s", tool, -1, startTime)
                        .build();
            }

            // Let the readers forward the last lines before judging the result
            joinQuietly(exec.outReader(), ProcessTimeouts.READER_FLUSH_TIMEOUT);
            joinQuietly(exec.errReader(), ProcessTimeouts.READER_FLUSH_TIMEOUT);

            int exitCode = exec.process().exitValue();
            if (exitCode != 0) {
                ToolExecutionExceptionBuilder builder = toolError("Command failed (code " + exitCode + ")",
                        tool, exitCode, startTime);
                String known = knownErrorCodes == null ? null : knownErrorCodes.get(exitCode);
                if (known != null) {
                    builder.metadata("reason", known);
                } else if (exec.stderr().length() > 0) {
                    builder.metadata("stderr", LogSanitizer.truncate(exec.stderr().toString(),
                            STDERR_SNIPPET_MAX_CHARS));
                }
                throw builder.build();
            }
            LOG.debug("{} finished in {}ms", tool, TimeUtils.elapsedMillis(startTime));
        } catch (IOException e) {
            throw toolError("Command not found: " + command.get(0), tool, -1, startTime)
                    .cause(e)
                    .build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw toolError("Interrupted while waiting for tool", tool, -1, startTime)
                    .cause(e)
                    .build();
        } finally {
            if (exec != null) {
                cleanup(exec);
            }
        }
    }

    private ProcessExecution startWithReaders(List<String> command, Path workingDir, String tool,
                                              ToolOutputListener listener) throws IOException {
        Process process = processFactory.start(command, workingDir);
        StringBuffer stderr = new StringBuffer();
        OutputGate gate = new OutputGate(listener);

        // Readers start before waiting so a chatty tool never blocks on a full pipe
        Thread outReader = startReader(process.getInputStream(), tool + "-out", gate::stdout);
        Thread errReader = startReader(process.getErrorStream(), tool + "-err", line -> {
            if (stderr.length() < STDERR_CAPTURE_MAX_CHARS) {
                if (stderr.length() > 0) {
                    stderr.append('\n');
                }
                stderr.append(line);
            }
            gate.stderr(line);
        });
        return new ProcessExecution(process, outReader, errReader, stderr, gate);
    }

    /**
     * Forwards lines to the caller's listener until {@link #close()}; later lines are dropped.
     *
     * <p>A reader can outlive {@code execute} when a child process keeps the pipe open. Closing
     * waits for any delivery in progress, so no line reaches the listener once {@code execute}
     * has returned.
     */
    private static final class OutputGate {
        private final ToolOutputListener listener;
        private boolean open = true;

        OutputGate(ToolOutputListener listener) {
            this.listener = listener;
        }

        synchronized void stdout(String line) {
            if (open) {
                listener.stdout(line);
            }
        }

        synchronized void stderr(String line) {
            if (open) {
                listener.stderr(line);
            }
        }

        synchronized void close() {
            open = false;
        }
    }

    private Thread startReader(InputStream inputStream, String name, Consumer<String> sink) {
        Thread thread = new Thread(new LineReader(inputStream, name, sink), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Forwards non-blank lines, ANSI codes removed. Keeps draining even if the sink throws,
     * so the tool never stalls on a full pipe.
     */
    private static final class LineReader implements Runnable {
        private final InputStream inputStream;
        private final String name;
        private final Consumer<String> sink;

        LineReader(InputStream inputStream, String name, Consumer<String> sink) {
            this.inputStream = inputStream;
            this.name = name;
            this.sink = sink;
        }

        @Override
        public void run() {
            boolean sinkFailed = false;
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = br.readLine()) != null) {
                    String clean = LogSanitizer.stripAnsi(line).strip();
                    if (clean.isEmpty() || sinkFailed) {
                        continue;
                    }
                    try {
                        sink.accept(clean);
                    } catch (RuntimeException e) {
                        sinkFailed = true;
                        LOG.warn("Output listener for '{}' failed; discarding further lines: {}", name, e.toString());
                    }
                }
            } catch (IOException e) {
                LOG.debug("Reader '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private static String toolName(String executable) {
        Path fileName = Path.of(executable).getFileName();
        return fileName == null ? executable : fileName.toString();
    }

    private ToolExecutionExceptionBuilder toolError(String msg, String tool, int exitCode, long startNanos) {
        return ToolExecutionExceptionBuilder.create(msg)
                .tool(tool)
                .exitCode(exitCode)
                .durationMs(TimeUtils.elapsedMillis(startNanos));
    }

    private void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying process");
        }
    }

    private void cleanup(ProcessExecution exec) {
        if (exec.process().isAlive()) {
            destroyProcess(exec.process());
        }
        joinQuietly(exec.outReader(), ProcessTimeouts.READER_CLEANUP_TIMEOUT);
        joinQuietly(exec.errReader(), ProcessTimeouts.READER_CLEANUP_TIMEOUT);
        exec.gate().close();
        if (exec.outReader().isAlive() || exec.errReader().isAlive()) {
            LOG.debug("Output pipe still open after tool exit; further lines are discarded");
        }
    }
}
