package com.phillippitts.ozconverter.service.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} so tool invocations can be tested without real binaries.
 *
 * <p>Production code uses {@link DefaultProcessFactory}. Tests supply a stub that returns a fake
 * {@link Process} with scripted stdout/stderr/exit behavior.
 */
public interface ProcessFactory {
    /**
     * Starts a new process with the given command and working directory.
     *
     * @param command full command line, with the executable as the first element
     * @param workingDir working directory for the process (may be null)
     * @return started {@link Process}
     * @throws IOException if the process cannot be started, e.g. the executable is missing
     */
    Process start(List<String> command, Path workingDir) throws IOException;
}
