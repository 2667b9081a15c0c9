package com.phillippitts.ozconverter.service.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * {@link ProcessFactory} backed by {@link ProcessBuilder}. Stdout and stderr stay separate.
 */
public final class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(List<String> command, Path workingDir) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }
        pb.redirectErrorStream(false);
        Process process = pb.start();
        // Tools never read stdin; EOF instead of a hang if one ever prompts
        process.getOutputStream().close();
        return process;
    }
}
