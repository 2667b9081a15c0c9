package com.phillippitts.ozconverter.exception;

import java.nio.file.Path;

/**
 * Thrown when a per-job scratch directory cannot be created.
 */
public class WorkspaceException extends OzConverterException {

    private final Path baseDirectory;

    public WorkspaceException(Path baseDirectory, Throwable cause) {
        super("Failed to create workspace under " + baseDirectory, cause);
        this.baseDirectory = baseDirectory;
    }

    public Path getBaseDirectory() {
        return baseDirectory;
    }
}
