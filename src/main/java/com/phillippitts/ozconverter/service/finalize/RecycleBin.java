package com.phillippitts.ozconverter.service.finalize;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Removes a file, recoverably where the platform allows it.
 */
@FunctionalInterface
public interface RecycleBin {

    /**
     * @return true if the file was moved to the trash, false if it was permanently deleted
     * @throws IOException if the file could not be removed at all
     */
    boolean remove(Path file) throws IOException;
}
