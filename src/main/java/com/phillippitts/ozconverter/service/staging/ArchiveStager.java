package com.phillippitts.ozconverter.service.staging;

import com.phillippitts.ozconverter.service.routine.RoutineContext;

import java.nio.file.Path;
import java.util.Set;

/**
 * Unpacks an archive into a directory. Like a conversion routine it never throws;
 * failures are reported on the context and returned as {@code false}.
 */
public interface ArchiveStager {

    /** Input extensions treated as archives. */
    Set<String> ARCHIVE_EXTENSIONS = Set.of("7z", "zip", "rar", "gz");

    boolean extract(Path archive, Path destinationDir, RoutineContext context);
}
