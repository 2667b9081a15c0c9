package com.phillippitts.ozconverter.service.finalize;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.awt.Desktop;
import java.awt.GraphicsEnvironment;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Uses {@link Desktop#moveToTrash} when running with a desktop that supports it,
 * otherwise deletes permanently.
 */
@Component
public class DesktopRecycleBin implements RecycleBin {

    private static final Logger LOG = LogManager.getLogger(DesktopRecycleBin.class);

    private final boolean trashSupported;

    public DesktopRecycleBin() {
        this.trashSupported = detectTrashSupport();
        LOG.debug("Trash support: {}", trashSupported);
    }

    @Override
    public boolean remove(Path file) throws IOException {
        if (trashSupported && Desktop.getDesktop().moveToTrash(file.toFile())) {
            return true;
        }
        if (Files.isDirectory(file)) {
            FileSystemUtils.deleteRecursively(file);
        } else {
            Files.delete(file);
        }
        return false;
    }

    private static boolean detectTrashSupport() {
        try {
            return !GraphicsEnvironment.isHeadless()
                    && Desktop.isDesktopSupported()
                    && Desktop.getDesktop().isSupported(Desktop.Action.MOVE_TO_TRASH);
        } catch (UnsupportedOperationException | SecurityException e) {
            LOG.debug("Desktop integration unavailable: {}", e.toString());
            return false;
        }
    }
}
