package com.phillippitts.ozconverter.util;

import java.nio.file.Path;
import java.util.Locale;

/**
 * File name helpers shared by staging, finalizing and planning.
 *
 * <p>Extensions are always returned lower-case and without the leading dot.
 */
public final class FileNames {

    private FileNames() {
        // Utility class - prevent instantiation
    }

    /**
     * Name without its last extension: {@code "Game (USA).cue"} becomes {@code "Game (USA)"}.
     */
    public static String baseName(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /**
     * Last extension in lower case, or "" when the name has none.
     */
    public static String extension(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 && dot < name.length() - 1 ? name.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }

    public static boolean hasExtension(Path path, String ext) {
        return extension(path).equals(normalizeExtension(ext));
    }

    /**
     * Lower-cases an extension and strips a leading dot, so ".CUE" and "cue" compare equal.
     */
    public static String normalizeExtension(String ext) {
        if (ext == null) {
            return "";
        }
        String trimmed = ext.trim();
        if (trimmed.startsWith(".")) {
            trimmed = trimmed.substring(1);
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }
}
