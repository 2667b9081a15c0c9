package com.phillippitts.ozconverter.util;

import java.util.regex.Pattern;

/** Cleans external tool output before it reaches logs and job events. */
public final class LogSanitizer {

    // CSI sequences (colors, cursor moves) and the single-character Fe escapes
    private static final Pattern ANSI_ESCAPE = Pattern.compile("\\x1B(?:[@-Z\\\\-_]|\\[[0-?]*[ -/]*[@-~])");

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Removes ANSI escape codes; returns "" for null.
     */
    public static String stripAnsi(String s) {
        if (s == null) {
            return "";
        }
        return ANSI_ESCAPE.matcher(s).replaceAll("");
    }
}
