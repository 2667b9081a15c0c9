package com.phillippitts.ozconverter.service.routine.impl;

import java.util.List;

/**
 * Media families chdman handles, with the sub-commands and input extensions for each.
 */
public enum ChdmanMediaType {
    CD("cd", "createcd", "extractcd", "cue", true, List.of("iso", "cue", "img", "toc", "gdi")),
    DVD("dvd", "createdvd", "extractdvd", "iso", true, List.of("iso", "img")),
    HD("hd", "createhd", "extracthd", "img", true, List.of("img", "raw", "bin", "iso")),
    LD("ld", "createld", "extractld", "raw", false, List.of("raw", "cue", "ld")),
    // Raw images go through the hard disk commands
    RAW("raw", "createhd", "extracthd", "raw", true, List.of("img", "raw", "bin"));

    private final String key;
    private final String createCommand;
    private final String extractCommand;
    private final String defaultExtractFormat;
    private final boolean verifyBeforeExtract;
    private final List<String> mediaExtensions;

    ChdmanMediaType(String key, String createCommand, String extractCommand, String defaultExtractFormat,
                    boolean verifyBeforeExtract, List<String> mediaExtensions) {
        this.key = key;
        this.createCommand = createCommand;
        this.extractCommand = extractCommand;
        this.defaultExtractFormat = defaultExtractFormat;
        this.verifyBeforeExtract = verifyBeforeExtract;
        this.mediaExtensions = mediaExtensions;
    }

    /** Settings key segment, as in {@code chdman.cd.hunks}. */
    public String key() {
        return key;
    }

    public String createCommand() {
        return createCommand;
    }

    public String extractCommand() {
        return extractCommand;
    }

    public String defaultExtractFormat() {
        return defaultExtractFormat;
    }

    public boolean verifyBeforeExtract() {
        return verifyBeforeExtract;
    }

    /** Extensions accepted as compression input, in preference order when picking from an archive. */
    public List<String> mediaExtensions() {
        return mediaExtensions;
    }
}
