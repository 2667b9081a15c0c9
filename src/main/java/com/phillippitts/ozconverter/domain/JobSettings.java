package com.phillippitts.ozconverter.domain;

import com.phillippitts.ozconverter.exception.SettingsSnapshotException;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Worker-local, typed view of a {@link SettingsSnapshot}.
 *
 * <p>Missing keys fall back to the defaults below; malformed values fail the decode with a
 * {@link SettingsSnapshotException}, which the pipeline reports as a setup failure.
 */
public record JobSettings(
        boolean copyLocally,
        Path mainTempDir,
        boolean deleteSourceOnSuccess,
        Duration subprocessTimeout,
        boolean validateOutput,
        Chdman chdman,
        Dolphin dolphin,
        Tools tools
) {

    public static final String COPY_LOCALLY = "copy-locally";
    public static final String MAIN_TEMP_DIR = "main-temp-dir";
    public static final String DELETE_SOURCE_ON_SUCCESS = "delete-source-on-success";
    public static final String SUBPROCESS_TIMEOUT_SECONDS = "subprocess-timeout-seconds";
    public static final String VALIDATE_OUTPUT = "validate-output";

    public static final String CHDMAN_NUM_PROCESSORS_MODE = "chdman.num-processors-mode";
    public static final String CHDMAN_NUM_PROCESSORS_MANUAL = "chdman.num-processors-manual";
    public static final String CHDMAN_VERIFY_FIX = "chdman.verify-fix";
    /** Per-media chdman keys are {@code chdman.<media>.hunks} and {@code chdman.<media>.compression}. */
    public static final List<String> CHDMAN_MEDIA = List.of("cd", "dvd", "hd", "ld", "raw");

    public static final String DOLPHIN_RVZ_COMPRESSION_TYPE = "dolphin.rvz-compression-type";
    public static final String DOLPHIN_RVZ_COMPRESSION_LEVEL = "dolphin.rvz-compression-level";
    public static final String DOLPHIN_RVZ_BLOCK_SIZE = "dolphin.rvz-block-size";
    public static final String DOLPHIN_WIA_COMPRESSION_TYPE = "dolphin.wia-compression-type";
    public static final String DOLPHIN_WIA_COMPRESSION_LEVEL = "dolphin.wia-compression-level";
    public static final String DOLPHIN_GCZ_BLOCK_SIZE = "dolphin.gcz-block-size";

    public static final String TOOL_CHDMAN = "tools.chdman";
    public static final String TOOL_DOLPHINTOOL = "tools.dolphintool";
    public static final String TOOL_MAXCSO = "tools.maxcso";
    public static final String TOOL_SEVENZIP = "tools.sevenzip";

    public static final long DEFAULT_SUBPROCESS_TIMEOUT_SECONDS = 3600;

    /**
     * @param manualProcessors pass {@code --numprocessors} instead of letting chdman decide
     * @param numProcessors processor count used when manual
     * @param verifyFix add {@code --fix} to verify runs
     * @param media per-media overrides keyed by {@link #CHDMAN_MEDIA} entries
     */
    public record Chdman(boolean manualProcessors, int numProcessors, boolean verifyFix,
                         Map<String, ChdmanMedia> media) {
        public Chdman {
            media = Map.copyOf(media);
        }

        public ChdmanMedia forMedia(String mediaKey) {
            return media.getOrDefault(mediaKey, ChdmanMedia.DEFAULTS);
        }
    }

    /**
     * @param hunkSize custom hunk size, 0 for chdman's default
     * @param compression custom compression list such as {@code cdlz,cdzl,cdfl}, blank for default
     */
    public record ChdmanMedia(int hunkSize, String compression) {
        public static final ChdmanMedia DEFAULTS = new ChdmanMedia(0, "");

        public boolean hasCustomHunks() {
            return hunkSize > 0;
        }

        public boolean hasCustomCompression() {
            return compression != null && !compression.isBlank();
        }
    }

    public record Dolphin(String rvzCompressionType, int rvzCompressionLevel, int rvzBlockSize,
                          String wiaCompressionType, int wiaCompressionLevel, int gczBlockSize) {
        public static final Dolphin DEFAULTS = new Dolphin("zstd", 5, 131072, "none", 5, 131072);
    }

    public record Tools(String chdman, String dolphinTool, String maxcso, String sevenZip) {
        public static final Tools DEFAULTS = new Tools("chdman", "DolphinTool", "maxcso", "7za");
    }

    public static Path defaultMainTempDir() {
        return Path.of(System.getProperty("java.io.tmpdir"), "OzConverter");
    }

    public static JobSettings defaults() {
        return decode(SettingsSnapshot.empty());
    }

    /**
     * Decodes a snapshot taken by the coordinator.
     *
     * @throws SettingsSnapshotException if a value cannot be parsed
     */
    public static JobSettings decode(SettingsSnapshot snapshot) {
        Reader r = new Reader(snapshot);

        long timeoutSeconds = r.longValue(SUBPROCESS_TIMEOUT_SECONDS, DEFAULT_SUBPROCESS_TIMEOUT_SECONDS);
        if (timeoutSeconds <= 0) {
            throw new SettingsSnapshotException(SUBPROCESS_TIMEOUT_SECONDS, String.valueOf(timeoutSeconds),
                    new IllegalArgumentException("must be positive"));
        }

        Map<String, ChdmanMedia> media = new HashMap<>();
        for (String key : CHDMAN_MEDIA) {
            int hunks = r.intValue("chdman." + key + ".hunks", 0);
            String compression = r.string("chdman." + key + ".compression", "");
            media.put(key, new ChdmanMedia(hunks, compression));
        }
        String mode = r.string(CHDMAN_NUM_PROCESSORS_MODE, "auto").toLowerCase(Locale.ROOT);
        Chdman chdman = new Chdman(
                "manual".equals(mode),
                r.intValue(CHDMAN_NUM_PROCESSORS_MANUAL, Math.max(1, Runtime.getRuntime().availableProcessors() * 2 / 3)),
                r.bool(CHDMAN_VERIFY_FIX, false),
                media);

        Dolphin d = Dolphin.DEFAULTS;
        Dolphin dolphin = new Dolphin(
                r.string(DOLPHIN_RVZ_COMPRESSION_TYPE, d.rvzCompressionType()),
                r.intValue(DOLPHIN_RVZ_COMPRESSION_LEVEL, d.rvzCompressionLevel()),
                r.intValue(DOLPHIN_RVZ_BLOCK_SIZE, d.rvzBlockSize()),
                r.string(DOLPHIN_WIA_COMPRESSION_TYPE, d.wiaCompressionType()),
                r.intValue(DOLPHIN_WIA_COMPRESSION_LEVEL, d.wiaCompressionLevel()),
                r.intValue(DOLPHIN_GCZ_BLOCK_SIZE, d.gczBlockSize()));

        Tools t = Tools.DEFAULTS;
        Tools tools = new Tools(
                r.string(TOOL_CHDMAN, t.chdman()),
                r.string(TOOL_DOLPHINTOOL, t.dolphinTool()),
                r.string(TOOL_MAXCSO, t.maxcso()),
                r.string(TOOL_SEVENZIP, t.sevenZip()));

        String tempDir = r.string(MAIN_TEMP_DIR, "");
        return new JobSettings(
                r.bool(COPY_LOCALLY, false),
                tempDir.isBlank() ? defaultMainTempDir() : Path.of(tempDir),
                r.bool(DELETE_SOURCE_ON_SUCCESS, false),
                Duration.ofSeconds(timeoutSeconds),
                r.bool(VALIDATE_OUTPUT, true),
                chdman,
                dolphin,
                tools);
    }

    private record Reader(SettingsSnapshot snapshot) {

        String string(String key, String fallback) {
            String v = snapshot.get(key);
            return v == null ? fallback : v.trim();
        }

        boolean bool(String key, boolean fallback) {
            String v = snapshot.get(key);
            if (v == null || v.isBlank()) {
                return fallback;
            }
            return switch (v.trim().toLowerCase(Locale.ROOT)) {
                case "true" -> true;
                case "false" -> false;
                default -> throw new SettingsSnapshotException(key, v,
                        new IllegalArgumentException("expected true or false"));
            };
        }

        int intValue(String key, int fallback) {
            String v = snapshot.get(key);
            if (v == null || v.isBlank()) {
                return fallback;
            }
            try {
                return Integer.parseInt(v.trim());
            } catch (NumberFormatException e) {
                throw new SettingsSnapshotException(key, v, e);
            }
        }

        long longValue(String key, long fallback) {
            String v = snapshot.get(key);
            if (v == null || v.isBlank()) {
                return fallback;
            }
            try {
                return Long.parseLong(v.trim());
            } catch (NumberFormatException e) {
                throw new SettingsSnapshotException(key, v, e);
            }
        }
    }
}
